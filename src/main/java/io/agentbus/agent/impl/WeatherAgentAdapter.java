package io.agentbus.agent.impl;

import io.agentbus.agent.client.ForecastDay;
import io.agentbus.agent.client.WeatherClient;
import io.agentbus.agent.client.WeatherReport;
import io.agentbus.agent.model.AgentResponse;
import io.agentbus.agent.model.RoutingMetadata;
import io.agentbus.agent.type.AbstractAgentAdapter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Current conditions and multi-day forecasts over a {@link WeatherClient}.
 */
@Slf4j
public final class WeatherAgentAdapter extends AbstractAgentAdapter {

    public static final String NAME = "weather_agent";
    public static final String CURRENT_WEATHER = "get_current_weather";
    public static final String FORECAST = "get_weather_forecast";

    public static final String LOCATION = "location";
    public static final String DAYS = "days";

    static final int MAX_FORECAST_DAYS = 10;

    private final WeatherClient client;
    private final int defaultForecastDays;

    public WeatherAgentAdapter(final WeatherClient client, final int defaultForecastDays) {
        super(NAME);
        this.client = Objects.requireNonNull(client, "client");
        this.defaultForecastDays = defaultForecastDays;

        register(CURRENT_WEATHER, List.of(LOCATION), this::current);
        register(FORECAST, List.of(LOCATION), this::forecast);
    }

    private CompletableFuture<AgentResponse> current(final Map<String, Object> params, final RoutingMetadata routing) {
        final String location = stringParam(params, LOCATION);
        log.info("Getting current weather for: {}", location);

        return client.currentWeather(location).thenApply(report -> {
            if (report.failed()) return failure(location, report, routing);
            return AgentResponse.text(formatCurrent(location, report), routing);
        });
    }

    private CompletableFuture<AgentResponse> forecast(final Map<String, Object> params, final RoutingMetadata routing) {
        final String location = stringParam(params, LOCATION);
        final int days = intParam(params, DAYS, defaultForecastDays, 1, MAX_FORECAST_DAYS);
        log.info("Getting {}-day forecast for: {}", days, location);

        return client.forecast(location, days).thenApply(report -> {
            if (report.failed()) return failure(location, report, routing);
            return AgentResponse.text(formatForecast(location, report, days), routing);
        });
    }

    private static AgentResponse failure(final String location, final WeatherReport report, final RoutingMetadata routing) {
        log.warn("Weather lookup for '{}' failed: {}", location, report.error());
        return AgentResponse.error("Weather lookup failed: " + report.error(), routing);
    }

    static String formatCurrent(final String location, final WeatherReport report) {
        if (report.tempC() == null || report.condition() == null) {
            return "Could not get detailed weather information for " + location + ". Please try again.";
        }

        final StringBuilder sb = new StringBuilder()
                .append("Current weather in ").append(report.displayLocation(location)).append(":\n\n")
                .append("- Condition: ").append(report.condition()).append('\n')
                .append("- Temperature: ").append(celsius(report.tempC()));
        if (report.feelsLikeC() != null && Math.abs(report.feelsLikeC() - report.tempC()) > 1.0) {
            sb.append(" (feels like ").append(celsius(report.feelsLikeC())).append(')');
        }
        sb.append('\n');
        if (report.windKph() != null) {
            sb.append("- Wind: ").append(String.format(Locale.ROOT, "%.1f", report.windKph())).append(" km/h\n");
        }
        if (report.humidity() != null) {
            sb.append("- Humidity: ").append(report.humidity()).append('%');
        }
        return sb.toString().stripTrailing();
    }

    static String formatForecast(final String location, final WeatherReport report, final int days) {
        if (report.forecast().isEmpty()) {
            return "Could not retrieve weather forecast for " + location + ".";
        }

        final List<ForecastDay> shown = report.forecast().subList(0, Math.min(days, report.forecast().size()));
        final StringBuilder sb = new StringBuilder()
                .append("Weather forecast for ").append(report.displayLocation(location))
                .append(" (").append(shown.size()).append(" days):\n\n");

        for (int i = 0; i < shown.size(); i++) {
            final ForecastDay day = shown.get(i);
            final String label = i == 0 ? "Today" : i == 1 ? "Tomorrow" : day.date();
            sb.append(label).append(" (").append(day.date()).append("):\n")
                    .append("   - ").append(day.condition()).append('\n')
                    .append("   - High: ").append(celsius(day.maxTempC()))
                    .append(", Low: ").append(celsius(day.minTempC())).append('\n');
            if (day.chanceOfRain() > 0) {
                sb.append("   - Chance of rain: ").append(day.chanceOfRain()).append("%\n");
            }
            sb.append('\n');
        }
        return sb.toString().stripTrailing();
    }

    private static String celsius(final double value) {
        return String.format(Locale.ROOT, "%.1f°C", value);
    }
}
