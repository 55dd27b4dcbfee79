package io.agentbus.agent.client;

import java.util.List;

/**
 * Current conditions and/or forecast for one location, or an error detail.
 * <p>
 * Numeric current-condition fields are null when the collaborator did not provide them.
 * </p>
 */
public record WeatherReport(String locationName,
                            String country,
                            String condition,
                            Double tempC,
                            Double feelsLikeC,
                            Double windKph,
                            Integer humidity,
                            List<ForecastDay> forecast,
                            String error) {

    public WeatherReport {
        forecast = forecast == null ? List.of() : List.copyOf(forecast);
    }

    public static WeatherReport failure(final String error) {
        return new WeatherReport(null, null, null, null, null, null, null, List.of(), error);
    }

    public boolean failed() {
        return error != null;
    }

    /**
     * "Name, Country" when both are known, falling back to {@code requested}.
     */
    public String displayLocation(final String requested) {
        final String name = locationName == null || locationName.isBlank() ? requested : locationName;
        return country == null || country.isBlank() ? name : name + ", " + country;
    }
}
