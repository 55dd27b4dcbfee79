package io.agentbus.agent.client;

/**
 * @param date            ISO date, e.g. {@code 2025-06-01}
 * @param chanceOfRain    percentage, 0 when none
 */
public record ForecastDay(String date, String condition, double maxTempC, double minTempC, int chanceOfRain) {
}
