package io.agentbus.agent.client;

import java.util.concurrent.CompletableFuture;

/**
 * Weather collaborator (WeatherAPI.com in production).
 */
public interface WeatherClient {

    CompletableFuture<WeatherReport> currentWeather(String location);

    CompletableFuture<WeatherReport> forecast(String location, int days);
}
