/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */


package me.golemcore.assistant.tools;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.component.ToolComponent;
import me.golemcore.assistant.domain.model.ToolDefinition;
import me.golemcore.assistant.domain.model.ToolExecutionException;
import me.golemcore.assistant.domain.model.ToolPriority;
import me.golemcore.assistant.domain.model.ToolResult;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import me.golemcore.assistant.infrastructure.http.FeignClientFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Current weather for a location via the Open-Meteo API (no API key).
 *
 * <p>
 * Process:
 * <ol>
 * <li>Geocode the location name to coordinates (Open-Meteo Geocoding API)
 * <li>Fetch current weather for the coordinates (Open-Meteo Forecast API)
 * </ol>
 *
 * <p>
 * Without a {@code location} argument the configured
 * {@code assistant.tools.weather.default-location} is used, which lets
 * templates prefetch weather with empty arguments.
 *
 * @see <a href="https://open-meteo.com/">Open-Meteo API</a>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WeatherTool implements ToolComponent {

    public static final String TOOL_NAME = "weather";

    private final FeignClientFactory feignClientFactory;
    private final AssistantProperties properties;

    private GeocodingApi geocodingApi;
    private WeatherApi weatherApi;

    @PostConstruct
    public void init() {
        AssistantProperties.WeatherProperties weather = properties.getTools().getWeather();
        this.geocodingApi = feignClientFactory.create(GeocodingApi.class, weather.getGeocodingUrl());
        this.weatherApi = feignClientFactory.create(WeatherApi.class, weather.getForecastUrl());
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Get current weather for a location.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "location", Map.of(
                                        "type", "string",
                                        "description", "City name (e.g., 'London', 'New York', 'Tokyo')"))))
                .build();
    }

    @Override
    public ToolPriority getPriority() {
        return ToolPriority.IMPORTANT;
    }

    @Override
    public String getCapability() {
        return "check the weather";
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String location = resolveLocation(parameters.get("location"));
            if (location == null) {
                return ToolResult.failure(ToolExecutionException.Kind.INVALID_ARGUMENTS, "Location is required");
            }

            try {
                GeocodingResponse geocoding = geocodingApi.search(location, 1);
                if (geocoding == null || geocoding.getResults() == null || geocoding.getResults().isEmpty()) {
                    return ToolResult.failure("Location not found: " + location);
                }
                GeoResult place = geocoding.getResults().get(0);

                WeatherResponse weather = weatherApi.getCurrentWeather(place.getLatitude(), place.getLongitude(),
                        "temperature_2m,relative_humidity_2m,wind_speed_10m,weather_code");
                if (weather == null || weather.getCurrent() == null) {
                    return ToolResult.failure("Weather data not available");
                }

                CurrentWeather current = weather.getCurrent();
                String description = describe(current.getWeatherCode());
                String output = String.format(
                        "Weather in %s, %s: %s, %.1f°C, humidity %.0f%%, wind %.1f km/h",
                        place.getName(), place.getCountry(), description, current.getTemperature(),
                        current.getHumidity(), current.getWindSpeed());

                return ToolResult.success(output, Map.of(
                        "location", place.getName(),
                        "temperature_celsius", current.getTemperature(),
                        "description", description));
            } catch (RuntimeException e) {
                log.warn("[Tools] Weather lookup failed for '{}': {}", location, e.getMessage());
                return ToolResult.failure("Failed to get weather: " + e.getMessage());
            }
        });
    }

    private String resolveLocation(Object argument) {
        if (argument instanceof String location && !location.isBlank()) {
            return location.trim();
        }
        String fallback = properties.getTools().getWeather().getDefaultLocation();
        return fallback != null && !fallback.isBlank() ? fallback : null;
    }

    static String describe(int code) {
        return switch (code) {
        case 0 -> "Clear sky";
        case 1, 2, 3 -> "Partly cloudy";
        case 45, 48 -> "Foggy";
        case 51, 53, 55 -> "Drizzle";
        case 61, 63, 65 -> "Rain";
        case 66, 67 -> "Freezing rain";
        case 71, 73, 75 -> "Snow";
        case 77 -> "Snow grains";
        case 80, 81, 82 -> "Rain showers";
        case 85, 86 -> "Snow showers";
        case 95 -> "Thunderstorm";
        case 96, 99 -> "Thunderstorm with hail";
        default -> "Unknown";
        };
    }

    interface GeocodingApi {
        @RequestLine("GET /v1/search?name={name}&count={count}")
        GeocodingResponse search(@Param("name") String name, @Param("count") int count);
    }

    interface WeatherApi {
        @RequestLine("GET /v1/forecast?latitude={lat}&longitude={lon}&current={current}")
        WeatherResponse getCurrentWeather(@Param("lat") double latitude, @Param("lon") double longitude,
                @Param("current") String current);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GeocodingResponse {
        private List<GeoResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GeoResult {
        private String name;
        private String country;
        private double latitude;
        private double longitude;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WeatherResponse {
        private CurrentWeather current;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CurrentWeather {
        @JsonProperty("temperature_2m")
        private double temperature;
        @JsonProperty("relative_humidity_2m")
        private double humidity;
        @JsonProperty("wind_speed_10m")
        private double windSpeed;
        @JsonProperty("weather_code")
        private int weatherCode;
    }
}
