package me.golemcore.assistant.tools;

import me.golemcore.assistant.domain.model.ToolDefinition;
import me.golemcore.assistant.domain.model.ToolExecutionException;
import me.golemcore.assistant.domain.model.ToolResult;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import me.golemcore.assistant.infrastructure.http.FeignClientFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class WeatherToolTest {

    private AssistantProperties properties;
    private WeatherTool.GeocodingApi geocodingApi;
    private WeatherTool.WeatherApi weatherApi;
    private WeatherTool tool;

    @BeforeEach
    void setUp() {
        properties = new AssistantProperties();
        geocodingApi = mock(WeatherTool.GeocodingApi.class);
        weatherApi = mock(WeatherTool.WeatherApi.class);

        FeignClientFactory feignClientFactory = mock(FeignClientFactory.class);
        when(feignClientFactory.create(WeatherTool.GeocodingApi.class, "https://geocoding-api.open-meteo.com"))
                .thenReturn(geocodingApi);
        when(feignClientFactory.create(WeatherTool.WeatherApi.class, "https://api.open-meteo.com"))
                .thenReturn(weatherApi);

        tool = new WeatherTool(feignClientFactory, properties);
        tool.init();
    }

    // ===== getDefinition =====

    @Test
    void shouldReturnValidDefinition() {
        ToolDefinition definition = tool.getDefinition();
        assertEquals("weather", definition.getName());
        assertTrue(definition.getDescription().contains("weather"));
        assertNull(definition.getInputSchema().get("required"));
    }

    // ===== Input validation =====

    @Test
    void shouldFailWithoutLocationOrDefault() {
        ToolResult result = tool.execute(Map.of()).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolExecutionException.Kind.INVALID_ARGUMENTS, result.getFailureKind());
        assertEquals("Location is required", result.getError());
        verifyNoInteractions(geocodingApi);
    }

    // ===== Successful weather fetch =====

    @Test
    void shouldReturnWeatherForLocation() {
        stubGeocoding("Paris", geoResult("Paris", "France"));
        stubWeather(24.0, 0);

        ToolResult result = tool.execute(Map.of("location", "Paris")).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("Weather in Paris, France: Clear sky"));
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals("Paris", data.get("location"));
        assertEquals(24.0, data.get("temperature_celsius"));
        assertEquals("Clear sky", data.get("description"));
        verify(weatherApi).getCurrentWeather(48.85, 2.35,
                "temperature_2m,relative_humidity_2m,wind_speed_10m,weather_code");
    }

    @Test
    void shouldUseDefaultLocationWhenArgumentMissing() {
        properties.getTools().getWeather().setDefaultLocation("Paris");
        stubGeocoding("Paris", geoResult("Paris", "France"));
        stubWeather(18.5, 61);

        ToolResult result = tool.execute(Map.of()).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("Rain"));
        verify(geocodingApi).search("Paris", 1);
    }

    // ===== Failures =====

    @Test
    void shouldFailWhenLocationNotFound() {
        WeatherTool.GeocodingResponse empty = new WeatherTool.GeocodingResponse();
        empty.setResults(List.of());
        when(geocodingApi.search("Atlantis", 1)).thenReturn(empty);

        ToolResult result = tool.execute(Map.of("location", "Atlantis")).join();

        assertFalse(result.isSuccess());
        assertEquals("Location not found: Atlantis", result.getError());
        verifyNoInteractions(weatherApi);
    }

    @Test
    void shouldFailWhenWeatherMissing() {
        stubGeocoding("Paris", geoResult("Paris", "France"));
        when(weatherApi.getCurrentWeather(anyDouble(), anyDouble(), anyString()))
                .thenReturn(new WeatherTool.WeatherResponse());

        ToolResult result = tool.execute(Map.of("location", "Paris")).join();

        assertFalse(result.isSuccess());
        assertEquals("Weather data not available", result.getError());
    }

    @Test
    void shouldReportApiFailure() {
        when(geocodingApi.search(anyString(), anyInt())).thenThrow(new IllegalStateException("service down"));

        ToolResult result = tool.execute(Map.of("location", "Paris")).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolExecutionException.Kind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("Failed to get weather: service down", result.getError());
    }

    // ===== Weather codes =====

    @ParameterizedTest
    @CsvSource({
            "0, Clear sky",
            "2, Partly cloudy",
            "45, Foggy",
            "53, Drizzle",
            "65, Rain",
            "67, Freezing rain",
            "73, Snow",
            "77, Snow grains",
            "81, Rain showers",
            "86, Snow showers",
            "95, Thunderstorm",
            "99, Thunderstorm with hail",
            "42, Unknown"
    })
    void shouldDescribeWeatherCodes(int code, String expected) {
        assertEquals(expected, WeatherTool.describe(code));
    }

    private WeatherTool.GeoResult geoResult(String name, String country) {
        WeatherTool.GeoResult place = new WeatherTool.GeoResult();
        place.setName(name);
        place.setCountry(country);
        place.setLatitude(48.85);
        place.setLongitude(2.35);
        return place;
    }

    private void stubGeocoding(String location, WeatherTool.GeoResult place) {
        WeatherTool.GeocodingResponse response = new WeatherTool.GeocodingResponse();
        response.setResults(List.of(place));
        when(geocodingApi.search(location, 1)).thenReturn(response);
    }

    private void stubWeather(double temperature, int code) {
        WeatherTool.CurrentWeather current = new WeatherTool.CurrentWeather();
        current.setTemperature(temperature);
        current.setHumidity(40);
        current.setWindSpeed(5.5);
        current.setWeatherCode(code);
        WeatherTool.WeatherResponse response = new WeatherTool.WeatherResponse();
        response.setCurrent(current);
        when(weatherApi.getCurrentWeather(anyDouble(), anyDouble(), anyString())).thenReturn(response);
    }
}
