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


package me.golemcore.assistant.infrastructure.config;

import lombok.Data;
import me.golemcore.assistant.domain.model.AgentConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the assistant core.
 *
 * <p>
 * All settings live under the {@code assistant.*} prefix:
 * <ul>
 * <li>{@link AgentProperties} - run loop limits and retry backoff</li>
 * <li>{@link BudgetProperties} - context window reserves and prompt section
 * caps</li>
 * <li>{@link ProactiveProperties} - intent-driven tool prefetch</li>
 * <li>{@link ToolsProperties} - tool enablement and execution timeout</li>
 * <li>{@link LlmProperties} - model backend settings</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "assistant")
@Data
public class AssistantProperties {

    private AgentProperties agent = new AgentProperties();
    private BudgetProperties budget = new BudgetProperties();
    private ProactiveProperties proactive = new ProactiveProperties();
    private ToolsProperties tools = new ToolsProperties();
    private LlmProperties llm = new LlmProperties();
    private SummaryProperties summary = new SummaryProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class AgentProperties {
        private int maxIterations = AgentConfig.DEFAULT_MAX_ITERATIONS;
        private int maxRetries = AgentConfig.DEFAULT_MAX_RETRIES;
        private long baseRetryDelayMs = 1000;
        private int loopDetectionWindow = 3;

        public AgentConfig toAgentConfig() {
            return new AgentConfig(maxIterations, maxRetries, Duration.ofMillis(baseRetryDelayMs));
        }
    }

    @Data
    public static class BudgetProperties {
        private int contextWindow = 4096;
        private int systemReserve = 500;
        private int toolSchemaReserve = 400;
        private int responseReserve = 1200;
        private double summarizationThreshold = 0.8;
        private int summaryMaxTokens = 150;
        private SectionCaps sections = new SectionCaps();

        public int getMaxHistoryTokens() {
            return contextWindow - systemReserve - toolSchemaReserve - responseReserve;
        }
    }

    @Data
    public static class SectionCaps {
        private int core = 250;
        private int template = 50;
        private int summary = 100;
        private int memories = 80;
        private int proactive = 80;
        private int disabledTools = 40;
    }

    @Data
    public static class ProactiveProperties {
        private boolean enabled = false;
        private long timeoutMs = 2000;
        private long templateTimeoutMs = 3000;
        private int maxChars = 400;
    }

    @Data
    public static class ToolsProperties {
        private List<String> disabled = new ArrayList<>();
        private long timeoutSeconds = 30;
        private WebFetchProperties webFetch = new WebFetchProperties();
        private WeatherProperties weather = new WeatherProperties();
    }

    @Data
    public static class WeatherProperties {
        private String defaultLocation;
        private String geocodingUrl = "https://geocoding-api.open-meteo.com";
        private String forecastUrl = "https://api.open-meteo.com";
    }

    @Data
    public static class WebFetchProperties {
        private int defaultMaxLength = 10000;
        private long maxResponseBytes = 5L * 1024 * 1024;
    }

    @Data
    public static class LlmProperties {
        private String providerName = "openrouter";
        private String apiKey;
        private String baseUrl = "https://openrouter.ai/api/v1";
        private String model = "openai/gpt-4o-mini";
        private long timeoutMs = 120000;
        private int maxTools = 10;
        private Double temperature = 0.7;
    }

    @Data
    public static class SummaryProperties {
        private long timeoutMs = 15000;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
