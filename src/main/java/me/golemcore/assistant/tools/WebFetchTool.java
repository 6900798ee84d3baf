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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.component.ToolComponent;
import me.golemcore.assistant.domain.model.ToolDefinition;
import me.golemcore.assistant.domain.model.ToolExecutionException;
import me.golemcore.assistant.domain.model.ToolResult;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Fetches a web page or API response over HTTP(S) and returns it as text.
 *
 * <p>
 * Only {@code http} and {@code https} URLs are accepted. Bodies larger than
 * {@code assistant.tools.web-fetch.max-response-bytes} are rejected. In
 * {@code text} format HTML is stripped to plain text; in {@code json} format
 * the body is pretty-printed. The result is a JSON object with the url,
 * format, content, truncated flag and original character count.
 */
@Component
@Slf4j
public class WebFetchTool implements ToolComponent {

    public static final String TOOL_NAME = "web_fetch";

    private static final String USER_AGENT = "GolemCore-Assistant/1.0";
    private static final Pattern SCRIPT = Pattern.compile("<script[^>]*>[\\s\\S]*?</script>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern STYLE = Pattern.compile("<style[^>]*>[\\s\\S]*?</style>", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AssistantProperties.WebFetchProperties settings;

    public WebFetchTool(OkHttpClient httpClient, ObjectMapper objectMapper, AssistantProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.settings = properties.getTools().getWebFetch();
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("url", Map.of("type", "string", "description", "The URL to fetch"));
        properties.put("format", Map.of(
                "type", "string",
                "enum", List.of("text", "json", "html"),
                "description", "Response format (default: text)"));
        properties.put("maxLength", Map.of(
                "type", "integer",
                "description", "Maximum response length in characters (default: " + settings.getDefaultMaxLength()
                        + ")"));
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Fetch content from a URL and return it as text. Useful for reading web pages, "
                        + "APIs or documentation.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", properties,
                        "required", List.of("url")))
                .build();
    }

    @Override
    public String getCapability() {
        return "read web pages";
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object rawUrl = parameters.get("url");
        HttpUrl url = rawUrl instanceof String text ? HttpUrl.parse(text.trim()) : null;
        if (url == null) {
            return CompletableFuture.completedFuture(ToolResult.failure(
                    ToolExecutionException.Kind.INVALID_ARGUMENTS,
                    "Invalid URL. Only HTTP and HTTPS URLs are supported."));
        }
        String format = parameters.get("format") instanceof String f ? f : "text";
        int maxLength = parameters.get("maxLength") instanceof Number n && n.intValue() > 0
                ? n.intValue()
                : settings.getDefaultMaxLength();

        return CompletableFuture.supplyAsync(() -> fetch(url, format, maxLength));
    }

    private ToolResult fetch(HttpUrl url, String format, int maxLength) {
        Request request = new Request.Builder()
                .url(url)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "json".equals(format) ? "application/json" : "text/html,text/plain,*/*")
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                return ToolResult.failure("HTTP " + response.code() + ": " + response.message());
            }
            ResponseBody body = response.body();
            if (body == null) {
                return ToolResult.failure("Empty response from server");
            }
            byte[] bytes = readLimited(body);
            if (bytes == null) {
                return ToolResult.failure("Response too large. Maximum allowed is "
                        + settings.getMaxResponseBytes() / (1024 * 1024) + "MB.");
            }

            String content = render(new String(bytes, StandardCharsets.UTF_8), format);
            int originalLength = content.length();
            boolean truncated = originalLength > maxLength;
            if (truncated) {
                content = content.substring(0, maxLength);
            }

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("url", url.toString());
            result.put("format", format);
            result.put("content", content);
            result.put("truncated", truncated);
            result.put("characterCount", originalLength);
            log.debug("[Tools] Fetched {} ({} chars)", url, originalLength);
            return ToolResult.success(objectMapper.writeValueAsString(result), result);
        } catch (IOException e) {
            log.warn("[Tools] Fetch failed for {}: {}", url, e.getMessage());
            return ToolResult.failure("Failed to fetch URL: " + e.getMessage());
        }
    }

    /**
     * Reads the body up to the configured cap; null when it is larger.
     */
    private byte[] readLimited(ResponseBody body) throws IOException {
        long max = settings.getMaxResponseBytes();
        if (body.contentLength() > max) {
            return null;
        }
        try (InputStream in = body.byteStream()) {
            byte[] bytes = in.readNBytes((int) Math.min(Integer.MAX_VALUE - 8L, max + 1));
            return bytes.length > max ? null : bytes;
        }
    }

    private String render(String raw, String format) {
        if ("json".equals(format)) {
            try {
                JsonNode node = objectMapper.readTree(raw);
                return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (JsonProcessingException e) {
                return raw;
            }
        }
        if ("text".equals(format) && raw.contains("<")) {
            return stripHtml(raw);
        }
        return raw;
    }

    static String stripHtml(String html) {
        String text = SCRIPT.matcher(html).replaceAll("");
        text = STYLE.matcher(text).replaceAll("");
        text = TAG.matcher(text).replaceAll(" ");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
