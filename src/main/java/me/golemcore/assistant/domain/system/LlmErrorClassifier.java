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


package me.golemcore.assistant.domain.system;

import java.io.InterruptedIOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Maps model-backend failures to stable string codes. The cause chain is
 * walked until a known exception type or a recognizable message is found.
 * Langchain4j exceptions are matched by class name so the domain layer does not
 * link against the adapter library.
 */
public final class LlmErrorClassifier {

    public static final String RATE_LIMIT = "llm.rate_limit";
    public static final String CONCURRENCY_LIMIT = "llm.concurrency_limit";
    public static final String REQUEST_TIMEOUT = "llm.request.timeout";
    public static final String CONNECTION_LOST = "llm.connection.lost";
    public static final String REQUEST_ABORTED = "llm.request.aborted";
    public static final String CONTEXT_LENGTH_EXCEEDED = "llm.context.length_exceeded";
    public static final String AUTHENTICATION = "llm.authentication";
    public static final String INVALID_REQUEST = "llm.invalid_request";
    public static final String CONTENT_FILTERED = "llm.content_filtered";
    public static final String SERVER_ERROR = "llm.server_error";
    public static final String UNKNOWN = "llm.error.unknown";

    private static final Set<String> TRANSIENT_CODES = Set.of(
            RATE_LIMIT, CONCURRENCY_LIMIT, REQUEST_TIMEOUT, CONNECTION_LOST);

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    private static final String CLASS_INVALID_REQUEST_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InvalidRequestException";
    private static final String CLASS_CONTENT_FILTERED_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ContentFilteredException";
    private static final String CLASS_INTERNAL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InternalServerException";
    private static final String CLASS_HTTP_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "HttpException";

    private LlmErrorClassifier() {
    }

    public static String classify(Throwable throwable) {
        if (throwable == null) {
            return UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            String byType = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(byType)) {
                return byType;
            }

            String byMessage = classifyFromMessage(current.getMessage());
            if (!UNKNOWN.equals(byMessage)) {
                return byMessage;
            }

            current = current.getCause();
        }
        return UNKNOWN;
    }

    /**
     * Rate and concurrency limits, timeouts and dropped connections. Everything
     * else, cancellation included, is permanent.
     */
    public static boolean isTransientCode(String code) {
        return code != null && TRANSIENT_CODES.contains(code);
    }

    public static boolean isContextOverflowCode(String code) {
        return CONTEXT_LENGTH_EXCEEDED.equals(code);
    }

    public static boolean isAbortCode(String code) {
        return REQUEST_ABORTED.equals(code);
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return REQUEST_ABORTED;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return REQUEST_TIMEOUT;
        }
        if (throwable instanceof InterruptedIOException) {
            return REQUEST_ABORTED;
        }
        if (throwable instanceof SocketException && !(throwable instanceof ConnectException)) {
            return CONNECTION_LOST;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return UNKNOWN;
        }

        switch (className) {
        case CLASS_RATE_LIMIT_EXCEPTION:
            return isConcurrencyMessage(throwable.getMessage()) ? CONCURRENCY_LIMIT : RATE_LIMIT;
        case CLASS_TIMEOUT_EXCEPTION:
            return REQUEST_TIMEOUT;
        case CLASS_AUTHENTICATION_EXCEPTION:
            return AUTHENTICATION;
        case CLASS_INVALID_REQUEST_EXCEPTION:
            return isContextMessage(throwable.getMessage()) ? CONTEXT_LENGTH_EXCEEDED : INVALID_REQUEST;
        case CLASS_CONTENT_FILTERED_EXCEPTION:
            return CONTENT_FILTERED;
        case CLASS_INTERNAL_SERVER_EXCEPTION:
            return SERVER_ERROR;
        case CLASS_HTTP_EXCEPTION:
            return classifyHttpExceptionByStatus(throwable);
        default:
            return UNKNOWN;
        }
    }

    private static String classifyHttpExceptionByStatus(Throwable throwable) {
        Integer statusCode = readHttpStatusCode(throwable);
        if (statusCode == null) {
            return UNKNOWN;
        }
        if (statusCode == 429) {
            return isConcurrencyMessage(throwable.getMessage()) ? CONCURRENCY_LIMIT : RATE_LIMIT;
        }
        if (statusCode == 401 || statusCode == 403) {
            return AUTHENTICATION;
        }
        if (statusCode == 408 || statusCode == 504) {
            return REQUEST_TIMEOUT;
        }
        if (statusCode >= 500) {
            return SERVER_ERROR;
        }
        if (statusCode >= 400) {
            return isContextMessage(throwable.getMessage()) ? CONTEXT_LENGTH_EXCEEDED : INVALID_REQUEST;
        }
        return UNKNOWN;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer) {
                return (Integer) result;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException e) {
            return null;
        }
        return null;
    }

    private static String classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN;
        }
        if (isContextMessage(message)) {
            return CONTEXT_LENGTH_EXCEEDED;
        }
        if (isConcurrencyMessage(message)) {
            return CONCURRENCY_LIMIT;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("rate limit") || normalized.contains("too many requests")) {
            return RATE_LIMIT;
        }
        if (normalized.contains("connection reset") || normalized.contains("connection lost")
                || normalized.contains("network connection was lost")) {
            return CONNECTION_LOST;
        }
        return UNKNOWN;
    }

    private static boolean isContextMessage(String message) {
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return normalized.contains("context length")
                || normalized.contains("context window")
                || normalized.contains("maximum context")
                || normalized.contains("exceeds context")
                || normalized.contains("token limit exceeded")
                || normalized.contains("prompt is too long");
    }

    private static boolean isConcurrencyMessage(String message) {
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return normalized.contains("concurrent request") || normalized.contains("concurrency limit");
    }
}
