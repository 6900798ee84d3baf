package me.golemcore.assistant.testsupport.http;

import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory OkHttp exchange engine for unit tests.
 * <p>
 * This interceptor never performs network I/O. Tests enqueue responses (or
 * failures), and every request is captured for assertions.
 */
public final class OkHttpMockEngine implements Interceptor {

    private final ConcurrentLinkedQueue<PlannedResult> plannedResults = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<Request> capturedRequests = new ConcurrentLinkedQueue<>();
    private final AtomicInteger requestCount = new AtomicInteger();

    /**
     * Client that routes every call through this engine.
     */
    public OkHttpClient client() {
        return new OkHttpClient.Builder().addInterceptor(this).build();
    }

    public void enqueueJson(int code, String body) {
        enqueueText(code, body, "application/json");
    }

    public void enqueueText(int code, String body, String contentType) {
        enqueueBytes(code, body != null ? body.getBytes(StandardCharsets.UTF_8) : new byte[0], contentType);
    }

    public void enqueueBytes(int code, byte[] body, String contentType) {
        plannedResults.add(PlannedResult.response(code, body != null ? body : new byte[0], contentType));
    }

    public void enqueueFailure(IOException failure) {
        plannedResults.add(PlannedResult.failure(failure));
    }

    public Request takeRequest() {
        return capturedRequests.poll();
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        capturedRequests.add(request);
        requestCount.incrementAndGet();

        PlannedResult plannedResult = plannedResults.poll();
        if (plannedResult == null) {
            throw new IOException("No planned response for request: " + request.method() + " " + request.url());
        }
        if (plannedResult.failure() != null) {
            throw plannedResult.failure();
        }

        MediaType mediaType = plannedResult.contentType() != null
                ? MediaType.parse(plannedResult.contentType())
                : null;
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(plannedResult.code())
                .message(plannedResult.code() >= 400 ? "Error" : "OK")
                .headers(Headers.of())
                .body(ResponseBody.create(plannedResult.body(), mediaType))
                .build();
    }

    private record PlannedResult(int code, byte[] body, String contentType, IOException failure) {
        static PlannedResult response(int code, byte[] body, String contentType) {
            return new PlannedResult(code, body, contentType, null);
        }

        static PlannedResult failure(IOException failure) {
            return new PlannedResult(0, new byte[0], null, failure);
        }
    }
}
