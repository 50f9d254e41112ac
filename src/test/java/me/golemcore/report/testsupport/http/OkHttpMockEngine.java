package me.golemcore.report.testsupport.http;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Scripted OkHttp interceptor: answers requests from a queue of planned
 * responses in order and records every request. No network I/O.
 */
public final class OkHttpMockEngine implements Interceptor {

    private final ConcurrentLinkedQueue<Planned> planned = new ConcurrentLinkedQueue<>();
    private final List<CapturedRequest> captured = new ArrayList<>();

    public OkHttpClient client() {
        return new OkHttpClient.Builder().addInterceptor(this).build();
    }

    public void enqueueJson(int code, String body) {
        enqueueText(code, body, "application/json");
    }

    public void enqueueText(int code, String body, String contentType) {
        planned.add(new Planned(code, body == null ? "" : body, contentType, null));
    }

    public void enqueueFailure(IOException failure) {
        planned.add(new Planned(0, "", null, failure));
    }

    public synchronized List<CapturedRequest> requests() {
        return List.copyOf(captured);
    }

    public synchronized CapturedRequest request(int index) {
        return captured.get(index);
    }

    public synchronized int getRequestCount() {
        return captured.size();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        synchronized (this) {
            captured.add(new CapturedRequest(request, readBody(request)));
        }
        Planned next = planned.poll();
        if (next == null) {
            throw new IOException("Unexpected request: " + request.method() + " " + request.url());
        }
        if (next.failure() != null) {
            throw next.failure();
        }
        MediaType mediaType = next.contentType() != null ? MediaType.parse(next.contentType()) : null;
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(next.code())
                .message("mock")
                .body(ResponseBody.create(next.body(), mediaType))
                .build();
    }

    private static String readBody(Request request) throws IOException {
        if (request.body() == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        request.body().writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record Planned(int code, String body, String contentType, IOException failure) {
    }

    public record CapturedRequest(Request request, String body) {

        public String method() {
            return request.method();
        }

        /** Encoded path plus query string. */
        public String target() {
            String query = request.url().encodedQuery();
            return query == null ? request.url().encodedPath() : request.url().encodedPath() + "?" + query;
        }

        public String header(String name) {
            return request.header(name);
        }
    }
}
