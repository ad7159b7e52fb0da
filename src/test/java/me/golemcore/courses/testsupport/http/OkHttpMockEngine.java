package me.golemcore.courses.testsupport.http;

import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory OkHttp interceptor for adapter tests. Never touches the network:
 * responses and failures are queued up front, and every request is captured.
 */
public final class OkHttpMockEngine implements Interceptor {

    private static final MediaType JSON = MediaType.get("application/json");

    private final ConcurrentLinkedQueue<Planned> planned = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<CapturedRequest> captured = new ConcurrentLinkedQueue<>();
    private final AtomicInteger requestCount = new AtomicInteger();
    private final CountDownLatch requestStarted = new CountDownLatch(1);
    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void enqueueJson(int code, String body) {
        planned.add(new Planned(code, body != null ? body : "", null, false));
    }

    public void enqueueFailure(IOException failure) {
        planned.add(new Planned(0, "", failure, false));
    }

    /**
     * Plans a response that never arrives: the call blocks until it is
     * cancelled.
     */
    public void enqueueHang() {
        planned.add(new Planned(0, "", null, true));
    }

    public boolean awaitRequest(long timeout, TimeUnit unit) throws InterruptedException {
        return requestStarted.await(timeout, unit);
    }

    public boolean awaitCancellation(long timeout, TimeUnit unit) throws InterruptedException {
        return cancelled.await(timeout, unit);
    }

    public CapturedRequest takeRequest() {
        return captured.poll();
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        captured.add(new CapturedRequest(request, readBody(request)));
        requestCount.incrementAndGet();
        requestStarted.countDown();

        Planned next = planned.poll();
        if (next == null) {
            throw new IOException("No planned response for " + request.method() + " " + request.url());
        }
        if (next.failure() != null) {
            throw next.failure();
        }
        if (next.hang()) {
            return hangUntilCancelled(chain);
        }

        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(next.code())
                .message("mock")
                .headers(Headers.of())
                .body(ResponseBody.create(next.body().getBytes(StandardCharsets.UTF_8), JSON))
                .build();
    }

    private Response hangUntilCancelled(Chain chain) throws IOException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (System.nanoTime() < deadline) {
            if (chain.call().isCanceled()) {
                cancelled.countDown();
                throw new IOException("Canceled");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while hanging", e);
            }
        }
        throw new IOException("Hanging call was never cancelled");
    }

    private static String readBody(Request request) throws IOException {
        RequestBody body = request.body();
        if (body == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record Planned(int code, String body, IOException failure, boolean hang) {
    }

    public record CapturedRequest(Request request, String body) {

        public String method() {
            return request.method();
        }

        public String path() {
            return request.url().encodedPath();
        }

        public String queryParameter(String name) {
            return request.url().queryParameter(name);
        }

        public String header(String name) {
            return request.header(name);
        }
    }
}
