package com.lumen.transport;

import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * {@link HttpTransport} backed by OkHttp's asynchronous call API.
 * <p>
 * Calls are enqueued on OkHttp's dispatcher, so the caller only waits on the returned future.
 * Cancelling that future cancels the underlying {@link Call}.
 * </p>
 */
public class OkHttpTransport implements HttpTransport {

    private static final Logger log = LoggerFactory.getLogger(OkHttpTransport.class);

    private static final MediaType MEDIA_TYPE_JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;

    public OkHttpTransport(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * Builds a transport whose connect, read and write timeouts all equal {@code timeout}.
     */
    public static OkHttpTransport withTimeout(Duration timeout) {
        return new OkHttpTransport(new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .writeTimeout(timeout)
                .readTimeout(timeout)
                .build());
    }

    @Override
    public CompletableFuture<HttpResponse> exchange(HttpExchange exchange) {
        var builder = new Request.Builder().url(exchange.url());
        exchange.headers().forEach(builder::header);

        RequestBody body = exchange.body() != null ? RequestBody.create(exchange.body(), MEDIA_TYPE_JSON) : null;
        builder.method(exchange.method(), body);

        Call call = httpClient.newCall(builder.build());
        CompletableFuture<HttpResponse> future = new CompletableFuture<>();
        future.whenComplete((ignored, error) -> {
            if (future.isCancelled()) {
                call.cancel();
            }
        });

        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failedCall, IOException e) {
                log.debug("{} {} failed before a response: {}", exchange.method(), exchange.url(), e.getMessage());
                future.completeExceptionally(new TransportException(TransportException.Kind.RETRYABLE,
                        TransportException.NO_RESPONSE,
                        "Could not reach %s: %s".formatted(exchange.url(), e.getMessage()), e));
            }

            @Override
            public void onResponse(Call completedCall, Response response) {
                try (response) {
                    ResponseBody responseBody = response.body();
                    String responseString = responseBody != null ? responseBody.string() : "";

                    if (!response.isSuccessful()) {
                        log.debug("{} {} returned {}: {}", exchange.method(), exchange.url(), response.code(), responseString);
                        future.completeExceptionally(
                                TransportException.forStatus(response.code(), exchange.method(), exchange.url()));
                        return;
                    }
                    future.complete(new HttpResponse(response.code(), responseString));
                } catch (IOException e) {
                    future.completeExceptionally(new TransportException(TransportException.Kind.RETRYABLE,
                            response.code(), "Failed reading response from " + exchange.url(), e));
                }
            }
        });
        return future;
    }
}
