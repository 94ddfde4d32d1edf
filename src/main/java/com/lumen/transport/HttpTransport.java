package com.lumen.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Performs one request/response exchange without retrying.
 * <p>
 * Implementations complete the returned future with the response on a 2xx status and
 * exceptionally with a {@link TransportException} otherwise. The calling thread is never
 * blocked for the duration of the round-trip.
 * </p>
 */
public interface HttpTransport {

    CompletableFuture<HttpResponse> exchange(HttpExchange exchange);
}
