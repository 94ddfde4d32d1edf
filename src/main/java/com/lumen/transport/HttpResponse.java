package com.lumen.transport;

/**
 * A successful (2xx) HTTP response.
 */
public record HttpResponse(int statusCode, String body) {
}
