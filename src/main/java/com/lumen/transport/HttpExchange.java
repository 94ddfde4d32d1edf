package com.lumen.transport;

import java.util.Map;

/**
 * A single HTTP request to perform.
 *
 * @param method  HTTP verb, e.g. {@code GET} or {@code POST}.
 * @param url     Absolute target URL.
 * @param headers Extra request headers.
 * @param body    JSON body, or {@code null} for bodiless requests.
 */
public record HttpExchange(String method, String url, Map<String, String> headers, String body) {

    public HttpExchange {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static HttpExchange get(String url, Map<String, String> headers) {
        return new HttpExchange("GET", url, headers, null);
    }

    public static HttpExchange post(String url, Map<String, String> headers, String body) {
        return new HttpExchange("POST", url, headers, body);
    }
}
