package org.sunbreeze.http.common;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum HttpMethod {
    GET,
    HEAD,
    POST,
    PUT,
    PATCH,
    DELETE,
    OPTIONS,
    TRACE;

    public static Optional<HttpMethod> parse(String method) {
        if (method == null || method.isBlank()) {
            return Optional.empty();
        }
        String upper = method.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(m -> m.name().equals(upper))
                .findFirst();
    }

}
