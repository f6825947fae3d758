package org.sunbreeze.http.message;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.sunbreeze.http.common.HttpMethod;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

@Getter
public final class Request {

    private final String method;
    private final String path;
    private final Map<String, List<String>> queryParams;
    private final Map<String, String> headers;
    private final byte[] body;

    @Builder
    private Request(String method, String path, @Singular Map<String, List<String>> queryParams,
                    @Singular Map<String, String> headers, byte[] body) {
        this.method = method == null ? HttpMethod.GET.name() : method;
        this.path = path == null || path.isEmpty() ? "/" : path;
        this.queryParams = Map.copyOf(queryParams);
        TreeMap<String, String> caseInsensitive = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        caseInsensitive.putAll(headers);
        this.headers = Collections.unmodifiableMap(caseInsensitive);
        this.body = body == null ? new byte[0] : body.clone();
    }

    public static Request of(String method, String path) {
        return builder().method(method).path(path).build();
    }

    public Optional<HttpMethod> httpMethod() {
        return HttpMethod.parse(method);
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    public Optional<String> queryParam(String name) {
        List<String> values = queryParams.get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0));
    }

    public byte[] getBody() {
        return body.clone();
    }

    public String bodyAsText() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return method + " " + path;
    }

}
