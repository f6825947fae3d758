package org.sunbreeze.http.message;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.SneakyThrows;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public final class Response {

    public static final String TEXT_PLAIN = "text/plain; charset=UTF-8";
    public static final String TEXT_HTML = "text/html; charset=UTF-8";
    public static final String APPLICATION_JSON = "application/json; charset=UTF-8";

    private static final ObjectMapper mapper = new ObjectMapper();

    @Getter
    private int status = 200;
    @Getter
    private String mediaType = TEXT_PLAIN;
    private byte[] body = new byte[0];
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private volatile boolean committed;

    public Response() {
    }

    public static Response text(int status, String text) {
        Response response = new Response();
        response.setStatus(status);
        response.setText(text);
        return response;
    }

    public Response setStatus(int status) {
        ensureMutable();
        if (status < 100 || status > 999) {
            throw new IllegalArgumentException("Status code out of range: " + status);
        }
        this.status = status;
        return this;
    }

    public Response setMediaType(String mediaType) {
        ensureMutable();
        this.mediaType = mediaType;
        return this;
    }

    /**
     * @throws IllegalArgumentException if the name is not an HTTP token or the value holds
     *                                  control characters
     */
    public Response setHeader(String name, String value) {
        ensureMutable();
        if (name == null || name.isEmpty() || !name.chars().allMatch(Response::isTokenChar)) {
            throw new IllegalArgumentException("Invalid header name: '" + name + "'");
        }
        if (value == null || !value.chars().allMatch(c -> c == '\t' || (c >= 0x20 && c != 0x7f))) {
            throw new IllegalArgumentException("Invalid value for header " + name);
        }
        headers.put(name, value);
        return this;
    }

    public Response setBody(byte[] body) {
        ensureMutable();
        this.body = body == null ? new byte[0] : body.clone();
        return this;
    }

    public Response setText(String text) {
        setBody(text.getBytes(StandardCharsets.UTF_8));
        return setMediaType(TEXT_PLAIN);
    }

    public Response setHtml(String html) {
        setBody(html.getBytes(StandardCharsets.UTF_8));
        return setMediaType(TEXT_HTML);
    }

    @SneakyThrows
    public Response setJson(Object value) {
        setBody(mapper.writeValueAsBytes(value));
        return setMediaType(APPLICATION_JSON);
    }

    public byte[] getBody() {
        return body.clone();
    }

    public String getText() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public boolean isCommitted() {
        return committed;
    }

    public Response commit() {
        committed = true;
        return this;
    }

    private void ensureMutable() {
        if (committed) {
            throw new IllegalStateException("Response already committed");
        }
    }

    @Override
    public String toString() {
        return "Response{status=" + status + ", mediaType=" + mediaType + ", length=" + body.length + "}";
    }

    private static boolean isTokenChar(int c) {
        return c > 0x20 && c < 0x7f && "\"(),/:;<=>?@[\\]{}".indexOf(c) < 0;
    }

}
