package org.sunbreeze.http.routing;

import org.sunbreeze.http.common.HttpMethod;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class Resource {

    private final Map<HttpMethod, Endpoint> operations;

    private Resource(Map<HttpMethod, Endpoint> operations) {
        Map<HttpMethod, Endpoint> copy = new EnumMap<>(HttpMethod.class);
        copy.putAll(operations);
        this.operations = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<HttpMethod, Endpoint> getOperations() {
        return operations;
    }

    public Set<HttpMethod> defaultMethods() {
        EnumSet<HttpMethod> methods = EnumSet.copyOf(operations.keySet());
        if (methods.contains(HttpMethod.GET)) {
            methods.add(HttpMethod.HEAD);
        }
        return methods;
    }

    public static final class Builder {

        private final Map<HttpMethod, Endpoint> operations = new EnumMap<>(HttpMethod.class);

        private Builder() {
        }

        public Builder on(HttpMethod method, RouteHandler handler) {
            return register(method, Endpoint.of(Objects.requireNonNull(handler, "handler")));
        }

        public Builder onAsync(HttpMethod method, AsyncRouteHandler handler) {
            return register(method, Endpoint.of(Objects.requireNonNull(handler, "handler")));
        }

        public Builder get(RouteHandler handler) {
            return on(HttpMethod.GET, handler);
        }

        public Builder post(RouteHandler handler) {
            return on(HttpMethod.POST, handler);
        }

        public Builder put(RouteHandler handler) {
            return on(HttpMethod.PUT, handler);
        }

        public Builder patch(RouteHandler handler) {
            return on(HttpMethod.PATCH, handler);
        }

        public Builder delete(RouteHandler handler) {
            return on(HttpMethod.DELETE, handler);
        }

        public Resource build() {
            if (operations.isEmpty()) {
                throw new IllegalStateException("A resource needs at least one operation");
            }
            return new Resource(operations);
        }

        private Builder register(HttpMethod method, Endpoint endpoint) {
            Objects.requireNonNull(method, "method");
            if (operations.putIfAbsent(method, endpoint) != null) {
                throw new IllegalStateException("Operation for " + method + " declared twice");
            }
            return this;
        }

    }

}
