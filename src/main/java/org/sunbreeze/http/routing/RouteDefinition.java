package org.sunbreeze.http.routing;

import org.sunbreeze.http.common.HttpMethod;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

public record RouteDefinition(String originalPath, PathPattern pattern, Map<HttpMethod, Endpoint> operations,
                              Set<HttpMethod> methods, String name) {

    public static final Set<HttpMethod> DEFAULT_METHODS = Collections.unmodifiableSet(
            EnumSet.of(HttpMethod.GET, HttpMethod.HEAD));

    public RouteDefinition {
        Objects.requireNonNull(pattern, "pattern");
        if (methods == null || methods.isEmpty()) {
            throw new IllegalArgumentException("Route " + originalPath + " allows no methods");
        }
        Map<HttpMethod, Endpoint> copy = new EnumMap<>(HttpMethod.class);
        copy.putAll(operations);
        operations = Collections.unmodifiableMap(copy);
        methods = Collections.unmodifiableSet(EnumSet.copyOf(methods));
    }

    public static RouteDefinition of(String path, RouteHandler handler, Set<HttpMethod> methods, String name) {
        Set<HttpMethod> allowed = methods == null || methods.isEmpty() ? DEFAULT_METHODS : methods;
        Endpoint endpoint = Endpoint.of(Objects.requireNonNull(handler, "handler"));
        Map<HttpMethod, Endpoint> operations = new EnumMap<>(HttpMethod.class);
        allowed.forEach(method -> operations.put(method, endpoint));
        return new RouteDefinition(path, PathPattern.compile(path), operations, allowed, name);
    }

    /**
     * Resource-style route. When {@code methods} is null the resource's own operations decide,
     * otherwise every listed method needs an operation (HEAD is served by GET).
     *
     * @throws IllegalArgumentException if a listed method has no operation
     */
    public static RouteDefinition of(String path, Resource resource, Set<HttpMethod> methods, String name) {
        Map<HttpMethod, Endpoint> operations = resource.getOperations();
        if (methods == null || methods.isEmpty()) {
            return new RouteDefinition(path, PathPattern.compile(path), operations, resource.defaultMethods(), name);
        }
        for (HttpMethod method : methods) {
            boolean servedByGet = method == HttpMethod.HEAD && operations.containsKey(HttpMethod.GET);
            if (!operations.containsKey(method) && !servedByGet) {
                throw new IllegalArgumentException(
                        "Resource at " + path + " has no operation for " + method);
            }
        }
        return new RouteDefinition(path, PathPattern.compile(path), operations, methods, name);
    }

    public Optional<Endpoint> endpointFor(HttpMethod method) {
        if (!methods.contains(method)) {
            return Optional.empty();
        }
        Endpoint endpoint = operations.get(method);
        if (endpoint == null && method == HttpMethod.HEAD) {
            endpoint = operations.get(HttpMethod.GET);
        }
        return Optional.ofNullable(endpoint);
    }

    public boolean allows(HttpMethod method) {
        return endpointFor(method).isPresent();
    }

    public Optional<String> routeName() {
        return Optional.ofNullable(name);
    }

    public Set<String> allowHeaderValues() {
        return methods.stream()
                .filter(this::allows)
                .map(Enum::name)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

}
