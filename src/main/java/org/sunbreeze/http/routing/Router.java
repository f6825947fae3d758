package org.sunbreeze.http.routing;

import org.slf4j.Logger;
import org.sunbreeze.exception.DuplicateRouteException;
import org.sunbreeze.http.common.HttpMethod;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class Router {

    private final Logger log;
    private final List<RouteDefinition> pending = new ArrayList<>();
    private volatile List<RouteDefinition> routes = List.of();
    private volatile boolean frozen;

    public Router(Logger log) {
        this.log = log;
    }

    public synchronized void register(RouteDefinition route) {
        if (frozen) {
            throw new IllegalStateException("Route table is frozen, cannot register " + route.originalPath());
        }
        for (RouteDefinition existing : pending) {
            if (existing.pattern().equals(route.pattern())
                    && !Collections.disjoint(existing.methods(), route.methods())) {
                String msg = "Route '" + route.originalPath() + "' already exists.";
                log.error(msg);
                throw new DuplicateRouteException(msg);
            }
            if (route.name() != null && route.name().equals(existing.name())) {
                String msg = "Route name '" + route.name() + "' already used by " + existing.originalPath();
                log.error(msg);
                throw new DuplicateRouteException(msg);
            }
        }
        pending.add(route);
        routes = List.copyOf(pending);
        log.debug("Route table now holds {} routes", pending.size());
    }

    public synchronized void freeze() {
        if (!frozen) {
            routes = List.copyOf(pending);
            frozen = true;
            log.info("Route table frozen with {} routes", routes.size());
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Optional<RouteMatch> lookup(String path) {
        for (RouteDefinition route : routes) {
            Optional<Map<String, String>> params = route.pattern().match(path);
            if (params.isPresent()) {
                return Optional.of(new RouteMatch(route, params.get()));
            }
        }
        return Optional.empty();
    }

    /**
     * First route whose pattern matches the path and which accepts the method. When the
     * path matches but no such route accepts the method, the first path match is returned
     * so the caller can answer 405.
     */
    public Optional<RouteMatch> lookup(String path, String method) {
        Optional<HttpMethod> httpMethod = HttpMethod.parse(method);
        RouteMatch firstPathMatch = null;
        for (RouteDefinition route : routes) {
            Optional<Map<String, String>> params = route.pattern().match(path);
            if (params.isEmpty()) {
                continue;
            }
            RouteMatch match = new RouteMatch(route, params.get());
            if (httpMethod.isPresent() && route.allows(httpMethod.get())) {
                return Optional.of(match);
            }
            if (firstPathMatch == null) {
                firstPathMatch = match;
            }
        }
        return Optional.ofNullable(firstPathMatch);
    }

    public String urlFor(String name, Map<String, String> params) {
        return routes.stream()
                .filter(route -> name.equals(route.name()))
                .findFirst()
                .map(route -> route.pattern().expand(params))
                .orElseThrow(() -> new IllegalArgumentException("No route named '" + name + "'"));
    }

    public List<RouteDefinition> getRoutes() {
        return routes;
    }

}
