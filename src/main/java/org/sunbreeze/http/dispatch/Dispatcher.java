package org.sunbreeze.http.dispatch;

import org.slf4j.Logger;
import org.sunbreeze.exception.MethodNotAllowedException;
import org.sunbreeze.exception.NotFoundException;
import org.sunbreeze.http.common.HttpMethod;
import org.sunbreeze.http.message.Request;
import org.sunbreeze.http.message.Response;
import org.sunbreeze.http.routing.Endpoint;
import org.sunbreeze.http.routing.RouteMatch;
import org.sunbreeze.http.routing.Router;
import org.sunbreeze.http.staticfiles.StaticFiles;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public class Dispatcher {

    private final Logger log;
    private final Router router;
    private final ErrorBoundary errorBoundary;
    private final List<StaticFiles> mounts;
    private final boolean debug;

    public Dispatcher(Logger log, Router router, ErrorBoundary errorBoundary, List<StaticFiles> mounts,
                      boolean debug) {
        this.log = log;
        this.router = router;
        this.errorBoundary = errorBoundary;
        this.mounts = List.copyOf(mounts);
        this.debug = debug;
    }

    public CompletableFuture<Response> dispatch(Request request) {
        log.info("Request: {} {}", request.getMethod(), request.getPath());

        for (StaticFiles mount : mounts) {
            if (mount.owns(request.getPath())) {
                DispatchContext context = new DispatchContext(
                        request.getMethod(), request.getPath(), null, debug, mount.getPrefix());
                return errorBoundary.guard(context, () -> serveStatic(mount, request))
                        .thenApply(Response::commit);
            }
        }

        ResolvedRoute resolved;
        try {
            resolved = resolve(request);
        } catch (NotFoundException e) {
            log.debug("No route for {}", request.getPath());
            return CompletableFuture.completedFuture(notFound().commit());
        } catch (MethodNotAllowedException e) {
            log.debug("{} not allowed on {}", e.getMethod(), request.getPath());
            return CompletableFuture.completedFuture(methodNotAllowed(e).commit());
        }

        RouteMatch match = resolved.match();
        Endpoint endpoint = resolved.endpoint();
        DispatchContext context = new DispatchContext(request.getMethod(), request.getPath(),
                match.pathParams(), debug, match.route().name());
        Response response = new Response();
        return errorBoundary.guard(context, () -> endpoint.invoke(request, response, context.params()))
                .thenApply(Response::commit);
    }

    ResolvedRoute resolve(Request request) {
        RouteMatch match = router.lookup(request.getPath(), request.getMethod())
                .orElseThrow(() -> new NotFoundException(request.getPath()));
        Optional<Endpoint> endpoint = request.httpMethod().flatMap(method -> match.route().endpointFor(method));
        if (endpoint.isEmpty()) {
            throw new MethodNotAllowedException(request.getMethod(), match.route().allowHeaderValues());
        }
        return new ResolvedRoute(match, endpoint.get());
    }

    private CompletableFuture<Response> serveStatic(StaticFiles mount, Request request) throws Exception {
        try {
            return CompletableFuture.completedFuture(mount.serve(request.getMethod(), request.getPath()));
        } catch (NotFoundException e) {
            return CompletableFuture.completedFuture(notFound());
        } catch (MethodNotAllowedException e) {
            return CompletableFuture.completedFuture(methodNotAllowed(e));
        }
    }

    static Response notFound() {
        return Response.text(404, NotFoundException.MESSAGE);
    }

    static Response methodNotAllowed(MethodNotAllowedException e) {
        Response response = Response.text(405, MethodNotAllowedException.MESSAGE);
        String allow = String.join(", ", e.getAllowed().stream()
                .sorted(Comparator.comparingInt(Dispatcher::order))
                .toList());
        if (!allow.isEmpty()) {
            response.setHeader("Allow", allow);
        }
        return response;
    }

    private static int order(String method) {
        return HttpMethod.parse(method).map(Enum::ordinal).orElse(Integer.MAX_VALUE);
    }

    record ResolvedRoute(RouteMatch match, Endpoint endpoint) {
    }

}
