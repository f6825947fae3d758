package org.sunbreeze.http.routing;

import org.sunbreeze.http.message.Request;
import org.sunbreeze.http.message.Response;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

@FunctionalInterface
public interface Endpoint {

    CompletionStage<Response> invoke(Request request, Response response, Map<String, String> params) throws Exception;

    static Endpoint of(RouteHandler handler) {
        return (request, response, params) -> {
            handler.handle(request, response, params);
            return CompletableFuture.completedFuture(response);
        };
    }

    static Endpoint of(AsyncRouteHandler handler) {
        return (request, response, params) -> handler.handle(request, params);
    }

}
