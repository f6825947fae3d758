package org.sunbreeze.http.routing;

import org.sunbreeze.http.message.Request;
import org.sunbreeze.http.message.Response;

import java.util.Map;
import java.util.concurrent.CompletionStage;

@FunctionalInterface
public interface AsyncRouteHandler {

    CompletionStage<Response> handle(Request request, Map<String, String> params) throws Exception;

}
