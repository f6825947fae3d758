package org.sunbreeze.http.routing;

import org.sunbreeze.http.message.Request;
import org.sunbreeze.http.message.Response;

import java.util.Map;

@FunctionalInterface
public interface RouteHandler {

    void handle(Request request, Response response, Map<String, String> params) throws Exception;

}
