package org.sunbreeze;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sunbreeze.http.common.HttpMethod;
import org.sunbreeze.http.dispatch.Dispatcher;
import org.sunbreeze.http.dispatch.ErrorBoundary;
import org.sunbreeze.http.message.Request;
import org.sunbreeze.http.message.Response;
import org.sunbreeze.http.routing.Resource;
import org.sunbreeze.http.routing.RouteDefinition;
import org.sunbreeze.http.routing.RouteHandler;
import org.sunbreeze.http.routing.Router;
import org.sunbreeze.http.staticfiles.StaticFiles;
import org.sunbreeze.http.template.FileTemplateRenderer;
import org.sunbreeze.http.template.TemplateRenderer;
import org.sunbreeze.server.dto.SunbreezeProperties;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

public class Sunbreeze {

    private final SunbreezeProperties properties;
    private final Logger log;
    private final Router router;
    private final Dispatcher dispatcher;
    private final TemplateRenderer templates;

    public Sunbreeze(SunbreezeProperties properties) {
        this(properties, new FileTemplateRenderer(properties.getTemplateDir()));
    }

    public Sunbreeze(SunbreezeProperties properties, TemplateRenderer templates) {
        this(properties, templates, LoggerFactory.getLogger(properties.getName()));
    }

    public Sunbreeze(SunbreezeProperties properties, TemplateRenderer templates, Logger log) {
        this.properties = properties;
        this.templates = templates;
        this.log = log;
        this.router = new Router(log);
        StaticFiles staticFiles = new StaticFiles(properties.getStaticPrefix(), properties.getStaticDir());
        this.dispatcher = new Dispatcher(log, router, new ErrorBoundary(log, templates), List.of(staticFiles),
                properties.isDebug());
        log.info("Sunbreeze application initialized: {} v{}", properties.getName(), properties.getVersion());
    }

    public Sunbreeze route(String path, RouteHandler handler) {
        return route(path, handler, null, null);
    }

    public Sunbreeze route(String path, RouteHandler handler, Set<HttpMethod> methods) {
        return route(path, handler, methods, null);
    }

    public Sunbreeze route(String path, RouteHandler handler, Set<HttpMethod> methods, String name) {
        if (methods == null) {
            log.debug("No methods provided for {}, defaulting to GET and HEAD.", path);
        }
        router.register(RouteDefinition.of(path, handler, methods, name));
        log.info("Route added: {}", path);
        return this;
    }

    public Sunbreeze resource(String path, Resource resource) {
        return resource(path, resource, null, null);
    }

    public Sunbreeze resource(String path, Resource resource, Set<HttpMethod> methods, String name) {
        router.register(RouteDefinition.of(path, resource, methods, name));
        log.info("View registered: {} {}", resource.getOperations().keySet(), path);
        return this;
    }

    /**
     * Handles one request. The future fails only when the process is being stopped.
     */
    public CompletableFuture<Response> handle(Request request) {
        return dispatcher.dispatch(request);
    }

    public byte[] template(String templateName, Map<String, ?> context) {
        return templates.render(templateName, context == null ? Map.of() : context);
    }

    public String urlFor(String name, Map<String, String> params) {
        return router.urlFor(name, params);
    }

    public void freeze() {
        router.freeze();
    }

    public SunbreezeProperties getProperties() {
        return properties;
    }

    public Router getRouter() {
        return router;
    }

}
