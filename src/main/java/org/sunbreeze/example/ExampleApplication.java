package org.sunbreeze.example;

import lombok.extern.slf4j.Slf4j;
import org.sunbreeze.Sunbreeze;
import org.sunbreeze.example.dto.StatusResponse;
import org.sunbreeze.http.message.Response;
import org.sunbreeze.http.routing.Resource;
import org.sunbreeze.server.dto.SunbreezeProperties;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

@Slf4j
public final class ExampleApplication {

    private ExampleApplication() {
    }

    public static Sunbreeze create(SunbreezeProperties properties) {
        Sunbreeze app = new Sunbreeze(properties);
        List<String> books = new CopyOnWriteArrayList<>(List.of("Dune", "Hyperion"));

        app.route("/home", (request, response, params) -> response.setText("Hello, World!"));
        app.route("/about", (request, response, params) -> response.setText("About Sunbreeze"));
        app.route("/hello/{name}", (request, response, params) ->
                response.setText("Hello, " + params.get("name")), null, "greeting");

        app.resource("/book", Resource.builder()
                .get((request, response, params) -> {
                    log.debug("GET {}", request.getPath());
                    response.setText("Books Page");
                })
                .post((request, response, params) -> {
                    String title = request.bodyAsText().trim();
                    if (title.isEmpty()) {
                        response.setStatus(400).setText("Missing title");
                        return;
                    }
                    books.add(title);
                    response.setStatus(201).setJson(Map.of("title", title, "count", books.size()));
                })
                .build());

        app.route("/template", (request, response, params) -> response
                .setBody(app.template("index.html", Map.of("name", "TheLovinator", "title", "Sunbreeze")))
                .setMediaType(Response.TEXT_HTML));

        app.route("/status", (request, response, params) -> response.setJson(
                new StatusResponse(properties.getName(), properties.getVersion(), properties.isDebug())));

        return app;
    }

}
