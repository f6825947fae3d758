package org.sunbreeze;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sunbreeze.exception.DuplicateRouteException;
import org.sunbreeze.http.common.HttpMethod;
import org.sunbreeze.http.message.Request;
import org.sunbreeze.http.message.Response;
import org.sunbreeze.http.routing.Resource;
import org.sunbreeze.server.dto.SunbreezeProperties;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Whole-application behaviour through {@link Sunbreeze#handle(Request)}.
 */
class SunbreezeTest
{
    @TempDir
    Path dir;

    @Test
    void basic_route() {
        String random = UUID.randomUUID().toString();
        Sunbreeze app = app(false);
        app.route("/home", (request, response, params) -> response.setText(random));

        Response response = get(app, "/home");

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getText()).isEqualTo(random);

        assertThatThrownBy(() -> app.route("/home", (request, r, params) -> r.setText("Hello, World!")))
                .isExactlyInstanceOf(DuplicateRouteException.class);
        assertThat(get(app, "/home").getText()).isEqualTo(random);
    }

    @Test
    void parameterized_route() {
        Sunbreeze app = app(false);
        app.route("/{name}", (request, response, params) -> response.setText("Hello " + params.get("name")));

        assertThat(get(app, "/first").getText()).isEqualTo("Hello first");
        assertThat(get(app, "/second").getText()).isEqualTo("Hello second");
    }

    @Test
    void greeting_scenario() {
        Sunbreeze app = app(false);
        app.route("/hello/{name}", (request, response, params) -> response.setText("Hello, " + params.get("name")));

        assertThat(get(app, "/hello/Ada").getText()).isEqualTo("Hello, Ada");
    }

    @Test
    void default_404_response() {
        Response response = get(app(false), "/doesnotexist");

        assertThat(response.getStatus()).isEqualTo(404);
        assertThat(response.getText()).isEqualTo("Not Found");
    }

    @Test
    void resource_registration_with_get_and_post() {
        Sunbreeze app = app(false);
        app.resource("/", Resource.builder()
                .get((request, response, params) -> response.setText("Hello, World!"))
                .post((request, response, params) -> response.setText("Posted!"))
                .build(), EnumSet.of(HttpMethod.GET, HttpMethod.POST), "index");

        Response get = app.handle(Request.of("GET", "/")).join();
        Response post = app.handle(Request.of("POST", "/")).join();
        Response put = app.handle(Request.of("PUT", "/")).join();

        assertThat(get.getStatus()).isEqualTo(200);
        assertThat(get.getText()).isEqualTo("Hello, World!");
        assertThat(post.getStatus()).isEqualTo(200);
        assertThat(post.getText()).isEqualTo("Posted!");
        assertThat(put.getStatus()).isEqualTo(405);
        assertThat(put.getText()).isEqualTo("Method Not Allowed");
        assertThat(app.urlFor("index", Map.of())).isEqualTo("/");
    }

    @Test
    void debug_mode_sends_stack_trace() {
        Sunbreeze app = app(true);
        app.resource("/error", Resource.builder()
                .get((request, response, params) -> {
                    throw new RuntimeException("Intentional error for testing");
                })
                .build());

        Response response = get(app, "/error");

        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(response.getText())
                .contains("Intentional error for testing")
                .contains("Stack trace:")
                .contains("at org.sunbreeze.SunbreezeTest");
    }

    @Test
    void debug_mode_uses_user_error_template() throws Exception {
        Sunbreeze app = app(true);
        Files.writeString(dir.resolve("templates/error.html"), "custom: {{ message }}");
        app.route("/error", (request, response, params) -> {
            throw new IllegalStateException("<broken>");
        });

        assertThat(get(app, "/error").getText())
                .isEqualTo("custom: java.lang.IllegalStateException: &lt;broken&gt;");
    }

    @Test
    void production_mode_sends_generic_message() {
        Sunbreeze app = app(false);
        app.resource("/error", Resource.builder()
                .get((request, response, params) -> {
                    throw new RuntimeException("Intentional error for testing");
                })
                .build());

        Response response = get(app, "/error");

        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(response.getText()).isEqualTo("Something ducky happened.");
        assertThat(response.getText()).doesNotContain("Stack trace:");
    }

    @Test
    void one_failure_does_not_affect_next_request() {
        Sunbreeze app = app(false);
        app.route("/flaky", (request, response, params) -> {
            if (request.queryParam("fail").isPresent()) {
                throw new IllegalArgumentException("bad");
            }
            response.setText("ok");
        });

        Request failing = Request.builder().method("GET").path("/flaky")
                .queryParam("fail", List.of("1")).build();
        assertThat(app.handle(failing).join().getStatus()).isEqualTo(500);
        assertThat(get(app, "/flaky").getText()).isEqualTo("ok");
    }

    @Test
    void template_rendering() {
        Sunbreeze app = app(false);

        byte[] page = app.template("index.html", Map.of("name", "TheLovinator", "title", "Sunbreeze"));

        assertThat(new String(page, StandardCharsets.UTF_8))
                .contains("<title>Sunbreeze</title>")
                .contains("Hello, TheLovinator!");
    }

    @Test
    void static_files_are_served() throws Exception {
        Sunbreeze app = app(false);
        Files.writeString(dir.resolve("static/hello.txt"), "static hello");

        Response response = get(app, "/static/hello.txt");

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getText()).isEqualTo("static hello");
    }

    @Test
    void frozen_application_rejects_routes() {
        Sunbreeze app = app(false);
        app.freeze();

        assertThatThrownBy(() -> app.route("/late", (request, response, params) -> {}))
                .isExactlyInstanceOf(IllegalStateException.class);
    }

    private Sunbreeze app(boolean debug) {
        return new Sunbreeze(SunbreezeProperties.builder()
                .debug(debug)
                .staticDir(dir.resolve("static"))
                .templateDir(dir.resolve("templates"))
                .build());
    }

    private static Response get(Sunbreeze app, String path) {
        return app.handle(Request.of("GET", path)).join();
    }

}
