package org.sunbreeze.http.routing;

import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.sunbreeze.exception.DuplicateRouteException;
import org.sunbreeze.http.common.HttpMethod;

import java.util.EnumSet;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RouterTest
{
    private static final RouteHandler NOOP = (request, response, params) -> {};

    private final Router testee = new Router(LoggerFactory.getLogger(RouterTest.class));

    @Test
    void lookup_binds_parameters() {
        RouteDefinition hello = route("/hello/{name}");
        testee.register(hello);

        RouteMatch match = testee.lookup("/hello/Ada").orElseThrow();
        assertThat(match.route()).isSameAs(hello);
        assertThat(match.pathParams()).isEqualTo(Map.of("name", "Ada"));
    }

    @Test
    void lookup_of_unknown_path_is_empty() {
        testee.register(route("/home"));
        assertThat(testee.lookup("/nope")).isEmpty();
        assertThat(testee.lookup("/nope", "GET")).isEmpty();
    }

    @Test
    void first_registered_match_wins() {
        RouteDefinition literal = route("/users/me");
        RouteDefinition param = route("/users/{id}");
        testee.register(literal);
        testee.register(param);

        assertThat(testee.lookup("/users/me").orElseThrow().route()).isSameAs(literal);
        assertThat(testee.lookup("/users/42").orElseThrow().route()).isSameAs(param);
    }

    @Test
    void registration_order_decides_even_when_less_specific_first() {
        RouteDefinition param = route("/users/{id}");
        RouteDefinition literal = route("/users/me");
        testee.register(param);
        testee.register(literal);

        RouteMatch match = testee.lookup("/users/me").orElseThrow();
        assertThat(match.route()).isSameAs(param);
        assertThat(match.pathParams()).containsEntry("id", "me");
    }

    @Test
    void duplicate_path_is_rejected_and_first_stays_active() {
        RouteDefinition first = route("/home");
        testee.register(first);

        assertThatThrownBy(() -> testee.register(route("/home")))
                .isExactlyInstanceOf(DuplicateRouteException.class)
                .hasMessage("Route '/home' already exists.");
        assertThat(testee.getRoutes()).containsExactly(first);
        assertThat(testee.lookup("/home").orElseThrow().route()).isSameAs(first);
    }

    @Test
    void same_path_with_disjoint_methods_is_accepted() {
        RouteDefinition reads = RouteDefinition.of("/items", NOOP, EnumSet.of(HttpMethod.GET), null);
        RouteDefinition writes = RouteDefinition.of("/items", NOOP, EnumSet.of(HttpMethod.POST), null);
        testee.register(reads);
        testee.register(writes);

        assertThat(testee.lookup("/items", "GET").orElseThrow().route()).isSameAs(reads);
        assertThat(testee.lookup("/items", "POST").orElseThrow().route()).isSameAs(writes);
        // No route accepts PUT, the first path match is handed back for a 405
        assertThat(testee.lookup("/items", "PUT").orElseThrow().route()).isSameAs(reads);
    }

    @Test
    void overlapping_methods_on_same_path_are_rejected() {
        testee.register(RouteDefinition.of("/items", NOOP, EnumSet.of(HttpMethod.GET, HttpMethod.POST), null));

        assertThatThrownBy(() -> testee.register(
                RouteDefinition.of("/items", NOOP, EnumSet.of(HttpMethod.POST), null)))
                .isExactlyInstanceOf(DuplicateRouteException.class);
    }

    @Test
    void rejected_resource_registration_leaves_methods_free() {
        Resource readOnly = Resource.builder()
                .get((request, response, params) -> {})
                .build();

        assertThatThrownBy(() -> testee.register(
                RouteDefinition.of("/r", readOnly, EnumSet.of(HttpMethod.POST), null)))
                .isExactlyInstanceOf(IllegalArgumentException.class);
        RouteDefinition writes = RouteDefinition.of("/r", NOOP, EnumSet.of(HttpMethod.POST), null);
        testee.register(writes);

        assertThat(testee.getRoutes()).containsExactly(writes);
        assertThat(testee.lookup("/r", "POST").orElseThrow().route()).isSameAs(writes);
    }

    @Test
    void different_templates_with_same_shape_are_not_duplicates() {
        testee.register(route("/{a}"));
        testee.register(route("/{b}"));
        assertThat(testee.getRoutes()).hasSize(2);
    }

    @Test
    void duplicate_name_is_rejected() {
        testee.register(RouteDefinition.of("/a", NOOP, null, "page"));

        assertThatThrownBy(() -> testee.register(RouteDefinition.of("/b", NOOP, null, "page")))
                .isExactlyInstanceOf(DuplicateRouteException.class)
                .hasMessageContaining("page");
    }

    @Test
    void url_for_named_route() {
        testee.register(RouteDefinition.of("/hello/{name}", NOOP, null, "greeting"));

        assertThat(testee.urlFor("greeting", Map.of("name", "Ada"))).isEqualTo("/hello/Ada");
        assertThatThrownBy(() -> testee.urlFor("unknown", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void frozen_table_rejects_registration() {
        testee.register(route("/home"));
        testee.freeze();
        testee.freeze();

        assertThat(testee.isFrozen()).isTrue();
        assertThatThrownBy(() -> testee.register(route("/about")))
                .isExactlyInstanceOf(IllegalStateException.class);
        assertThat(testee.lookup("/home")).isPresent();
    }

    private static RouteDefinition route(String path) {
        return RouteDefinition.of(path, NOOP, null, null);
    }

}
