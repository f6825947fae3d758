package org.sunbreeze.http.routing;

import org.sunbreeze.exception.InvalidRoutePatternException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

public final class PathPattern {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String template;
    private final List<Segment> segments;
    private final List<String> parameterNames;

    private PathPattern(String template, List<Segment> segments, List<String> parameterNames) {
        this.template = template;
        this.segments = segments;
        this.parameterNames = parameterNames;
    }

    public static PathPattern compile(String template) {
        if (template == null || !template.startsWith("/")) {
            throw new InvalidRoutePatternException(String.valueOf(template), "must start with '/'");
        }
        List<Segment> segments = new ArrayList<>();
        List<String> names = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String raw : split(template)) {
            if (raw.startsWith("{") && raw.endsWith("}")) {
                String name = raw.substring(1, raw.length() - 1);
                if (!IDENTIFIER.matcher(name).matches()) {
                    throw new InvalidRoutePatternException(template, "bad placeholder name '" + name + "'");
                }
                if (!seen.add(name)) {
                    throw new InvalidRoutePatternException(template, "duplicate placeholder '" + name + "'");
                }
                segments.add(new Segment(name, true));
                names.add(name);
            } else if (raw.indexOf('{') >= 0 || raw.indexOf('}') >= 0) {
                throw new InvalidRoutePatternException(template, "placeholder must span a whole segment: '" + raw + "'");
            } else {
                segments.add(new Segment(raw, false));
            }
        }
        return new PathPattern(template, List.copyOf(segments), List.copyOf(names));
    }

    public Optional<Map<String, String>> match(String requestPath) {
        if (requestPath == null || !requestPath.startsWith("/")) {
            return Optional.empty();
        }
        String[] parts = split(requestPath);
        if (parts.length != segments.size()) {
            return Optional.empty();
        }
        Map<String, String> bound = new LinkedHashMap<>();
        for (int i = 0; i < parts.length; i++) {
            Segment segment = segments.get(i);
            String part = parts[i];
            if (segment.placeholder()) {
                if (part.isEmpty()) {
                    return Optional.empty();
                }
                bound.put(segment.value(), part);
            } else if (!segment.value().equals(part)) {
                return Optional.empty();
            }
        }
        return Optional.of(Collections.unmodifiableMap(bound));
    }

    public String expand(Map<String, String> params) {
        StringBuilder path = new StringBuilder();
        for (Segment segment : segments) {
            path.append('/');
            if (segment.placeholder()) {
                String value = params.get(segment.value());
                if (value == null || value.isEmpty() || value.indexOf('/') >= 0) {
                    throw new IllegalArgumentException(
                            "Missing or invalid value for '" + segment.value() + "' in " + template);
                }
                path.append(value);
            } else {
                path.append(segment.value());
            }
        }
        return path.toString();
    }

    public String getTemplate() {
        return template;
    }

    public List<String> getParameterNames() {
        return parameterNames;
    }

    private static String[] split(String path) {
        return path.substring(1).split("/", -1);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PathPattern other && template.equals(other.template);
    }

    @Override
    public int hashCode() {
        return template.hashCode();
    }

    @Override
    public String toString() {
        return template;
    }

    private record Segment(String value, boolean placeholder) {
    }

}
