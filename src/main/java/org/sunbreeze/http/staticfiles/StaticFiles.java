package org.sunbreeze.http.staticfiles;

import lombok.extern.slf4j.Slf4j;
import org.sunbreeze.exception.ConfigurationException;
import org.sunbreeze.exception.MethodNotAllowedException;
import org.sunbreeze.exception.NotFoundException;
import org.sunbreeze.http.common.HttpMethod;
import org.sunbreeze.http.message.Response;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
public class StaticFiles {

    private static final String OCTET_STREAM = "application/octet-stream";
    private static final Map<String, String> KNOWN_TYPES = Map.of(
            "css", "text/css; charset=UTF-8",
            "js", "text/javascript; charset=UTF-8",
            "html", Response.TEXT_HTML,
            "txt", Response.TEXT_PLAIN,
            "json", Response.APPLICATION_JSON,
            "svg", "image/svg+xml",
            "png", "image/png",
            "ico", "image/x-icon");

    private final String prefix;
    private final Path directory;

    public StaticFiles(String prefix, Path directory) {
        if (prefix == null || !prefix.startsWith("/") || prefix.length() < 2 || prefix.endsWith("/")) {
            throw new ConfigurationException("Static prefix must look like '/static', got: " + prefix);
        }
        this.prefix = prefix;
        this.directory = directory.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.directory);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot create static directory " + this.directory, e);
        }
        log.info("Serving static files from {} at {}", this.directory, prefix);
    }

    public boolean owns(String path) {
        return path.equals(prefix) || path.startsWith(prefix + "/");
    }

    public Response serve(String method, String path) throws IOException {
        Optional<HttpMethod> httpMethod = HttpMethod.parse(method);
        if (httpMethod.isEmpty() || (httpMethod.get() != HttpMethod.GET && httpMethod.get() != HttpMethod.HEAD)) {
            throw new MethodNotAllowedException(method, Set.of("GET", "HEAD"));
        }
        Path file = resolve(path).orElseThrow(() -> new NotFoundException(path));
        Response response = new Response();
        response.setBody(Files.readAllBytes(file));
        response.setMediaType(mediaTypeOf(file));
        return response;
    }

    public String getPrefix() {
        return prefix;
    }

    public Path getDirectory() {
        return directory;
    }

    private Optional<Path> resolve(String path) {
        String relative = path.substring(prefix.length());
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        if (relative.isEmpty()) {
            return Optional.empty();
        }
        try {
            Path candidate = directory.resolve(relative).normalize();
            if (!candidate.startsWith(directory) || !Files.isRegularFile(candidate)) {
                return Optional.empty();
            }
            return Optional.of(candidate);
        } catch (InvalidPathException e) {
            log.debug("Rejected static path {}", path, e);
            return Optional.empty();
        }
    }

    private static String mediaTypeOf(Path file) throws IOException {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot >= 0) {
            String known = KNOWN_TYPES.get(name.substring(dot + 1).toLowerCase(Locale.ROOT));
            if (known != null) {
                return known;
            }
        }
        String probed = Files.probeContentType(file);
        return probed == null ? OCTET_STREAM : probed;
    }

}
