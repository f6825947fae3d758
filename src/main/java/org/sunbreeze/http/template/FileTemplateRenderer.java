package org.sunbreeze.http.template;

import lombok.extern.slf4j.Slf4j;
import org.sunbreeze.exception.TemplateException;
import org.sunbreeze.exception.TemplateNotFoundException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
public class FileTemplateRenderer implements TemplateRenderer {

    public static final String BUILTIN_LOCATION = "templates/";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z_][A-Za-z0-9_.]*)\\s*}}");

    private final Path templateDir;
    private final ClassLoader classLoader;

    public FileTemplateRenderer(Path templateDir) {
        this(templateDir, FileTemplateRenderer.class.getClassLoader());
    }

    public FileTemplateRenderer(Path templateDir, ClassLoader classLoader) {
        this.templateDir = templateDir.toAbsolutePath().normalize();
        this.classLoader = classLoader;
        try {
            Files.createDirectories(this.templateDir);
        } catch (IOException e) {
            throw new TemplateException("Cannot create template directory " + this.templateDir, e);
        }
        log.debug("Template directory: {}", this.templateDir);
    }

    @Override
    public byte[] render(String templateName, Map<String, ?> context) {
        String source = load(templateName);
        boolean escape = isMarkup(templateName);
        Matcher matcher = PLACEHOLDER.matcher(source);
        StringBuilder out = new StringBuilder(source.length());
        while (matcher.find()) {
            Object value = context == null ? null : context.get(matcher.group(1));
            String text = value == null ? "" : value.toString();
            matcher.appendReplacement(out, Matcher.quoteReplacement(escape ? escapeHtml(text) : text));
        }
        matcher.appendTail(out);
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    public Path getTemplateDir() {
        return templateDir;
    }

    private String load(String templateName) {
        if (templateName == null || templateName.isBlank()) {
            throw new TemplateNotFoundException(String.valueOf(templateName));
        }
        return fromUserDirectory(templateName)
                .or(() -> fromClasspath(templateName))
                .orElseThrow(() -> new TemplateNotFoundException(templateName));
    }

    private Optional<String> fromUserDirectory(String templateName) {
        Path candidate = templateDir.resolve(templateName).normalize();
        if (!candidate.startsWith(templateDir) || !Files.isRegularFile(candidate)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(candidate, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TemplateException("Error reading template " + candidate, e);
        }
    }

    private Optional<String> fromClasspath(String templateName) {
        if (templateName.contains("..")) {
            return Optional.empty();
        }
        try (InputStream input = classLoader.getResourceAsStream(BUILTIN_LOCATION + templateName)) {
            if (input == null) {
                return Optional.empty();
            }
            return Optional.of(new String(input.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TemplateException("Error reading built-in template " + templateName, e);
        }
    }

    private static boolean isMarkup(String templateName) {
        String lower = templateName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".html") || lower.endsWith(".htm") || lower.endsWith(".xml");
    }

    static String escapeHtml(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#39;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }

}
