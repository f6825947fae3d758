package org.sunbreeze.server.dto;

import lombok.Builder;
import lombok.Data;
import org.sunbreeze.configuration.ConfigurationManager;

import java.nio.file.Path;

@Data
@Builder
public class SunbreezeProperties {

    @Builder.Default
    private String name = "Sunbreeze";
    @Builder.Default
    private String version = "0.1.0";
    private boolean debug;
    @Builder.Default
    private String host = "localhost";
    @Builder.Default
    private int port = 8000;
    @Builder.Default
    private String staticPrefix = "/static";
    @Builder.Default
    private Path staticDir = Path.of("static");
    @Builder.Default
    private Path templateDir = Path.of("templates");
    @Builder.Default
    private int maxContentLength = 512 * 1024;

    public static SunbreezeProperties initialize(ConfigurationManager config) {
        return SunbreezeProperties.builder()
                .name(config.getProperty("sunbreeze.name", "Sunbreeze"))
                .version(config.getProperty("sunbreeze.version", "0.1.0"))
                .debug(config.getBooleanProperty("sunbreeze.debug", false))
                .host(config.getProperty("sunbreeze.server.host", "localhost"))
                .port(config.getIntProperty("sunbreeze.server.port", 8000))
                .staticPrefix(config.getProperty("sunbreeze.static.prefix", "/static"))
                .staticDir(Path.of(config.getProperty("sunbreeze.static.dir", "static")))
                .templateDir(Path.of(config.getProperty("sunbreeze.templates.dir", "templates")))
                .maxContentLength(config.getIntProperty("sunbreeze.http.maxContentLength", 512 * 1024))
                .build();
    }

}
