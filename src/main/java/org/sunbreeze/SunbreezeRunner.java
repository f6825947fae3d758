package org.sunbreeze;

import lombok.extern.slf4j.Slf4j;
import org.sunbreeze.configuration.ConfigurationManager;
import org.sunbreeze.example.ExampleApplication;
import org.sunbreeze.server.SunbreezeHttp;
import org.sunbreeze.server.dto.SunbreezeProperties;

import java.nio.file.Path;

@Slf4j
public class SunbreezeRunner {

    public static void main(String[] args) throws InterruptedException {
        if (args.length > 1 || (args.length == 1 && (args[0].equals("--help") || args[0].equals("-h")))) {
            System.err.println("Usage: java -jar sunbreeze.jar [path-to-properties]");
            System.exit(args.length > 1 ? 1 : 0);
        }

        ConfigurationManager config = args.length == 1
                ? ConfigurationManager.load(Path.of(args[0]))
                : ConfigurationManager.load();
        SunbreezeProperties properties = SunbreezeProperties.initialize(config);

        if (properties.isDebug()) {
            log.warn("Debug mode is on: error pages include stack traces. Do not use in production.");
        }
        Sunbreeze app = ExampleApplication.create(properties);
        log.info("Starting development server on http://{}:{}", properties.getHost(), properties.getPort());
        new SunbreezeHttp(app).start();
    }

}
