package org.sunbreeze.configuration;

import lombok.extern.slf4j.Slf4j;
import org.sunbreeze.exception.ConfigurationException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Properties;

@Slf4j
public class ConfigurationManager {

    public static final String DEFAULT_RESOURCE = "sunbreeze.properties";

    private final Properties properties;

    ConfigurationManager(Properties properties) {
        this.properties = properties;
    }

    public static ConfigurationManager load() {
        Properties properties = new Properties();
        try (InputStream input = ConfigurationManager.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                log.warn("Configuration resource {} not found on classpath, relying on defaults", DEFAULT_RESOURCE);
            } else {
                properties.load(input);
            }
        } catch (IOException e) {
            log.error("Error loading configuration resource: {}", DEFAULT_RESOURCE, e);
            throw new ConfigurationException("Error loading configuration resource.", e);
        }
        return new ConfigurationManager(properties);
    }

    public static ConfigurationManager load(Path overrideFile) {
        ConfigurationManager config = load();
        try (FileInputStream input = new FileInputStream(overrideFile.toFile())) {
            config.properties.load(input);
            log.info("Configuration overridden from {}", overrideFile);
        } catch (FileNotFoundException e) {
            log.error("Configuration file not found: {}", overrideFile, e);
            throw new ConfigurationException("Configuration file not found: " + overrideFile, e);
        } catch (IOException e) {
            log.error("Error loading configuration file: {}", overrideFile, e);
            throw new ConfigurationException("Error loading configuration file: " + overrideFile, e);
        }
        return config;
    }

    public static ConfigurationManager of(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new ConfigurationManager(copy);
    }

    public String getProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            log.warn("Property {} not found in configuration. Using default value: {}", key, defaultValue);
            return defaultValue;
        }
        return value.trim();
    }

    public int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid integer format for property: {}", key, e);
                throw new ConfigurationException("Invalid integer format for property: " + key, e);
            }
        } else {
            log.info("Using default value for property: {}", key);
        }
        return defaultValue;
    }

    public boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            log.info("Using default value for property: {}", key);
            return defaultValue;
        }
        String normalized = value.trim();
        if (!normalized.equalsIgnoreCase("true") && !normalized.equalsIgnoreCase("false")) {
            throw new ConfigurationException("Invalid boolean format for property: " + key);
        }
        return Boolean.parseBoolean(normalized);
    }

}
