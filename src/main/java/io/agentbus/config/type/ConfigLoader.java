package io.agentbus.config.type;

import io.agentbus.config.impl.BusConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;

@Slf4j
public final class ConfigLoader {

    public static final String DEFAULT_RESOURCE = "agentbus.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file by delegating to {@link BusConfig#load(String)}.
     *
     * @param path the path to the YAML configuration file
     * @return a populated {@link BusConfig} instance
     * @throws IOException if the file cannot be read
     */
    public static BusConfig load(final String path) throws IOException {
        return BusConfig.load(path);
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, falling back to built-in defaults when absent.
     */
    public static BusConfig loadDefault() throws IOException {
        try (final InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.warn("{} not found on classpath, using defaults", DEFAULT_RESOURCE);
                return BusConfig.defaults();
            }
            return BusConfig.load(in);
        }
    }
}
