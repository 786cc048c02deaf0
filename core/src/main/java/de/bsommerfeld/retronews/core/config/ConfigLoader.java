package de.bsommerfeld.retronews.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link GlobalConfig} from a TOML file.
 *
 * <p>
 * A missing file is not an error: the defaults are written to the given path
 * so the user has a template to edit, and returned. Keys the model does not
 * know are ignored, keys the file omits keep their default.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    /**
     * @param configPath location of {@code config.toml}; parent directories are
     *                   created when the defaults have to be written
     * @throws ConfigException if the file is malformed or cannot be accessed
     */
    public static GlobalConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            GlobalConfig defaults = new GlobalConfig();
            write(configPath, defaults);
            LOG.info("No configuration found, wrote defaults to {}", configPath.toAbsolutePath());
            return defaults;
        }

        try {
            return MAPPER.readValue(configPath.toFile(), GlobalConfig.class);
        } catch (IOException e) {
            throw new ConfigException("Failed to read configuration from " + configPath, e);
        }
    }

    static void write(Path configPath, GlobalConfig config) {
        try {
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(configPath.toFile(), config);
        } catch (IOException e) {
            throw new ConfigException("Failed to write configuration to " + configPath, e);
        }
    }
}
