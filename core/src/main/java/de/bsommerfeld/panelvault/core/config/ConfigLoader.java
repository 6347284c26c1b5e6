package de.bsommerfeld.panelvault.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link PanelVaultConfig} as TOML.
 *
 * <p>
 * A missing file is created with defaults so users have something to edit.
 * Unknown keys are ignored, missing keys keep their defaults, which lets old
 * config files survive upgrades.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    private ConfigLoader() {
    }

    public static PanelVaultConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            PanelVaultConfig defaults = new PanelVaultConfig();
            save(configPath, defaults);
            LOG.info("Wrote default configuration to {}", configPath);
            return defaults;
        }
        return MAPPER.readValue(configPath.toFile(), PanelVaultConfig.class);
    }

    public static void save(Path configPath, PanelVaultConfig config) throws IOException {
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(configPath.toFile(), config);
    }
}
