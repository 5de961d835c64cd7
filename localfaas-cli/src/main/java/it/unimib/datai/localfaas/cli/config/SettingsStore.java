package it.unimib.datai.localfaas.cli.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;

public final class SettingsStore {
    public static final Path DEFAULT_PATH = Path.of("localfaas.yaml");

    private final Path path;
    private final ObjectMapper yaml;

    public SettingsStore() {
        this(DEFAULT_PATH);
    }

    public SettingsStore(Path path) {
        this.path = path;
        this.yaml = new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Settings load() {
        if (!Files.exists(path)) {
            return new Settings();
        }
        try {
            Settings settings = yaml.readValue(path.toFile(), Settings.class);
            return settings == null ? new Settings() : settings;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read settings: " + path, e);
        }
    }

    /**
     * Environment lookup that falls back to the settings file when a variable is unset.
     */
    public Function<String, String> environment(Function<String, String> getenv) {
        Map<String, String> defaults = load().asEnvironmentDefaults();
        return name -> {
            String value = getenv.apply(name);
            if (value != null && !value.isBlank()) {
                return value;
            }
            return defaults.get(name);
        };
    }
}
