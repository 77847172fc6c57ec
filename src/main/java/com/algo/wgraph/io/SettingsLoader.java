package com.algo.wgraph.io;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link GraphSettings} from JSON with Jackson.
 *
 * <p>
 * Enum values (the load policy) are matched case-insensitively. Unknown
 * properties are ignored. A document without a {@code graph} object is
 * rejected.
 */
public final class SettingsLoader {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    private SettingsLoader() {
        // Utility class
    }

    /** Parses a JSON settings file. */
    public static GraphSettings parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /**
     * Parses settings from a classpath resource, e.g. {@code "/wgraph.json"}.
     *
     * @throws FileNotFoundException if the resource does not exist.
     */
    public static GraphSettings fromClasspath(String resource) throws IOException {
        try (InputStream in = SettingsLoader.class.getResourceAsStream(resource)) {
            if (in == null)
                throw new FileNotFoundException("Classpath resource not found: " + resource);
            return validate(MAPPER.readValue(in, GraphSettings.class));
        }
    }

    /**
     * Parses a JSON settings string.
     *
     * @throws IOException              if the text is not valid JSON or does not
     *                                  map onto the settings model.
     * @throws IllegalArgumentException if the {@code graph} key is missing.
     */
    public static GraphSettings parse(String json) throws IOException {
        return validate(MAPPER.readValue(json, GraphSettings.class));
    }

    private static GraphSettings validate(GraphSettings settings) {
        if (settings == null || settings.getGraph() == null)
            throw new IllegalArgumentException("Missing 'graph' key");
        if (settings.getGraph().getLoadPolicy() == null)
            settings.getGraph().setLoadPolicy(LoadPolicy.ABORT);
        return settings;
    }
}
