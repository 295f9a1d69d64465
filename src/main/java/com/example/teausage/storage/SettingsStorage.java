package com.example.teausage.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.file.*;

/**
 * Reads {@link PipelineSettings}: packaged defaults first, then an optional JSON file whose
 * fields replace the defaults one by one.
 */
public class SettingsStorage {
    private static final Logger log = LoggerFactory.getLogger(SettingsStorage.class);
    public static final String DEFAULTS_RESOURCE = "/defaults/pipeline-settings.json";

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .registerModule(new JavaTimeModule());

    public PipelineSettings loadDefaults() throws IOException {
        try (InputStream in = SettingsStorage.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) throw new FileNotFoundException("Missing classpath resource " + DEFAULTS_RESOURCE);
            return read(in, new PipelineSettings(), DEFAULTS_RESOURCE);
        }
    }

    /** Defaults overlaid with {@code overrides} when given; validated before returning. */
    public PipelineSettings load(Path overrides) throws IOException {
        PipelineSettings s = loadDefaults();
        if (overrides != null) {
            if (!Files.exists(overrides)) throw new FileNotFoundException("Settings file not found: " + overrides);
            try (InputStream in = Files.newInputStream(overrides)) {
                s = read(in, s, overrides.toString());
            }
            log.info("Loaded settings overrides from {}", overrides);
        }
        s.validate();
        return s;
    }

    public void save(PipelineSettings s, Path file) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) Files.createDirectories(dir);
        try (OutputStream out = Files.newOutputStream(file)) {
            mapper.writeValue(out, s);
        }
    }

    private PipelineSettings read(InputStream in, PipelineSettings base, String source) throws IOException {
        try {
            return mapper.readerForUpdating(base).readValue(in);
        } catch (IOException ex) {
            throw new IOException("Failed to parse settings JSON from " + source + ". Expect an object of PipelineSettings fields.", ex);
        }
    }
}
