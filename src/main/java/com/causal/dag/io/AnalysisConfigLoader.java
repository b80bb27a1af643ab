package com.causal.dag.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.log4j.Log4j2;

/**
 * Reads {@link AnalysisConfig} and {@link GraphDefinition} JSON from files,
 * classpath resources or strings. Every loaded config is validated.
 */
@Log4j2
public final class AnalysisConfigLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AnalysisConfigLoader() {
    }

    public static AnalysisConfig load(Path path) {
        try {
            AnalysisConfig config = MAPPER.readValue(Files.readString(path), AnalysisConfig.class).validate();
            log.info("Loaded analysis config from {}", path);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read analysis config " + path, e);
        }
    }

    public static AnalysisConfig loadResource(String resource) {
        try (InputStream in = AnalysisConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new UncheckedIOException(new IOException("Resource not found: " + resource));
            return MAPPER.readValue(in, AnalysisConfig.class).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read analysis config resource " + resource, e);
        }
    }

    public static AnalysisConfig parse(String json) {
        try {
            return MAPPER.readValue(json, AnalysisConfig.class).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid analysis config JSON", e);
        }
    }

    public static GraphDefinition loadGraph(Path path) {
        try {
            return MAPPER.readValue(Files.readString(path), GraphDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read graph definition " + path, e);
        }
    }

    public static GraphDefinition loadGraphResource(String resource) {
        try (InputStream in = AnalysisConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new UncheckedIOException(new IOException("Resource not found: " + resource));
            return MAPPER.readValue(in, GraphDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read graph definition resource " + resource, e);
        }
    }
}
