package com.blastradius.io.config;

import com.blastradius.engine.config.AnalysisConfig;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public class AnalysisConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads a settings file and converts it to a validated configuration.
     *
     * @throws ConfigReadException if the file is missing, malformed or holds invalid settings
     */
    public AnalysisConfig read(Path configPath) {
        AnalysisConfigFile file = readFile(configPath);
        try {
            return file.toAnalysisConfig();
        } catch (AnalysisConfig.ConfigurationException e) {
            throw new ConfigReadException(configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a settings file without validating its values.
     *
     * @throws ConfigReadException if the file is missing or malformed
     */
    public AnalysisConfigFile readFile(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            AnalysisConfigFile file = GSON.fromJson(reader, AnalysisConfigFile.class);
            if (file == null) {
                throw new ConfigReadException("Config file is empty or invalid JSON: " + configPath);
            }
            return file;
        } catch (NoSuchFileException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Invalid config JSON in " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
