package com.blastradius.io.summary;

import com.blastradius.engine.model.SummaryModel.StructuralSummary;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads structural summaries written by a per-language extractor.
 * A file holds either one summary object or an array of them.
 */
public class SummaryReader {

    private static final Logger log = LoggerFactory.getLogger(SummaryReader.class);
    private static final Gson GSON = new Gson();

    /**
     * @throws SummaryReadException if the file is missing, empty or not a summary document
     */
    public List<StructuralSummary> read(Path path) {
        if (!Files.exists(path)) {
            throw new SummaryReadException("Summary file not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            JsonElement root = JsonParser.parseReader(reader);
            List<StructuralSummary> summaries;
            if (root.isJsonArray()) {
                summaries = new ArrayList<>(Arrays.asList(GSON.fromJson(root, StructuralSummary[].class)));
            } else if (root.isJsonObject()) {
                summaries = new ArrayList<>(List.of(GSON.fromJson(root, StructuralSummary.class)));
            } else {
                throw new SummaryReadException("Summary file is empty or not a JSON object/array: " + path);
            }
            log.debug("Read {} summaries from {}", summaries.size(), path);
            return summaries;
        } catch (NoSuchFileException e) {
            throw new SummaryReadException("Summary file not found: " + path, e);
        } catch (JsonParseException e) {
            throw new SummaryReadException("Invalid summary JSON in " + path + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new SummaryReadException("Failed to read summary: " + path + ": " + e.getMessage(), e);
        }
    }

    /** Reads every file in order and concatenates the summaries. */
    public List<StructuralSummary> readAll(List<Path> paths) {
        List<StructuralSummary> all = new ArrayList<>();
        for (Path path : paths) {
            all.addAll(read(path));
        }
        return all;
    }

    public static class SummaryReadException extends RuntimeException {
        public SummaryReadException(String message) { super(message); }
        public SummaryReadException(String message, Throwable cause) { super(message, cause); }
    }
}
