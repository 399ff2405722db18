package com.codeguard.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes reports to JSON.
 *
 * @since 1.0.0
 */
public final class ReportWriter {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private ReportWriter() {
    }

    /**
     * @param report report
     * @return pretty-printed JSON
     */
    public static String toJson(Report report) {
        try {
            return JSON_MAPPER.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report", e);
        }
    }

    /**
     * Writes the report, creating parent directories.
     *
     * @param report report
     * @param target output file
     * @throws IOException if the file cannot be written
     */
    public static void write(Report report, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, toJson(report));
    }

    /**
     * Reads a report written by {@link #write(Report, Path)}.
     *
     * @param json report JSON
     * @return report
     * @throws IOException if the JSON does not describe a report
     */
    public static Report fromJson(String json) throws IOException {
        return JSON_MAPPER.readValue(json, Report.class);
    }
}
