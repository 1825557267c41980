package com.ndf.cnl.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ndf.cnl.model.GraphSnapshot;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON export and import of {@link GraphSnapshot}s.
 */
public final class SnapshotCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private SnapshotCodec() {
        // Utility class
    }

    public static String toJson(GraphSnapshot snapshot) {
        try {
            return MAPPER.writeValueAsString(snapshot);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot serialize snapshot", e);
        }
    }

    public static GraphSnapshot fromJson(String json) {
        try {
            return MAPPER.readValue(json, GraphSnapshot.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read snapshot", e);
        }
    }

    public static void write(GraphSnapshot snapshot, Path path) throws IOException {
        Files.writeString(path, toJson(snapshot));
    }

    public static GraphSnapshot read(Path path) throws IOException {
        return fromJson(Files.readString(path));
    }
}
