package com.ndf.cnl.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * Compiler settings, usually loaded from JSON:
 *
 * <pre>
 * {
 *   "strictMode": true,
 *   "knownRelations": ["part of", "produces"],
 *   "knownAttributes": ["number of protons"],
 *   "transitionType": "Transition"
 * }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class CompilerConfig {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private boolean strictMode;
    private List<String> knownRelations = new ArrayList<>();
    private List<String> knownAttributes = new ArrayList<>();
    private String transitionType = CnlParser.DEFAULT_TRANSITION_TYPE;

    public static CompilerConfig defaults() {
        return new CompilerConfig();
    }

    public static CompilerConfig load(Path path) throws IOException {
        return MAPPER.readValue(Files.readString(path), CompilerConfig.class);
    }

    public static CompilerConfig fromJson(String json) {
        try {
            return MAPPER.readValue(json, CompilerConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid compiler config", e);
        }
    }

    public String toJson() {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(this);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
