package com.ndf.cnl.io;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class CompilerConfigTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testDefaults() {
        CompilerConfig config = CompilerConfig.defaults();
        assertFalse(config.isStrictMode());
        assertEquals("Transition", config.getTransitionType());
        assertTrue(config.getKnownRelations().isEmpty());
    }

    @Test
    public void testFromJsonIgnoresUnknownKeys() {
        CompilerConfig config = CompilerConfig.fromJson(
                "{\"strictMode\":true,\"knownRelations\":[\"part of\"],\"transitionType\":\"Process\",\"theme\":\"dark\"}");
        assertTrue(config.isStrictMode());
        assertEquals(1, config.getKnownRelations().size());
        assertEquals("Process", config.getTransitionType());
        assertTrue(config.getKnownAttributes().isEmpty());
    }

    @Test
    public void testLoadFromFile() throws Exception {
        Path file = tmp.newFile("cnl.json").toPath();
        Files.writeString(file, "{\"knownAttributes\":[\"mass\",\"colour\"]}");
        CompilerConfig config = CompilerConfig.load(file);
        assertEquals(2, config.getKnownAttributes().size());
        assertFalse(config.isStrictMode());
    }

    @Test
    public void testJsonRoundTrip() {
        CompilerConfig config = new CompilerConfig();
        config.setStrictMode(true);
        config.getKnownRelations().add("produces");
        assertEquals(config, CompilerConfig.fromJson(config.toJson()));
    }

    @Test(expected = UncheckedIOException.class)
    public void testMalformedJson() {
        CompilerConfig.fromJson("{strictMode:");
    }
}
