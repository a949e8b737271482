package com.intentguard.storage;

import com.intentguard.models.GeneratedPromptsFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonStorageTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileReadsAsNull() throws Exception {
        assertNull(JsonStorage.readJson(tempDir.resolve("nope.json"), GeneratedPromptsFile.class));
    }

    @Test
    void writeCreatesParentDirectories() throws Exception {
        Path file = tempDir.resolve("a").resolve("b").resolve("prompts.json");
        JsonStorage.writeJson(file, new GeneratedPromptsFile("Deceptive_Output", List.of("p1", "p2")));
        assertTrue(Files.exists(file));
        assertTrue(Files.readString(file).contains("\"scenario\" : \"Deceptive_Output\""));

        GeneratedPromptsFile read = JsonStorage.readJson(file, GeneratedPromptsFile.class);
        assertEquals(List.of("p1", "p2"), read.getPrompts());
    }
}
