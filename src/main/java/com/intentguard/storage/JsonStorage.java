package com.intentguard.storage;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class JsonStorage {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static <T> T readJson(Path filePath, Class<T> clazz) throws IOException {
        if (!Files.exists(filePath)) {
            return null;
        }
        return mapper.readValue(filePath.toFile(), clazz);
    }

    public static void writeJson(Path filePath, Object data) throws IOException {
        Path parent = filePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(filePath.toFile(), data);
    }
}
