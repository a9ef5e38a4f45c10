package com.confer.mortgageServer.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Utility class for loading bundled JSON files from the classpath.
 */
public class JsonFileLoader {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonFileLoader() {}

    /**
     * Loads a JSON file from the classpath as a String.
     *
     * @param resourcePath The path to the JSON file (e.g., "catalog/glossary.json")
     * @return The JSON content as a String
     * @throws IOException if the file cannot be read or doesn't exist
     */
    public static String loadAsString(String resourcePath) throws IOException {
        try (InputStream inputStream = JsonFileLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Loads a JSON object from the classpath. Bundled files are part of the build,
     * so a missing or broken one is a packaging error.
     *
     * @param resourcePath The path to the JSON file
     * @return The JSON object
     * @throws UncheckedIOException if the file cannot be read or is not a JSON object
     */
    public static ObjectNode loadRequiredObject(String resourcePath) {
        try {
            return (ObjectNode) objectMapper.readTree(loadAsString(resourcePath));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load bundled JSON: " + resourcePath, e);
        } catch (ClassCastException e) {
            throw new IllegalStateException("Bundled JSON is not an object: " + resourcePath, e);
        }
    }

    /**
     * Loads a flat JSON object of strings from the classpath, preserving key order.
     *
     * @param resourcePath The path to the JSON file
     * @return Key to value map in file order
     * @throws UncheckedIOException if the file cannot be read or is not a string map
     */
    public static Map<String, String> loadRequiredStringMap(String resourcePath) {
        try {
            return objectMapper.readValue(loadAsString(resourcePath), new TypeReference<LinkedHashMap<String, String>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load bundled JSON: " + resourcePath, e);
        }
    }
}
