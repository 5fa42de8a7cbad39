package com.structural.cbr.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.structural.cbr.model.ModelValidationException;

/**
 * Reads {@link ModelDefinition}s with Jackson.
 *
 * <p>
 * Non-numeric numbers ({@code Infinity}, {@code NaN}) are accepted both bare
 * and quoted, so rigid shear factors can be written as {@code "ky": Infinity}.
 */
public final class ModelDefinitionParser {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .build();

    private ModelDefinitionParser() {
        // Utility class
    }

    /** Parses a model file. */
    public static ModelDefinition parseFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in);
        }
    }

    /** Parses a classpath resource. */
    public static ModelDefinition parseResource(String resource) throws IOException {
        try (InputStream in = ModelDefinitionParser.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Resource not found: " + resource);
            return parse(in);
        }
    }

    public static ModelDefinition parse(InputStream in) throws IOException {
        return MAPPER.readValue(in, ModelDefinition.class);
    }

    /**
     * Parses a JSON string.
     *
     * @throws ModelValidationException if the text is not a valid model document.
     */
    public static ModelDefinition parse(String json) {
        try {
            return MAPPER.readValue(json, ModelDefinition.class);
        } catch (JsonProcessingException e) {
            throw new ModelValidationException("Malformed model definition: " + e.getOriginalMessage(), e);
        }
    }
}
