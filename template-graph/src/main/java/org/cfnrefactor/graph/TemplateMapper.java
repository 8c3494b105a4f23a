package org.cfnrefactor.graph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads and writes templates as JSON text.
 */
@Slf4j
public class TemplateMapper {

    public static class TemplateMappingException extends RuntimeException {
        public TemplateMappingException(String message, Throwable cause) {
            super(message, cause);
        }

        public TemplateMappingException(String message) {
            super(message);
        }
    }

    private final ObjectMapper objectMapper;

    public TemplateMapper() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public TemplateMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Template read(String json) {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TemplateMappingException("Template is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new TemplateMappingException("Template root must be a JSON object");
        }
        return new Template((ObjectNode) node);
    }

    public Template read(Path path) throws IOException {
        log.debug("Reading template from: {}", path);
        return read(Files.readString(path));
    }

    public String write(Template template) {
        try {
            return objectMapper.writeValueAsString(template.getRoot());
        } catch (JsonProcessingException e) {
            throw new TemplateMappingException("Could not serialize template", e);
        }
    }

    public void write(Template template, Path path) throws IOException {
        log.debug("Writing template to: {}", path);
        Files.writeString(path, write(template));
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
