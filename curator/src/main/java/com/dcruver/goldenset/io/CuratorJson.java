package com.dcruver.goldenset.io;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical JSON for every artifact the curator writes.
 *
 * Keys are snake_case and sorted; documents use a 2-space indent, LF line
 * endings and a trailing LF; JSON lines hold one compact object per line.
 */
@Component
@Slf4j
public class CuratorJson {

    private final ObjectMapper objectMapper;

    public CuratorJson() {
        this.objectMapper = JsonMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Indented canonical form, always ending in a single LF
     */
    public String canonical(Object value) {
        try {
            return objectMapper.writer(new CanonicalPrettyPrinter()).writeValueAsString(value) + "\n";
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Single-line canonical form, used for JSON lines and content digests
     */
    public String compact(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public void write(Path file, Object value) throws IOException {
        createParent(file);
        Files.writeString(file, canonical(value), StandardCharsets.UTF_8);
        log.debug("Wrote {}", file);
    }

    public <T> T read(Path file, Class<T> type) throws IOException {
        return objectMapper.readValue(file.toFile(), type);
    }

    public <T> T read(Path file, TypeReference<T> type) throws IOException {
        return objectMapper.readValue(file.toFile(), type);
    }

    public void writeLines(Path file, List<?> values) throws IOException {
        createParent(file);
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (Object value : values) {
                writer.write(compact(value));
                writer.write('\n');
            }
        }
        log.debug("Wrote {} lines to {}", values.size(), file);
    }

    public <T> List<T> readLines(Path file, Class<T> type) throws IOException {
        List<T> values = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                values.add(objectMapper.readValue(line, type));
            }
        }
        return values;
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    /**
     * Two-space indent, LF newlines, and "key": value with no space before the colon
     */
    static class CanonicalPrettyPrinter extends DefaultPrettyPrinter {

        CanonicalPrettyPrinter() {
            DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
            indentObjectsWith(indenter);
            indentArraysWith(indenter);
        }

        CanonicalPrettyPrinter(CanonicalPrettyPrinter base) {
            super(base);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new CanonicalPrettyPrinter(this);
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        // Empty containers render as [] and {} rather than [ ] and { }
        @Override
        public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
            if (!_arrayIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfValues > 0) {
                _arrayIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw(']');
        }

        @Override
        public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
            if (!_objectIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfEntries > 0) {
                _objectIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw('}');
        }
    }
}
