package com.dcruver.flowscript.io;

import com.dcruver.flowscript.exception.SchemaException;
import com.dcruver.flowscript.ir.FlowGraph;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes the serialized IR: snake_case property names, ISO-8601 timestamps.
 */
@Component
@Slf4j
public class IrJsonCodec {

    private final ObjectMapper objectMapper;

    public IrJsonCodec() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String toJson(Object value, boolean pretty) {
        try {
            return pretty
                ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value)
                : objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public FlowGraph fromJson(String json) {
        try {
            return objectMapper.readValue(json, FlowGraph.class);
        } catch (JsonProcessingException | RuntimeException e) {
            throw new SchemaException("Malformed IR document: " + e.getMessage(), e);
        }
    }

    /**
     * Write the graph to a file, creating parent directories as needed
     */
    public void write(FlowGraph graph, Path file, boolean pretty) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = toJson(graph, pretty);
        Files.writeString(file, pretty ? json + "\n" : json);
        log.info("Wrote IR with {} nodes to {}", graph.getNodes().size(), file);
    }

    public FlowGraph read(Path file) throws IOException {
        log.debug("Reading IR from {}", file);
        return fromJson(Files.readString(file));
    }
}
