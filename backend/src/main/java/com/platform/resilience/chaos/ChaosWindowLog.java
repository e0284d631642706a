package com.platform.resilience.chaos;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.resilience.error.ErrorCode;
import com.platform.resilience.error.ResilienceException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only JSON-lines log of chaos windows. One instance per run; appends are serialized.
 */
@Slf4j
public class ChaosWindowLog {
    
    private final Path path;
    private final ObjectMapper objectMapper;
    private final Object appendLock = new Object();
    
    public ChaosWindowLog(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }
    
    public static String fileName(double failureFraction, String runId) {
        return String.format("window_log_p%s_%s.jsonl", failureFraction, runId);
    }
    
    /**
     * Append one window record and flush it to disk.
     */
    public void append(ChaosWindow window) {
        String line;
        try {
            line = objectMapper.writeValueAsString(window) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new ResilienceException(ErrorCode.SERIALIZATION_ERROR, 
                "Cannot serialize chaos window " + window.windowId(), e);
        }
        synchronized (appendLock) {
            try {
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(path, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.SYNC);
            } catch (IOException e) {
                throw new ResilienceException(ErrorCode.SERIALIZATION_ERROR, 
                    "Cannot append to window log " + path, e);
            }
        }
    }
    
    /**
     * Read every well-formed record. Malformed lines are skipped with a warning.
     */
    public List<ChaosWindow> readAll() {
        return read(path, objectMapper);
    }
    
    public static List<ChaosWindow> read(Path path, ObjectMapper objectMapper) {
        List<ChaosWindow> windows = new ArrayList<>();
        if (!Files.exists(path)) {
            return windows;
        }
        try {
            for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    windows.add(objectMapper.readValue(line, ChaosWindow.class));
                } catch (JsonProcessingException e) {
                    log.warn("Skipping malformed window log line in {}: {}", path, e.getOriginalMessage());
                }
            }
        } catch (IOException e) {
            throw new ResilienceException(ErrorCode.SERIALIZATION_ERROR, "Cannot read window log " + path, e);
        }
        return windows;
    }
    
    public Path getPath() {
        return path;
    }
}
