package com.platform.resilience.fleet;

import com.platform.resilience.error.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Services that must never be chaos targets. Entries are normalized on load.
 */
@Slf4j
public final class Disallowlist {
    
    private final Set<String> entries;
    
    private Disallowlist(Set<String> entries) {
        this.entries = Collections.unmodifiableSet(entries);
    }
    
    public static Disallowlist empty() {
        return new Disallowlist(new LinkedHashSet<>());
    }
    
    public static Disallowlist of(Collection<String> names, Collection<String> domainSuffixes) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String name : names) {
            String entry = ServiceNames.normalize(name, domainSuffixes);
            if (!entry.isEmpty()) {
                normalized.add(entry);
            }
        }
        return new Disallowlist(normalized);
    }
    
    /**
     * Load a disallowlist file: one service per line, blank lines and '#' comments ignored.
     *
     * @param required fail when the file is missing instead of returning an empty list
     */
    public static Disallowlist load(Path path, boolean required, Collection<String> domainSuffixes) {
        if (path == null) {
            if (required) {
                throw new ConfigurationException("disallowlist", "path is required but not configured");
            }
            return empty();
        }
        if (!Files.isRegularFile(path)) {
            if (required) {
                throw new ConfigurationException(path.toString(), "disallowlist file not found");
            }
            log.warn("Disallowlist {} not found, relying on built-in infrastructure exclusion", path);
            return empty();
        }
        try {
            List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8).stream()
                .map(String::strip)
                .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                .toList();
            Disallowlist list = of(lines, domainSuffixes);
            log.info("Loaded {} disallowlist entries from {}", list.size(), path);
            return list;
        } catch (IOException e) {
            throw new ConfigurationException(path.toString(), "cannot read disallowlist: " + e.getMessage(), e);
        }
    }
    
    public boolean contains(String normalizedService) {
        return entries.contains(normalizedService);
    }
    
    public Set<String> entries() {
        return entries;
    }
    
    public int size() {
        return entries.size();
    }
    
    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
