package com.b2b.inventory.repository;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Scanner;

/**
 * Loads named SQL blocks from a single file. Each block starts with a
 * {@code -- name: <queryName>} line and runs until the next one.
 * Parsed once, on first use; safe for concurrent callers.
 */
@Component
public class SqlTemplateLoader {

    static final String DEFAULT_LOCATION = "classpath:sql/queries.sql";
    private static final String NAME_MARKER = "-- name:";

    private final ResourceLoader resourceLoader;
    private final String location;
    private volatile Map<String, String> queries;

    public SqlTemplateLoader(ResourceLoader resourceLoader) {
        this(resourceLoader, DEFAULT_LOCATION);
    }

    @Autowired
    public SqlTemplateLoader(ResourceLoader resourceLoader,
                             @Value("${app.db.queries-location:" + DEFAULT_LOCATION + "}") String location) {
        this.resourceLoader = resourceLoader;
        this.location = location;
    }

    public String load(String name) {
        String query = queries().get(name);
        if (query == null) {
            throw new IllegalArgumentException("SQL query not found in " + location + ": " + name);
        }
        return query;
    }

    private Map<String, String> queries() {
        Map<String, String> loaded = queries;
        if (loaded == null) {
            synchronized (this) {
                loaded = queries;
                if (loaded == null) {
                    loaded = parse();
                    queries = loaded;
                }
            }
        }
        return loaded;
    }

    private Map<String, String> parse() {
        Resource resource = resourceLoader.getResource(location);
        Map<String, String> parsed = new HashMap<>();
        try (InputStream in = resource.getInputStream();
             Scanner scanner = new Scanner(in, StandardCharsets.UTF_8)) {
            String currentName = null;
            StringBuilder body = new StringBuilder();
            while (scanner.hasNextLine()) {
                String line = scanner.nextLine();
                String trimmed = line.trim();
                if (trimmed.startsWith(NAME_MARKER)) {
                    if (currentName != null) {
                        parsed.put(currentName, body.toString().trim());
                    }
                    currentName = trimmed.substring(NAME_MARKER.length()).trim();
                    body = new StringBuilder();
                } else if (currentName != null) {
                    body.append(line).append('\n');
                }
            }
            if (currentName != null) {
                parsed.put(currentName, body.toString().trim());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load SQL queries file: " + location, e);
        }
        return Map.copyOf(parsed);
    }
}
