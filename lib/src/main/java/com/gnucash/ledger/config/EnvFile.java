package com.gnucash.ledger.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code KEY=value} settings file. Blank lines and {@code #} comments are ignored; one pair of
 * surrounding quotes is removed from values.
 */
public final class EnvFile {

    private EnvFile() {}

    /** Entries of {@code path}; empty when the file does not exist. */
    public static Map<String, String> read(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            return Collections.emptyMap();
        }
        Map<String, String> entries = new LinkedHashMap<>();
        for (String raw : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            int eq = line.indexOf('=');
            if (eq < 0) {
                continue;
            }
            entries.put(line.substring(0, eq).trim(), unquote(line.substring(eq + 1).trim()));
        }
        return entries;
    }

    /** Sets {@code key}, replacing earlier lines for it and keeping every other line. */
    public static void write(Path path, String key, String value) throws IOException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        List<String> lines = new ArrayList<>();
        if (Files.isRegularFile(path)) {
            for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                String trimmed = line.stripLeading();
                if (!trimmed.startsWith(key + "=") && !line.isBlank()) {
                    lines.add(line);
                }
            }
        }
        lines.add(key + "=" + value);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
    }

    private static String unquote(String value) {
        String result = value;
        if (result.startsWith("\"") || result.startsWith("'")) {
            result = result.substring(1);
        }
        if (result.endsWith("\"") || result.endsWith("'")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
