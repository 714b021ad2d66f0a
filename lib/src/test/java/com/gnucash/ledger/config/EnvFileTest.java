package com.gnucash.ledger.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class EnvFileTest {

    @TempDir
    Path dir;

    @Test
    void readsPairsSkippingCommentsAndQuotes() throws Exception {
        Path env = dir.resolve(".env");
        Files.writeString(env, "# ledger\nGNUCASH_FILE=\"/books/home.gnucash\"\n\nnot a pair\nGNUCASH_TIME_ZONE = 'Europe/Paris'\nEMPTY=\n",
                StandardCharsets.UTF_8);

        Map<String, String> entries = EnvFile.read(env);

        assertEquals("/books/home.gnucash", entries.get("GNUCASH_FILE"));
        assertEquals("Europe/Paris", entries.get("GNUCASH_TIME_ZONE"));
        assertEquals("", entries.get("EMPTY"));
        assertEquals(3, entries.size());
    }

    @Test
    void missingFileIsEmpty() throws Exception {
        assertTrue(EnvFile.read(dir.resolve("absent.env")).isEmpty());
    }

    @Test
    void writeReplacesOnlyTheKey() throws Exception {
        Path env = dir.resolve("conf").resolve(".env");
        EnvFile.write(env, "GNUCASH_FILE", "/a.gnucash");
        Files.writeString(env, Files.readString(env) + "OTHER=1\n", StandardCharsets.UTF_8);

        EnvFile.write(env, "GNUCASH_FILE", "/b.gnucash");

        assertEquals("OTHER=1\nGNUCASH_FILE=/b.gnucash\n", Files.readString(env));
    }
}
