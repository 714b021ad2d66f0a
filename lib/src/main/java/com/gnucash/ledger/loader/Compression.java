package com.gnucash.ledger.loader;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.ZipException;

/** Gzip and digest helpers for the compressed book file. */
public final class Compression {

    public static final int DEFAULT_LEVEL = 9;

    private Compression() {}

    /** Inflates a gzip stream fully into memory and decodes it as UTF-8. */
    public static String gunzip(byte[] compressed) throws LedgerParseException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (ZipException ex) {
            throw new LedgerParseException("Ledger file is not gzip-compressed: " + ex.getMessage(), ex);
        } catch (IOException ex) {
            throw new LedgerParseException("Failed to decompress ledger: " + ex.getMessage(), ex);
        }
    }

    /** Encodes {@code text} as UTF-8 and gzips it at {@code level} (0-9). */
    public static byte[] gzip(String text, int level) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(512, text.length() / 4));
        try (OutputStream out = new LevelledGzipOutputStream(buffer, level)) {
            out.write(text.getBytes(StandardCharsets.UTF_8));
        }
        return buffer.toByteArray();
    }

    public static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private static final class LevelledGzipOutputStream extends GZIPOutputStream {
        LevelledGzipOutputStream(OutputStream out, int level) throws IOException {
            super(out);
            def.setLevel(level);
        }
    }
}
