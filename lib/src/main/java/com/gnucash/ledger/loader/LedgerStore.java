package com.gnucash.ledger.loader;

import com.gnucash.ledger.ledger.LedgerData;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-through cache over one ledger file. Holds the decompressed book text, keyed to the
 * SHA-256 digest of the compressed bytes it came from, and the model parsed from that text.
 *
 * <p>Not thread-safe; callers that share a store serialize access to it.</p>
 */
public final class LedgerStore {

    private static final Logger LOGGER = Logger.getLogger(LedgerStore.class.getName());

    private final Path ledgerPath;
    private String rawText;
    private String digest;
    private LedgerData parsed;

    public LedgerStore(Path ledgerPath) {
        this.ledgerPath = Objects.requireNonNull(ledgerPath, "ledgerPath");
    }

    public Path getLedgerPath() {
        return ledgerPath;
    }

    /** Parsed model, re-parsing the cached text when the model was dropped. */
    public LedgerData get() throws LedgerParseException {
        if (parsed == null) {
            parsed = LedgerReader.parse(rawText());
        }
        return parsed;
    }

    /** Decompressed book text, reading the file on first use. */
    public String rawText() throws LedgerParseException {
        if (rawText == null) {
            load(readBytes());
        }
        return rawText;
    }

    /** Digest of the compressed bytes behind {@link #rawText()}, or null before the first read. */
    public String digest() {
        return digest;
    }

    /** Drops both the text and the model; the next call reads the file again. */
    public void invalidate() {
        rawText = null;
        digest = null;
        parsed = null;
    }

    /** Installs text the writer just persisted as {@code compressed} and drops the model. */
    public void replaceRawText(String newText, byte[] compressed) {
        rawText = Objects.requireNonNull(newText, "newText");
        digest = Compression.sha256(Objects.requireNonNull(compressed, "compressed"));
        parsed = null;
    }

    /**
     * Re-reads the file when its bytes differ from the cached ones.
     *
     * @return true when the cache was refreshed
     */
    public boolean reloadIfChanged() throws LedgerParseException {
        byte[] bytes = readBytes();
        String current = Compression.sha256(bytes);
        if (current.equals(digest)) {
            return false;
        }
        if (digest != null) {
            LOGGER.log(Level.INFO, "Ledger {0} changed on disk; reloading", ledgerPath);
        }
        load(bytes);
        return true;
    }

    private void load(byte[] bytes) throws LedgerParseException {
        String text = Compression.gunzip(bytes);
        rawText = text;
        digest = Compression.sha256(bytes);
        parsed = null;
    }

    private byte[] readBytes() throws LedgerParseException {
        try {
            return Files.readAllBytes(ledgerPath);
        } catch (IOException ex) {
            throw new LedgerParseException("Failed to read ledger " + ledgerPath + ": " + ex.getMessage(), ex);
        }
    }
}
