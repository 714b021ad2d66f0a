package com.gnucash.ledger.config;

import com.gnucash.ledger.loader.Compression;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Where the ledger lives and how it is written. Each setting is looked up, first match wins, in
 * system properties, the process environment, the {@code .env} file and finally the bundled
 * {@value #DEFAULTS_RESOURCE}.
 *
 * <table>
 *   <caption>Settings</caption>
 *   <tr><th>Property</th><th>Environment</th><th>Default</th></tr>
 *   <tr><td>{@code gnucash.file}</td><td>{@code GNUCASH_FILE}</td><td>none</td></tr>
 *   <tr><td>{@code gnucash.compression-level}</td><td>{@code GNUCASH_COMPRESSION_LEVEL}</td><td>9</td></tr>
 *   <tr><td>{@code gnucash.time-zone}</td><td>{@code GNUCASH_TIME_ZONE}</td><td>UTC</td></tr>
 * </table>
 */
public final class LedgerConfig {

    private static final Logger LOGGER = Logger.getLogger(LedgerConfig.class.getName());

    public static final String FILE_PROPERTY = "gnucash.file";
    public static final String FILE_ENV = "GNUCASH_FILE";
    public static final String COMPRESSION_LEVEL_PROPERTY = "gnucash.compression-level";
    public static final String COMPRESSION_LEVEL_ENV = "GNUCASH_COMPRESSION_LEVEL";
    public static final String TIME_ZONE_PROPERTY = "gnucash.time-zone";
    public static final String TIME_ZONE_ENV = "GNUCASH_TIME_ZONE";
    public static final String DEFAULTS_RESOURCE = "gnucash-ledger.properties";
    public static final String DEFAULT_ENV_FILE = ".env";

    private final Path ledgerFile;
    private final int compressionLevel;
    private final ZoneId timeZone;
    private final Path envFile;

    public LedgerConfig(Path ledgerFile, int compressionLevel, ZoneId timeZone, Path envFile) {
        if (compressionLevel < 0 || compressionLevel > 9) {
            throw new IllegalArgumentException("Compression level must be between 0 and 9: " + compressionLevel);
        }
        this.ledgerFile = ledgerFile;
        this.compressionLevel = compressionLevel;
        this.timeZone = Objects.requireNonNull(timeZone, "timeZone");
        this.envFile = Objects.requireNonNull(envFile, "envFile");
    }

    /** Resolves the settings for this process, reading {@code .env} from the working directory. */
    public static LedgerConfig load() throws IOException {
        return load(Paths.get(DEFAULT_ENV_FILE));
    }

    public static LedgerConfig load(Path envFile) throws IOException {
        return resolve(System.getProperties(), System.getenv(), envFile);
    }

    /** Resolution against explicit sources. */
    public static LedgerConfig resolve(Properties systemProperties, Map<String, String> environment, Path envFile)
            throws IOException {
        Objects.requireNonNull(systemProperties, "systemProperties");
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(envFile, "envFile");
        Map<String, String> dotEnv = EnvFile.read(envFile);
        Properties defaults = defaults();

        String file = lookup(FILE_PROPERTY, FILE_ENV, systemProperties, environment, dotEnv, defaults);
        String level = lookup(
                COMPRESSION_LEVEL_PROPERTY, COMPRESSION_LEVEL_ENV, systemProperties, environment, dotEnv, defaults);
        String zone = lookup(TIME_ZONE_PROPERTY, TIME_ZONE_ENV, systemProperties, environment, dotEnv, defaults);

        int compressionLevel = Compression.DEFAULT_LEVEL;
        if (level != null) {
            try {
                compressionLevel = Integer.parseInt(level.trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid " + COMPRESSION_LEVEL_PROPERTY + ": '" + level + "'", ex);
            }
        }
        ZoneId timeZone;
        try {
            timeZone = zone == null ? ZoneId.of("UTC") : ZoneId.of(zone.trim());
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("Invalid " + TIME_ZONE_PROPERTY + ": '" + zone + "'", ex);
        }
        Path ledgerFile = file == null || file.isBlank() ? null : Paths.get(file.trim());
        return new LedgerConfig(ledgerFile, compressionLevel, timeZone, envFile);
    }

    public Optional<Path> getLedgerFile() {
        return Optional.ofNullable(ledgerFile);
    }

    /** Configured ledger path, failing when none is set. */
    public Path requireLedgerFile() {
        if (ledgerFile == null) {
            throw new IllegalStateException(
                    "No ledger configured; set " + FILE_PROPERTY + " or " + FILE_ENV + " or choose a file");
        }
        return ledgerFile;
    }

    /** A path is configured and the file exists. */
    public boolean isConfigured() {
        return ledgerFile != null && Files.isRegularFile(ledgerFile);
    }

    public int getCompressionLevel() {
        return compressionLevel;
    }

    public ZoneId getTimeZone() {
        return timeZone;
    }

    public Path getEnvFile() {
        return envFile;
    }

    /** Points at a different ledger and records the choice in the {@code .env} file. */
    public LedgerConfig withLedgerFile(Path newLedgerFile) throws IOException {
        Objects.requireNonNull(newLedgerFile, "newLedgerFile");
        EnvFile.write(envFile, FILE_ENV, newLedgerFile.toString());
        LOGGER.log(Level.INFO, "Ledger location set to {0}", newLedgerFile);
        return new LedgerConfig(newLedgerFile, compressionLevel, timeZone, envFile);
    }

    @Override
    public String toString() {
        return "LedgerConfig{file=" + ledgerFile
                + ", compressionLevel=" + compressionLevel
                + ", timeZone=" + timeZone + "}";
    }

    private static String lookup(
            String property,
            String env,
            Properties systemProperties,
            Map<String, String> environment,
            Map<String, String> dotEnv,
            Properties defaults) {
        String value = systemProperties.getProperty(property);
        if (isSet(value)) {
            return value;
        }
        value = environment.get(env);
        if (isSet(value)) {
            return value;
        }
        value = dotEnv.get(env);
        if (isSet(value)) {
            return value;
        }
        value = defaults.getProperty(property);
        return isSet(value) ? value : null;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    private static Properties defaults() throws IOException {
        Properties defaults = new Properties();
        try (InputStream in = LedgerConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                LOGGER.log(Level.WARNING, "{0} not found on the classpath; using built-in defaults", DEFAULTS_RESOURCE);
                return defaults;
            }
            defaults.load(in);
        }
        return defaults;
    }
}
