package com.nomen.iupac.infra.config;

import com.nomen.iupac.api.model.TraceLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.function.UnaryOperator;

/**
 * Configuration of the naming engine.
 *
 * <p><b>Override order</b> (later wins): built-in defaults, {@code nomen.properties}
 * (when loaded through {@link #loadDefault()} or {@link #loadFromProperties(String)}),
 * system properties {@code nomen.<property>}, environment variables
 * {@code NOMEN_<PROPERTY>}, explicit builder calls.
 *
 * <p>Example environment variables:
 * <pre>
 * NOMEN_TRACE_LEVEL=STANDARD
 * NOMEN_MAX_CYCLE_LENGTH=24
 * NOMEN_RETAINED_ALKYL_NAMES=true
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * NamingConfig config = NamingConfig.builder()
 *     .traceLevel(TraceLevel.FULL)
 *     .retainedAlkylNames(true)
 *     .build();
 * }</pre>
 */
public final class NamingConfig {

    private static final Logger logger = LoggerFactory.getLogger(NamingConfig.class);

    // ========================================================================
    // ENVIRONMENT VARIABLE / PROPERTY KEYS
    // ========================================================================
    static final String ENV_TRACE_LEVEL = "NOMEN_TRACE_LEVEL";
    static final String ENV_MAX_CYCLE_LENGTH = "NOMEN_MAX_CYCLE_LENGTH";
    static final String ENV_RETAINED_ALKYL_NAMES = "NOMEN_RETAINED_ALKYL_NAMES";
    static final String ENV_MAX_ATOMS = "NOMEN_MAX_ATOMS";

    static final String PROP_TRACE_LEVEL = "nomen.trace.level";
    static final String PROP_MAX_CYCLE_LENGTH = "nomen.max.cycle.length";
    static final String PROP_RETAINED_ALKYL_NAMES = "nomen.retained.alkyl.names";
    static final String PROP_MAX_ATOMS = "nomen.max.atoms";

    private final TraceLevel traceLevel;
    private final int maxCycleLength;
    private final boolean retainedAlkylNames;
    private final int maxAtoms;

    private NamingConfig(Builder builder) {
        this.traceLevel = builder.traceLevel;
        this.maxCycleLength = builder.maxCycleLength;
        this.retainedAlkylNames = builder.retainedAlkylNames;
        this.maxAtoms = builder.maxAtoms;
        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Defaults with system-property and environment overrides applied.
     */
    public static NamingConfig fromEnvironment() {
        return builder().build();
    }

    /**
     * Loads {@code nomen.properties} from the classpath, falling back to defaults.
     */
    public static NamingConfig loadDefault() {
        return loadFromProperties("nomen.properties");
    }

    /**
     * Loads configuration from a properties file on the classpath or file system.
     * System properties and environment variables still take precedence.
     */
    public static NamingConfig loadFromProperties(String propertiesPath) {
        Properties props = new Properties();
        try (InputStream is = NamingConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded {} naming properties from classpath: {}", props.size(), propertiesPath);
            }
        } catch (IOException e) {
            logger.debug("Could not load from classpath: {}", propertiesPath, e);
        }
        if (props.isEmpty()) {
            try (InputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded {} naming properties from file: {}", props.size(), propertiesPath);
            } catch (IOException e) {
                logger.debug("No naming properties at {}, using defaults", propertiesPath);
            }
        }
        Builder builder = new Builder(false);
        builder.applyProperties(props::getProperty);
        builder.applyOverrides();
        return builder.build();
    }

    public static Builder builder() {
        return new Builder(true);
    }

    /**
     * Copy of this configuration as a builder, without re-reading overrides.
     */
    public Builder toBuilder() {
        Builder builder = new Builder(false);
        builder.traceLevel = traceLevel;
        builder.maxCycleLength = maxCycleLength;
        builder.retainedAlkylNames = retainedAlkylNames;
        builder.maxAtoms = maxAtoms;
        return builder;
    }

    private void validate() {
        if (maxCycleLength < 3) {
            throw new IllegalArgumentException("maxCycleLength must be >= 3, was " + maxCycleLength);
        }
        if (maxAtoms <= 0) {
            throw new IllegalArgumentException("maxAtoms must be > 0, was " + maxAtoms);
        }
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public TraceLevel traceLevel() {
        return traceLevel;
    }

    public int maxCycleLength() {
        return maxCycleLength;
    }

    /**
     * When true, branched alkyl prefixes use retained names (isopropyl, sec-butyl, ...).
     */
    public boolean retainedAlkylNames() {
        return retainedAlkylNames;
    }

    /**
     * Size above which a diagnostic is added to the result; naming still proceeds.
     */
    public int maxAtoms() {
        return maxAtoms;
    }

    @Override
    public String toString() {
        return "NamingConfig{traceLevel=" + traceLevel
                + ", maxCycleLength=" + maxCycleLength
                + ", retainedAlkylNames=" + retainedAlkylNames
                + ", maxAtoms=" + maxAtoms + '}';
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {

        private TraceLevel traceLevel = TraceLevel.NONE;
        private int maxCycleLength = 40;
        private boolean retainedAlkylNames = false;
        private int maxAtoms = 200;

        private Builder(boolean readOverrides) {
            if (readOverrides) {
                applyOverrides();
            }
        }

        private void applyOverrides() {
            applyProperties(System::getProperty);
            applyEnvironment();
        }

        private void applyProperties(UnaryOperator<String> source) {
            Optional.ofNullable(source.apply(PROP_TRACE_LEVEL)).ifPresent(this::parseTraceLevel);
            Optional.ofNullable(source.apply(PROP_MAX_CYCLE_LENGTH))
                    .ifPresent(val -> parseInt(PROP_MAX_CYCLE_LENGTH, val).ifPresent(v -> this.maxCycleLength = v));
            Optional.ofNullable(source.apply(PROP_RETAINED_ALKYL_NAMES))
                    .ifPresent(val -> this.retainedAlkylNames = Boolean.parseBoolean(val.trim()));
            Optional.ofNullable(source.apply(PROP_MAX_ATOMS))
                    .ifPresent(val -> parseInt(PROP_MAX_ATOMS, val).ifPresent(v -> this.maxAtoms = v));
        }

        private void applyEnvironment() {
            getEnv(ENV_TRACE_LEVEL).ifPresent(this::parseTraceLevel);
            getEnv(ENV_MAX_CYCLE_LENGTH)
                    .ifPresent(val -> parseInt(ENV_MAX_CYCLE_LENGTH, val).ifPresent(v -> this.maxCycleLength = v));
            getEnv(ENV_RETAINED_ALKYL_NAMES).ifPresent(val -> this.retainedAlkylNames = Boolean.parseBoolean(val.trim()));
            getEnv(ENV_MAX_ATOMS).ifPresent(val -> parseInt(ENV_MAX_ATOMS, val).ifPresent(v -> this.maxAtoms = v));
        }

        private void parseTraceLevel(String value) {
            try {
                this.traceLevel = TraceLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid trace level: {}, using default: {}", value, this.traceLevel);
            }
        }

        private static Optional<Integer> parseInt(String key, String value) {
            try {
                return Optional.of(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer for {}: {}", key, value);
                return Optional.empty();
            }
        }

        private static Optional<String> getEnv(String key) {
            String value = System.getenv(key);
            return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
        }

        public Builder traceLevel(TraceLevel level) {
            this.traceLevel = Objects.requireNonNull(level, "level must not be null");
            return this;
        }

        public Builder maxCycleLength(int length) {
            this.maxCycleLength = length;
            return this;
        }

        public Builder retainedAlkylNames(boolean retained) {
            this.retainedAlkylNames = retained;
            return this;
        }

        public Builder maxAtoms(int atoms) {
            this.maxAtoms = atoms;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a value is out of range
         */
        public NamingConfig build() {
            return new NamingConfig(this);
        }
    }
}
