package io.surfworks.tirnarrow.config;

import java.nio.file.Path;

/**
 * Settings for the data type narrowing pass.
 *
 * <p>Loaded by {@link NarrowingConfigLoader} from
 * {@code ~/.config/tirnarrow/narrowing.json}, or built in code from
 * {@link #defaults()}.
 *
 * @param targetBits     width to narrow candidate variables to, 8 to 64
 * @param validateOutput type check every rewritten function
 * @param logSummary     log a per-function summary at INFO
 * @param parallelism    number of functions narrowed concurrently by
 *                       {@code apply(IrModule)}; 1 runs them in order
 */
public record NarrowingConfig(
        int targetBits,
        boolean validateOutput,
        boolean logSummary,
        int parallelism
) {

    /** Target width when none is configured */
    public static final int DEFAULT_TARGET_BITS = 32;

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "tirnarrow"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "narrowing.json";

    public NarrowingConfig {
        if (targetBits < 8 || targetBits > 64) {
            throw new IllegalArgumentException("targetBits must be between 8 and 64, got " + targetBits);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
    }

    /**
     * 32-bit target, validated output, no summary, sequential.
     */
    public static NarrowingConfig defaults() {
        return new NarrowingConfig(DEFAULT_TARGET_BITS, true, false, 1);
    }

    /**
     * Returns the config file path.
     */
    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public NarrowingConfig withTargetBits(int bits) {
        return new NarrowingConfig(bits, validateOutput, logSummary, parallelism);
    }

    public NarrowingConfig withValidateOutput(boolean validate) {
        return new NarrowingConfig(targetBits, validate, logSummary, parallelism);
    }

    public NarrowingConfig withLogSummary(boolean log) {
        return new NarrowingConfig(targetBits, validateOutput, log, parallelism);
    }

    public NarrowingConfig withParallelism(int threads) {
        return new NarrowingConfig(targetBits, validateOutput, logSummary, threads);
    }
}
