package sokoban.checker;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Configuration for the model checker run and the pipeline around it.
 * Centralizes all configurable parameters to avoid hardcoding.
 *
 * Environment Variables:
 * - NUXMV_PATH : path to the nuXmv executable (default: "nuXmv" on the PATH)
 * - NUXMV_TIMEOUT_MS : per-engine timeout in milliseconds
 * - SOKOBAN_LOG_LEVEL : 0..3, see {@link #LOG_LEVEL}
 */
public class CheckerConfig {

    /** Executable looked up on the PATH when NUXMV_PATH is not set */
    public static final String DEFAULT_EXECUTABLE = "nuXmv";

    /** Default per-engine timeout (10 minutes) */
    public static final long DEFAULT_TIMEOUT_MS = 600_000;

    /** Engines run in order; the first one's output is decoded */
    public static final List<String> DEFAULT_ENGINES = List.of("bdd", "sat");

    /** Name of the generated model inside the output directory */
    public static final String MODEL_FILE_NAME = "board.smv";

    /** Name of the solution report inside the output directory */
    public static final String SOLUTION_FILE_NAME = "solution.txt";

    // ========== Logging Configuration ==========

    /**
     * Log level for controlling output verbosity.
     * 0 = SILENT (no output except critical errors)
     * 1 = MINIMAL (only final result and failures)
     * 2 = NORMAL (+ per-engine progress, encoding warnings)
     * 3 = VERBOSE (+ parsed board, generated model size)
     */
    public static int LOG_LEVEL = 2;

    static {
        String level = System.getenv("SOKOBAN_LOG_LEVEL");
        if (level != null) {
            try {
                LOG_LEVEL = Integer.parseInt(level.trim());
            } catch (NumberFormatException e) {
                System.err.println("[CheckerConfig] Ignoring invalid SOKOBAN_LOG_LEVEL '" + level + "'");
            }
        }
    }

    /** Helper method to check if verbose logging is enabled */
    public static boolean isVerbose() { return LOG_LEVEL >= 3; }

    /** Helper method to check if normal logging is enabled */
    public static boolean isNormal() { return LOG_LEVEL >= 2; }

    /** Helper method to check if minimal logging is enabled */
    public static boolean isMinimal() { return LOG_LEVEL >= 1; }

    // Instance configuration
    private String executable = DEFAULT_EXECUTABLE;
    private long timeoutMs = DEFAULT_TIMEOUT_MS;
    private List<String> engines = DEFAULT_ENGINES;

    public CheckerConfig() {}

    public CheckerConfig(String executable, long timeoutMs, List<String> engines) {
        this.executable = executable;
        this.timeoutMs = timeoutMs;
        setEngines(engines);
    }

    /**
     * Creates a CheckerConfig with default values.
     * Factory method for cleaner API.
     */
    public static CheckerConfig defaults() {
        return new CheckerConfig();
    }

    /**
     * Creates a CheckerConfig with defaults overridden by NUXMV_PATH and NUXMV_TIMEOUT_MS.
     *
     * @throws IllegalArgumentException if NUXMV_TIMEOUT_MS is not a number
     */
    public static CheckerConfig fromEnvironment() {
        CheckerConfig config = new CheckerConfig();
        String path = System.getenv("NUXMV_PATH");
        if (path != null && !path.isBlank()) {
            config.setExecutable(path.trim());
        }
        String timeout = System.getenv("NUXMV_TIMEOUT_MS");
        if (timeout != null && !timeout.isBlank()) {
            try {
                config.setTimeoutMs(Long.parseLong(timeout.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("NUXMV_TIMEOUT_MS is not a number: " + timeout, e);
            }
        }
        return config;
    }

    public String getExecutable() { return executable; }
    public void setExecutable(String executable) { this.executable = executable; }

    public long getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

    public List<String> getEngines() { return engines; }
    public void setEngines(List<String> engines) {
        if (engines.isEmpty()) {
            throw new IllegalArgumentException("At least one engine is required");
        }
        this.engines = Collections.unmodifiableList(new ArrayList<>(engines));
    }

    @Override
    public String toString() {
        return "CheckerConfig[executable=" + executable + ", timeoutMs=" + timeoutMs
                + ", engines=" + Arrays.toString(engines.toArray()) + "]";
    }
}
