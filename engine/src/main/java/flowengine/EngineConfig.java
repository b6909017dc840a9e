package flowengine;

import flowengine.persistence.Database;
import flowengine.statemachine.ErroredRunPolicy;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;

/**
 * @param databasePath       SQLite file holding checkpoints and records
 * @param workerCount        size of the flow worker pool
 * @param busyTimeoutMs      how long a transaction waits for the SQLite write lock
 * @param erroredRunPolicy   whether errored runs may be retried without a restart
 * @param dumpHistoryOnError install the transition history interceptor
 * @param printTransitions   install the debug transition logger
 */
public record EngineConfig(
        Path databasePath,
        int workerCount,
        int busyTimeoutMs,
        ErroredRunPolicy erroredRunPolicy,
        boolean dumpHistoryOnError,
        boolean printTransitions) {

    public static final int DEFAULT_WORKER_COUNT = 4;
    public static final String PREFIX = "flowengine.";

    public EngineConfig {
        Objects.requireNonNull(databasePath, "databasePath");
        Objects.requireNonNull(erroredRunPolicy, "erroredRunPolicy");
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1: " + workerCount);
        }
        if (busyTimeoutMs < 0) {
            throw new IllegalArgumentException("busyTimeoutMs must not be negative: " + busyTimeoutMs);
        }
    }

    public static EngineConfig defaults(Path databasePath) {
        return new EngineConfig(
                databasePath,
                DEFAULT_WORKER_COUNT,
                Database.DEFAULT_BUSY_TIMEOUT_MS,
                ErroredRunPolicy.HOLD,
                true,
                false);
    }

    /**
     * Reads {@code flowengine.workers}, {@code flowengine.busy-timeout-ms},
     * {@code flowengine.errored-run-policy}, {@code flowengine.dump-history-on-error} and
     * {@code flowengine.print-transitions}; anything missing keeps its default.
     */
    public static EngineConfig fromProperties(Path databasePath, Properties properties) {
        EngineConfig defaults = defaults(databasePath);
        return new EngineConfig(
                databasePath,
                intProperty(properties, "workers", defaults.workerCount()),
                intProperty(properties, "busy-timeout-ms", defaults.busyTimeoutMs()),
                ErroredRunPolicy.fromValue(properties.getProperty(PREFIX + "errored-run-policy")),
                booleanProperty(properties, "dump-history-on-error", defaults.dumpHistoryOnError()),
                booleanProperty(properties, "print-transitions", defaults.printTransitions()));
    }

    public EngineConfig withErroredRunPolicy(ErroredRunPolicy policy) {
        return new EngineConfig(databasePath, workerCount, busyTimeoutMs, policy, dumpHistoryOnError, printTransitions);
    }

    private static int intProperty(Properties properties, String name, int fallback) {
        String raw = properties.getProperty(PREFIX + name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + name + ": " + raw, e);
        }
    }

    private static boolean booleanProperty(Properties properties, String name, boolean fallback) {
        String raw = properties.getProperty(PREFIX + name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return switch (raw.trim().toLowerCase()) {
            case "true", "yes", "on" -> true;
            case "false", "no", "off" -> false;
            default -> throw new IllegalArgumentException("Invalid value for " + PREFIX + name + ": " + raw);
        };
    }
}
