package flowengine.persistence;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;
import org.sqlite.SQLiteOpenMode;

/**
 * Transactional context provider over a single SQLite file.
 *
 * <p>Every store call takes the {@link DatabaseTransaction} handed out here. Transactions begin
 * {@code IMMEDIATE}, so writers are serialised and a reader outside a transaction only ever sees
 * committed state. After-commit hooks of different transactions run in commit order.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5_000;
    private static final int DEFAULT_BUSY_RETRIES = 8;
    private static final long DEFAULT_RETRY_BACKOFF_MS = 40L;

    private final String jdbcUrl;
    private final DataSource dataSource;
    private final int busyRetries;
    private final long retryBackoffMs;
    private final ReentrantLock commitLock = new ReentrantLock();

    public Database(Path dbPath) {
        this(dbPath, DEFAULT_BUSY_TIMEOUT_MS);
    }

    public Database(Path dbPath, int busyTimeoutMs) {
        this("jdbc:sqlite:" + dbPath.toAbsolutePath(), busyTimeoutMs, DEFAULT_BUSY_RETRIES, DEFAULT_RETRY_BACKOFF_MS);
    }

    public Database(String jdbcUrl, int busyTimeoutMs, int busyRetries, long retryBackoffMs) {
        this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        this.dataSource = createDataSource(jdbcUrl, busyTimeoutMs);
        this.busyRetries = busyRetries;
        this.retryBackoffMs = retryBackoffMs;
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    /**
     * Opens a new transaction. The caller owns it and must commit, roll back or close it.
     */
    public DatabaseTransaction begin() {
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            throw new StorageUnavailableException("Could not open a connection to " + jdbcUrl, e);
        }
        try {
            executeWithBusyRetry(() -> {
                beginImmediate(connection);
                return null;
            });
        } catch (SQLException e) {
            closeAfterFailure(connection, e);
            throw new StorageUnavailableException("Could not begin a transaction on " + jdbcUrl, e);
        } catch (RuntimeException e) {
            closeAfterFailure(connection, e);
            throw e;
        }
        return new DatabaseTransaction(connection, commitLock);
    }

    /**
     * Runs {@code work} in a fresh transaction, committing when it returns and rolling back when
     * it throws.
     */
    public <T> T transaction(TransactionWork<T> work) {
        Objects.requireNonNull(work, "work");
        DatabaseTransaction transaction = begin();
        T result;
        try {
            result = work.execute(transaction);
        } catch (RuntimeException | Error e) {
            transaction.rollback(e);
            throw e;
        }
        transaction.commit();
        return result;
    }

    private <T> T executeWithBusyRetry(SqlSupplier<T> supplier) throws SQLException {
        SQLException last = null;
        for (int attempt = 0; attempt <= busyRetries; attempt++) {
            try {
                return supplier.get();
            } catch (SQLException e) {
                if (!isBusy(e) || attempt == busyRetries) {
                    throw e;
                }
                last = e;
                log.debug("Database busy while beginning a transaction, attempt {} of {}", attempt + 1, busyRetries);
                sleep(retryBackoffMs * (attempt + 1));
            }
        }
        throw last;
    }

    private static boolean isBusy(SQLException e) {
        if (e instanceof SQLiteException sqliteException) {
            SQLiteErrorCode resultCode = sqliteException.getResultCode();
            if (resultCode == SQLiteErrorCode.SQLITE_BUSY || resultCode == SQLiteErrorCode.SQLITE_LOCKED) {
                return true;
            }
        }
        String message = e.getMessage();
        return e.getErrorCode() == 5
                || (message != null
                && (message.contains("SQLITE_BUSY")
                || message.contains("SQLITE_LOCKED")
                || message.contains("database is locked")));
    }

    private static void beginImmediate(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("BEGIN IMMEDIATE");
        }
    }

    private static void closeAfterFailure(Connection connection, Throwable rootCause) {
        try {
            connection.close();
        } catch (SQLException closeFailure) {
            rootCause.addSuppressed(closeFailure);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a busy database", interrupted);
        }
    }

    @FunctionalInterface
    private interface SqlSupplier<T> {
        T get() throws SQLException;
    }

    private static DataSource createDataSource(String jdbcUrl, int busyTimeoutMs) {
        SQLiteConfig config = new SQLiteConfig();
        config.setOpenMode(SQLiteOpenMode.FULLMUTEX);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setBusyTimeout(busyTimeoutMs);

        SQLiteDataSource sqliteDataSource = new SQLiteDataSource(config);
        sqliteDataSource.setUrl(jdbcUrl);
        return sqliteDataSource;
    }
}
