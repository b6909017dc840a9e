package flowengine.persistence;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explicit handle for one database transaction. Writes made through {@link #connection()} are
 * visible to later reads through the same handle and to everyone else only after {@link #commit()}.
 *
 * <p>A handle is confined to the thread that uses it.
 */
public final class DatabaseTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DatabaseTransaction.class);

    private enum Status {
        ACTIVE,
        COMMITTED,
        ROLLED_BACK
    }

    private final Connection connection;
    private final Lock commitLock;
    private final List<Runnable> commitHooks = new ArrayList<>();
    private final List<Runnable> rollbackHooks = new ArrayList<>();
    private final List<AutoCloseable> openCursors = new ArrayList<>();
    private Status status = Status.ACTIVE;

    DatabaseTransaction(Connection connection, Lock commitLock) {
        this.connection = connection;
        this.commitLock = commitLock;
    }

    public Connection connection() {
        ensureActive();
        return connection;
    }

    public boolean isActive() {
        return status == Status.ACTIVE;
    }

    /**
     * Registers work to run after a successful commit, in registration order. Dropped on rollback.
     * A failing hook is logged and does not affect the other hooks or the commit. Hooks run while
     * other commits wait, so they must not open a transaction of their own.
     */
    public void onCommit(Runnable hook) {
        Objects.requireNonNull(hook, "hook");
        ensureActive();
        commitHooks.add(hook);
    }

    /**
     * Registers work to run after a rollback, including the implicit one of {@link #close()}.
     */
    public void onRollback(Runnable hook) {
        Objects.requireNonNull(hook, "hook");
        ensureActive();
        rollbackHooks.add(hook);
    }

    void registerCursor(AutoCloseable cursor) {
        openCursors.add(cursor);
    }

    public void commit() {
        ensureActive();
        closeCursors();
        // Held until the hooks finish so that a later commit cannot publish ahead of this one.
        commitLock.lock();
        try {
            try (Statement statement = connection.createStatement()) {
                statement.execute("COMMIT");
            } catch (SQLException e) {
                StorageUnavailableException failure = new StorageUnavailableException("Commit failed", e);
                rollback(failure);
                throw failure;
            }
            status = Status.COMMITTED;
            rollbackHooks.clear();
            closeConnection(null);
            runHooks(commitHooks, "After-commit");
        } finally {
            commitLock.unlock();
        }
    }

    public void rollback() {
        rollback(null);
    }

    /**
     * Rolls back, attaching any failure of the rollback itself to {@code rootCause} when given.
     */
    void rollback(Throwable rootCause) {
        if (status != Status.ACTIVE) {
            return;
        }
        status = Status.ROLLED_BACK;
        commitHooks.clear();
        closeCursors();
        try (Statement statement = connection.createStatement()) {
            statement.execute("ROLLBACK");
        } catch (SQLException e) {
            if (rootCause != null) {
                rootCause.addSuppressed(e);
            } else {
                log.warn("Rollback failed", e);
            }
        }
        closeConnection(rootCause);
        runHooks(rollbackHooks, "After-rollback");
    }

    @Override
    public void close() {
        if (status == Status.ACTIVE) {
            rollback(null);
        }
    }

    private static void runHooks(List<Runnable> hooks, String kind) {
        for (Runnable hook : hooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                log.warn("{} hook failed", kind, e);
            }
        }
        hooks.clear();
    }

    private void closeCursors() {
        for (AutoCloseable cursor : openCursors) {
            try {
                cursor.close();
            } catch (Exception e) {
                log.debug("Failed to close cursor", e);
            }
        }
        openCursors.clear();
    }

    private void closeConnection(Throwable rootCause) {
        try {
            connection.close();
        } catch (SQLException e) {
            if (rootCause != null) {
                rootCause.addSuppressed(e);
            } else {
                log.warn("Failed to close connection", e);
            }
        }
    }

    private void ensureActive() {
        if (status != Status.ACTIVE) {
            throw new IllegalStateException("Transaction is no longer active: " + status);
        }
    }
}
