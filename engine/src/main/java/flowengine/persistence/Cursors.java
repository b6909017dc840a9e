package flowengine.persistence;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

final class Cursors {
    private Cursors() {
    }

    @FunctionalInterface
    interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    static <T> Stream<T> stream(DatabaseTransaction transaction, PreparedStatement statement, RowMapper<T> mapper,
                                String description) throws SQLException {
        transaction.registerCursor(statement);
        ResultSet rs = statement.executeQuery();
        Spliterator<T> rows = new Spliterators.AbstractSpliterator<>(Long.MAX_VALUE,
                Spliterator.ORDERED | Spliterator.NONNULL) {
            private boolean exhausted;

            @Override
            public boolean tryAdvance(Consumer<? super T> action) {
                if (exhausted) {
                    return false;
                }
                try {
                    if (!rs.next()) {
                        exhausted = true;
                        return false;
                    }
                    action.accept(mapper.map(rs));
                    return true;
                } catch (SQLException e) {
                    throw new StorageUnavailableException("Failed to read " + description, e);
                }
            }
        };
        return StreamSupport.stream(rows, false).onClose(() -> {
            try {
                statement.close();
            } catch (SQLException e) {
                throw new StorageUnavailableException("Failed to close cursor over " + description, e);
            }
        });
    }
}
