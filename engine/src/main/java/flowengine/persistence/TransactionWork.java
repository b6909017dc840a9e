package flowengine.persistence;

@FunctionalInterface
public interface TransactionWork<T> {
    T execute(DatabaseTransaction transaction);
}
