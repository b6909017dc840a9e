package flowengine.statemachine;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

public record FlowError(long errorId, String exceptionType, String message) {
    public FlowError {
        Objects.requireNonNull(exceptionType, "exceptionType");
    }

    public static FlowError from(Throwable throwable) {
        return new FlowError(
                ThreadLocalRandom.current().nextLong(Long.MAX_VALUE),
                throwable.getClass().getName(),
                throwable.getMessage());
    }

    public static FlowError of(String message) {
        return new FlowError(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), FlowError.class.getName(), message);
    }
}
