package flowengine.statemachine;

import java.util.Objects;
import java.util.UUID;

public record RunId(UUID uuid) {
    public RunId {
        Objects.requireNonNull(uuid, "uuid");
    }

    public static RunId createRandom() {
        return new RunId(UUID.randomUUID());
    }

    public static RunId parse(String value) {
        return new RunId(UUID.fromString(value));
    }

    @Override
    public String toString() {
        return "[" + uuid + "]";
    }
}
