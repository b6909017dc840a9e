package flowengine.statemachine;

import java.util.Objects;

public record WaitingOn(Kind kind, String key) {
    public enum Kind {
        EXTERNAL_EVENT,
        RECORD
    }

    public WaitingOn {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(key, "key");
    }

    public static WaitingOn externalEvent(String key) {
        return new WaitingOn(Kind.EXTERNAL_EVENT, key);
    }

    public static WaitingOn record(String key) {
        return new WaitingOn(Kind.RECORD, key);
    }
}
