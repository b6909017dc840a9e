package flowengine.statemachine;

public enum ErroredRunPolicy {
    HOLD,
    RETRY_FROM_CHECKPOINT;

    public static ErroredRunPolicy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return HOLD;
        }
        return switch (value.trim().toLowerCase()) {
            case "hold" -> HOLD;
            case "retry-from-checkpoint" -> RETRY_FROM_CHECKPOINT;
            default -> throw new IllegalArgumentException("Unsupported errored run policy: " + value);
        };
    }
}
