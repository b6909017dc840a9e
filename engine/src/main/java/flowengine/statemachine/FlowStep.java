package flowengine.statemachine;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record FlowStep(
        Kind kind,
        FlowFrame frame,
        String waitKey,
        JsonNode result,
        String failure,
        List<Action.AddRecord> records) {

    public enum Kind {
        NEXT,
        AWAIT_EVENT,
        AWAIT_RECORD,
        FINISH,
        FAIL
    }

    public FlowStep {
        Objects.requireNonNull(kind, "kind");
        records = List.copyOf(records == null ? List.of() : records);
    }

    public static FlowStep next(String stage, JsonNode data) {
        return new FlowStep(Kind.NEXT, new FlowFrame(stage, data), null, null, null, List.of());
    }

    public static FlowStep awaitEvent(String stage, JsonNode data, String eventKey) {
        return new FlowStep(Kind.AWAIT_EVENT, new FlowFrame(stage, data),
                Objects.requireNonNull(eventKey, "eventKey"), null, null, List.of());
    }

    public static FlowStep awaitRecord(String stage, JsonNode data, String recordKey) {
        return new FlowStep(Kind.AWAIT_RECORD, new FlowFrame(stage, data),
                Objects.requireNonNull(recordKey, "recordKey"), null, null, List.of());
    }

    public static FlowStep finish(JsonNode result) {
        return new FlowStep(Kind.FINISH, null, null, result, null, List.of());
    }

    public static FlowStep fail(String message) {
        return new FlowStep(Kind.FAIL, null, null, null, Objects.requireNonNull(message, "message"), List.of());
    }

    public FlowStep withRecord(String key, JsonNode value) {
        List<Action.AddRecord> all = new ArrayList<>(records);
        all.add(new Action.AddRecord(key, value));
        return new FlowStep(kind, frame, waitKey, result, failure, all);
    }
}
