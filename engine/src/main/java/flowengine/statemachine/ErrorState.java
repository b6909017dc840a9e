package flowengine.statemachine;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ErrorState.Clean.class, name = "clean"),
        @JsonSubTypes.Type(value = ErrorState.Errored.class, name = "errored")
})
public interface ErrorState {
    Clean CLEAN = new Clean();

    boolean errored();

    ErrorState addErrors(List<FlowError> newErrors);

    record Clean() implements ErrorState {
        @Override
        public boolean errored() {
            return false;
        }

        @Override
        public ErrorState addErrors(List<FlowError> newErrors) {
            return new Errored(newErrors);
        }
    }

    record Errored(List<FlowError> errors) implements ErrorState {
        public Errored {
            errors = List.copyOf(Objects.requireNonNull(errors, "errors"));
            if (errors.isEmpty()) {
                throw new IllegalArgumentException("An errored run carries at least one error");
            }
        }

        @Override
        public boolean errored() {
            return true;
        }

        @Override
        public ErrorState addErrors(List<FlowError> newErrors) {
            List<FlowError> all = new ArrayList<>(errors);
            all.addAll(newErrors);
            return new Errored(all);
        }
    }
}
