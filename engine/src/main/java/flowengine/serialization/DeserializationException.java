package flowengine.serialization;

import flowengine.FlowEngineException;

public class DeserializationException extends FlowEngineException {
    public DeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
