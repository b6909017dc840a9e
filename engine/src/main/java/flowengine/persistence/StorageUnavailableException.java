package flowengine.persistence;

import flowengine.FlowEngineException;

public class StorageUnavailableException extends FlowEngineException {
    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
