package flowengine.statemachine;

public interface FlowFiber {
    RunId id();
}
