package flowengine.statemachine;

@FunctionalInterface
public interface TransitionExecutor {
    TransitionOutcome executeTransition(
            FlowFiber fiber,
            StateMachineState previousState,
            Event event,
            TransitionResult transition,
            ActionExecutor actionExecutor);
}
