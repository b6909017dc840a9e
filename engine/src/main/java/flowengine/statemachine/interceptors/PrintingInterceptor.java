package flowengine.statemachine.interceptors;

import flowengine.statemachine.ActionExecutor;
import flowengine.statemachine.Event;
import flowengine.statemachine.FlowFiber;
import flowengine.statemachine.StateMachineState;
import flowengine.statemachine.TransitionExecutor;
import flowengine.statemachine.TransitionOutcome;
import flowengine.statemachine.TransitionResult;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class PrintingInterceptor implements TransitionExecutor {
    private static final Logger log = LoggerFactory.getLogger(PrintingInterceptor.class);

    private final TransitionExecutor delegate;

    public PrintingInterceptor(TransitionExecutor delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public TransitionOutcome executeTransition(
            FlowFiber fiber,
            StateMachineState previousState,
            Event event,
            TransitionResult transition,
            ActionExecutor actionExecutor) {
        TransitionOutcome outcome = delegate.executeTransition(fiber, previousState, event, transition, actionExecutor);
        if (log.isDebugEnabled()) {
            log.debug("Flow {} {} -> {} ({}) via {}",
                    fiber.id(), previousState.summary(), outcome.nextState().summary(),
                    outcome.continuation(), event);
        }
        return outcome;
    }
}
