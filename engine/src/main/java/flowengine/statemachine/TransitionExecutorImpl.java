package flowengine.statemachine;

import flowengine.persistence.Database;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Innermost executor: runs every action of a transition in one transaction. Any failure rolls the
 * transaction back and propagates, leaving the previous state in force. Transitions whose actions
 * do not touch storage run without one.
 */
public final class TransitionExecutorImpl implements TransitionExecutor {
    private static final Logger log = LoggerFactory.getLogger(TransitionExecutorImpl.class);

    private final Database database;

    public TransitionExecutorImpl(Database database) {
        this.database = Objects.requireNonNull(database, "database");
    }

    @Override
    public TransitionOutcome executeTransition(
            FlowFiber fiber,
            StateMachineState previousState,
            Event event,
            TransitionResult transition,
            ActionExecutor actionExecutor) {
        List<Action> actions = transition.actions();
        if (!actions.isEmpty()) {
            try {
                if (actions.stream().anyMatch(Action::transactional)) {
                    database.transaction(tx -> {
                        for (Action action : actions) {
                            actionExecutor.executeAction(fiber, action, tx);
                        }
                        return null;
                    });
                } else {
                    for (Action action : actions) {
                        actionExecutor.executeAction(fiber, action, null);
                    }
                }
            } catch (RuntimeException e) {
                log.warn("Flow {} failed executing actions for {}: {}", fiber.id(), event, e.toString());
                throw e;
            }
        }
        return new TransitionOutcome(transition.continuation(), transition.newState());
    }
}
