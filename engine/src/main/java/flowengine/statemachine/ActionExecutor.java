package flowengine.statemachine;

import flowengine.persistence.DatabaseTransaction;

@FunctionalInterface
public interface ActionExecutor {
    /**
     * @param transaction the transition's transaction, {@code null} when none of its actions is
     *                    {@link Action#transactional() transactional}
     */
    void executeAction(FlowFiber fiber, Action action, DatabaseTransaction transaction);
}
