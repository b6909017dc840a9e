package flowengine.statemachine;

import java.util.List;
import java.util.Objects;

public final class TransitionExecutorChain {
    private TransitionExecutorChain() {
    }

    /**
     * Composes {@code interceptors} around {@code core}. The first interceptor is the outermost
     * one, so it sees every transition first and the final outcome last.
     */
    public static TransitionExecutor of(TransitionExecutor core, List<TransitionInterceptor> interceptors) {
        Objects.requireNonNull(core, "core");
        TransitionExecutor executor = core;
        for (int i = interceptors.size() - 1; i >= 0; i--) {
            executor = Objects.requireNonNull(interceptors.get(i).wrap(executor), "interceptor returned null");
        }
        return executor;
    }
}
