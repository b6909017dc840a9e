package flowengine.statemachine;

@FunctionalInterface
public interface TransitionInterceptor {
    TransitionExecutor wrap(TransitionExecutor delegate);
}
