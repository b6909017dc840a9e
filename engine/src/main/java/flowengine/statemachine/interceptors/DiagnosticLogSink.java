package flowengine.statemachine.interceptors;

import flowengine.statemachine.RunId;

import java.util.List;

@FunctionalInterface
public interface DiagnosticLogSink {
    void dump(RunId runId, List<TransitionDiagnosticRecord> history);
}
