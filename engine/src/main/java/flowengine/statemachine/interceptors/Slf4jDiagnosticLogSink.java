package flowengine.statemachine.interceptors;

import flowengine.statemachine.RunId;

import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Slf4jDiagnosticLogSink implements DiagnosticLogSink {
    private static final Logger log = LoggerFactory.getLogger(DumpHistoryOnErrorInterceptor.class);

    @Override
    public void dump(RunId runId, List<TransitionDiagnosticRecord> history) {
        String lines = history.stream()
                .map(TransitionDiagnosticRecord::toString)
                .collect(Collectors.joining("\n"));
        log.warn("Flow {} dirtied, dumping all transitions:\n{}", runId, lines);
    }
}
