package flowengine;

import com.fasterxml.jackson.databind.JsonNode;
import flowengine.persistence.CheckpointStorage;
import flowengine.persistence.DBCheckpointStorage;
import flowengine.persistence.Database;
import flowengine.persistence.RecordStorage;
import flowengine.serialization.JsonCodec;
import flowengine.statemachine.Flow;
import flowengine.statemachine.FlowHandle;
import flowengine.statemachine.FlowTransitions;
import flowengine.statemachine.RunId;
import flowengine.statemachine.StateMachineManager;
import flowengine.statemachine.TransitionExecutor;
import flowengine.statemachine.TransitionExecutorChain;
import flowengine.statemachine.TransitionExecutorImpl;
import flowengine.statemachine.TransitionInterceptor;
import flowengine.statemachine.interceptors.DiagnosticLogSink;
import flowengine.statemachine.interceptors.DumpHistoryOnErrorInterceptor;
import flowengine.statemachine.interceptors.PrintingInterceptor;
import flowengine.statemachine.interceptors.Slf4jDiagnosticLogSink;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FlowEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FlowEngine.class);

    private final EngineConfig config;
    private final JsonCodec codec;
    private final Database database;
    private final CheckpointStorage checkpointStorage;
    private final RecordStorage recordStorage;
    private final DumpHistoryOnErrorInterceptor diagnostics;
    private final StateMachineManager stateMachineManager;

    private FlowEngine(EngineConfig config,
                       List<? extends Flow> flows,
                       DiagnosticLogSink diagnosticLogSink,
                       List<TransitionInterceptor> interceptors) {
        this.config = Objects.requireNonNull(config, "config");
        this.codec = new JsonCodec();
        this.database = new Database(config.databasePath(), config.busyTimeoutMs());
        this.checkpointStorage = DBCheckpointStorage.create(database, codec);
        this.recordStorage = RecordStorage.create(database, codec);

        TransitionExecutor executor = new TransitionExecutorImpl(database);
        DumpHistoryOnErrorInterceptor dumpHistory = null;
        if (config.dumpHistoryOnError()) {
            dumpHistory = new DumpHistoryOnErrorInterceptor(executor, diagnosticLogSink);
            executor = dumpHistory;
        }
        List<TransitionInterceptor> chain = new ArrayList<>(interceptors);
        if (config.printTransitions()) {
            chain.add(PrintingInterceptor::new);
        }
        executor = TransitionExecutorChain.of(executor, chain);
        this.diagnostics = dumpHistory;
        this.stateMachineManager = new StateMachineManager(
                database,
                checkpointStorage,
                recordStorage,
                new FlowTransitions(flows, config.erroredRunPolicy()),
                executor,
                config.workerCount());
    }

    /**
     * Opens the engine and resumes every run found in the checkpoint store.
     *
     * @param interceptors extra interceptors, outermost first, wrapped around the built-in ones
     */
    public static FlowEngine open(EngineConfig config,
                                  List<? extends Flow> flows,
                                  DiagnosticLogSink diagnosticLogSink,
                                  List<TransitionInterceptor> interceptors) {
        FlowEngine engine = new FlowEngine(config, flows, diagnosticLogSink, interceptors);
        int restored = engine.stateMachineManager.start();
        log.info("Flow engine open on {} with {} workers, {} runs restored",
                config.databasePath(), config.workerCount(), restored);
        return engine;
    }

    public static FlowEngine open(EngineConfig config, List<? extends Flow> flows, DiagnosticLogSink diagnosticLogSink) {
        return open(config, flows, diagnosticLogSink, List.of());
    }

    public static FlowEngine open(EngineConfig config, List<? extends Flow> flows) {
        return open(config, flows, new Slf4jDiagnosticLogSink());
    }

    public static FlowEngine forSqlite(Path dbPath, Flow... flows) {
        return open(EngineConfig.defaults(dbPath), List.of(flows));
    }

    public FlowHandle startFlow(String flowName, JsonNode input) {
        return stateMachineManager.startFlow(flowName, input);
    }

    public FlowHandle startFlow(String flowName, Object input) {
        return startFlow(flowName, codec.toTree(input));
    }

    public boolean deliverExternalEvent(String eventKey, JsonNode payload) {
        return stateMachineManager.deliverExternalEvent(eventKey, payload);
    }

    public boolean killFlow(RunId id) {
        return stateMachineManager.killFlow(id);
    }

    public boolean retryFlow(RunId id) {
        return stateMachineManager.retryFlow(id);
    }

    public EngineConfig config() {
        return config;
    }

    public JsonCodec codec() {
        return codec;
    }

    public Database database() {
        return database;
    }

    public CheckpointStorage checkpointStorage() {
        return checkpointStorage;
    }

    public RecordStorage recordStorage() {
        return recordStorage;
    }

    public StateMachineManager stateMachineManager() {
        return stateMachineManager;
    }

    public Optional<DumpHistoryOnErrorInterceptor> diagnostics() {
        return Optional.ofNullable(diagnostics);
    }

    @Override
    public void close() {
        stateMachineManager.close();
    }
}
