package flowengine.statemachine;

import com.fasterxml.jackson.databind.JsonNode;
import flowengine.persistence.CheckpointStorage;
import flowengine.persistence.Database;
import flowengine.persistence.RecordStorage;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schedules runs onto a fixed worker pool. Each run has a mailbox of events and is drained by at
 * most one worker at a time; a suspended run holds no worker until an event arrives for it.
 */
public final class StateMachineManager implements FlowScheduler, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StateMachineManager.class);

    private final Database database;
    private final CheckpointStorage checkpointStorage;
    private final FlowTransitions transitions;
    private final TransitionExecutor transitionExecutor;
    private final ActionExecutor actionExecutor;
    private final ExecutorService workers;
    private final ConcurrentHashMap<RunId, FlowRunner> runners = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RunId> parkedOnEvent = new ConcurrentHashMap<>();

    public StateMachineManager(Database database,
                               CheckpointStorage checkpointStorage,
                               RecordStorage recordStorage,
                               FlowTransitions transitions,
                               TransitionExecutor transitionExecutor,
                               int workerCount) {
        this.database = Objects.requireNonNull(database, "database");
        this.checkpointStorage = Objects.requireNonNull(checkpointStorage, "checkpointStorage");
        this.transitions = Objects.requireNonNull(transitions, "transitions");
        this.transitionExecutor = Objects.requireNonNull(transitionExecutor, "transitionExecutor");
        this.actionExecutor = new ActionExecutorImpl(checkpointStorage, recordStorage, this);
        this.workers = Executors.newFixedThreadPool(workerCount, new WorkerThreadFactory());
    }

    /**
     * Reloads every run from its checkpoint and resumes it.
     *
     * @return the number of runs restored
     */
    public int start() {
        List<Map.Entry<RunId, Checkpoint>> checkpoints = database.transaction(tx -> {
            try (Stream<Map.Entry<RunId, Checkpoint>> all = checkpointStorage.getAllCheckpoints(tx)) {
                return all.collect(Collectors.toList());
            }
        });
        for (Map.Entry<RunId, Checkpoint> entry : checkpoints) {
            FlowRunner runner = new FlowRunner(entry.getKey(), StateMachineState.of(entry.getValue()));
            if (runners.putIfAbsent(runner.id(), runner) == null) {
                runner.deliver(Event.RESTORED);
            }
        }
        log.info("Restored {} flows from checkpoints", checkpoints.size());
        return checkpoints.size();
    }

    public FlowHandle startFlow(String flowName, JsonNode input) {
        if (!transitions.knows(flowName)) {
            throw new IllegalArgumentException("No flow registered as " + flowName);
        }
        RunId id = RunId.createRandom();
        FlowRunner runner = new FlowRunner(id, StateMachineState.of(Checkpoint.create(flowName, input)));
        runners.put(id, runner);
        log.info("Starting flow {} as {}", flowName, id);
        runner.deliver(new Event.Start(input));
        return new FlowHandle(id, runner.result);
    }

    /**
     * @return {@code false} if no run is parked on {@code eventKey}
     */
    public boolean deliverExternalEvent(String eventKey, JsonNode payload) {
        RunId id = parkedOnEvent.remove(eventKey);
        if (id == null) {
            return false;
        }
        FlowRunner runner = runners.get(id);
        if (runner == null) {
            return false;
        }
        runner.deliver(new Event.ExternalEventReceived(eventKey, payload));
        return true;
    }

    public boolean killFlow(RunId id) {
        return deliverTo(id, Event.KILL);
    }

    public boolean retryFlow(RunId id) {
        return deliverTo(id, Event.RETRY_FROM_CHECKPOINT);
    }

    /**
     * @return the result of an active run, or a failed future if no such run is active
     */
    public CompletableFuture<JsonNode> resultFuture(RunId id) {
        FlowRunner runner = runners.get(id);
        if (runner == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("No active flow " + id));
        }
        return runner.result;
    }

    public Optional<StateMachineState> currentState(RunId id) {
        FlowRunner runner = runners.get(id);
        return runner == null ? Optional.empty() : Optional.of(runner.state);
    }

    public Set<RunId> activeRuns() {
        return Set.copyOf(runners.keySet());
    }

    public Set<String> parkedEventKeys() {
        return Set.copyOf(parkedOnEvent.keySet());
    }

    @Override
    public void parkOnExternalEvent(RunId id, String eventKey) {
        RunId existing = parkedOnEvent.putIfAbsent(eventKey, id);
        if (existing != null && !existing.equals(id)) {
            log.warn("Flow {} wants event {} which flow {} is already waiting for", id, eventKey, existing);
        }
    }

    @Override
    public void parkOnRecord(RunId id, String recordKey, CompletableFuture<JsonNode> record) {
        FlowRunner runner = runners.get(id);
        if (runner == null) {
            record.cancel(false);
            return;
        }
        runner.replacePendingRecord(record);
        record.thenAccept(value -> runner.deliver(new Event.RecordAvailable(recordKey, value)));
    }

    @Override
    public void deliver(RunId id, Event event) {
        if (!deliverTo(id, event)) {
            log.debug("Dropping {} for unknown flow {}", event, id);
        }
    }

    @Override
    public void flowFinished(RunId id, JsonNode result, FlowError error) {
        FlowRunner runner = runners.get(id);
        if (runner == null) {
            log.debug("Result for unknown flow {} dropped", id);
            return;
        }
        if (error == null) {
            runner.result.complete(result);
        } else {
            runner.result.completeExceptionally(new FlowKilledException(error));
        }
    }

    private boolean deliverTo(RunId id, Event event) {
        FlowRunner runner = runners.get(id);
        if (runner == null) {
            return false;
        }
        runner.deliver(event);
        return true;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Flow workers did not stop within 10s, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private final class FlowRunner implements FlowFiber {
        private final RunId id;
        private final ConcurrentLinkedQueue<Event> mailbox = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean scheduled = new AtomicBoolean(false);
        private final CompletableFuture<JsonNode> result = new CompletableFuture<>();
        private volatile StateMachineState state;
        private volatile CompletableFuture<JsonNode> pendingRecord;

        private FlowRunner(RunId id, StateMachineState state) {
            this.id = id;
            this.state = state;
        }

        @Override
        public RunId id() {
            return id;
        }

        void deliver(Event event) {
            mailbox.add(event);
            schedule();
        }

        void replacePendingRecord(CompletableFuture<JsonNode> record) {
            CompletableFuture<JsonNode> previous = pendingRecord;
            pendingRecord = record;
            if (previous != null && previous != record) {
                previous.cancel(false);
            }
        }

        private void schedule() {
            if (!scheduled.compareAndSet(false, true)) {
                return;
            }
            try {
                workers.execute(this::drain);
            } catch (RejectedExecutionException e) {
                scheduled.set(false);
                log.warn("Flow {} has {} pending events but the workers are shut down", id, mailbox.size());
            }
        }

        private void drain() {
            try {
                Event event;
                while ((event = mailbox.poll()) != null) {
                    process(event);
                }
            } finally {
                scheduled.set(false);
                if (!mailbox.isEmpty()) {
                    schedule();
                }
            }
        }

        private void process(Event event) {
            StateMachineState previous = state;
            TransitionOutcome outcome;
            try {
                TransitionResult transition = transitions.transition(id, previous, event);
                outcome = transitionExecutor.executeTransition(this, previous, event, transition, actionExecutor);
            } catch (RuntimeException e) {
                if (event instanceof Event.Error) {
                    log.error("Flow {} could not handle its own error event, leaving it in place", id, e);
                } else {
                    mailbox.add(new Event.Error(FlowError.from(e)));
                }
                return;
            }
            state = outcome.nextState();
            FlowContinuation continuation = outcome.continuation();
            if (continuation instanceof FlowContinuation.Continue) {
                mailbox.add(Event.PROCEED);
            } else if (continuation instanceof FlowContinuation.Remove) {
                runners.remove(id, this);
                parkedOnEvent.values().removeIf(id::equals);
                replacePendingRecord(null);
                log.info("Flow {} removed", id);
            } else if (continuation instanceof FlowContinuation.Suspend suspend) {
                log.debug("Flow {} suspended: {}", id, suspend.reason());
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "flow-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
