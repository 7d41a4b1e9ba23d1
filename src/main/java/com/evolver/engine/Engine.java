package com.evolver.engine;

import com.evolver.capability.Capability;
import com.evolver.capability.FailureKind;
import com.evolver.capability.Observation;
import com.evolver.config.EngineConfig;
import com.evolver.dag.ActionDAG;
import com.evolver.dag.ActionNode;
import com.evolver.dag.BuildResult;
import com.evolver.dag.NodeStatus;
import com.evolver.exception.ActionFailureException;
import com.evolver.exception.EvolverException;
import com.evolver.state.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes an {@link ActionDAG} against a {@link Capability}.
 *
 * <p>A node starts only after all of its predecessors SUCCEEDED. Ready nodes are launched
 * in node order on a bounded worker pool, at most {@link EngineConfig#maxParallelism()} of
 * one run at a time. The node timeout starts when the capability call begins; an expired
 * call is interrupted and its late result discarded. A failed or timed-out node marks its
 * descendants SKIPPED while independent branches keep running. All bookkeeping happens on the calling thread, so
 * events are recorded in a single order.
 */
public class Engine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Engine.class);

    private final EngineConfig config;
    private final Clock clock;
    private final ExecutorService workers;
    private final ScheduledExecutorService deadlines;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public Engine(EngineConfig config) {
        this(config, Clock.systemUTC());
    }

    public Engine(EngineConfig config, Clock clock) {
        this(config, clock, config.maxParallelism());
    }

    /**
     * @param workerThreads pool size; larger than the per-run parallelism when several runs
     *                      share the engine
     */
    public Engine(EngineConfig config, Clock clock, int workerThreads) {
        this.config = config;
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(workerThreads, new WorkerFactory(config.threadNamePrefix()));
        this.deadlines = Executors.newSingleThreadScheduledExecutor(
                new WorkerFactory(config.threadNamePrefix() + "deadline-"));
        log.info("Engine initialized (parallelism={}, workers={}, node timeout={}ms)",
                config.maxParallelism(), workerThreads, config.nodeTimeoutMillis());
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * Run the built DAG to completion.
     *
     * @param taskId       task id used in logs and the report
     * @param build        graph, trace and goal to run
     * @param versionId    world model version the graph was built from
     * @param initialState state the run starts from
     * @param capability   capability executing the actions
     * @return report with one result per node
     */
    public ExecutionReport execute(String taskId, BuildResult build, String versionId,
                                   WorldState initialState, Capability capability) {
        if (shutdown.get()) {
            throw new EvolverException("Engine is shut down");
        }
        Run run = new Run(taskId, build.dag(), capability);
        run.event(ExecutionEvent.run(clock.instant(), EventType.RUN_STARTED,
                build.dag().size() + " nodes for goal '" + build.goal().text() + "'"));
        run.drive();

        Map<String, NodeResult> ordered = new LinkedHashMap<>();
        long total = 0;
        for (ActionNode node : build.dag().nodes()) {
            NodeResult result = run.results.get(node.id());
            ordered.put(node.id(), result);
            total += result.durationMillis();
        }
        ExecutionStatus status = ExecutionReport.statusOf(ordered.values());
        run.event(ExecutionEvent.run(clock.instant(), EventType.RUN_COMPLETED, status.name()));

        log.debug("Task {} finished with {} ({} nodes, {}ms reported)", taskId, status, ordered.size(), total);
        return new ExecutionReport(taskId, build.goal(), versionId, initialState, build.dag(), build.trace(),
                ordered, run.events, status, total);
    }

    public void shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            workers.shutdown();
            deadlines.shutdown();
            log.debug("Engine shutdown initiated");
        }
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return workers.awaitTermination(timeout, unit);
    }

    @Override
    public void close() {
        shutdown();
        try {
            if (!workers.awaitTermination(config.nodeTimeoutMillis(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            deadlines.shutdownNow();
        }
    }

    private record Completion(String nodeId, Observation observation, Throwable error) {
    }

    /**
     * State of one execute() call.
     */
    private final class Run {
        private final String taskId;
        private final ActionDAG dag;
        private final Capability capability;
        private final Map<String, NodeStatus> statuses = new HashMap<>();
        private final Map<String, NodeResult> results = new HashMap<>();
        private final List<ExecutionEvent> events = new ArrayList<>();
        private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
        private int running;

        Run(String taskId, ActionDAG dag, Capability capability) {
            this.taskId = taskId;
            this.dag = dag;
            this.capability = capability;
            for (ActionNode node : dag.nodes()) {
                statuses.put(node.id(), NodeStatus.PENDING);
            }
        }

        void drive() {
            launchReady();
            while (running > 0) {
                Completion completion;
                try {
                    completion = completions.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new EvolverException("Interrupted while executing task " + taskId, e);
                }
                running--;
                complete(completion);
                launchReady();
            }
            // Unreachable nodes can only remain if a predecessor never succeeded
            for (ActionNode node : dag.nodes()) {
                if (statuses.get(node.id()) == NodeStatus.PENDING) {
                    skip(node, "predecessor did not succeed");
                }
            }
        }

        private void launchReady() {
            for (ActionNode node : dag.nodes()) {
                if (running >= config.maxParallelism()) {
                    return;
                }
                if (statuses.get(node.id()) == NodeStatus.PENDING && predecessorsSucceeded(node)) {
                    launch(node);
                }
            }
        }

        private boolean predecessorsSucceeded(ActionNode node) {
            for (String pred : node.predecessors()) {
                if (statuses.get(pred) != NodeStatus.SUCCEEDED) {
                    return false;
                }
            }
            return true;
        }

        private void launch(ActionNode node) {
            statuses.put(node.id(), NodeStatus.RUNNING);
            running++;
            event(new ExecutionEvent(clock.instant(), EventType.NODE_STARTED, node.id(), node.actionName(), null));
            log.debug("Task {} starting node {} ({})", taskId, node.id(), node.actionName());
            workers.execute(new NodeCall(node));
        }

        private void complete(Completion completion) {
            ActionNode node = dag.node(completion.nodeId());
            if (completion.error() == null) {
                Observation observation = completion.observation();
                statuses.put(node.id(), NodeStatus.SUCCEEDED);
                results.put(node.id(), NodeResult.succeeded(node.id(), node.actionName(),
                        observation.durationMillis(), observation.payload()));
                event(new ExecutionEvent(clock.instant(), EventType.NODE_SUCCEEDED, node.id(), node.actionName(), null));
                return;
            }

            NodeResult failed = toFailure(node, completion.error());
            statuses.put(node.id(), NodeStatus.FAILED);
            results.put(node.id(), failed);
            event(new ExecutionEvent(clock.instant(), EventType.NODE_FAILED, node.id(), node.actionName(),
                    failed.failureKind() + ": " + failed.reason()));
            log.debug("Task {} node {} ({}) failed: {} {}", taskId, node.id(), node.actionName(),
                    failed.failureKind(), failed.reason());

            for (String descendant : dag.descendants(node.id())) {
                if (statuses.get(descendant) == NodeStatus.PENDING) {
                    skip(dag.node(descendant), "depends on failed node " + node.id());
                }
            }
        }

        private NodeResult toFailure(ActionNode node, Throwable error) {
            if (error instanceof ActionFailureException failure) {
                return NodeResult.failed(node.id(), node.actionName(), failure.getKind(),
                        failure.getSubject().orElse(null), failure.getExpected().orElse(null), failure.getMessage());
            }
            if (error instanceof TimeoutException) {
                log.warn("Task {} node {} ({}) timed out after {}ms", taskId, node.id(), node.actionName(),
                        config.nodeTimeoutMillis());
                return NodeResult.failed(node.id(), node.actionName(), FailureKind.TIMEOUT, null, null,
                        "timed out after " + config.nodeTimeoutMillis() + "ms");
            }
            log.warn("Task {} node {} ({}) raised {}", taskId, node.id(), node.actionName(), error.toString());
            return NodeResult.failed(node.id(), node.actionName(), FailureKind.ERROR, null, null, String.valueOf(error));
        }

        private void skip(ActionNode node, String reason) {
            statuses.put(node.id(), NodeStatus.SKIPPED);
            results.put(node.id(), NodeResult.skipped(node.id(), node.actionName(), reason));
            event(new ExecutionEvent(clock.instant(), EventType.NODE_SKIPPED, node.id(), node.actionName(), reason));
        }

        void event(ExecutionEvent event) {
            events.add(event);
        }

        /**
         * One capability call on a worker. Whichever of the call and its deadline ends first
         * reports the node; an expiring deadline also interrupts the worker.
         */
        private final class NodeCall implements Runnable {
            private final ActionNode node;
            private Thread worker;
            private boolean reported;

            NodeCall(ActionNode node) {
                this.node = node;
            }

            @Override
            public void run() {
                synchronized (this) {
                    worker = Thread.currentThread();
                }
                ScheduledFuture<?> deadline = null;
                try {
                    deadline = deadlines.schedule(this::expire, config.nodeTimeoutMillis(), TimeUnit.MILLISECONDS);
                    report(new Completion(node.id(), capability.execute(node.action()), null));
                } catch (RuntimeException | Error e) {
                    report(new Completion(node.id(), null, e));
                } finally {
                    if (deadline != null) {
                        deadline.cancel(false);
                    }
                    synchronized (this) {
                        reported = true;
                        worker = null;
                    }
                    // expire() interrupts under the lock, so its interrupt is visible here
                    Thread.interrupted();
                }
            }

            private synchronized void expire() {
                if (reported) {
                    return;
                }
                reported = true;
                completions.add(new Completion(node.id(), null,
                        new TimeoutException("timed out after " + config.nodeTimeoutMillis() + "ms")));
                worker.interrupt();
            }

            private synchronized void report(Completion completion) {
                if (!reported) {
                    reported = true;
                    completions.add(completion);
                } else {
                    log.debug("Task {} node {} ({}) answered after its deadline, result discarded",
                            taskId, node.id(), node.actionName());
                }
            }
        }
    }

    /**
     * Names engine threads {@code <prefix><n>}.
     */
    private static final class WorkerFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        WorkerFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
