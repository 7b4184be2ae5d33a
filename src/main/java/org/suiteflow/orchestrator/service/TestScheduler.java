package org.suiteflow.orchestrator.service;

import lombok.extern.slf4j.Slf4j;
import org.suiteflow.hooks.TakeScreenshots;
import org.suiteflow.orchestrator.context.SessionAcquisitionException;
import org.suiteflow.orchestrator.context.SessionLease;
import org.suiteflow.orchestrator.context.SharedContextManager;
import org.suiteflow.orchestrator.context.SuiteRunContext;
import org.suiteflow.orchestrator.graph.DependencyCycleException;
import org.suiteflow.orchestrator.model.DependencyGraph;
import org.suiteflow.orchestrator.model.DependencyNode;
import org.suiteflow.orchestrator.model.ExecutionResult;
import org.suiteflow.orchestrator.model.NodeStatus;
import org.suiteflow.orchestrator.model.SuiteOptions;
import org.suiteflow.orchestrator.model.TestDefinition;
import org.suiteflow.orchestrator.model.TestFixtures;
import org.suiteflow.orchestrator.model.TestOutcome;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Walks the execution order one test at a time.
 *
 * <p>For every test: a required dependency that did not pass turns the test into a skip naming
 * the failed ancestor; otherwise the body runs with the session from the
 * {@link SharedContextManager} and its outcome is recorded. Since the order is topological,
 * every dependency has a final status by the time its dependents are checked, which makes skips
 * transitive without a separate propagation pass.</p>
 *
 * <p>With continue-on-failure disabled the walk stops after the first failure and the remaining
 * tests stay {@code pending}.</p>
 */
@Slf4j
public class TestScheduler {

    /** How long a timed-out body gets to react to its interrupt. */
    static final Duration STOP_GRACE = Duration.ofMillis(500);

    private final SuiteOptions options;
    private final SuiteLogger out;

    public TestScheduler(SuiteOptions options) {
        this.options = options;
        this.out = new SuiteLogger(log, options.getLogLevel());
    }

    /**
     * Runs the suite.
     *
     * @return {@code true} if the run was aborted after a failure
     * @throws DependencyCycleException    if the graph has cycles, before any body runs
     * @throws SessionAcquisitionException if the shared session cannot be opened
     */
    public boolean run(DependencyGraph graph,
                       ExecutionStateTracker tracker,
                       SharedContextManager contexts,
                       SuiteRunContext runContext) {
        if (graph.hasCycles()) {
            throw new DependencyCycleException(graph);
        }
        if (!options.isSequential()) {
            log.warn("Parallel execution is not supported for orchestrated suites, running \"{}\" sequentially",
                    options.getSuiteName());
        }

        out.detailed("Starting orchestrated test suite: \"{}\"", options.getSuiteName());
        out.detailed("Suite contains {} tests with conditional execution", graph.size());

        for (String testName : graph.getExecutionOrder()) {
            DependencyNode node = graph.getNode(testName);

            Optional<TestOutcome> skip = checkDependencies(node, tracker);
            if (skip.isPresent()) {
                out.minimal("Skipping test \"{}\": {}", testName, skip.get().getReason());
                tracker.conclude(testName, skip.get(), 0, null);
                continue;
            }

            ExecutionResult result = execute(node, tracker, contexts, runContext);
            if (result.getStatus() == NodeStatus.FAILED && !options.isContinueOnFailure()) {
                log.warn("Test \"{}\" failed and continueOnFailure is disabled, aborting suite; "
                        + "{} test(s) left pending", testName, tracker.pendingTests().size());
                return true;
            }
        }
        return false;
    }

    /**
     * Empty when the test may run, otherwise the skip outcome.
     */
    Optional<TestOutcome> checkDependencies(DependencyNode node, ExecutionStateTracker tracker) {
        if (node.hasDependencies()) {
            out.verbose("Dependencies for \"{}\": [{}]", node.getTestName(), String.join(", ", node.getDependencies()));
        }

        for (String dependency : node.getDependencies()) {
            NodeStatus status = tracker.statusOf(dependency);
            if (!status.isTerminal()) {
                throw new IllegalStateException("Dependency \"" + dependency + "\" of \"" + node.getTestName()
                        + "\" has not concluded (" + status.getValue() + "), execution order is not topological");
            }
        }

        if (node.isRunRegardless()) {
            out.verbose("Test \"{}\" set to run regardless of dependencies", node.getTestName());
            return Optional.empty();
        }

        for (String dependency : node.getRequiredDependencies()) {
            if (tracker.statusOf(dependency) != NodeStatus.PASSED) {
                return Optional.of(TestOutcome.dependencySkip(tracker.rootCauseOf(dependency)));
            }
        }
        return Optional.empty();
    }

    private ExecutionResult execute(DependencyNode node,
                                    ExecutionStateTracker tracker,
                                    SharedContextManager contexts,
                                    SuiteRunContext runContext) {
        String testName = node.getTestName();

        SessionLease lease;
        try {
            lease = contexts.acquire(testName);
        } catch (SessionAcquisitionException e) {
            if (contexts.isShared()) {
                log.error("Shared browser session could not be opened, suite \"{}\" cannot run",
                        options.getSuiteName(), e);
                throw e;
            }
            tracker.markRunning(testName);
            out.minimal("Test \"{}\" failed: {}", testName, e.getMessage());
            return tracker.conclude(testName, TestOutcome.failed(e.getMessage()), 0, null);
        }

        try (lease) {
            tracker.markRunning(testName);
            out.detailed("Executing orchestrated test: \"{}\"", testName);

            TestFixtures fixtures = new TestFixtures(testName, lease.getSession(), runContext, lease.isShared());
            long start = System.nanoTime();
            TestOutcome outcome = invokeBody(node.getDefinition(), fixtures);
            long duration = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            String screenshotPath = null;
            if (outcome.getKind() == TestOutcome.Kind.FAILED) {
                out.minimal("Test \"{}\" failed ({}ms): {}", testName, duration, outcome.getError());
                screenshotPath = TakeScreenshots
                        .captureScreenshot(lease.getSession(), testName, runContext.getScreenshotsDir())
                        .map(Path::toString)
                        .orElse(null);
            } else {
                out.minimal("Test \"{}\" passed ({}ms)", testName, duration);
            }
            return tracker.conclude(testName, outcome, duration, screenshotPath);
        }
    }

    private TestOutcome invokeBody(TestDefinition definition, TestFixtures fixtures) {
        Duration timeout = definition.getTimeout();
        if (timeout != null) {
            return invokeWithTimeout(definition, fixtures, timeout);
        }
        try {
            definition.getBody().execute(fixtures);
            return TestOutcome.passed();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TestOutcome.failed(describe(e));
        } catch (Throwable e) {
            // Errors like StackOverflowError fail the test, they do not end the suite
            return TestOutcome.failed(describe(e));
        }
    }

    /**
     * Runs the body on its own daemon thread. Every call gets a fresh executor, so a body that
     * ignores the interrupt after its timeout cannot hold up the next test.
     */
    private TestOutcome invokeWithTimeout(TestDefinition definition, TestFixtures fixtures, Duration timeout) {
        String testName = fixtures.getTestName();
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("orchestrated-test-" + testName);
            t.setDaemon(true);
            return t;
        });
        Future<?> future = executor.submit(() -> {
            definition.getBody().execute(fixtures);
            return null;
        });
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return TestOutcome.passed();
        } catch (TimeoutException e) {
            future.cancel(true);
            awaitStop(executor, testName);
            return TestOutcome.failed("Test timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            return TestOutcome.failed(describe(e.getCause()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return TestOutcome.failed("Interrupted while waiting for test \"" + testName + "\"");
        } finally {
            executor.shutdownNow();
        }
    }

    private void awaitStop(ExecutorService executor, String testName) {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Body of timed-out test \"{}\" ignored the interrupt and is still running; "
                        + "later tests may see its effects on the shared page", testName);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static String describe(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getName();
        }
        return message;
    }
}
