package org.suiteflow.orchestrator.service;

import lombok.extern.slf4j.Slf4j;
import org.suiteflow.browser.BrowserSessionFactory;
import org.suiteflow.browser.PlaywrightSessionFactory;
import org.suiteflow.config.OrchestratorConfig;
import org.suiteflow.orchestrator.context.SessionAcquisitionException;
import org.suiteflow.orchestrator.context.SharedContextManager;
import org.suiteflow.orchestrator.context.SuiteRunContext;
import org.suiteflow.orchestrator.graph.DependencyCycleException;
import org.suiteflow.orchestrator.graph.DependencyGraphBuilder;
import org.suiteflow.orchestrator.graph.OrchestratorConfigurationException;
import org.suiteflow.orchestrator.model.DependencyGraph;
import org.suiteflow.orchestrator.model.OrchestratorSnapshot;
import org.suiteflow.orchestrator.model.SuiteOptions;
import org.suiteflow.orchestrator.model.SuiteRunResult;
import org.suiteflow.orchestrator.model.SuiteSummary;
import org.suiteflow.orchestrator.registry.TestRegistry;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Entry point for running a declared suite:
 * registry -> graph (fails fast on configuration errors and cycles) -> scheduler -> snapshot.
 *
 * <pre>{@code
 * TestRegistry registry = TestRegistry.of(
 *         TestDefinition.builder().name("login").priority(TestPriority.HIGHEST).body(f -> login(f.getPage())).build(),
 *         TestDefinition.builder().name("open chat").dependsOn("login").body(f -> openChat(f.getPage())).build());
 * SuiteRunResult run = new TestOrchestrator(OrchestratorConfig.suiteOptions("Chat")).run(registry);
 * }</pre>
 */
@Slf4j
public class TestOrchestrator {

    private final SuiteOptions options;
    private final BrowserSessionFactory sessionFactory;
    private final Path resultsBasePath;
    private final DependencyGraphBuilder graphBuilder = new DependencyGraphBuilder();
    private final PriorityAggregator aggregator = new PriorityAggregator();
    private final ReporterAdapter reporterAdapter = new ReporterAdapter(aggregator);

    public TestOrchestrator(SuiteOptions options) {
        this(options, new PlaywrightSessionFactory());
    }

    public TestOrchestrator(SuiteOptions options, BrowserSessionFactory sessionFactory) {
        this(options, sessionFactory, null);
    }

    /**
     * @param resultsBasePath base directory for run output, {@code null} to resolve it from
     *                        {@code TEST_RESULTS_PATH} / {@code test.results.path}
     */
    public TestOrchestrator(SuiteOptions options, BrowserSessionFactory sessionFactory, Path resultsBasePath) {
        this.options = options != null ? options : OrchestratorConfig.suiteOptions("Orchestrated Test Suite");
        this.sessionFactory = sessionFactory;
        this.resultsBasePath = resultsBasePath;
    }

    public SuiteRunResult run(TestRegistry registry) {
        return run(registry, UUID.randomUUID().toString());
    }

    /**
     * Builds the graph and runs every test once, in order.
     *
     * @throws OrchestratorConfigurationException for duplicate, blank or unknown test names
     * @throws DependencyCycleException           if the dependencies contain cycles; no test runs
     * @throws SessionAcquisitionException        if the shared session cannot be opened
     */
    public SuiteRunResult run(TestRegistry registry, String runId) {
        DependencyGraph graph = graphBuilder.buildAcyclic(registry);

        SuiteRunContext runContext = resultsBasePath != null
                ? SuiteRunContext.create(runId, resultsBasePath)
                : SuiteRunContext.create(runId);
        ExecutionStateTracker tracker = new ExecutionStateTracker(graph);
        TestScheduler scheduler = new TestScheduler(options);

        log.info("Suite \"{}\" started: runId={}, sharedPage={}, continueOnFailure={}",
                options.getSuiteName(), runId, options.isUseSharedPage(), options.isContinueOnFailure());

        boolean aborted;
        try (SharedContextManager contexts = new SharedContextManager(sessionFactory, options.isUseSharedPage())) {
            aborted = scheduler.run(graph, tracker, contexts, runContext);
        }

        OrchestratorSnapshot snapshot = reporterAdapter.snapshot(tracker);
        SuiteSummary summary = aggregator.summarize(options.getSuiteName(), graph, tracker.results(), aborted);
        logSummary(summary);

        return new SuiteRunResult(runContext, snapshot, summary);
    }

    /**
     * Snapshot of the graph alone, without running anything. Useful to report cycles.
     *
     * @throws OrchestratorConfigurationException for duplicate, blank or unknown test names
     */
    public OrchestratorSnapshot describe(TestRegistry registry) {
        return reporterAdapter.snapshot(graphBuilder.build(registry));
    }

    public SuiteOptions getOptions() {
        return options;
    }

    private void logSummary(SuiteSummary summary) {
        log.info("Test Execution Summary: \"{}\"", summary.getSuiteName());
        log.info("   Total:     {}", summary.getTotal());
        log.info("   Passed:    {}", summary.getPassed());
        log.info("   Failed:    {}", summary.getFailed());
        log.info("   Skipped:   {}", summary.getSkipped());
        if (summary.getPending() > 0) {
            log.info("   Pending:   {} (suite aborted)", summary.getPending());
        }
        log.info("   Pass Rate: {}%", String.format("%.1f", summary.getPassRate()));
    }
}
