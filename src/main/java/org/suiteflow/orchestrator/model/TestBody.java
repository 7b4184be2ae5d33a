package org.suiteflow.orchestrator.model;

/**
 * Executable logic of an orchestrated test. Returning normally means the test passed,
 * any thrown exception or assertion error means it failed.
 */
@FunctionalInterface
public interface TestBody {

    void execute(TestFixtures fixtures) throws Exception;
}
