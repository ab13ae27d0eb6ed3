package dev.trellis.testrunner.execution;

import dev.trellis.testrunner.plan.WorkerQueue;

import java.util.List;

/**
 * Receives results as units finish. All calls come from the coordinating thread.
 */
public interface ResultListener {
	default void runStarted(List<WorkerQueue> queues, long seed) {}
	default void unitFinished(RunResult result) {}
	default void runFinished(RunReport report) {}

	ResultListener NONE = new ResultListener() {};
}
