package dev.trellis.testrunner.execution;

import com.google.common.collect.ImmutableList;
import dev.trellis.testrunner.resolve.ExecutionUnit;

sealed interface WorkerEvent permits WorkerEvent.UnitFinished, WorkerEvent.WorkerStopped, WorkerEvent.WorkerCrashed {
	int workerId();

	record UnitFinished(int workerId, RunResult result) implements WorkerEvent {}

	// notStarted is non-empty only when the run was stopped.
	record WorkerStopped(
		int workerId,
		ImmutableList<ExecutionUnit> notStarted,
		ImmutableList<FailureDetail> shutdownFailures
	) implements WorkerEvent {}

	// unfinished includes the unit that was running when the worker died.
	record WorkerCrashed(
		int workerId,
		Throwable cause,
		ImmutableList<ExecutionUnit> unfinished,
		ImmutableList<FailureDetail> shutdownFailures
	) implements WorkerEvent {}
}
