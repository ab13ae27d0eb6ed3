package dev.trellis.testrunner.execution;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import dev.trellis.testrunner.resolve.ExecutionUnit;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.EnumMap;

/**
 * @param results one result per unit that finished, in discovery order
 * @param notRun units that were never started because the run was stopped
 * @param shutdownFailures teardown failures of shared fixtures torn down when a worker stopped
 * @param deselected number of units excluded by name or tag filters
 */
public record RunReport(
	@NotNull ImmutableList<RunResult> results,
	@NotNull ImmutableList<ExecutionUnit> notRun,
	@NotNull ImmutableList<FailureDetail> shutdownFailures,
	int deselected,
	@Nullable StopReason stopReason,
	long seed,
	@NotNull Duration elapsed
) {
	public static RunReport empty(long seed) {
		return new RunReport(ImmutableList.of(), ImmutableList.of(), ImmutableList.of(), 0, null, seed, Duration.ZERO);
	}

	public RunReport withDeselected(int deselected) {
		return new RunReport(results, notRun, shutdownFailures, deselected, stopReason, seed, elapsed);
	}

	public ImmutableMap<Outcome, Integer> counts() {
		var counts = new EnumMap<Outcome, Integer>(Outcome.class);
		for(var outcome : Outcome.values()) {
			counts.put(outcome, 0);
		}
		for(var result : results) {
			counts.merge(result.outcome(), 1, Integer::sum);
		}
		return ImmutableMap.copyOf(counts);
	}

	public int count(Outcome outcome) {
		return (int)results.stream().filter(result -> result.outcome() == outcome).count();
	}

	public boolean isCancelled() {
		return stopReason != null;
	}

	public boolean isSuccessful() {
		return shutdownFailures.isEmpty() && results.stream().allMatch(RunResult::isSuccessful);
	}

	public ExitStatus exitStatus() {
		if(stopReason != null && !notRun.isEmpty()) {
			return ExitStatus.ABORTED;
		}

		if(!isSuccessful()) {
			return ExitStatus.FAILURE;
		}

		return ExitStatus.SUCCESS;
	}
}
