package dev.trellis.testrunner.execution;

import com.google.common.collect.ImmutableList;
import dev.trellis.testrunner.item.TestIdentity;
import dev.trellis.testrunner.item.TestInstance;
import dev.trellis.testrunner.resolve.ExecutionUnit;
import dev.trellis.testrunner.resolve.ResolutionError;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;

/**
 * The final outcome of one unit.
 *
 * @param ordinal discovery position, used to order the report
 * @param workerId the worker that ran the unit, or {@link #NO_WORKER} when it never reached one
 * @param failure why the unit did not pass; also set for an unexpected pass
 * @param teardownFailures teardown errors of fixtures released by this unit
 * @param cancelled a stop signal arrived while the unit was running
 */
public record RunResult(
	int ordinal,
	@NotNull String unitId,
	@NotNull TestIdentity identity,
	@NotNull Outcome outcome,
	@NotNull Duration elapsed,
	int retries,
	@Nullable FailureDetail failure,
	@NotNull ImmutableList<FailureDetail> teardownFailures,
	@Nullable String skipReason,
	boolean cancelled,
	int workerId
) {
	public static final int NO_WORKER = -1;

	public static RunResult resolutionError(int ordinal, TestInstance instance, ResolutionError error) {
		return new RunResult(
			ordinal,
			instance.displayName(),
			instance.identity(),
			Outcome.ERROR,
			Duration.ZERO,
			0,
			FailureDetail.resolution(error),
			ImmutableList.of(),
			null,
			false,
			NO_WORKER
		);
	}

	public static RunResult infrastructureError(ExecutionUnit unit, int workerId, Throwable cause) {
		return new RunResult(
			unit.ordinal(),
			unit.id(),
			unit.identity(),
			Outcome.ERROR,
			Duration.ZERO,
			0,
			FailureDetail.infrastructure("Worker " + workerId + " crashed: " + FailureDetail.describe(cause), cause),
			ImmutableList.of(),
			null,
			false,
			workerId
		);
	}

	public boolean isSuccessful() {
		return outcome.isSuccessful();
	}
}
