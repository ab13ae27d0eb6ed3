package dev.trellis.testrunner;

import com.google.common.collect.ImmutableList;
import dev.trellis.testrunner.execution.RunResult;
import dev.trellis.testrunner.resolve.ExecutionUnit;
import org.jetbrains.annotations.NotNull;

/**
 * @param units selected units that resolved, in discovery order
 * @param resolutionErrors selected instances whose fixtures could not be resolved
 * @param deselected units excluded by name or tag filters
 */
public record CollectedUnits(
	@NotNull ImmutableList<ExecutionUnit> units,
	@NotNull ImmutableList<RunResult> resolutionErrors,
	int deselected
) {
}
