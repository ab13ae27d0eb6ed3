package dev.trellis.testrunner.plan;

import com.google.common.collect.ImmutableList;
import dev.trellis.testrunner.resolve.ExecutionUnit;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;

public record WorkerQueue(
	int workerId,
	@NotNull ImmutableList<ExecutionUnit> units,
	@NotNull Duration estimatedCost
) {
	public boolean isEmpty() {
		return units.isEmpty();
	}

	public int size() {
		return units.size();
	}
}
