package dev.trellis.testrunner;

import com.google.common.collect.ImmutableList;
import dev.trellis.testrunner.filter.TagExpression;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * @param workerCount number of workers, 0 for one per available processor
 * @param retries how often a failing body is re-run
 * @param seed planner seed; a random one is drawn when absent
 */
public record RunConfig(
	int workerCount,
	boolean failFast,
	int retries,
	@NotNull ImmutableList<String> namePatterns,
	@NotNull ImmutableList<TagExpression> tagExpressions,
	boolean noCache,
	boolean noParallel,
	@Nullable Long seed
) {
	public RunConfig {
		if(workerCount < 0) {
			throw new IllegalArgumentException("Worker count must not be negative: " + workerCount);
		}
		if(retries < 0) {
			throw new IllegalArgumentException("Retry count must not be negative: " + retries);
		}
	}

	public static RunConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public int effectiveWorkerCount() {
		if(noParallel) {
			return 1;
		}
		if(workerCount == 0) {
			return Runtime.getRuntime().availableProcessors();
		}
		return workerCount;
	}

	public static final class Builder {
		private Builder() {}

		private int workerCount = 0;
		private boolean failFast = false;
		private int retries = 0;
		private final List<String> namePatterns = new ArrayList<>();
		private final List<TagExpression> tagExpressions = new ArrayList<>();
		private boolean noCache = false;
		private boolean noParallel = false;
		private Long seed;

		public Builder workerCount(int workerCount) {
			this.workerCount = workerCount;
			return this;
		}

		public Builder failFast(boolean failFast) {
			this.failFast = failFast;
			return this;
		}

		public Builder retries(int retries) {
			this.retries = retries;
			return this;
		}

		public Builder namePattern(String pattern) {
			namePatterns.add(pattern);
			return this;
		}

		public Builder namePatterns(Iterable<String> patterns) {
			patterns.forEach(namePatterns::add);
			return this;
		}

		public Builder tagExpression(TagExpression expression) {
			tagExpressions.add(expression);
			return this;
		}

		public Builder tagExpressions(Iterable<TagExpression> expressions) {
			expressions.forEach(tagExpressions::add);
			return this;
		}

		public Builder noCache(boolean noCache) {
			this.noCache = noCache;
			return this;
		}

		public Builder noParallel(boolean noParallel) {
			this.noParallel = noParallel;
			return this;
		}

		public Builder seed(@Nullable Long seed) {
			this.seed = seed;
			return this;
		}

		public RunConfig build() {
			return new RunConfig(
				workerCount,
				failFast,
				retries,
				ImmutableList.copyOf(namePatterns),
				ImmutableList.copyOf(tagExpressions),
				noCache,
				noParallel,
				seed
			);
		}
	}
}
