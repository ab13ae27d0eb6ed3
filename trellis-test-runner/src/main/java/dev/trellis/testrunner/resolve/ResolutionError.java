package dev.trellis.testrunner.resolve;

import com.google.common.collect.ImmutableList;
import dev.trellis.testrunner.fixture.FixtureScope;
import org.jetbrains.annotations.NotNull;

/**
 * Why a test instance could not be given a fixture plan. Every variant carries the
 * dependency chain starting at the test instance, for the diagnostics renderer.
 */
public sealed interface ResolutionError permits ResolutionError.MissingFixture, ResolutionError.CyclicDependency, ResolutionError.ScopeConflict {
	@NotNull ImmutableList<String> chain();

	// The chain ends with the name that could not be resolved.
	record MissingFixture(@NotNull ImmutableList<String> chain) implements ResolutionError {
		public String missingName() {
			return chain.get(chain.size() - 1);
		}

		@Override
		public String toString() {
			return "Fixture " + missingName() + " not found (" + String.join(" -> ", chain) + ")";
		}
	}

	// The chain ends with the first fixture that was reached twice.
	record CyclicDependency(@NotNull ImmutableList<String> chain) implements ResolutionError {
		@Override
		public String toString() {
			return "Cyclic fixture dependency (" + String.join(" -> ", chain) + ")";
		}
	}

	record ScopeConflict(
		@NotNull ImmutableList<String> chain,
		@NotNull String fixture,
		@NotNull FixtureScope fixtureScope,
		@NotNull String dependency,
		@NotNull FixtureScope dependencyScope
	) implements ResolutionError {
		@Override
		public String toString() {
			return "Fixture " + fixture + " with scope " + fixtureScope.scopeId() +
				" requests " + dependency + " with narrower scope " + dependencyScope.scopeId() +
				" (" + String.join(" -> ", chain) + ")";
		}
	}
}
