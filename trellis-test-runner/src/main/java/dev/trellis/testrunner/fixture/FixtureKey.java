package dev.trellis.testrunner.fixture;

import org.jetbrains.annotations.NotNull;

public record FixtureKey(@NotNull ScopeNode declaredIn, @NotNull String name) {
	@Override
	public String toString() {
		return name + "@" + declaredIn;
	}
}
