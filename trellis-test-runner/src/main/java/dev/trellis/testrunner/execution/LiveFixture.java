package dev.trellis.testrunner.execution;

import dev.trellis.testrunner.fixture.FixtureRequest;
import dev.trellis.testrunner.resolve.PlannedFixture;
import org.jetbrains.annotations.Nullable;

record LiveFixture(PlannedFixture fixture, FixtureRequest request, @Nullable Object value) {
	String name() {
		return fixture.name();
	}
}
