package dev.trellis.testrunner.fixture;

import org.jetbrains.annotations.Nullable;

@FunctionalInterface
public interface FixtureOperation {
	@Nullable Object setUp(FixtureRequest request) throws Exception;

	default void tearDown(FixtureRequest request, @Nullable Object value) throws Exception {}
}
