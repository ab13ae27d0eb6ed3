package dev.trellis.testrunner.fixture;

import dev.trellis.testrunner.execution.Awaiting;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

public interface AsyncFixtureOperation extends FixtureOperation {
	CompletionStage<?> setUpAsync(FixtureRequest request);

	default CompletionStage<?> tearDownAsync(FixtureRequest request, @Nullable Object value) {
		return CompletableFuture.completedFuture(null);
	}

	@Override
	default @Nullable Object setUp(FixtureRequest request) throws Exception {
		return Awaiting.await(setUpAsync(request));
	}

	@Override
	default void tearDown(FixtureRequest request, @Nullable Object value) throws Exception {
		Awaiting.await(tearDownAsync(request, value));
	}
}
