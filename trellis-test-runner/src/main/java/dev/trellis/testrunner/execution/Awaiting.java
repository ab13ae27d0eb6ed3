package dev.trellis.testrunner.execution;

import org.jetbrains.annotations.Nullable;

import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

public final class Awaiting {
	private Awaiting() { }

	public static @Nullable Object await(CompletionStage<?> stage) throws Exception {
		try {
			return stage.toCompletableFuture().get();
		}
		catch(ExecutionException e) {
			if(e.getCause() instanceof Exception e2) {
				throw e2;
			}

			if(e.getCause() instanceof Error err) {
				throw err;
			}

			throw e;
		}
	}
}
