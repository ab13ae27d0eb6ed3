package dev.trellis.testrunner.item;

import dev.trellis.testrunner.execution.Awaiting;

import java.util.concurrent.CompletionStage;

@FunctionalInterface
public interface AsyncTestBody extends TestBody {
	CompletionStage<?> runAsync(TestInvocation invocation);

	@Override
	default void run(TestInvocation invocation) throws Exception {
		Awaiting.await(runAsync(invocation));
	}
}
