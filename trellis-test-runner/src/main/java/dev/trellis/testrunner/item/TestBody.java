package dev.trellis.testrunner.item;

@FunctionalInterface
public interface TestBody {
	void run(TestInvocation invocation) throws Exception;
}
