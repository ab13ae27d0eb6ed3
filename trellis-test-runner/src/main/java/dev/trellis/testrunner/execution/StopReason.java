package dev.trellis.testrunner.execution;

public enum StopReason {
	FAIL_FAST,
	INTERRUPTED,
}
