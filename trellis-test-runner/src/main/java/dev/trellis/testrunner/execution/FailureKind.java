package dev.trellis.testrunner.execution;

public enum FailureKind {
	RESOLUTION,
	SETUP,
	BODY,
	TEARDOWN,
	INFRASTRUCTURE,
}
