package dev.trellis.testrunner.item;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown from a test body (or a fixture setup) to skip the test at runtime.
 */
public class TestSkippedException extends Exception {
	public TestSkippedException(@Nullable String reason) {
		super(reason);
		this.reason = reason;
	}

	private final @Nullable String reason;

	public @Nullable String getReason() {
		return reason;
	}
}
