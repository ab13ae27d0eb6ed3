package dev.trellis.testrunner.execution;

public enum Outcome {
	PASSED("passed"),
	FAILED("failed"),
	ERROR("error"),
	SKIPPED("skipped"),
	EXPECTED_FAILURE("xfailed"),
	UNEXPECTED_PASS("xpassed"),
	;

	Outcome(String id) {
		this.id = id;
	}

	private final String id;

	public String outcomeId() {
		return id;
	}

	public boolean isSuccessful() {
		return this == PASSED || this == SKIPPED || this == EXPECTED_FAILURE;
	}

	// Outcomes that stop the run when fail-fast is enabled.
	public boolean isDefinitiveFailure() {
		return !isSuccessful();
	}
}
