package dev.trellis.testrunner.execution;

public enum ExitStatus {
	SUCCESS(0),
	FAILURE(1),
	ERROR(2),
	ABORTED(3),
	;

	ExitStatus(int code) {
		this.code = code;
	}

	private final int code;

	public int code() {
		return code;
	}
}
