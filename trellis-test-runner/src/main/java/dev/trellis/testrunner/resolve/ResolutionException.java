package dev.trellis.testrunner.resolve;

public class ResolutionException extends Exception {
	public ResolutionException(ResolutionError error) {
		super(error.toString());
		this.error = error;
	}

	private final ResolutionError error;

	public ResolutionError getError() {
		return error;
	}
}
