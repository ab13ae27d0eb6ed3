package dev.trellis.testrunner.fixture;

public class InvalidFixtureException extends Exception {
	public InvalidFixtureException(String message) {
		super(message);
	}

	public InvalidFixtureException(String message, Throwable cause) {
		super(message, cause);
	}
}
