package dev.trellis.launcher;

/**
 * Receives the output of test commands that passed. Called from worker threads.
 */
@FunctionalInterface
public interface CommandOutputListener {
	CommandOutputListener NONE = (unitId, output) -> {};

	void commandSucceeded(String unitId, String output);
}
