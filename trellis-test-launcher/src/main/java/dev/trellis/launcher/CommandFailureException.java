package dev.trellis.launcher;

public class CommandFailureException extends Exception {
	public CommandFailureException(String message, int exitCode, String commandOutput) {
		super(message);
		this.exitCode = exitCode;
		this.commandOutput = commandOutput;
	}

	private final int exitCode;
	private final String commandOutput;

	public int getExitCode() {
		return exitCode;
	}

	public String getCommandOutput() {
		return commandOutput;
	}

	@Override
	public String toString() {
		return super.toString() + System.lineSeparator() + "Output:" + System.lineSeparator() + commandOutput;
	}
}
