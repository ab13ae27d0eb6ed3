package dev.trellis.launcher;

import dev.trellis.testrunner.item.TestBody;
import dev.trellis.testrunner.item.TestInvocation;

import java.nio.file.Path;

public class CommandTestBody implements TestBody {

	public CommandTestBody(CommandRunner runner, Path workingDirectory, String command) {
		this(runner, workingDirectory, command, CommandOutputListener.NONE);
	}

	public CommandTestBody(CommandRunner runner, Path workingDirectory, String command, CommandOutputListener outputListener) {
		this.runner = runner;
		this.workingDirectory = workingDirectory;
		this.command = command;
		this.outputListener = outputListener;
	}

	private final CommandRunner runner;
	private final Path workingDirectory;
	private final String command;
	private final CommandOutputListener outputListener;

	public String getCommand() {
		return command;
	}

	@Override
	public void run(TestInvocation invocation) throws Exception {
		var output = runner.runChecked(command, workingDirectory, CommandEnvironment.forTest(invocation), true);
		outputListener.commandSucceeded(invocation.unitId(), output);
	}
}
