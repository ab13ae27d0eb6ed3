package dev.trellis.launcher;

import dev.trellis.testrunner.fixture.FixtureOperation;
import dev.trellis.testrunner.fixture.FixtureRequest;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

/**
 * A fixture whose setup prints its value on stdout. Without a setup command the value is
 * the fixture's parameter, if any.
 */
public class CommandFixtureOperation implements FixtureOperation {

	public CommandFixtureOperation(CommandRunner runner, Path workingDirectory, @Nullable String setUpCommand, @Nullable String tearDownCommand) {
		this.runner = runner;
		this.workingDirectory = workingDirectory;
		this.setUpCommand = blankToNull(setUpCommand);
		this.tearDownCommand = blankToNull(tearDownCommand);
	}

	private final CommandRunner runner;
	private final Path workingDirectory;
	private final @Nullable String setUpCommand;
	private final @Nullable String tearDownCommand;

	@Override
	public @Nullable Object setUp(FixtureRequest request) throws Exception {
		if(setUpCommand == null) {
			return request.parameter() == null ? null : request.parameter().toString();
		}

		var output = runner.runChecked(setUpCommand, workingDirectory, CommandEnvironment.forSetUp(request), false);
		return output.strip();
	}

	@Override
	public void tearDown(FixtureRequest request, @Nullable Object value) throws Exception {
		if(tearDownCommand == null) {
			return;
		}

		var result = runner.run(tearDownCommand, workingDirectory, CommandEnvironment.forTearDown(request, value), true);
		if(result.exitCode() != 0) {
			throw new CommandFailureException("Teardown command completed with exit code " + result.exitCode() + ": " + tearDownCommand, result.exitCode(), result.output());
		}
	}

	private static @Nullable String blankToNull(@Nullable String command) {
		if(command == null || command.isBlank()) {
			return null;
		}
		return command.strip();
	}
}
