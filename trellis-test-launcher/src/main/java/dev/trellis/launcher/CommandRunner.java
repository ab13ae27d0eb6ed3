package dev.trellis.launcher;

import dev.trellis.testrunner.item.TestSkippedException;
import org.apache.commons.io.IOUtils;
import org.jetbrains.annotations.Nullable;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

/**
 * Runs manifest commands through the platform shell.
 */
public class CommandRunner {

	private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(CommandRunner.class);

	// Exit code of a command that asks for its test to be skipped.
	public static final int SKIP_EXIT_CODE = 77;

	public CommandRunner() {
		this(Shell.current());
	}

	public CommandRunner(Shell shell) {
		this.shell = shell;
	}

	private final Shell shell;

	public record Result(int exitCode, String output) {}

	/**
	 * @param mergeErrorOutput capture stderr together with stdout; otherwise stderr goes to the runner's stderr
	 */
	public Result run(String command, Path workingDirectory, Map<String, String> environment, boolean mergeErrorOutput) throws IOException, InterruptedException {
		var pb = new ProcessBuilder(shell.commandLine(command));
		pb.directory(workingDirectory.toFile());
		pb.environment().putAll(environment);
		pb.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
		pb.redirectOutput(ProcessBuilder.Redirect.PIPE);
		if(mergeErrorOutput) {
			pb.redirectErrorStream(true);
		}
		else {
			pb.redirectError(ProcessBuilder.Redirect.INHERIT);
		}

		log.debug("Running command {} in {}", command, workingDirectory);
		var process = pb.start();
		try {
			String output;
			try(var is = process.getInputStream()) {
				output = IOUtils.toString(is, StandardCharsets.UTF_8);
			}

			int exitCode = process.waitFor();
			return new Result(exitCode, output);
		}
		catch(InterruptedException | IOException e) {
			process.destroyForcibly();
			throw e;
		}
	}

	/**
	 * Runs a command that must succeed. Exit code {@value #SKIP_EXIT_CODE} skips the test.
	 */
	public String runChecked(String command, Path workingDirectory, Map<String, String> environment, boolean mergeErrorOutput) throws IOException, InterruptedException, CommandFailureException, TestSkippedException {
		var result = run(command, workingDirectory, environment, mergeErrorOutput);
		if(result.exitCode() == SKIP_EXIT_CODE) {
			throw new TestSkippedException(skipReason(result.output()));
		}

		if(result.exitCode() != 0) {
			throw new CommandFailureException("Command completed with exit code " + result.exitCode() + ": " + command, result.exitCode(), result.output());
		}

		return result.output();
	}

	private static @Nullable String skipReason(String output) {
		var reason = output.strip();
		return reason.isEmpty() ? null : reason;
	}

	private File nullDevice() {
		return new File(shell == Shell.WINDOWS ? "NUL" : "/dev/null");
	}
}
