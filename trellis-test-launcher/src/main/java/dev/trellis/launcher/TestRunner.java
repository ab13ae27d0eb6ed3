package dev.trellis.launcher;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import dev.trellis.testrunner.TestSession;
import dev.trellis.testrunner.cache.DurationCache;
import dev.trellis.testrunner.cache.JsonDurationStore;
import dev.trellis.testrunner.execution.CancellationToken;
import dev.trellis.testrunner.execution.ExitStatus;
import dev.trellis.testrunner.execution.StopReason;
import dev.trellis.testrunner.filter.TagExpressionException;

import java.io.IOException;
import java.io.PrintStream;

public class TestRunner {

	private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(TestRunner.class);

	public static void main(String[] args) {
		var token = new CancellationToken();
		var mainThread = Thread.currentThread();

		// On Ctrl+C the run stops cooperatively and the JVM waits until fixtures are torn down.
		var shutdownHook = new Thread(() -> {
			token.cancel(StopReason.INTERRUPTED);
			mainThread.interrupt();
			try {
				mainThread.join();
			}
			catch(InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		});
		Runtime.getRuntime().addShutdownHook(shutdownHook);

		int exitCode = run(args, System.out, token);

		try {
			Runtime.getRuntime().removeShutdownHook(shutdownHook);
		}
		catch(IllegalStateException e) {
			// Already shutting down; the hook is waiting for this thread to return.
			return;
		}
		System.exit(exitCode);
	}

	static int run(String[] args, PrintStream out, CancellationToken token) {
		var testArgs = new TestRunnerArgs();
		var commander = JCommander.newBuilder()
			.programName("trellis")
			.addObject(testArgs)
			.build();

		try {
			commander.parse(args);
		}
		catch(ParameterException e) {
			out.println(e.getMessage());
			printUsage(commander, out);
			return ExitStatus.ERROR.code();
		}

		if(testArgs.help) {
			printUsage(commander, out);
			return ExitStatus.SUCCESS.code();
		}

		try {
			var config = testArgs.toRunConfig();
			var reporter = new ConsoleReporter(out, !testArgs.noProgress);
			var outputListener = testArgs.showOutput ? reporter : CommandOutputListener.NONE;
			var suite = new ManifestDiscovery(new CommandRunner(), outputListener).discover(testArgs.paths);
			var session = new TestSession(new DurationCache(JsonDurationStore.inDirectory(testArgs.cacheDir)));

			if(testArgs.dryRun) {
				var collected = session.collect(suite, config);
				reporter.printCollected(collected);
				return collected.resolutionErrors().isEmpty() ? ExitStatus.SUCCESS.code() : ExitStatus.FAILURE.code();
			}

			var report = session.run(suite, config, reporter, token);
			return report.exitStatus().code();
		}
		catch(TagExpressionException e) {
			out.println("Invalid tag expression: " + e.getMessage());
			return ExitStatus.ERROR.code();
		}
		catch(IOException e) {
			out.println("Could not load test manifests: " + e.getMessage());
			return ExitStatus.ERROR.code();
		}
		catch(RuntimeException e) {
			log.error("Trellis failed", e);
			out.println("Trellis failed");
			for(Throwable t = e; t != null; t = t.getCause()) {
				out.println("  " + t);
			}
			return ExitStatus.ERROR.code();
		}
	}

	private static void printUsage(JCommander commander, PrintStream out) {
		var usage = new StringBuilder();
		commander.getUsageFormatter().usage(usage);
		out.print(usage);
	}
}
