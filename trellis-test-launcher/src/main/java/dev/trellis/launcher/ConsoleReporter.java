package dev.trellis.launcher;

import dev.trellis.testrunner.CollectedUnits;
import dev.trellis.testrunner.execution.FailureDetail;
import dev.trellis.testrunner.execution.Outcome;
import dev.trellis.testrunner.execution.ResultListener;
import dev.trellis.testrunner.execution.RunReport;
import dev.trellis.testrunner.execution.RunResult;
import dev.trellis.testrunner.plan.WorkerQueue;

import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Plain text output: one line per result and a summary.
 * Without progress output, only the results that did not succeed are listed, once the run finished.
 */
public class ConsoleReporter implements ResultListener, CommandOutputListener {

	public ConsoleReporter(PrintStream out) {
		this(out, true);
	}

	public ConsoleReporter(PrintStream out, boolean progress) {
		this.out = out;
		this.progress = progress;
	}

	private final PrintStream out;
	private final boolean progress;

	@Override
	public void runStarted(List<WorkerQueue> queues, long seed) {
		int units = 0;
		int workers = 0;
		for(var queue : queues) {
			units += queue.size();
			if(!queue.isEmpty()) {
				++workers;
			}
		}
		out.println("Running " + units + " tests on " + workers + " workers (seed " + seed + ")");
	}

	@Override
	public void unitFinished(RunResult result) {
		if(progress) {
			printResult(result);
		}
	}

	@Override
	public void commandSucceeded(String unitId, String output) {
		if(output.isEmpty()) {
			return;
		}

		synchronized(out) {
			out.println("Output of " + unitId + ":");
			printIndented(output, "    | ");
		}
	}

	@Override
	public void runFinished(RunReport report) {
		if(!progress) {
			for(var result : report.results()) {
				if(!result.isSuccessful() || !result.teardownFailures().isEmpty()) {
					printResult(result);
				}
			}
		}

		for(var failure : report.shutdownFailures()) {
			printFailure(failure);
		}

		if(report.isCancelled()) {
			out.println("Run stopped (" + report.stopReason() + "), " + report.notRun().size() + " tests not run");
		}

		out.println(formatSummary(report));
	}

	public void printCollected(CollectedUnits collected) {
		for(var unit : collected.units()) {
			out.println(unit.id());
		}
		for(var error : collected.resolutionErrors()) {
			out.println(formatResult(error));
			printFailure(error.failure());
		}
		out.println(collected.units().size() + " tests collected, " + collected.deselected() + " deselected");
	}

	static String formatResult(RunResult result) {
		var line = new StringBuilder();
		line.append(String.format(Locale.ROOT, "%-8s", result.outcome().outcomeId().toUpperCase(Locale.ROOT)));
		line.append(' ').append(result.unitId());
		line.append(" [").append(formatDuration(result.elapsed())).append(']');
		if(result.retries() > 0) {
			line.append(" (retried ").append(result.retries()).append(')');
		}
		if(result.skipReason() != null) {
			line.append(": ").append(result.skipReason());
		}
		return line.toString();
	}

	static String formatSummary(RunReport report) {
		var parts = new ArrayList<String>();
		var counts = report.counts();
		for(var outcome : Outcome.values()) {
			int count = counts.get(outcome);
			if(count > 0) {
				parts.add(count + " " + outcome.outcomeId());
			}
		}
		if(report.deselected() > 0) {
			parts.add(report.deselected() + " deselected");
		}
		if(parts.isEmpty()) {
			parts.add("no tests ran");
		}

		return String.join(", ", parts) + " in " + formatDuration(report.elapsed()) + " (seed " + report.seed() + ")";
	}

	static String formatDuration(Duration duration) {
		return String.format(Locale.ROOT, "%.2fs", duration.toMillis() / 1000.0);
	}

	private void printResult(RunResult result) {
		synchronized(out) {
			out.println(formatResult(result));
			if(result.failure() != null && !result.isSuccessful()) {
				printFailure(result.failure());
			}
			for(var teardownFailure : result.teardownFailures()) {
				if(teardownFailure != result.failure()) {
					printFailure(teardownFailure);
				}
			}
		}
	}

	private void printFailure(FailureDetail failure) {
		printIndented(failure.toString(), "    ");
		if(failure.cause() instanceof CommandFailureException commandFailure) {
			printIndented(commandFailure.getCommandOutput(), "    | ");
		}
	}

	private void printIndented(String text, String prefix) {
		for(var line : text.split("\\R")) {
			out.println(prefix + line);
		}
	}
}
