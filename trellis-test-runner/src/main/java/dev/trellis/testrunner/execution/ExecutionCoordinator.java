package dev.trellis.testrunner.execution;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import dev.trellis.testrunner.RunConfig;
import dev.trellis.testrunner.plan.WorkerQueue;
import dev.trellis.testrunner.resolve.ExecutionUnit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Runs planned queues on one worker thread each and collects their results.
 * Workers never share fixture instances; results flow back over a queue in completion order.
 */
public final class ExecutionCoordinator {

	private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ExecutionCoordinator.class);

	public ExecutionCoordinator(RunConfig config) {
		this.config = config;
	}

	private final RunConfig config;

	public RunReport run(List<WorkerQueue> queues, long seed, CancellationToken token, ResultListener listener) {
		return run(queues, ImmutableList.of(), seed, token, listener);
	}

	/**
	 * An interrupt of the calling thread stops the run cooperatively; the interrupt status is restored on return.
	 *
	 * @param unrunnable results already known before any worker starts, such as resolution errors
	 */
	public RunReport run(List<WorkerQueue> queues, List<RunResult> unrunnable, long seed, CancellationToken token, ResultListener listener) {
		var stopwatch = Stopwatch.createStarted();
		var events = new LinkedBlockingQueue<WorkerEvent>();
		var executor = new WorkerExecutor("trellis-worker");

		var results = new ArrayList<RunResult>();
		var notRun = new ArrayList<ExecutionUnit>();
		var shutdownFailures = new ArrayList<FailureDetail>();

		notify(() -> listener.runStarted(queues, seed));
		for(var result : unrunnable) {
			accept(result, results, token, listener);
		}

		int running = 0;
		for(var queue : queues) {
			if(queue.isEmpty()) {
				continue;
			}

			var worker = new Worker(queue, config.retries(), config.failFast(), token, events);
			executor.submit(() -> {
				try {
					worker.run();
				}
				catch(Throwable t) {
					worker.reportCrash(t);
				}
			});
			++running;
		}
		log.info("Started {} workers", running);

		boolean interrupted = false;
		while(running > 0) {
			WorkerEvent event;
			try {
				event = events.take();
			}
			catch(InterruptedException e) {
				interrupted = true;
				token.cancel(StopReason.INTERRUPTED);
				continue;
			}

			if(event instanceof WorkerEvent.UnitFinished finished) {
				accept(finished.result(), results, token, listener);
			}
			else if(event instanceof WorkerEvent.WorkerStopped stopped) {
				--running;
				notRun.addAll(stopped.notStarted());
				shutdownFailures.addAll(stopped.shutdownFailures());
				log.debug("Worker {} finished", stopped.workerId());
			}
			else if(event instanceof WorkerEvent.WorkerCrashed crashed) {
				--running;
				shutdownFailures.addAll(crashed.shutdownFailures());
				for(var unit : crashed.unfinished()) {
					accept(RunResult.infrastructureError(unit, crashed.workerId(), crashed.cause()), results, token, listener);
				}
			}
		}

		interrupted |= awaitThreads(executor);
		if(interrupted) {
			Thread.currentThread().interrupt();
		}

		results.sort(Comparator.comparingInt(RunResult::ordinal));
		notRun.sort(Comparator.comparingInt(ExecutionUnit::ordinal));

		var report = new RunReport(
			ImmutableList.copyOf(results),
			ImmutableList.copyOf(notRun),
			ImmutableList.copyOf(shutdownFailures),
			0,
			token.reason(),
			seed,
			stopwatch.elapsed()
		);
		log.info("Finished {} units in {}", results.size(), report.elapsed());
		return report;
	}

	private void accept(RunResult result, List<RunResult> results, CancellationToken token, ResultListener listener) {
		results.add(result);
		if(config.failFast() && result.outcome().isDefinitiveFailure()) {
			token.cancel(StopReason.FAIL_FAST);
		}
		notify(() -> listener.unitFinished(result));
	}

	private static boolean awaitThreads(WorkerExecutor executor) {
		boolean interrupted = false;
		while(true) {
			try {
				executor.join();
				return interrupted;
			}
			catch(InterruptedException e) {
				interrupted = true;
			}
		}
	}

	private static void notify(Runnable notification) {
		try {
			notification.run();
		}
		catch(RuntimeException e) {
			log.warn("Result listener failed", e);
		}
	}
}
