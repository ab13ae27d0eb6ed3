package dev.trellis.testrunner.execution;

import com.google.common.collect.ImmutableList;
import dev.trellis.testrunner.plan.WorkerQueue;
import dev.trellis.testrunner.resolve.ExecutionUnit;

import java.util.concurrent.BlockingQueue;

/**
 * Runs one queue sequentially and reports each result as soon as it is known.
 */
final class Worker {

	private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(Worker.class);

	Worker(WorkerQueue queue, int retries, boolean failFast, CancellationToken token, BlockingQueue<WorkerEvent> events) {
		this.workerId = queue.workerId();
		this.units = queue.units();
		this.failFast = failFast;
		this.token = token;
		this.events = events;

		var invoker = new FixtureInvoker();
		this.scopes = new ScopeManager(invoker, units);
		this.runner = new UnitRunner(workerId, retries, scopes, invoker, token);
	}

	private final int workerId;
	private final ImmutableList<ExecutionUnit> units;
	private final boolean failFast;
	private final CancellationToken token;
	private final BlockingQueue<WorkerEvent> events;
	private final ScopeManager scopes;
	private final UnitRunner runner;

	// Index of the first unit without a result.
	private int next = 0;
	private ImmutableList<FailureDetail> shutdownFailures = ImmutableList.of();

	// Must be called on the worker thread; errors escaping a unit propagate after shared fixtures are torn down.
	void run() {
		log.debug("Worker {} starting with {} units", workerId, units.size());
		try {
			while(next < units.size() && !token.isCancelled()) {
				var result = runner.run(units.get(next));
				++next;
				if(failFast && result.outcome().isDefinitiveFailure()) {
					token.cancel(StopReason.FAIL_FAST);
				}
				events.add(new WorkerEvent.UnitFinished(workerId, result));
			}
		}
		finally {
			shutdownFailures = scopes.closeAll();
		}

		events.add(new WorkerEvent.WorkerStopped(workerId, unfinished(), shutdownFailures));
	}

	void reportCrash(Throwable cause) {
		log.error("Worker {} crashed", workerId, cause);
		events.add(new WorkerEvent.WorkerCrashed(workerId, cause, unfinished(), shutdownFailures));
	}

	ImmutableList<ExecutionUnit> unfinished() {
		return units.subList(next, units.size());
	}
}
