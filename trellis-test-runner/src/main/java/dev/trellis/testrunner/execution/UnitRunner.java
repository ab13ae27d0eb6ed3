package dev.trellis.testrunner.execution;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import dev.trellis.testrunner.fixture.FixtureKey;
import dev.trellis.testrunner.item.TestInvocation;
import dev.trellis.testrunner.item.TestSkippedException;
import dev.trellis.testrunner.resolve.ExecutionUnit;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Runs one unit on its worker thread: skip check, fixture setup, body, teardown and retries.
 * Any {@link Error} other than an {@link AssertionError} is not caught and ends the worker.
 */
final class UnitRunner {

	private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(UnitRunner.class);

	UnitRunner(int workerId, int retries, ScopeManager scopes, FixtureInvoker invoker, CancellationToken token) {
		this.workerId = workerId;
		this.retries = retries;
		this.scopes = scopes;
		this.invoker = invoker;
		this.token = token;
	}

	private final int workerId;
	private final int retries;
	private final ScopeManager scopes;
	private final FixtureInvoker invoker;
	private final CancellationToken token;

	RunResult run(ExecutionUnit unit) {
		log.debug("Running {} on worker {}", unit, workerId);
		boolean stoppedBeforeStart = token.isCancelled();
		var stopwatch = Stopwatch.createStarted();
		var teardownFailures = ImmutableList.<FailureDetail>builder();

		int retriesUsed = 0;
		Attempt attempt = checkSkip(unit);
		if(attempt == null) {
			attempt = runAttempt(unit);
			teardownFailures.addAll(attempt.teardownFailures());
			while(attempt.outcome() == Outcome.FAILED && retriesUsed < retries && !token.isCancelled()) {
				++retriesUsed;
				log.debug("Retrying {} ({}/{})", unit, retriesUsed, retries);
				attempt = runAttempt(unit);
				teardownFailures.addAll(attempt.teardownFailures());
			}
		}

		teardownFailures.addAll(scopes.release(unit));
		var allTeardownFailures = teardownFailures.build();

		var outcome = attempt.outcome();
		var failure = attempt.failure();
		if(outcome.isSuccessful() && !allTeardownFailures.isEmpty()) {
			outcome = Outcome.ERROR;
			failure = allTeardownFailures.get(0);
		}

		return new RunResult(
			unit.ordinal(),
			unit.id(),
			unit.identity(),
			outcome,
			stopwatch.elapsed(),
			retriesUsed,
			failure,
			allTeardownFailures,
			attempt.skipReason(),
			!stoppedBeforeStart && token.isCancelled(),
			workerId
		);
	}

	private @Nullable Attempt checkSkip(ExecutionUnit unit) {
		var condition = unit.item().skipCondition();
		if(condition == null) {
			return null;
		}

		try {
			if(condition.shouldSkip()) {
				return Attempt.skipped(condition.reason());
			}
			return null;
		}
		catch(RuntimeException e) {
			return Attempt.of(Outcome.ERROR, new FailureDetail(FailureKind.SETUP, "Skip condition failed: " + FailureDetail.describe(e), null, e, null));
		}
	}

	private Attempt runAttempt(ExecutionUnit unit) {
		var functionFixtures = new ArrayList<LiveFixture>();
		Attempt attempt = null;
		try {
			attempt = setUpAndRun(unit, functionFixtures);
		}
		finally {
			var failures = tearDown(functionFixtures);
			if(attempt != null) {
				attempt = attempt.withTeardownFailures(failures);
			}
		}
		return attempt;
	}

	private Attempt setUpAndRun(ExecutionUnit unit, List<LiveFixture> functionFixtures) {
		var values = new HashMap<FixtureKey, Object>();
		for(var fixture : unit.plan().setupOrder()) {
			try {
				if(fixture.scope().isShared()) {
					values.put(fixture.key(), scopes.acquire(fixture, unit, values));
				}
				else {
					var live = invoker.setUp(fixture, unit.id(), values);
					functionFixtures.add(live);
					values.put(fixture.key(), live.value());
				}
			}
			catch(TestSkippedException e) {
				return Attempt.skipped(e.getReason());
			}
			catch(Exception | AssertionError e) {
				log.debug("Setup of fixture {} failed for {}", fixture, unit, e);
				return Attempt.of(Outcome.ERROR, FailureDetail.setup(fixture.name(), e));
			}
		}

		var fixtures = new LinkedHashMap<String, Object>();
		for(var requested : unit.plan().requested().entrySet()) {
			fixtures.put(requested.getKey(), values.get(requested.getValue()));
		}
		var invocation = new TestInvocation(unit.id(), Collections.unmodifiableMap(fixtures), unit.instance().arguments());

		var expectedFailure = unit.item().expectedFailure();
		try {
			unit.item().body().run(invocation);
		}
		catch(TestSkippedException e) {
			return Attempt.skipped(e.getReason());
		}
		catch(Exception | AssertionError e) {
			if(expectedFailure != null) {
				return Attempt.of(Outcome.EXPECTED_FAILURE, null);
			}
			return Attempt.of(Outcome.FAILED, FailureDetail.body(e));
		}

		if(expectedFailure != null) {
			return Attempt.of(Outcome.UNEXPECTED_PASS, FailureDetail.unexpectedPass(expectedFailure.reason()));
		}
		return Attempt.of(Outcome.PASSED, null);
	}

	private ImmutableList<FailureDetail> tearDown(List<LiveFixture> functionFixtures) {
		var failures = ImmutableList.<FailureDetail>builder();
		for(int i = functionFixtures.size() - 1; i >= 0; --i) {
			invoker.tearDown(functionFixtures.get(i)).ifPresent(failures::add);
		}
		return failures.build();
	}

	private record Attempt(
		Outcome outcome,
		@Nullable FailureDetail failure,
		@Nullable String skipReason,
		ImmutableList<FailureDetail> teardownFailures
	) {
		static Attempt of(Outcome outcome, @Nullable FailureDetail failure) {
			return new Attempt(outcome, failure, null, ImmutableList.of());
		}

		static Attempt skipped(@Nullable String reason) {
			return new Attempt(Outcome.SKIPPED, null, reason, ImmutableList.of());
		}

		Attempt withTeardownFailures(ImmutableList<FailureDetail> failures) {
			return new Attempt(outcome, failure, skipReason, failures);
		}
	}
}
