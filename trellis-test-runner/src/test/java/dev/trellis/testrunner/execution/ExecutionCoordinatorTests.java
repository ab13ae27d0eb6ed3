package dev.trellis.testrunner.execution;

import dev.trellis.testrunner.DiscoveredSuite;
import dev.trellis.testrunner.InMemoryDurationStore;
import dev.trellis.testrunner.RunConfig;
import dev.trellis.testrunner.TestSession;
import dev.trellis.testrunner.cache.DurationCache;
import dev.trellis.testrunner.fixture.AsyncFixtureOperation;
import dev.trellis.testrunner.fixture.FixtureDef;
import dev.trellis.testrunner.fixture.FixtureOperation;
import dev.trellis.testrunner.fixture.FixtureRequest;
import dev.trellis.testrunner.fixture.FixtureScope;
import dev.trellis.testrunner.fixture.ScopeNode;
import dev.trellis.testrunner.item.AsyncTestBody;
import dev.trellis.testrunner.item.SkipCondition;
import dev.trellis.testrunner.item.TestIdentity;
import dev.trellis.testrunner.item.TestItem;
import dev.trellis.testrunner.item.TestSkippedException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static dev.trellis.testrunner.Definitions.MODULE;
import static dev.trellis.testrunner.Definitions.eventLog;
import static dev.trellis.testrunner.Definitions.item;
import static dev.trellis.testrunner.Definitions.passing;
import static dev.trellis.testrunner.Definitions.recordingFixture;
import static dev.trellis.testrunner.Definitions.result;
import static dev.trellis.testrunner.Definitions.singleWorker;
import static dev.trellis.testrunner.Definitions.withBody;

public class ExecutionCoordinatorTests {

	private static final ScopeNode MODULE_NODE = ScopeNode.module(MODULE);

	private static RunReport run(List<FixtureDef> fixtures, List<TestItem> items, RunConfig config) {
		return TestSession.withoutHistory().run(DiscoveredSuite.of(fixtures, items), config, ResultListener.NONE);
	}

	@Test
	void passingAndFailingBodies() {
		var report = run(List.of(), List.of(
			passing("test_ok"),
			withBody("test_broken", invocation -> Assertions.fail("boom"))
		), singleWorker());

		Assertions.assertEquals(Outcome.PASSED, result(report, "test_ok").outcome());
		var broken = result(report, "test_broken");
		Assertions.assertEquals(Outcome.FAILED, broken.outcome());
		Assertions.assertEquals(FailureKind.BODY, broken.failure().kind());
		Assertions.assertInstanceOf(AssertionError.class, broken.failure().cause());
		Assertions.assertEquals(ExitStatus.FAILURE, report.exitStatus());
	}

	@Test
	void functionFixturesAreFreshPerTest() throws Exception {
		var events = eventLog();
		var report = run(
			List.of(recordingFixture(events, "conn", MODULE_NODE, FixtureScope.FUNCTION)),
			List.of(
				withBody("test_a", invocation -> events.add("body a " + invocation.fixture("conn")), "conn"),
				withBody("test_b", invocation -> events.add("body b"), "conn")
			),
			singleWorker()
		);

		Assertions.assertEquals(ExitStatus.SUCCESS, report.exitStatus());
		Assertions.assertEquals(List.of(
			"setup conn", "body a conn-value", "teardown conn",
			"setup conn", "body b", "teardown conn"
		), events);
	}

	@Test
	void fixtureReceivesRequestedFixtureValues() throws Exception {
		var root = FixtureDef.builder("root", MODULE_NODE)
			.operation(request -> "/tmp/work")
			.build();
		var file = FixtureDef.builder("file", MODULE_NODE)
			.requires("root")
			.operation(request -> request.dependency("root") + "/data.txt")
			.build();
		var seen = Collections.synchronizedList(new ArrayList<Object>());

		var report = run(
			List.of(root, file),
			List.of(withBody("test_file", invocation -> seen.add(invocation.fixture("file")), "file")),
			singleWorker()
		);

		Assertions.assertEquals(ExitStatus.SUCCESS, report.exitStatus());
		Assertions.assertEquals(List.of("/tmp/work/data.txt"), seen);
	}

	@Test
	void sessionFixtureIsRebuiltForModulesOverridingItsDependency() throws Exception {
		var configA = FixtureDef.builder("config", ScopeNode.module("tests/a"))
			.scope(FixtureScope.SESSION)
			.operation(request -> "A")
			.build();
		var configB = FixtureDef.builder("config", ScopeNode.module("tests/b"))
			.scope(FixtureScope.SESSION)
			.operation(request -> "B")
			.build();
		var client = FixtureDef.builder("client", ScopeNode.SESSION)
			.scope(FixtureScope.SESSION)
			.requires("config")
			.operation(request -> "client(" + request.dependency("config") + ")")
			.build();
		var seen = new ConcurrentHashMap<String, Object>();

		var report = run(
			List.of(configA, configB, client),
			List.of(
				item("tests/a", "test_a").requires("client").body(invocation -> seen.put("a", invocation.fixture("client"))).build(),
				item("tests/b", "test_b").requires("client").body(invocation -> seen.put("b", invocation.fixture("client"))).build()
			),
			singleWorker()
		);

		Assertions.assertEquals(ExitStatus.SUCCESS, report.exitStatus());
		Assertions.assertEquals(Map.of("a", "client(A)", "b", "client(B)"), seen);
	}

	@Test
	void moduleFixtureIsRebuiltForGroupOverridingItsDependency() throws Exception {
		var events = eventLog();
		var moduleConfig = FixtureDef.builder("config", MODULE_NODE)
			.scope(FixtureScope.MODULE)
			.operation(request -> "module")
			.build();
		var groupConfig = FixtureDef.builder("config", ScopeNode.group(MODULE, "Slow"))
			.scope(FixtureScope.MODULE)
			.operation(request -> "group")
			.build();
		var client = FixtureDef.builder("client", MODULE_NODE)
			.scope(FixtureScope.MODULE)
			.requires("config")
			.operation(request -> "client(" + request.dependency("config") + ")")
			.build();

		var report = run(
			List.of(moduleConfig, groupConfig, client),
			List.of(
				TestItem.builder(new TestIdentity(MODULE, "Slow", "test_grouped"))
					.requires("client")
					.body(invocation -> events.add("grouped " + invocation.fixture("client")))
					.build(),
				withBody("test_plain", invocation -> events.add("plain " + invocation.fixture("client")), "client")
			),
			singleWorker()
		);

		Assertions.assertEquals(ExitStatus.SUCCESS, report.exitStatus());
		Assertions.assertEquals(2, events.size());
		Assertions.assertTrue(events.contains("grouped client(group)"), events::toString);
		Assertions.assertTrue(events.contains("plain client(module)"), events::toString);
	}

	@Test
	void moduleFixtureIsSharedAndTornDownAfterLastConsumer() throws Exception {
		var events = eventLog();
		var report = run(
			List.of(recordingFixture(events, "server", MODULE_NODE, FixtureScope.MODULE)),
			List.of(
				withBody("test_a", invocation -> events.add("body a"), "server"),
				withBody("test_b", invocation -> events.add("body b")),
				withBody("test_c", invocation -> events.add("body c"), "server")
			),
			singleWorker()
		);

		Assertions.assertEquals(ExitStatus.SUCCESS, report.exitStatus());
		Assertions.assertEquals(List.of(
			"setup server", "body a", "body b", "body c", "teardown server"
		), events);
	}

	@Test
	void moduleFixtureHasOneInstancePerModule() throws Exception {
		var events = eventLog();
		var fixture = recordingFixture(events, "server", ScopeNode.SESSION, FixtureScope.MODULE);
		var report = run(
			List.of(fixture),
			List.of(
				item("tests/one", "test_a").requires("server").build(),
				item("tests/one", "test_b").requires("server").build(),
				item("tests/two", "test_c").requires("server").build()
			),
			singleWorker()
		);

		Assertions.assertEquals(ExitStatus.SUCCESS, report.exitStatus());
		Assertions.assertEquals(List.of(
			"setup server", "teardown server", "setup server", "teardown server"
		), events);
	}

	@Test
	void sessionFixtureIsSetUpOncePerWorker() throws Exception {
		var setups = new AtomicInteger();
		var session = FixtureDef.builder("env", ScopeNode.SESSION)
			.scope(FixtureScope.SESSION)
			.operation(request -> setups.incrementAndGet())
			.build();
		var items = new ArrayList<TestItem>();
		for(int i = 0; i < 4; ++i) {
			items.add(passing("test_" + i, "env"));
		}

		var report = run(List.of(session), items, RunConfig.builder().workerCount(2).seed(5L).build());

		Assertions.assertEquals(4, report.count(Outcome.PASSED));
		Assertions.assertEquals(2, setups.get());
	}

	@Test
	void setupFailureIsAnErrorAndUndoesEarlierSetups() throws Exception {
		var events = eventLog();
		var broken = FixtureDef.builder("db", MODULE_NODE)
			.requires("tmp")
			.operation(request -> { throw new IllegalStateException("db down"); })
			.build();
		var bodyRuns = new AtomicInteger();
		var report = run(
			List.of(recordingFixture(events, "tmp", MODULE_NODE, FixtureScope.FUNCTION), broken),
			List.of(withBody("test_db", invocation -> bodyRuns.incrementAndGet(), "db")),
			RunConfig.builder().workerCount(1).retries(3).build()
		);

		var result = result(report, "test_db");
		Assertions.assertEquals(Outcome.ERROR, result.outcome());
		Assertions.assertEquals(FailureKind.SETUP, result.failure().kind());
		Assertions.assertEquals("db", result.failure().fixtureName());
		Assertions.assertEquals(0, result.retries());
		Assertions.assertEquals(0, bodyRuns.get());
		Assertions.assertEquals(List.of("setup tmp", "teardown tmp"), events);
	}

	@Test
	void teardownFailureIsReportedAndOtherTeardownsStillRun() throws Exception {
		var events = eventLog();
		var leaky = FixtureDef.builder("leaky", MODULE_NODE)
			.requires("tmp")
			.operation(new FixtureOperation() {
				@Override
				public Object setUp(FixtureRequest request) {
					return "leaky";
				}

				@Override
				public void tearDown(FixtureRequest request, Object value) {
					throw new IllegalStateException("cannot close");
				}
			})
			.build();
		var report = run(
			List.of(recordingFixture(events, "tmp", MODULE_NODE, FixtureScope.FUNCTION), leaky),
			List.of(passing("test_leak", "leaky")),
			singleWorker()
		);

		var result = result(report, "test_leak");
		Assertions.assertEquals(Outcome.ERROR, result.outcome());
		Assertions.assertEquals(1, result.teardownFailures().size());
		Assertions.assertEquals(FailureKind.TEARDOWN, result.failure().kind());
		Assertions.assertEquals("leaky", result.failure().fixtureName());
		Assertions.assertEquals(List.of("setup tmp", "teardown tmp"), events);
	}

	@Test
	void sharedTeardownFailureIsAttachedToReleasingUnit() throws Exception {
		var server = FixtureDef.builder("server", MODULE_NODE)
			.scope(FixtureScope.MODULE)
			.operation(new FixtureOperation() {
				@Override
				public Object setUp(FixtureRequest request) {
					return "server";
				}

				@Override
				public void tearDown(FixtureRequest request, Object value) throws Exception {
					throw new java.io.IOException("port still bound");
				}
			})
			.build();
		var report = run(List.of(server), List.of(passing("test_a", "server"), passing("test_b", "server")), singleWorker());

		Assertions.assertEquals(Outcome.PASSED, result(report, "test_a").outcome());
		var last = result(report, "test_b");
		Assertions.assertEquals(Outcome.ERROR, last.outcome());
		Assertions.assertEquals(FailureKind.TEARDOWN, last.failure().kind());
	}

	@Test
	void failedBodyIsRetried() {
		var attempts = new AtomicInteger();
		var report = run(List.of(), List.of(withBody("test_flaky", invocation -> {
			if(attempts.incrementAndGet() < 3) {
				throw new AssertionError("flaky");
			}
		})), RunConfig.builder().workerCount(1).retries(5).build());

		var result = result(report, "test_flaky");
		Assertions.assertEquals(Outcome.PASSED, result.outcome());
		Assertions.assertEquals(2, result.retries());
		Assertions.assertEquals(3, attempts.get());
	}

	@Test
	void retriesAreBounded() throws Exception {
		var events = eventLog();
		var attempts = new AtomicInteger();
		var report = run(
			List.of(recordingFixture(events, "tmp", MODULE_NODE, FixtureScope.FUNCTION)),
			List.of(withBody("test_broken", invocation -> {
				attempts.incrementAndGet();
				throw new AssertionError("always");
			}, "tmp")),
			RunConfig.builder().workerCount(1).retries(2).build()
		);

		var result = result(report, "test_broken");
		Assertions.assertEquals(Outcome.FAILED, result.outcome());
		Assertions.assertEquals(2, result.retries());
		Assertions.assertEquals(3, attempts.get());
		Assertions.assertEquals(Collections.nCopies(3, List.of("setup tmp", "teardown tmp")).stream().flatMap(List::stream).toList(), events);
	}

	@Test
	void expectedFailureInvertsOutcome() {
		var report = run(List.of(), List.of(
			item("test_known_bug").expectFailure("issue 12").body(invocation -> { throw new AssertionError("still broken"); }).build(),
			item("test_fixed_bug").expectFailure(null).build()
		), singleWorker());

		Assertions.assertEquals(Outcome.EXPECTED_FAILURE, result(report, "test_known_bug").outcome());
		var fixed = result(report, "test_fixed_bug");
		Assertions.assertEquals(Outcome.UNEXPECTED_PASS, fixed.outcome());
		Assertions.assertEquals(FailureKind.BODY, fixed.failure().kind());
		Assertions.assertEquals(ExitStatus.FAILURE, report.exitStatus());
	}

	@Test
	void expectedFailureAloneSucceeds() {
		var report = run(List.of(), List.of(
			item("test_known_bug").expectFailure("issue 12").body(invocation -> { throw new IllegalStateException(); }).build()
		), singleWorker());

		Assertions.assertEquals(ExitStatus.SUCCESS, report.exitStatus());
	}

	@Test
	void skippedTestsDoNotSetUpFixtures() throws Exception {
		var events = eventLog();
		var report = run(
			List.of(recordingFixture(events, "tmp", MODULE_NODE, FixtureScope.FUNCTION)),
			List.of(
				item("test_skipped").requires("tmp").skip(SkipCondition.always("not on this platform")).build(),
				item("test_not_skipped").requires("tmp").skip(SkipCondition.when(() -> false, "never")).build()
			),
			singleWorker()
		);

		var skipped = result(report, "test_skipped");
		Assertions.assertEquals(Outcome.SKIPPED, skipped.outcome());
		Assertions.assertEquals("not on this platform", skipped.skipReason());
		Assertions.assertEquals(Outcome.PASSED, result(report, "test_not_skipped").outcome());
		Assertions.assertEquals(List.of("setup tmp", "teardown tmp"), events);
		Assertions.assertEquals(ExitStatus.SUCCESS, report.exitStatus());
	}

	@Test
	void skipRaisedAtRuntime() throws Exception {
		var unavailable = FixtureDef.builder("gpu", MODULE_NODE)
			.operation(request -> { throw new TestSkippedException("no gpu"); })
			.build();
		var report = run(List.of(unavailable), List.of(
			withBody("test_body_skip", invocation -> { throw new TestSkippedException("later"); }),
			passing("test_fixture_skip", "gpu")
		), singleWorker());

		Assertions.assertEquals("later", result(report, "test_body_skip").skipReason());
		var fixtureSkip = result(report, "test_fixture_skip");
		Assertions.assertEquals(Outcome.SKIPPED, fixtureSkip.outcome());
		Assertions.assertEquals("no gpu", fixtureSkip.skipReason());
	}

	@Test
	void failFastStopsDispatching() {
		var report = run(List.of(), List.of(
			withBody("test_1", invocation -> Assertions.fail("first")),
			passing("test_2"),
			passing("test_3")
		), RunConfig.builder().workerCount(1).failFast(true).build());

		Assertions.assertEquals(1, report.results().size());
		Assertions.assertEquals(2, report.notRun().size());
		Assertions.assertEquals(StopReason.FAIL_FAST, report.stopReason());
		Assertions.assertEquals(ExitStatus.ABORTED, report.exitStatus());
	}

	@Test
	void failFastLetsInFlightUnitsFinish() throws Exception {
		var events = eventLog();
		var slowStarted = new CountDownLatch(1);
		var token = new CancellationToken();
		var store = new InMemoryDurationStore(Map.of(
			MODULE + "::test_fail", Duration.ofSeconds(20),
			MODULE + "::test_slow", Duration.ofSeconds(10),
			MODULE + "::test_after", Duration.ofSeconds(1)
		));
		var suite = DiscoveredSuite.of(
			List.of(recordingFixture(events, "tmp", MODULE_NODE, FixtureScope.FUNCTION)),
			List.of(
				withBody("test_fail", invocation -> {
					Assertions.assertTrue(slowStarted.await(10, TimeUnit.SECONDS));
					Assertions.fail("first failure");
				}),
				withBody("test_slow", invocation -> {
					slowStarted.countDown();
					long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
					while(!token.isCancelled() && System.nanoTime() < deadline) {
						Thread.sleep(5);
					}
				}, "tmp"),
				passing("test_after")
			)
		);

		var report = new TestSession(new DurationCache(store))
			.run(suite, RunConfig.builder().workerCount(2).failFast(true).build(), ResultListener.NONE, token);

		Assertions.assertEquals(Outcome.FAILED, result(report, "test_fail").outcome());
		var slow = result(report, "test_slow");
		Assertions.assertEquals(Outcome.PASSED, slow.outcome());
		Assertions.assertTrue(slow.cancelled());
		Assertions.assertEquals(List.of("setup tmp", "teardown tmp"), events);
		Assertions.assertEquals(List.of(MODULE + "::test_after"), report.notRun().stream().map(unit -> unit.id()).toList());
		Assertions.assertEquals(ExitStatus.ABORTED, report.exitStatus());
	}

	@Test
	void interruptStopsTheRunAfterTheUnitInFlight() throws Exception {
		var started = new CountDownLatch(1);
		var token = new CancellationToken();
		var items = new ArrayList<TestItem>();
		for(int i = 0; i < 5; ++i) {
			items.add(withBody("test_" + i, invocation -> {
				started.countDown();
				long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
				while(!token.isCancelled() && System.nanoTime() < deadline) {
					Thread.sleep(5);
				}
			}));
		}

		var coordinating = Thread.currentThread();
		var interrupter = new Thread(() -> {
			try {
				if(started.await(10, TimeUnit.SECONDS)) {
					coordinating.interrupt();
				}
			}
			catch(InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		});
		interrupter.start();

		var report = TestSession.withoutHistory()
			.run(DiscoveredSuite.of(List.of(), items), singleWorker(), ResultListener.NONE, token);
		boolean interrupted = Thread.interrupted();
		interrupter.join();

		Assertions.assertTrue(interrupted);
		Assertions.assertEquals(StopReason.INTERRUPTED, report.stopReason());
		Assertions.assertEquals(1, report.results().size());
		var inFlight = report.results().get(0);
		Assertions.assertEquals(Outcome.PASSED, inFlight.outcome());
		Assertions.assertTrue(inFlight.cancelled());
		Assertions.assertEquals(4, report.notRun().size());
		Assertions.assertEquals(ExitStatus.ABORTED, report.exitStatus());
	}

	@Test
	void workerCrashFailsItsRemainingUnits() throws Exception {
		var events = eventLog();
		var report = run(
			List.of(recordingFixture(events, "server", MODULE_NODE, FixtureScope.MODULE)),
			List.of(
				passing("test_before", "server"),
				withBody("test_crash", invocation -> { throw new SimulatedCrash(); }, "server"),
				passing("test_after", "server")
			),
			singleWorker()
		);

		Assertions.assertEquals(Outcome.PASSED, result(report, "test_before").outcome());
		for(var function : List.of("test_crash", "test_after")) {
			var result = result(report, function);
			Assertions.assertEquals(Outcome.ERROR, result.outcome());
			Assertions.assertEquals(FailureKind.INFRASTRUCTURE, result.failure().kind());
			Assertions.assertInstanceOf(SimulatedCrash.class, result.failure().cause());
		}
		Assertions.assertEquals(List.of("setup server", "teardown server"), events);
		Assertions.assertEquals(ExitStatus.FAILURE, report.exitStatus());
	}

	@Test
	void otherWorkersSurviveACrash() {
		var store = new InMemoryDurationStore(Map.of(
			MODULE + "::test_crash", Duration.ofSeconds(10),
			MODULE + "::test_ok_1", Duration.ofSeconds(3),
			MODULE + "::test_ok_2", Duration.ofSeconds(3)
		));
		var suite = DiscoveredSuite.of(List.of(), List.of(
			withBody("test_crash", invocation -> { throw new SimulatedCrash(); }),
			passing("test_ok_1"),
			passing("test_ok_2")
		));

		var report = new TestSession(new DurationCache(store))
			.run(suite, RunConfig.builder().workerCount(2).build(), ResultListener.NONE);

		Assertions.assertEquals(Outcome.ERROR, result(report, "test_crash").outcome());
		Assertions.assertEquals(Outcome.PASSED, result(report, "test_ok_1").outcome());
		Assertions.assertEquals(Outcome.PASSED, result(report, "test_ok_2").outcome());
	}

	@Test
	void asyncOperationsAreAwaited() throws Exception {
		var events = eventLog();
		var token = FixtureDef.builder("token", MODULE_NODE)
			.operation(new AsyncFixtureOperation() {
				@Override
				public CompletableFuture<?> setUpAsync(FixtureRequest request) {
					return CompletableFuture.supplyAsync(() -> "secret");
				}

				@Override
				public CompletableFuture<?> tearDownAsync(FixtureRequest request, Object value) {
					return CompletableFuture.runAsync(() -> events.add("revoked " + value));
				}
			})
			.build();
		var report = run(List.of(token), List.of(
			item("test_async_ok").requires("token").body((AsyncTestBody)invocation -> CompletableFuture.runAsync(() -> {
				if(!"secret".equals(invocation.fixture("token"))) {
					throw new IllegalStateException("wrong token");
				}
			})).build(),
			item("test_async_fail").body((AsyncTestBody)invocation -> CompletableFuture.failedFuture(new AssertionError("async failure"))).build()
		), singleWorker());

		Assertions.assertEquals(Outcome.PASSED, result(report, "test_async_ok").outcome());
		var failed = result(report, "test_async_fail");
		Assertions.assertEquals(Outcome.FAILED, failed.outcome());
		Assertions.assertInstanceOf(AssertionError.class, failed.failure().cause());
		Assertions.assertEquals(List.of("revoked secret"), events);
	}

	@Test
	void parametrizedArgumentsReachTheBody() {
		var seen = eventLog();
		var report = run(List.of(), List.of(
			item("test_sizes")
				.parameters(Map.of("size", 1))
				.parameters(Map.of("size", 2))
				.body(invocation -> seen.add("size " + invocation.argument("size")))
				.build()
		), singleWorker());

		Assertions.assertEquals(2, report.count(Outcome.PASSED));
		Assertions.assertEquals(List.of("size 1", "size 2"), seen);
		Assertions.assertEquals(List.of(MODULE + "::test_sizes[0]", MODULE + "::test_sizes[1]"),
			report.results().stream().map(RunResult::unitId).toList());
	}

	@Test
	void resultsStreamToListener() {
		var seen = eventLog();
		var finished = new AtomicInteger();
		var listener = new ResultListener() {
			@Override
			public void unitFinished(RunResult result) {
				seen.add(result.unitId());
			}

			@Override
			public void runFinished(RunReport report) {
				finished.incrementAndGet();
			}
		};

		TestSession.withoutHistory().run(
			DiscoveredSuite.of(List.of(), List.of(passing("test_a"), passing("test_b"), passing("test_c"))),
			RunConfig.builder().workerCount(2).build(),
			listener
		);

		Assertions.assertEquals(3, seen.size());
		Assertions.assertEquals(1, finished.get());
	}

	private static final class SimulatedCrash extends Error {
		SimulatedCrash() {
			super("simulated worker crash");
		}
	}
}
