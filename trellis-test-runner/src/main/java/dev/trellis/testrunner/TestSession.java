package dev.trellis.testrunner;

import com.google.common.collect.ImmutableList;
import dev.trellis.testrunner.cache.DurationCache;
import dev.trellis.testrunner.cache.DurationStore;
import dev.trellis.testrunner.execution.CancellationToken;
import dev.trellis.testrunner.execution.ExecutionCoordinator;
import dev.trellis.testrunner.execution.Outcome;
import dev.trellis.testrunner.execution.ResultListener;
import dev.trellis.testrunner.execution.RunReport;
import dev.trellis.testrunner.execution.RunResult;
import dev.trellis.testrunner.filter.FilterEngine;
import dev.trellis.testrunner.filter.NameFilterSet;
import dev.trellis.testrunner.filter.TagFilterSet;
import dev.trellis.testrunner.fixture.FixtureRegistry;
import dev.trellis.testrunner.plan.RunPlanner;
import dev.trellis.testrunner.resolve.DependencyResolver;
import dev.trellis.testrunner.resolve.ExecutionUnit;
import dev.trellis.testrunner.resolve.ResolutionException;

import java.io.IOException;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Resolves, filters, plans and runs a discovered suite.
 */
public final class TestSession {

	private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(TestSession.class);

	public TestSession(DurationCache durations) {
		this.durations = durations;
	}

	private final DurationCache durations;

	public static TestSession withoutHistory() {
		return new TestSession(new DurationCache(DurationStore.disabled()));
	}

	public RunReport run(DiscoveredSuite suite, RunConfig config, ResultListener listener) {
		return run(suite, config, listener, new CancellationToken());
	}

	public RunReport run(DiscoveredSuite suite, RunConfig config, ResultListener listener, CancellationToken token) {
		var collected = collect(suite, config);

		long seed = config.seed() != null ? config.seed() : ThreadLocalRandom.current().nextLong();
		int workerCount = config.effectiveWorkerCount();
		log.info(
			"Running {} units on {} workers ({} deselected, {} unresolved), planner seed {}",
			collected.units().size(),
			workerCount,
			collected.deselected(),
			collected.resolutionErrors().size(),
			seed
		);

		var history = durations.history(config.noCache());
		var queues = new RunPlanner(seed).plan(collected.units(), workerCount, history);

		var report = new ExecutionCoordinator(config)
			.run(queues, collected.resolutionErrors(), seed, token, listener)
			.withDeselected(collected.deselected());

		for(var result : report.results()) {
			if(result.workerId() != RunResult.NO_WORKER && result.outcome() != Outcome.SKIPPED) {
				durations.record(result.unitId(), result.elapsed());
			}
		}

		try {
			durations.save();
		}
		catch(IOException e) {
			log.warn("Could not save test durations", e);
		}

		listener.runFinished(report);
		return report;
	}

	/**
	 * Resolves and filters without running anything.
	 */
	public CollectedUnits collect(DiscoveredSuite suite, RunConfig config) {
		var resolver = new DependencyResolver(FixtureRegistry.of(suite.fixtures()));
		var filter = new FilterEngine(NameFilterSet.compile(config.namePatterns()), new TagFilterSet(config.tagExpressions()));

		var units = ImmutableList.<ExecutionUnit>builder();
		var resolutionErrors = ImmutableList.<RunResult>builder();
		int deselected = 0;
		int ordinal = 0;
		for(var item : suite.items()) {
			boolean selected = filter.matches(item);
			for(var instance : item.instances()) {
				try {
					var plans = resolver.plan(instance);
					if(!selected) {
						deselected += plans.size();
						continue;
					}

					for(var plan : plans) {
						units.add(new ExecutionUnit(ordinal++, instance, plan));
					}
				}
				catch(ResolutionException e) {
					if(!selected) {
						++deselected;
						continue;
					}

					log.debug("Could not resolve fixtures of {}: {}", instance, e.getError());
					resolutionErrors.add(RunResult.resolutionError(ordinal++, instance, e.getError()));
				}
			}
		}

		return new CollectedUnits(units.build(), resolutionErrors.build(), deselected);
	}
}
