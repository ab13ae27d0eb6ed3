package dev.trellis.testrunner.plan;

import com.google.common.collect.ImmutableList;
import dev.trellis.testrunner.resolve.ExecutionUnit;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Random;

/**
 * Partitions units across workers with longest-processing-time-first greedy assignment.
 * Units without recorded history cost nothing and are shuffled, so without history the
 * result is a randomized even split.
 */
public final class RunPlanner {

	private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(RunPlanner.class);

	public RunPlanner(long seed) {
		this.seed = seed;
	}

	private final long seed;

	public ImmutableList<WorkerQueue> plan(List<ExecutionUnit> units, int workerCount, Map<String, Duration> history) {
		if(workerCount < 1) {
			throw new IllegalArgumentException("Worker count must be at least 1: " + workerCount);
		}

		log.debug("Planning {} units across {} workers with seed {}", units.size(), workerCount, seed);

		var estimated = new ArrayList<Estimate>();
		var unestimated = new ArrayList<Estimate>();
		for(var unit : units) {
			var cost = history.get(unit.id());
			if(cost != null) {
				estimated.add(new Estimate(unit, cost));
			}
			else {
				unestimated.add(new Estimate(unit, Duration.ZERO));
			}
		}

		estimated.sort(
			Comparator.comparing(Estimate::cost).reversed()
				.thenComparingInt(estimate -> estimate.unit().ordinal())
		);
		Collections.shuffle(unestimated, new Random(seed));

		var buckets = new ArrayList<List<ExecutionUnit>>(workerCount);
		var heap = new PriorityQueue<Load>(
			Comparator.comparing(Load::total)
				.thenComparingInt(Load::count)
				.thenComparingInt(Load::workerId)
		);
		for(int i = 0; i < workerCount; ++i) {
			buckets.add(new ArrayList<>());
			heap.add(new Load(i, Duration.ZERO, 0));
		}

		var totals = new Duration[workerCount];
		for(var estimate : concat(estimated, unestimated)) {
			var load = heap.remove();
			buckets.get(load.workerId()).add(estimate.unit());
			var next = load.plus(estimate.cost());
			totals[load.workerId()] = next.total();
			heap.add(next);
		}

		var queues = ImmutableList.<WorkerQueue>builder();
		for(int i = 0; i < workerCount; ++i) {
			var bucket = buckets.get(i);
			// Discovery order within a worker keeps scope-shared fixtures alive for as short as possible.
			bucket.sort(Comparator.comparingInt(ExecutionUnit::ordinal));
			var total = totals[i] == null ? Duration.ZERO : totals[i];
			queues.add(new WorkerQueue(i, ImmutableList.copyOf(bucket), total));
		}
		return queues.build();
	}

	private static List<Estimate> concat(List<Estimate> first, List<Estimate> second) {
		var all = new ArrayList<Estimate>(first.size() + second.size());
		all.addAll(first);
		all.addAll(second);
		return all;
	}

	private record Estimate(ExecutionUnit unit, Duration cost) {}

	private record Load(int workerId, Duration total, int count) {
		Load plus(Duration cost) {
			return new Load(workerId, total.plus(cost), count + 1);
		}
	}
}
