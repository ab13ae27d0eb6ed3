package dev.trellis.testrunner.execution;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Multiset;
import dev.trellis.testrunner.fixture.FixtureKey;
import dev.trellis.testrunner.item.TestIdentity;
import dev.trellis.testrunner.resolve.ExecutionUnit;
import dev.trellis.testrunner.resolve.PlannedFixture;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Live group, module and session fixture instances of one worker.
 * An instance is created by the first unit that needs it and torn down after the last unit
 * of the worker's queue that needs it. Only the owning worker thread touches it.
 */
final class ScopeManager {

	private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ScopeManager.class);

	ScopeManager(FixtureInvoker invoker, Iterable<ExecutionUnit> queue) {
		this.invoker = invoker;
		for(var unit : queue) {
			for(var fixture : unit.plan().shared()) {
				consumers.add(instanceKey(fixture, unit));
			}
		}
	}

	private final FixtureInvoker invoker;
	private final Multiset<InstanceKey> consumers = HashMultiset.create();

	// Insertion order is creation order.
	private final Map<InstanceKey, LiveFixture> live = new LinkedHashMap<>();

	Object acquire(PlannedFixture fixture, ExecutionUnit unit, Map<FixtureKey, Object> values) throws Exception {
		var key = instanceKey(fixture, unit);
		var existing = live.get(key);
		if(existing != null) {
			return existing.value();
		}

		var created = invoker.setUp(fixture, unit.id(), values);
		live.put(key, created);
		return created.value();
	}

	// Called once per unit after it finished, whatever its outcome.
	ImmutableList<FailureDetail> release(ExecutionUnit unit) {
		var expired = new HashSet<InstanceKey>();
		for(var fixture : unit.plan().shared()) {
			var key = instanceKey(fixture, unit);
			consumers.remove(key);
			if(consumers.count(key) == 0) {
				expired.add(key);
			}
		}
		return tearDown(expired);
	}

	ImmutableList<FailureDetail> closeAll() {
		if(!live.isEmpty()) {
			log.debug("Tearing down {} remaining shared fixtures", live.size());
		}
		consumers.clear();
		return tearDown(new HashSet<>(live.keySet()));
	}

	private ImmutableList<FailureDetail> tearDown(Set<InstanceKey> keys) {
		var failures = ImmutableList.<FailureDetail>builder();
		var entries = Lists.reverse(new ArrayList<>(live.entrySet()));
		for(var entry : entries) {
			if(!keys.contains(entry.getKey())) {
				continue;
			}

			live.remove(entry.getKey());
			invoker.tearDown(entry.getValue()).ifPresent(failures::add);
		}
		return failures.build();
	}

	static InstanceKey instanceKey(PlannedFixture fixture, ExecutionUnit unit) {
		return new InstanceKey(
			fixture.key(),
			scopeInstance(fixture, unit.identity()),
			fixture.parameterSignature(),
			fixture.resolvedDependencies()
		);
	}

	private static String scopeInstance(PlannedFixture fixture, TestIdentity identity) {
		return switch(fixture.scope()) {
			case SESSION -> "";
			case MODULE -> identity.modulePath();
			case GROUP -> identity.modulePath() + TestIdentity.SEPARATOR + (identity.group() == null ? "" : identity.group());
			case FUNCTION -> throw new IllegalArgumentException("Not a shared scope: " + fixture.scope());
		};
	}

	// Units whose visible overrides give a fixture different dependencies get separate instances.
	record InstanceKey(
		FixtureKey fixture,
		String scopeInstance,
		ImmutableSortedMap<String, Integer> parameters,
		ImmutableSet<FixtureKey> dependencies
	) {}
}
