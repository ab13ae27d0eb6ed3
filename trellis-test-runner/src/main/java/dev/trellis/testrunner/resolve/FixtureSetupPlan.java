package dev.trellis.testrunner.resolve;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import dev.trellis.testrunner.fixture.FixtureKey;
import org.jetbrains.annotations.NotNull;

import java.util.Optional;

public final class FixtureSetupPlan {

	public FixtureSetupPlan(ImmutableList<PlannedFixture> setupOrder, ImmutableMap<String, FixtureKey> requested) {
		this.setupOrder = setupOrder;
		this.requested = requested;
	}

	private final ImmutableList<PlannedFixture> setupOrder;
	private final ImmutableMap<String, FixtureKey> requested;

	public static FixtureSetupPlan empty() {
		return new FixtureSetupPlan(ImmutableList.of(), ImmutableMap.of());
	}

	// Every fixture appears after all of its dependencies.
	public @NotNull ImmutableList<PlannedFixture> setupOrder() {
		return setupOrder;
	}

	public @NotNull ImmutableList<PlannedFixture> teardownOrder() {
		return setupOrder.reverse();
	}

	public @NotNull ImmutableList<PlannedFixture> shared() {
		return setupOrder.stream()
			.filter(fixture -> fixture.scope().isShared())
			.collect(ImmutableList.toImmutableList());
	}

	// Names the test body asked for (including auto-use fixtures) and the definitions providing them.
	public @NotNull ImmutableMap<String, FixtureKey> requested() {
		return requested;
	}

	public Optional<PlannedFixture> find(FixtureKey key) {
		return setupOrder.stream()
			.filter(fixture -> fixture.key().equals(key))
			.findFirst();
	}

	public boolean isEmpty() {
		return setupOrder.isEmpty();
	}

	@Override
	public String toString() {
		return "FixtureSetupPlan" + setupOrder;
	}
}
