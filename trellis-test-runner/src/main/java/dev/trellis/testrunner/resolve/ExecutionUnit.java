package dev.trellis.testrunner.resolve;

import dev.trellis.testrunner.item.TestIdentity;
import dev.trellis.testrunner.item.TestInstance;
import dev.trellis.testrunner.item.TestItem;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Objects;

public final class ExecutionUnit {

	public ExecutionUnit(int ordinal, TestInstance instance, FixtureSetupPlan plan) {
		this.ordinal = ordinal;
		this.instance = Objects.requireNonNull(instance, "instance");
		this.plan = Objects.requireNonNull(plan, "plan");
		this.id = buildId(instance, plan);
	}

	private final int ordinal;
	private final TestInstance instance;
	private final FixtureSetupPlan plan;
	private final String id;

	public int ordinal() {
		return ordinal;
	}

	public @NotNull String id() {
		return id;
	}

	public @NotNull TestInstance instance() {
		return instance;
	}

	public @NotNull TestItem item() {
		return instance.item();
	}

	public @NotNull TestIdentity identity() {
		return instance.identity();
	}

	public @NotNull FixtureSetupPlan plan() {
		return plan;
	}

	static String buildId(TestInstance instance, FixtureSetupPlan plan) {
		var parts = new ArrayList<String>();
		if(instance.isParametrized()) {
			parts.add(Integer.toString(instance.parameterIndex()));
		}

		for(var fixture : plan.setupOrder()) {
			if(fixture.isParametrized()) {
				parts.add(fixture.name() + "=" + fixture.parameterIndex());
			}
		}

		var name = instance.identity().qualifiedName();
		if(parts.isEmpty()) {
			return name;
		}
		return name + "[" + String.join(",", parts) + "]";
	}

	@Override
	public boolean equals(Object o) {
		if(this == o) return true;
		if(!(o instanceof ExecutionUnit other)) return false;
		return ordinal == other.ordinal && id.equals(other.id);
	}

	@Override
	public int hashCode() {
		return Objects.hash(ordinal, id);
	}

	@Override
	public String toString() {
		return id;
	}
}
