package dev.trellis.testrunner.fixture;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class FixtureDef {

	private FixtureDef(Builder builder, FixtureScope scope) {
		this.name = builder.name;
		this.declaredIn = builder.declaredIn;
		this.scope = scope;
		this.dependencies = ImmutableList.copyOf(builder.dependencies);
		this.operation = Objects.requireNonNull(builder.operation, "operation");
		this.parameters = ImmutableList.copyOf(builder.parameters);
		this.autoUse = builder.autoUse;
	}

	private final String name;
	private final ScopeNode declaredIn;
	private final FixtureScope scope;
	private final ImmutableList<String> dependencies;
	private final FixtureOperation operation;
	private final ImmutableList<Object> parameters;
	private final boolean autoUse;

	public static Builder builder(String name, ScopeNode declaredIn) {
		return new Builder(name, declaredIn);
	}

	public @NotNull String name() {
		return name;
	}

	public @NotNull ScopeNode declaredIn() {
		return declaredIn;
	}

	public @NotNull FixtureKey key() {
		return new FixtureKey(declaredIn, name);
	}

	public @NotNull FixtureScope scope() {
		return scope;
	}

	public @NotNull ImmutableList<String> dependencies() {
		return dependencies;
	}

	public @NotNull FixtureOperation operation() {
		return operation;
	}

	public @NotNull ImmutableList<Object> parameters() {
		return parameters;
	}

	public boolean isParametrized() {
		return !parameters.isEmpty();
	}

	public boolean isAutoUse() {
		return autoUse;
	}

	@Override
	public String toString() {
		return "FixtureDef{" +
			"name='" + name + '\'' +
			", declaredIn=" + declaredIn +
			", scope=" + scope.scopeId() +
			", dependencies=" + dependencies +
			", parameters=" + parameters.size() +
			", autoUse=" + autoUse +
			'}';
	}

	public static final class Builder {
		private Builder(String name, ScopeNode declaredIn) {
			this.name = Objects.requireNonNull(name, "name");
			this.declaredIn = Objects.requireNonNull(declaredIn, "declaredIn");
		}

		private final String name;
		private final ScopeNode declaredIn;
		private FixtureScope scope = FixtureScope.FUNCTION;
		private DynamicScope dynamicScope;
		private final List<String> dependencies = new ArrayList<>();
		private FixtureOperation operation;
		private final List<Object> parameters = new ArrayList<>();
		private boolean autoUse = false;

		public Builder scope(FixtureScope scope) {
			this.scope = Objects.requireNonNull(scope, "scope");
			this.dynamicScope = null;
			return this;
		}

		public Builder dynamicScope(DynamicScope dynamicScope) {
			this.dynamicScope = Objects.requireNonNull(dynamicScope, "dynamicScope");
			return this;
		}

		public Builder requires(String... names) {
			dependencies.addAll(List.of(names));
			return this;
		}

		public Builder requires(Iterable<String> names) {
			names.forEach(dependencies::add);
			return this;
		}

		public Builder operation(FixtureOperation operation) {
			this.operation = operation;
			return this;
		}

		public Builder parameters(Iterable<?> values) {
			values.forEach(parameters::add);
			return this;
		}

		public Builder autoUse(boolean autoUse) {
			this.autoUse = autoUse;
			return this;
		}

		public FixtureDef build() throws InvalidFixtureException {
			FixtureScope resolvedScope = scope;
			if(dynamicScope != null) {
				try {
					resolvedScope = dynamicScope.resolve(name);
				}
				catch(Exception e) {
					throw new InvalidFixtureException("Failed to compute the scope of fixture " + name, e);
				}

				if(resolvedScope == null) {
					throw new InvalidFixtureException("Dynamic scope of fixture " + name + " returned no scope");
				}
			}

			return new FixtureDef(this, resolvedScope);
		}
	}
}
