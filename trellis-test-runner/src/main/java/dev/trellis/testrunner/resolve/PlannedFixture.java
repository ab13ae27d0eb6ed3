package dev.trellis.testrunner.resolve;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import dev.trellis.testrunner.fixture.FixtureDef;
import dev.trellis.testrunner.fixture.FixtureKey;
import dev.trellis.testrunner.fixture.FixtureScope;
import dev.trellis.testrunner.item.TestInstance;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One fixture of a setup plan.
 *
 * @param dependencies requested name to the definition that satisfies it
 * @param parameterSignature parameter index of every parametrized fixture this instance depends on,
 *                           itself included
 * @param resolvedDependencies every definition this instance depends on, directly or transitively;
 *                             two units share an instance only if both this and the signature match
 */
public record PlannedFixture(
	@NotNull FixtureDef definition,
	int parameterIndex,
	@NotNull ImmutableMap<String, FixtureKey> dependencies,
	@NotNull ImmutableSortedMap<String, Integer> parameterSignature,
	@NotNull ImmutableSet<FixtureKey> resolvedDependencies
) {
	public FixtureKey key() {
		return definition.key();
	}

	public String name() {
		return definition.name();
	}

	public FixtureScope scope() {
		return definition.scope();
	}

	public boolean isParametrized() {
		return parameterIndex != TestInstance.NOT_PARAMETRIZED;
	}

	public @Nullable Object parameter() {
		if(!isParametrized()) {
			return null;
		}
		return definition.parameters().get(parameterIndex);
	}

	@Override
	public String toString() {
		if(!isParametrized()) {
			return key().toString();
		}
		return key() + "[" + parameterIndex + "]";
	}
}
