package dev.trellis.testrunner.fixture;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Passed to a fixture operation: the values of the fixtures it requested, keyed by requested name,
 * and its parameter when the fixture is parametrized.
 */
public record FixtureRequest(
	@NotNull String fixtureName,
	@NotNull FixtureScope scope,
	@NotNull String unitId,
	int parameterIndex,
	@Nullable Object parameter,
	@NotNull Map<String, Object> dependencies
) {
	public @Nullable Object dependency(String name) {
		if(!dependencies.containsKey(name)) {
			throw new IllegalArgumentException("Fixture " + fixtureName + " did not request " + name);
		}
		return dependencies.get(name);
	}
}
