package dev.trellis.testrunner.item;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * What a test body receives: the values of the fixtures it requested (by requested name)
 * and the arguments of its parametrized instance.
 */
public record TestInvocation(
	@NotNull String unitId,
	@NotNull Map<String, Object> fixtures,
	@NotNull Map<String, Object> arguments
) {
	public @Nullable Object fixture(String name) {
		if(!fixtures.containsKey(name)) {
			throw new IllegalArgumentException("Fixture was not requested: " + name);
		}
		return fixtures.get(name);
	}

	public @Nullable Object argument(String name) {
		return arguments.get(name);
	}
}
