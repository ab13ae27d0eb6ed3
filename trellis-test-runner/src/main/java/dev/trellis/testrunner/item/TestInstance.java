package dev.trellis.testrunner.item;

import com.google.common.collect.ImmutableMap;
import org.jetbrains.annotations.NotNull;

public record TestInstance(
	@NotNull TestItem item,
	int parameterIndex,
	@NotNull ImmutableMap<String, Object> arguments
) {
	public static final int NOT_PARAMETRIZED = -1;

	public TestIdentity identity() {
		return item.identity();
	}

	public boolean isParametrized() {
		return parameterIndex != NOT_PARAMETRIZED;
	}

	public String displayName() {
		if(!isParametrized()) {
			return identity().qualifiedName();
		}
		return identity().qualifiedName() + "[" + parameterIndex + "]";
	}

	@Override
	public String toString() {
		return displayName();
	}
}
