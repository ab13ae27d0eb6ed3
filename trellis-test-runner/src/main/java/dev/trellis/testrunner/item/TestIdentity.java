package dev.trellis.testrunner.item;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

public record TestIdentity(
	@NotNull String modulePath,
	@Nullable String group,
	@NotNull String function
) {
	public static final String SEPARATOR = "::";

	public TestIdentity {
		Objects.requireNonNull(modulePath, "modulePath");
		Objects.requireNonNull(function, "function");
		if(group != null && group.isEmpty()) {
			group = null;
		}
	}

	public static TestIdentity of(String modulePath, String function) {
		return new TestIdentity(modulePath, null, function);
	}

	public String qualifiedName() {
		var name = new StringBuilder(modulePath);
		if(group != null) {
			name.append(SEPARATOR).append(group);
		}
		name.append(SEPARATOR).append(function);
		return name.toString();
	}

	@Override
	public String toString() {
		return qualifiedName();
	}
}
