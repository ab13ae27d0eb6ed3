package dev.trellis.testrunner.item;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.function.BooleanSupplier;

public record SkipCondition(@NotNull BooleanSupplier predicate, @Nullable String reason) {
	public static SkipCondition always(@Nullable String reason) {
		return new SkipCondition(() -> true, reason);
	}

	public static SkipCondition when(BooleanSupplier predicate, @Nullable String reason) {
		return new SkipCondition(predicate, reason);
	}

	public boolean shouldSkip() {
		return predicate.getAsBoolean();
	}
}
