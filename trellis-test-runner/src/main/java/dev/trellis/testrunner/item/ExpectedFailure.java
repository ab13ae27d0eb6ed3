package dev.trellis.testrunner.item;

import org.jetbrains.annotations.Nullable;

public record ExpectedFailure(@Nullable String reason) {
	public static ExpectedFailure withoutReason() {
		return new ExpectedFailure(null);
	}
}
