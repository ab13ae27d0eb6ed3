package dev.trellis.testrunner.execution;

import dev.trellis.testrunner.resolve.ResolutionError;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Why a unit did not pass.
 *
 * @param fixtureName the fixture whose setup or teardown failed, for {@link FailureKind#SETUP} and {@link FailureKind#TEARDOWN}
 */
public record FailureDetail(
	@NotNull FailureKind kind,
	@NotNull String message,
	@Nullable String fixtureName,
	@Nullable Throwable cause,
	@Nullable ResolutionError resolutionError
) {
	public static FailureDetail resolution(ResolutionError error) {
		return new FailureDetail(FailureKind.RESOLUTION, error.toString(), null, null, error);
	}

	public static FailureDetail setup(String fixtureName, Throwable cause) {
		return new FailureDetail(FailureKind.SETUP, "Setup of fixture " + fixtureName + " failed: " + describe(cause), fixtureName, cause, null);
	}

	public static FailureDetail teardown(String fixtureName, Throwable cause) {
		return new FailureDetail(FailureKind.TEARDOWN, "Teardown of fixture " + fixtureName + " failed: " + describe(cause), fixtureName, cause, null);
	}

	public static FailureDetail body(Throwable cause) {
		return new FailureDetail(FailureKind.BODY, describe(cause), null, cause, null);
	}

	public static FailureDetail unexpectedPass(@Nullable String reason) {
		var message = reason == null ? "Expected failure but passed" : "Expected failure but passed: " + reason;
		return new FailureDetail(FailureKind.BODY, message, null, null, null);
	}

	public static FailureDetail infrastructure(String message, @Nullable Throwable cause) {
		return new FailureDetail(FailureKind.INFRASTRUCTURE, message, null, cause, null);
	}

	static String describe(Throwable cause) {
		var message = cause.getMessage();
		if(message == null || message.isEmpty()) {
			return cause.getClass().getName();
		}
		return cause.getClass().getSimpleName() + ": " + message;
	}

	@Override
	public String toString() {
		return kind + ": " + message;
	}
}
