package dev.trellis.testrunner.execution;

import org.jetbrains.annotations.Nullable;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative stop signal shared by the coordinator and its workers.
 * Workers check it between units; a unit already running always finishes.
 */
public final class CancellationToken {

	private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(CancellationToken.class);

	private final AtomicReference<StopReason> reason = new AtomicReference<>();

	// Only the first reason is kept.
	public boolean cancel(StopReason stopReason) {
		if(reason.compareAndSet(null, stopReason)) {
			log.info("Stopping run: {}", stopReason);
			return true;
		}
		return false;
	}

	public boolean isCancelled() {
		return reason.get() != null;
	}

	public @Nullable StopReason reason() {
		return reason.get();
	}
}
