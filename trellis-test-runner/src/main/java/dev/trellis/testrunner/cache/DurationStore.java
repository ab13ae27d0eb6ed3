package dev.trellis.testrunner.cache;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

public interface DurationStore {
	// An absent store yields an empty map, never an error.
	Map<String, Duration> load() throws IOException;

	void save(Map<String, Duration> durations) throws IOException;

	static DurationStore disabled() {
		return Disabled.INSTANCE;
	}

	final class Disabled implements DurationStore {
		private Disabled() { }

		private static final Disabled INSTANCE = new Disabled();

		@Override
		public Map<String, Duration> load() {
			return Map.of();
		}

		@Override
		public void save(Map<String, Duration> durations) {}
	}
}
