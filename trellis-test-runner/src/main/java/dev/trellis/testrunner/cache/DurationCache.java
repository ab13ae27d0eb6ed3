package dev.trellis.testrunner.cache;

import com.google.common.collect.ImmutableMap;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Historical unit durations. Loaded once before planning and written once after the run,
 * both from the coordinating thread.
 */
public final class DurationCache {

	private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(DurationCache.class);

	public DurationCache(DurationStore store) {
		this.store = store;
	}

	private final DurationStore store;
	private Map<String, Duration> stored;
	private final Map<String, Duration> observed = new LinkedHashMap<>();

	// With noCache the stored history is kept for the final write but not handed out.
	public ImmutableMap<String, Duration> history(boolean noCache) {
		var loaded = loadStored();
		if(noCache) {
			return ImmutableMap.of();
		}
		return ImmutableMap.copyOf(loaded);
	}

	public void record(String unitId, Duration duration) {
		observed.put(unitId, duration);
	}

	public void save() throws IOException {
		if(observed.isEmpty()) {
			return;
		}

		var merged = new LinkedHashMap<>(loadStored());
		merged.putAll(observed);
		store.save(merged);
		log.debug("Saved {} test durations", merged.size());
	}

	private Map<String, Duration> loadStored() {
		if(stored == null) {
			try {
				stored = store.load();
			}
			catch(IOException e) {
				log.warn("Ignoring unreadable duration cache", e);
				stored = Map.of();
			}
		}
		return stored;
	}
}
