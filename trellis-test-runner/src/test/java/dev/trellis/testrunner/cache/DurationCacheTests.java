package dev.trellis.testrunner.cache;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

public class DurationCacheTests {

	@TempDir
	Path cacheDir;

	@Test
	void historyComesFromStore() throws Exception {
		var store = JsonDurationStore.inDirectory(cacheDir);
		store.save(Map.of("a::test_x", Duration.ofSeconds(4)));

		var cache = new DurationCache(store);

		Assertions.assertEquals(Map.of("a::test_x", Duration.ofSeconds(4)), cache.history(false));
	}

	@Test
	void noCacheHidesHistoryButKeepsItOnSave() throws Exception {
		var store = JsonDurationStore.inDirectory(cacheDir);
		store.save(Map.of("a::test_old", Duration.ofSeconds(4)));

		var cache = new DurationCache(store);
		Assertions.assertTrue(cache.history(true).isEmpty());

		cache.record("a::test_new", Duration.ofMillis(250));
		cache.save();

		Assertions.assertEquals(Map.of(
			"a::test_old", Duration.ofSeconds(4),
			"a::test_new", Duration.ofMillis(250)
		), store.load());
	}

	@Test
	void observedDurationsReplaceStoredOnes() throws Exception {
		var store = JsonDurationStore.inDirectory(cacheDir);
		store.save(Map.of("a::test_x", Duration.ofSeconds(4)));

		var cache = new DurationCache(store);
		cache.record("a::test_x", Duration.ofSeconds(1));
		cache.save();

		Assertions.assertEquals(Map.of("a::test_x", Duration.ofSeconds(1)), store.load());
	}

	@Test
	void corruptStoreIsTreatedAsEmpty() throws Exception {
		var store = JsonDurationStore.inDirectory(cacheDir);
		Files.writeString(store.getFile(), "not json", StandardCharsets.UTF_8);

		var cache = new DurationCache(store);

		Assertions.assertTrue(cache.history(false).isEmpty());
	}

	@Test
	void nothingIsWrittenWithoutObservations() throws Exception {
		var store = JsonDurationStore.inDirectory(cacheDir.resolve("never"));

		new DurationCache(store).save();

		Assertions.assertFalse(Files.exists(store.getFile()));
	}
}
