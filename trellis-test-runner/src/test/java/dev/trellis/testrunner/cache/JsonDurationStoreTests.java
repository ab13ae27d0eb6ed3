package dev.trellis.testrunner.cache;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

public class JsonDurationStoreTests {

	@TempDir
	Path cacheDir;

	@Test
	void missingFileLoadsAsEmpty() throws Exception {
		var store = JsonDurationStore.inDirectory(cacheDir.resolve("absent"));

		Assertions.assertEquals(Map.of(), store.load());
	}

	@Test
	void savedDurationsAreLoadedBack() throws Exception {
		var store = JsonDurationStore.inDirectory(cacheDir.resolve("nested"));
		store.save(Map.of(
			"tests/a::test_x", Duration.ofMillis(1500),
			"tests/b::test_y[0]", Duration.ofSeconds(2)
		));

		Assertions.assertTrue(Files.isRegularFile(cacheDir.resolve("nested").resolve(JsonDurationStore.FILE_NAME)));
		Assertions.assertEquals(Map.of(
			"tests/a::test_x", Duration.ofMillis(1500),
			"tests/b::test_y[0]", Duration.ofSeconds(2)
		), store.load());
	}

	@Test
	void negativeEntriesAreIgnored() throws Exception {
		var store = JsonDurationStore.inDirectory(cacheDir);
		Files.writeString(store.getFile(), "{\"a::test_ok\": 10, \"a::test_bad\": -5}", StandardCharsets.UTF_8);

		Assertions.assertEquals(Map.of("a::test_ok", Duration.ofMillis(10)), store.load());
	}
}
