package dev.trellis.testrunner.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

// Stores durations as a JSON object of unit id to elapsed milliseconds.
public final class JsonDurationStore implements DurationStore {

	public static final String FILE_NAME = "durations.json";

	public JsonDurationStore(Path file) {
		this.file = file;
	}

	private final Path file;
	private final ObjectMapper mapper = new ObjectMapper()
		.enable(SerializationFeature.INDENT_OUTPUT);

	public static JsonDurationStore inDirectory(Path cacheDir) {
		return new JsonDurationStore(cacheDir.resolve(FILE_NAME));
	}

	public Path getFile() {
		return file;
	}

	@Override
	public Map<String, Duration> load() throws IOException {
		if(!Files.exists(file)) {
			return Map.of();
		}

		Map<String, Long> millis = mapper.readValue(file.toFile(), new TypeReference<LinkedHashMap<String, Long>>() {});
		var durations = new LinkedHashMap<String, Duration>();
		for(var entry : millis.entrySet()) {
			if(entry.getValue() != null && entry.getValue() >= 0) {
				durations.put(entry.getKey(), Duration.ofMillis(entry.getValue()));
			}
		}
		return durations;
	}

	@Override
	public void save(Map<String, Duration> durations) throws IOException {
		var millis = new TreeMap<String, Long>();
		for(var entry : durations.entrySet()) {
			millis.put(entry.getKey(), entry.getValue().toMillis());
		}

		var dir = file.toAbsolutePath().getParent();
		Files.createDirectories(dir);
		var temp = Files.createTempFile(dir, FILE_NAME, ".tmp");
		try {
			mapper.writeValue(temp.toFile(), millis);
			Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		}
		finally {
			Files.deleteIfExists(temp);
		}
	}
}
