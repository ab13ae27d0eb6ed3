package dev.trellis.launcher;

import java.io.IOException;
import java.nio.file.Path;

public class ManifestException extends IOException {
	public ManifestException(Path manifest, String message) {
		super(manifest + ": " + message);
		this.manifest = manifest;
	}

	public ManifestException(Path manifest, String message, Throwable cause) {
		super(manifest + ": " + message, cause);
		this.manifest = manifest;
	}

	private final Path manifest;

	public Path getManifest() {
		return manifest;
	}
}
