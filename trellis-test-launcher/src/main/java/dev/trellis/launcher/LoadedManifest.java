package dev.trellis.launcher;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class LoadedManifest {

	public LoadedManifest(List<String> directories, String baseName, Path file, ModuleManifest manifest) {
		this.directories = directories;
		this.baseName = baseName;
		this.file = file;
		this.manifest = manifest;
	}

	public static final String SESSION_MANIFEST = "session";

	private final List<String> directories;
	private final String baseName;
	private final Path file;
	private final ModuleManifest manifest;

	public String getBaseName() {
		return baseName;
	}

	public Path getFile() {
		return file;
	}

	public ModuleManifest getManifest() {
		return manifest;
	}

	// Commands run next to their manifest.
	public Path getWorkingDirectory() {
		var parent = file.toAbsolutePath().getParent();
		return parent == null ? file.toAbsolutePath() : parent;
	}

	public String getModulePath() {
		var parts = new ArrayList<>(directories);
		parts.add(baseName);
		return String.join("/", parts);
	}

	public boolean isSessionManifest() {
		return directories.isEmpty() && baseName.equals(SESSION_MANIFEST);
	}

	@Override
	public String toString() {
		return getModulePath() + " (" + file + ")";
	}
}
