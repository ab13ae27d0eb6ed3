package dev.trellis.launcher;

import java.util.List;

public enum Shell {
	POSIX("sh", "-c"),
	WINDOWS("cmd.exe", "/c"),
	;

	Shell(String executable, String commandFlag) {
		this.executable = executable;
		this.commandFlag = commandFlag;
	}

	private final String executable;
	private final String commandFlag;

	public List<String> commandLine(String command) {
		return List.of(executable, commandFlag, command);
	}

	public static Shell current() {
		var osName = System.getProperty("os.name", "");
		if(osName.startsWith("Windows")) {
			return WINDOWS;
		}
		return POSIX;
	}
}
