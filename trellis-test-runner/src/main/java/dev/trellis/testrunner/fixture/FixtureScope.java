package dev.trellis.testrunner.fixture;

public enum FixtureScope {
	FUNCTION("function"),
	GROUP("group"),
	MODULE("module"),
	SESSION("session"),
	;

	FixtureScope(String id) {
		this.id = id;
	}

	private final String id;

	public String scopeId() {
		return id;
	}

	public boolean isWiderThan(FixtureScope other) {
		return compareTo(other) > 0;
	}

	// Instances outlive a single unit and are shared by every unit of the scope on a worker.
	public boolean isShared() {
		return this != FUNCTION;
	}

	public static FixtureScope fromId(String id) {
		for(var scope : values()) {
			if(scope.id.equalsIgnoreCase(id)) {
				return scope;
			}
		}

		throw new IllegalArgumentException("Unknown fixture scope: " + id);
	}
}
