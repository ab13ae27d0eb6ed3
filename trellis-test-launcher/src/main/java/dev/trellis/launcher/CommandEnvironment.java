package dev.trellis.launcher;

import com.google.common.collect.ImmutableMap;
import dev.trellis.testrunner.fixture.FixtureRequest;
import dev.trellis.testrunner.item.TestInvocation;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Map;

/**
 * Environment variables through which commands receive fixture values and arguments.
 */
public final class CommandEnvironment {
	private CommandEnvironment() {}

	public static final String UNIT = "TRELLIS_UNIT";
	public static final String FIXTURE_PREFIX = "TRELLIS_FIXTURE_";
	public static final String PARAM_PREFIX = "TRELLIS_PARAM_";
	public static final String PARAM = "TRELLIS_PARAM";
	public static final String VALUE = "TRELLIS_VALUE";

	public static ImmutableMap<String, String> forTest(TestInvocation invocation) {
		var env = ImmutableMap.<String, String>builder();
		env.put(UNIT, invocation.unitId());
		putAll(env, FIXTURE_PREFIX, invocation.fixtures());
		putAll(env, PARAM_PREFIX, invocation.arguments());
		return env.buildKeepingLast();
	}

	public static ImmutableMap<String, String> forSetUp(FixtureRequest request) {
		var env = ImmutableMap.<String, String>builder();
		env.put(UNIT, request.unitId());
		putAll(env, FIXTURE_PREFIX, request.dependencies());
		if(request.parameter() != null) {
			env.put(PARAM, request.parameter().toString());
		}
		return env.buildKeepingLast();
	}

	public static ImmutableMap<String, String> forTearDown(FixtureRequest request, @Nullable Object value) {
		var env = ImmutableMap.<String, String>builder();
		env.putAll(forSetUp(request));
		if(value != null) {
			env.put(VALUE, value.toString());
		}
		return env.buildKeepingLast();
	}

	// "db-url" becomes DB_URL.
	public static String variableName(String prefix, String name) {
		var sanitized = new StringBuilder(prefix.length() + name.length());
		sanitized.append(prefix);
		for(char c : name.toUpperCase(Locale.ROOT).toCharArray()) {
			if((c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_') {
				sanitized.append(c);
			}
			else {
				sanitized.append('_');
			}
		}
		return sanitized.toString();
	}

	private static void putAll(ImmutableMap.Builder<String, String> env, String prefix, Map<String, ?> values) {
		for(var entry : values.entrySet()) {
			if(entry.getValue() != null) {
				env.put(variableName(prefix, entry.getKey()), entry.getValue().toString());
			}
		}
	}
}
