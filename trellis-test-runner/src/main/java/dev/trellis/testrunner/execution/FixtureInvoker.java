package dev.trellis.testrunner.execution;

import dev.trellis.testrunner.fixture.FixtureKey;
import dev.trellis.testrunner.fixture.FixtureRequest;
import dev.trellis.testrunner.resolve.PlannedFixture;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

final class FixtureInvoker {

	private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(FixtureInvoker.class);

	// values holds every fixture set up so far for the unit, keyed by definition.
	LiveFixture setUp(PlannedFixture fixture, String unitId, Map<FixtureKey, Object> values) throws Exception {
		var dependencies = new LinkedHashMap<String, Object>();
		for(var dependency : fixture.dependencies().entrySet()) {
			dependencies.put(dependency.getKey(), values.get(dependency.getValue()));
		}

		var request = new FixtureRequest(
			fixture.name(),
			fixture.scope(),
			unitId,
			fixture.parameterIndex(),
			fixture.parameter(),
			Collections.unmodifiableMap(dependencies)
		);

		log.trace("Setting up fixture {} for {}", fixture, unitId);
		// Async operations are awaited by their default setUp.
		var value = fixture.definition().operation().setUp(request);
		return new LiveFixture(fixture, request, value);
	}

	Optional<FailureDetail> tearDown(LiveFixture live) {
		log.trace("Tearing down fixture {}", live.fixture());
		try {
			live.fixture().definition().operation().tearDown(live.request(), live.value());
			return Optional.empty();
		}
		catch(Exception | AssertionError e) {
			log.warn("Teardown of fixture {} failed", live.fixture(), e);
			return Optional.of(FailureDetail.teardown(live.name(), e));
		}
	}
}
