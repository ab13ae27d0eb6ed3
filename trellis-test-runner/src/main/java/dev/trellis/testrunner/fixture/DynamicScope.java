package dev.trellis.testrunner.fixture;

/**
 * Computes a fixture's scope when its definition is built during discovery.
 */
@FunctionalInterface
public interface DynamicScope {
	FixtureScope resolve(String fixtureName) throws Exception;
}
