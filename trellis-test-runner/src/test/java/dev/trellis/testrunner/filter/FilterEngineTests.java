package dev.trellis.testrunner.filter;

import dev.trellis.testrunner.item.TestIdentity;
import dev.trellis.testrunner.item.TestItem;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class FilterEngineTests {

	private static final TestItem SLOW_DB = TestItem.builder(new TestIdentity("tests/storage", "Postgres", "test_insert"))
		.body(invocation -> {})
		.tags(List.of("slow", "db"))
		.build();

	private static final TestItem FAST = TestItem.builder(TestIdentity.of("tests/util", "test_parse"))
		.body(invocation -> {})
		.tag("fast")
		.build();

	private static FilterEngine engine(List<String> patterns, List<String> tags) throws TagExpressionException {
		return new FilterEngine(NameFilterSet.compile(patterns), TagFilterSet.parse(tags));
	}

	@Test
	void emptyFiltersPassEverything() throws Exception {
		var engine = engine(List.of(), List.of());

		Assertions.assertTrue(engine.isPassThrough());
		Assertions.assertTrue(engine.matches(SLOW_DB));
		Assertions.assertTrue(engine.matches(FAST));
	}

	@Test
	void namePatternsMatchAnywhereInQualifiedName() throws Exception {
		var engine = engine(List.of("Postgres::"), List.of());

		Assertions.assertTrue(engine.matches(SLOW_DB));
		Assertions.assertFalse(engine.matches(FAST));
	}

	@Test
	void anyNamePatternSuffices() throws Exception {
		var engine = engine(List.of("^tests/util", "insert$"), List.of());

		Assertions.assertTrue(engine.matches(SLOW_DB));
		Assertions.assertTrue(engine.matches(FAST));
	}

	@Test
	void anyTagExpressionSuffices() throws Exception {
		var engine = engine(List.of(), List.of("slow and not db", "fast"));

		Assertions.assertFalse(engine.matches(SLOW_DB));
		Assertions.assertTrue(engine.matches(FAST));
	}

	@Test
	void namesAndTagsMustBothMatch() throws Exception {
		var engine = engine(List.of("storage"), List.of("fast"));

		Assertions.assertFalse(engine.matches(SLOW_DB));
		Assertions.assertFalse(engine.matches(FAST));
	}

	@Test
	void staticMatchUsesParsedExpressions() throws Exception {
		Assertions.assertTrue(FilterEngine.matches(SLOW_DB, List.of("insert"), List.of(TagExpression.parse("db"))));
	}
}
