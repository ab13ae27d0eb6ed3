package dev.trellis.testrunner.filter;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Set;

public class TagExpressionTests {

	private static boolean matches(String expression, String... tags) throws TagExpressionException {
		return TagExpression.parse(expression).matches(Set.of(tags));
	}

	@Test
	void singleTag() throws Exception {
		Assertions.assertTrue(matches("slow", "slow", "db"));
		Assertions.assertFalse(matches("slow", "db"));
	}

	@Test
	void notBindsTighterThanAndWhichBindsTighterThanOr() throws Exception {
		Assertions.assertTrue(matches("a or b and not c", "a", "c"));
		Assertions.assertTrue(matches("a or b and not c", "b"));
		Assertions.assertFalse(matches("a or b and not c", "b", "c"));
		Assertions.assertFalse(matches("a or b and not c"));
	}

	@Test
	void parenthesesOverridePrecedence() throws Exception {
		Assertions.assertFalse(matches("(a or b) and c", "a"));
		Assertions.assertTrue(matches("(a or b) and c", "b", "c"));
		Assertions.assertTrue(matches("not (a and b)", "a"));
		Assertions.assertFalse(matches("not (a and b)", "a", "b"));
	}

	@Test
	void doubleNegation() throws Exception {
		Assertions.assertTrue(matches("not not fast", "fast"));
	}

	@Test
	void tagsMayContainPunctuation() throws Exception {
		Assertions.assertTrue(matches("team:storage and py3.11", "team:storage", "py3.11"));
	}

	@Test
	void errorsCarryPosition() {
		assertError("a and", 5);
		assertError("a )", 2);
		assertError("(a or b", 7);
		assertError("a & b", 2);
		assertError("   ", 0);
		assertError("a b", 2);
	}

	private static void assertError(String expression, int position) {
		var e = Assertions.assertThrows(TagExpressionException.class, () -> TagExpression.parse(expression));
		Assertions.assertEquals(position, e.getPosition(), e.getMessage());
		Assertions.assertEquals(expression, e.getExpression());
	}
}
