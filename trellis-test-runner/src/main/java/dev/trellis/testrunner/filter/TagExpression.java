package dev.trellis.testrunner.filter;

import org.jetbrains.annotations.NotNull;

import java.util.Set;

public sealed interface TagExpression permits TagExpression.Tag, TagExpression.Not, TagExpression.And, TagExpression.Or {
	boolean matches(Set<String> tags);

	static TagExpression parse(String expression) throws TagExpressionException {
		return new TagExpressionParser(expression).parse();
	}

	record Tag(@NotNull String name) implements TagExpression {
		@Override
		public boolean matches(Set<String> tags) {
			return tags.contains(name);
		}

		@Override
		public String toString() {
			return name;
		}
	}

	record Not(@NotNull TagExpression operand) implements TagExpression {
		@Override
		public boolean matches(Set<String> tags) {
			return !operand.matches(tags);
		}

		@Override
		public String toString() {
			return "not " + operand;
		}
	}

	record And(@NotNull TagExpression left, @NotNull TagExpression right) implements TagExpression {
		@Override
		public boolean matches(Set<String> tags) {
			return left.matches(tags) && right.matches(tags);
		}

		@Override
		public String toString() {
			return "(" + left + " and " + right + ")";
		}
	}

	record Or(@NotNull TagExpression left, @NotNull TagExpression right) implements TagExpression {
		@Override
		public boolean matches(Set<String> tags) {
			return left.matches(tags) || right.matches(tags);
		}

		@Override
		public String toString() {
			return "(" + left + " or " + right + ")";
		}
	}
}
