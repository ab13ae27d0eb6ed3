package dev.trellis.testrunner.filter;

import com.google.common.collect.ImmutableList;

import java.util.Set;

// Passes a tag set matching any of the expressions; an empty set passes everything.
public final class TagFilterSet {

	public TagFilterSet(Iterable<TagExpression> expressions) {
		this.expressions = ImmutableList.copyOf(expressions);
	}

	private final ImmutableList<TagExpression> expressions;

	public static TagFilterSet parse(Iterable<String> expressions) throws TagExpressionException {
		var parsed = ImmutableList.<TagExpression>builder();
		for(var expression : expressions) {
			parsed.add(TagExpression.parse(expression));
		}
		return new TagFilterSet(parsed.build());
	}

	public boolean isEmpty() {
		return expressions.isEmpty();
	}

	public boolean matches(Set<String> tags) {
		if(expressions.isEmpty()) {
			return true;
		}

		for(var expression : expressions) {
			if(expression.matches(tags)) {
				return true;
			}
		}
		return false;
	}
}
