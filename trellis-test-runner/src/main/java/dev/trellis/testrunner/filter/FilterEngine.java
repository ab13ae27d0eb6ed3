package dev.trellis.testrunner.filter;

import dev.trellis.testrunner.item.TestItem;

public final class FilterEngine {

	public FilterEngine(NameFilterSet names, TagFilterSet tags) {
		this.names = names;
		this.tags = tags;
	}

	private final NameFilterSet names;
	private final TagFilterSet tags;

	public boolean isPassThrough() {
		return names.isEmpty() && tags.isEmpty();
	}

	// Names are matched against the item's qualified name, without parametrization suffixes.
	public boolean matches(TestItem item) {
		return names.matches(item.identity().qualifiedName()) && tags.matches(item.tags());
	}

	public static boolean matches(TestItem item, Iterable<String> namePatterns, Iterable<TagExpression> tagExpressions) {
		return new FilterEngine(NameFilterSet.compile(namePatterns), new TagFilterSet(tagExpressions)).matches(item);
	}
}
