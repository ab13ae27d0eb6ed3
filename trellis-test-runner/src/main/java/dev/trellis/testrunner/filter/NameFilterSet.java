package dev.trellis.testrunner.filter;

import com.google.common.collect.ImmutableList;

import java.util.regex.Pattern;

// Partial matching: a pattern may match anywhere in the name.
public final class NameFilterSet {

	public NameFilterSet(Iterable<Pattern> patterns) {
		this.patterns = ImmutableList.copyOf(patterns);
	}

	private final ImmutableList<Pattern> patterns;

	// Throws PatternSyntaxException for an invalid regular expression.
	public static NameFilterSet compile(Iterable<String> patterns) {
		var compiled = ImmutableList.<Pattern>builder();
		for(var pattern : patterns) {
			compiled.add(Pattern.compile(pattern));
		}
		return new NameFilterSet(compiled.build());
	}

	public boolean isEmpty() {
		return patterns.isEmpty();
	}

	public boolean matches(String qualifiedName) {
		if(patterns.isEmpty()) {
			return true;
		}

		for(var pattern : patterns) {
			if(pattern.matcher(qualifiedName).find()) {
				return true;
			}
		}
		return false;
	}
}
