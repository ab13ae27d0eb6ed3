package dev.trellis.testrunner.item;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class TestItem {

	private TestItem(Builder builder) {
		this.identity = Objects.requireNonNull(builder.identity, "identity");
		this.body = Objects.requireNonNull(builder.body, "body");
		this.tags = ImmutableSet.copyOf(builder.tags);
		this.requestedFixtures = ImmutableList.copyOf(builder.requestedFixtures);
		this.expectedFailure = builder.expectedFailure;
		this.skipCondition = builder.skipCondition;
		this.parameterSets = builder.parameterSets.stream()
			.map(ImmutableMap::copyOf)
			.collect(ImmutableList.toImmutableList());
	}

	private final TestIdentity identity;
	private final TestBody body;
	private final ImmutableSet<String> tags;
	private final ImmutableList<String> requestedFixtures;
	private final @Nullable ExpectedFailure expectedFailure;
	private final @Nullable SkipCondition skipCondition;
	private final ImmutableList<ImmutableMap<String, Object>> parameterSets;

	public static Builder builder(TestIdentity identity) {
		return new Builder(identity);
	}

	public @NotNull TestIdentity identity() {
		return identity;
	}

	public @NotNull TestBody body() {
		return body;
	}

	public @NotNull ImmutableSet<String> tags() {
		return tags;
	}

	public @NotNull ImmutableList<String> requestedFixtures() {
		return requestedFixtures;
	}

	public @Nullable ExpectedFailure expectedFailure() {
		return expectedFailure;
	}

	public @Nullable SkipCondition skipCondition() {
		return skipCondition;
	}

	public @NotNull ImmutableList<ImmutableMap<String, Object>> parameterSets() {
		return parameterSets;
	}

	public ImmutableList<TestInstance> instances() {
		if(parameterSets.isEmpty()) {
			return ImmutableList.of(new TestInstance(this, TestInstance.NOT_PARAMETRIZED, ImmutableMap.of()));
		}

		var instances = ImmutableList.<TestInstance>builder();
		for(int i = 0; i < parameterSets.size(); ++i) {
			instances.add(new TestInstance(this, i, parameterSets.get(i)));
		}
		return instances.build();
	}

	@Override
	public String toString() {
		return "TestItem{" +
			"identity=" + identity +
			", tags=" + tags +
			", requestedFixtures=" + requestedFixtures +
			", parameterSets=" + parameterSets.size() +
			'}';
	}

	public static final class Builder {
		private Builder(TestIdentity identity) {
			this.identity = identity;
		}

		private final TestIdentity identity;
		private TestBody body;
		private final Set<String> tags = new LinkedHashSet<>();
		private final List<String> requestedFixtures = new ArrayList<>();
		private ExpectedFailure expectedFailure;
		private SkipCondition skipCondition;
		private final List<Map<String, Object>> parameterSets = new ArrayList<>();

		public Builder body(TestBody body) {
			this.body = body;
			return this;
		}

		public Builder tag(String tag) {
			tags.add(tag);
			return this;
		}

		public Builder tags(Iterable<String> tags) {
			tags.forEach(this.tags::add);
			return this;
		}

		public Builder requires(String... fixtureNames) {
			requestedFixtures.addAll(List.of(fixtureNames));
			return this;
		}

		public Builder requires(Iterable<String> fixtureNames) {
			fixtureNames.forEach(requestedFixtures::add);
			return this;
		}

		public Builder expectFailure(@Nullable String reason) {
			this.expectedFailure = new ExpectedFailure(reason);
			return this;
		}

		public Builder skip(SkipCondition skipCondition) {
			this.skipCondition = skipCondition;
			return this;
		}

		public Builder parameters(Map<String, Object> arguments) {
			parameterSets.add(arguments);
			return this;
		}

		public TestItem build() {
			return new TestItem(this);
		}
	}
}
