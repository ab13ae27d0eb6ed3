package dev.trellis.testrunner.fixture;

import com.google.common.collect.ImmutableList;
import dev.trellis.testrunner.item.TestIdentity;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;

public final class FixtureRegistry {

	private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(FixtureRegistry.class);

	private final Map<ScopeNode, Map<String, FixtureDef>> definitions = new HashMap<>();

	public static FixtureRegistry of(Iterable<FixtureDef> fixtures) {
		var registry = new FixtureRegistry();
		fixtures.forEach(registry::register);
		return registry;
	}

	public void register(@NotNull FixtureDef fixture) {
		var declared = definitions.computeIfAbsent(fixture.declaredIn(), node -> new LinkedHashMap<>());
		var previous = declared.remove(fixture.name());
		declared.put(fixture.name(), fixture);

		if(previous != null) {
			log.warn("Fixture {} declared in {} replaces an earlier definition with the same name", fixture.name(), fixture.declaredIn());
		}
	}

	public Optional<FixtureDef> resolveActive(String name, TestIdentity item) {
		for(var node : ScopeNode.visibilityChain(item)) {
			var fixture = lookup(node, name);
			if(fixture != null) {
				return Optional.of(fixture);
			}
		}

		return Optional.empty();
	}

	// Resolves the definition that the fixture declared in `shadowing` overrides.
	public Optional<FixtureDef> resolveShadowed(String name, TestIdentity item, ScopeNode shadowing) {
		for(var node : ScopeNode.visibilityChain(item)) {
			if(!node.level().isWiderThan(shadowing.level())) {
				continue;
			}

			var fixture = lookup(node, name);
			if(fixture != null) {
				return Optional.of(fixture);
			}
		}

		return Optional.empty();
	}

	// Widest declaring node first, registration order within a node.
	public ImmutableList<FixtureDef> autoUseFixtures(TestIdentity item) {
		var chain = ScopeNode.visibilityChain(item).reverse();
		var names = new LinkedHashSet<String>();
		var result = ImmutableList.<FixtureDef>builder();
		for(var node : chain) {
			var declared = definitions.get(node);
			if(declared == null) {
				continue;
			}

			for(var fixture : declared.values()) {
				if(!fixture.isAutoUse() || names.contains(fixture.name())) {
					continue;
				}

				var active = resolveActive(fixture.name(), item);
				if(active.isPresent() && active.get() == fixture) {
					names.add(fixture.name());
					result.add(fixture);
				}
			}
		}
		return result.build();
	}

	public int size() {
		return definitions.values().stream().mapToInt(Map::size).sum();
	}

	private FixtureDef lookup(ScopeNode node, String name) {
		var declared = definitions.get(node);
		if(declared == null) {
			return null;
		}
		return declared.get(name);
	}
}
