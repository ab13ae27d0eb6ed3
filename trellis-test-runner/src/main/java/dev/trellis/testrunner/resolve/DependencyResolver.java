package dev.trellis.testrunner.resolve;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;
import dev.trellis.testrunner.fixture.FixtureDef;
import dev.trellis.testrunner.fixture.FixtureKey;
import dev.trellis.testrunner.fixture.FixtureRegistry;
import dev.trellis.testrunner.item.TestIdentity;
import dev.trellis.testrunner.item.TestInstance;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.IntStream;

public final class DependencyResolver {

	public DependencyResolver(FixtureRegistry registry) {
		this.registry = registry;
	}

	private final FixtureRegistry registry;

	/**
	 * Resolves the fixtures of a test instance. A parametrized fixture anywhere in the graph
	 * multiplies the result: one plan per combination of parameter values.
	 */
	public @NotNull ImmutableList<FixtureSetupPlan> plan(TestInstance instance) throws ResolutionException {
		var traversal = new Traversal(instance);

		var requested = new LinkedHashMap<String, FixtureKey>();
		for(var name : requestedNames(instance)) {
			var chain = new ArrayList<String>();
			chain.add(instance.displayName());

			var fixture = registry.resolveActive(name, instance.identity());
			if(fixture.isEmpty()) {
				traversal.missing(chain, name);
				continue;
			}

			traversal.visit(fixture.get(), chain);
			requested.put(name, fixture.get().key());
		}

		traversal.checkComplete();

		return expand(ImmutableList.copyOf(traversal.resolved.values()), ImmutableMap.copyOf(requested));
	}

	private Set<String> requestedNames(TestInstance instance) {
		var names = new LinkedHashSet<String>();
		for(var fixture : registry.autoUseFixtures(instance.identity())) {
			names.add(fixture.name());
		}
		names.addAll(instance.item().requestedFixtures());

		// Parametrized arguments take the place of fixtures with the same name.
		names.removeAll(instance.arguments().keySet());
		return names;
	}

	private static ImmutableList<FixtureSetupPlan> expand(List<Node> order, ImmutableMap<String, FixtureKey> requested) {
		var parametrized = order.stream()
			.filter(node -> node.fixture.isParametrized())
			.toList();

		var parameterRanges = parametrized.stream()
			.map(node -> IntStream.range(0, node.fixture.parameters().size()).boxed().toList())
			.toList();

		var plans = ImmutableList.<FixtureSetupPlan>builder();
		for(var combination : Lists.cartesianProduct(parameterRanges)) {
			var chosen = new HashMap<FixtureKey, Integer>();
			for(int i = 0; i < parametrized.size(); ++i) {
				chosen.put(parametrized.get(i).fixture.key(), combination.get(i));
			}

			var signatures = new HashMap<FixtureKey, ImmutableSortedMap<String, Integer>>();
			var closures = new HashMap<FixtureKey, ImmutableSet<FixtureKey>>();
			var setupOrder = ImmutableList.<PlannedFixture>builder();
			for(var node : order) {
				var key = node.fixture.key();
				var signature = new TreeMap<String, Integer>();
				var closure = ImmutableSet.<FixtureKey>builder();
				for(var dependency : node.dependencies.values()) {
					signature.putAll(signatures.get(dependency));
					closure.add(dependency).addAll(closures.get(dependency));
				}

				int parameterIndex = chosen.getOrDefault(key, TestInstance.NOT_PARAMETRIZED);
				if(parameterIndex != TestInstance.NOT_PARAMETRIZED) {
					signature.put(key.toString(), parameterIndex);
				}

				var frozen = ImmutableSortedMap.copyOf(signature);
				var resolvedDependencies = closure.build();
				signatures.put(key, frozen);
				closures.put(key, resolvedDependencies);
				setupOrder.add(new PlannedFixture(node.fixture, parameterIndex, node.dependencies, frozen, resolvedDependencies));
			}

			plans.add(new FixtureSetupPlan(setupOrder.build(), requested));
		}
		return plans.build();
	}

	private record Node(FixtureDef fixture, ImmutableMap<String, FixtureKey> dependencies) {}

	private final class Traversal {
		Traversal(TestInstance instance) {
			this.identity = instance.identity();
		}

		private final TestIdentity identity;
		private final Set<FixtureKey> visiting = new HashSet<>();
		// Insertion order is DFS post-order, i.e. a topological order.
		private final Map<FixtureKey, Node> resolved = new LinkedHashMap<>();
		private final Map<FixtureKey, ImmutableList<String>> firstChain = new HashMap<>();
		private ResolutionError.MissingFixture firstMissing;

		void visit(FixtureDef fixture, List<String> chain) throws ResolutionException {
			var key = fixture.key();
			chain.add(fixture.name());
			try {
				if(resolved.containsKey(key)) {
					return;
				}

				if(!visiting.add(key)) {
					throw new ResolutionException(new ResolutionError.CyclicDependency(ImmutableList.copyOf(chain)));
				}

				firstChain.put(key, ImmutableList.copyOf(chain));

				var dependencies = new LinkedHashMap<String, FixtureKey>();
				for(var name : fixture.dependencies()) {
					Optional<FixtureDef> dependency;
					if(name.equals(fixture.name())) {
						// A fixture requesting its own name extends the definition it shadows.
						dependency = registry.resolveShadowed(name, identity, fixture.declaredIn());
					}
					else {
						dependency = registry.resolveActive(name, identity);
					}

					if(dependency.isEmpty()) {
						missing(chain, name);
						continue;
					}

					visit(dependency.get(), chain);
					dependencies.put(name, dependency.get().key());
				}

				visiting.remove(key);
				resolved.put(key, new Node(fixture, ImmutableMap.copyOf(dependencies)));
			}
			finally {
				chain.remove(chain.size() - 1);
			}
		}

		void missing(List<String> chain, String name) {
			if(firstMissing == null) {
				firstMissing = new ResolutionError.MissingFixture(
					ImmutableList.<String>builder().addAll(chain).add(name).build()
				);
			}
		}

		// Cycles are reported first: they abort the traversal, missing names and scope conflicts do not.
		void checkComplete() throws ResolutionException {
			if(firstMissing != null) {
				throw new ResolutionException(firstMissing);
			}

			for(var node : resolved.values()) {
				for(var entry : node.dependencies.entrySet()) {
					var dependency = resolved.get(entry.getValue()).fixture;
					if(node.fixture.scope().isWiderThan(dependency.scope())) {
						var chain = ImmutableList.<String>builder()
							.addAll(firstChain.get(node.fixture.key()))
							.add(entry.getKey())
							.build();

						throw new ResolutionException(new ResolutionError.ScopeConflict(
							chain,
							node.fixture.name(),
							node.fixture.scope(),
							dependency.name(),
							dependency.scope()
						));
					}
				}
			}
		}
	}
}
