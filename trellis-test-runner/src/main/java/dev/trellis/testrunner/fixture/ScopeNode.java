package dev.trellis.testrunner.fixture;

import com.google.common.collect.ImmutableList;
import dev.trellis.testrunner.item.TestIdentity;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Where a fixture is declared. A test item sees the nodes of its visibility chain:
 * its group (if any), its module and the session.
 */
public sealed interface ScopeNode permits ScopeNode.Session, ScopeNode.Module, ScopeNode.Group {

	FixtureScope level();

	record Session() implements ScopeNode {
		@Override
		public FixtureScope level() {
			return FixtureScope.SESSION;
		}

		@Override
		public String toString() {
			return "session";
		}
	}

	record Module(@NotNull String modulePath) implements ScopeNode {
		public Module {
			Objects.requireNonNull(modulePath, "modulePath");
		}

		@Override
		public FixtureScope level() {
			return FixtureScope.MODULE;
		}

		@Override
		public String toString() {
			return modulePath;
		}
	}

	record Group(@NotNull String modulePath, @NotNull String group) implements ScopeNode {
		public Group {
			Objects.requireNonNull(modulePath, "modulePath");
			Objects.requireNonNull(group, "group");
		}

		@Override
		public FixtureScope level() {
			return FixtureScope.GROUP;
		}

		@Override
		public String toString() {
			return modulePath + TestIdentity.SEPARATOR + group;
		}
	}

	ScopeNode SESSION = new Session();

	static ScopeNode module(String modulePath) {
		return new Module(modulePath);
	}

	static ScopeNode group(String modulePath, String group) {
		return new Group(modulePath, group);
	}

	// Narrowest first.
	static ImmutableList<ScopeNode> visibilityChain(TestIdentity identity) {
		var chain = ImmutableList.<ScopeNode>builder();
		if(identity.group() != null) {
			chain.add(new Group(identity.modulePath(), identity.group()));
		}
		chain.add(new Module(identity.modulePath()));
		chain.add(SESSION);
		return chain.build();
	}
}
