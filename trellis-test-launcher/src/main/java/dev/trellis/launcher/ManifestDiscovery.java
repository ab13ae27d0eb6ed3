package dev.trellis.launcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.deser.FromXmlParser;
import com.google.common.collect.ImmutableList;
import dev.trellis.testrunner.DiscoveredSuite;
import dev.trellis.testrunner.fixture.FixtureDef;
import dev.trellis.testrunner.fixture.FixtureScope;
import dev.trellis.testrunner.fixture.InvalidFixtureException;
import dev.trellis.testrunner.fixture.ScopeNode;
import dev.trellis.testrunner.item.SkipCondition;
import dev.trellis.testrunner.item.TestIdentity;
import dev.trellis.testrunner.item.TestItem;
import org.apache.commons.io.FilenameUtils;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.StreamSupport;

/**
 * Builds a suite from XML manifests. Every manifest is a module named after its path
 * relative to the root it was found under.
 */
public class ManifestDiscovery {

	private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ManifestDiscovery.class);

	public ManifestDiscovery(CommandRunner commandRunner) {
		this(commandRunner, CommandOutputListener.NONE);
	}

	public ManifestDiscovery(CommandRunner commandRunner, CommandOutputListener outputListener) {
		this.commandRunner = commandRunner;
		this.outputListener = outputListener;
	}

	private final CommandRunner commandRunner;
	private final CommandOutputListener outputListener;
	private final XmlMapper mapper = createMapper();

	private static XmlMapper createMapper() {
		var mapper = new XmlMapper();
		mapper.configure(FromXmlParser.Feature.EMPTY_ELEMENT_AS_NULL, false);
		return mapper;
	}

	public DiscoveredSuite discover(List<Path> paths) throws IOException {
		var manifests = new ArrayList<LoadedManifest>();
		for(var path : paths) {
			if(!Files.exists(path)) {
				throw new ManifestException(path, "No such file or directory");
			}
			loadManifests(path, path, manifests);
		}

		var fixtures = ImmutableList.<FixtureDef>builder();
		var items = ImmutableList.<TestItem>builder();
		for(var manifest : manifests) {
			addManifest(manifest, fixtures, items);
		}

		var suite = DiscoveredSuite.of(fixtures.build(), items.build());
		log.info("Discovered {} tests and {} fixtures in {} manifests", suite.items().size(), suite.fixtures().size(), manifests.size());
		return suite;
	}

	private void loadManifests(Path baseDir, Path path, List<LoadedManifest> manifests) throws IOException {
		if(Files.isDirectory(path)) {
			List<Path> children;
			try(var dirStream = Files.list(path)) {
				children = dirStream.sorted().toList();
			}

			for(var p : children) {
				if(Files.isDirectory(p) || p.getFileName().toString().endsWith(".xml")) {
					loadManifests(baseDir, p, manifests);
				}
			}
		}
		else {
			var relPath = baseDir.relativize(path);
			var relDir = relPath.getParent();

			List<String> directories;
			if(relDir == null) {
				directories = List.of();
			}
			else {
				directories = StreamSupport.stream(relDir.spliterator(), false)
					.map(Path::toString)
					.toList();
			}

			ModuleManifest manifest;
			try {
				manifest = mapper.readValue(path.toFile(), ModuleManifest.class);
			}
			catch(JsonProcessingException e) {
				throw new ManifestException(path, e.getOriginalMessage(), e);
			}

			var baseName = FilenameUtils.getBaseName(path.getFileName().toString());
			manifests.add(new LoadedManifest(directories, baseName, path, manifest));
		}
	}

	private void addManifest(LoadedManifest loaded, ImmutableList.Builder<FixtureDef> fixtures, ImmutableList.Builder<TestItem> items) throws ManifestException {
		var manifest = loaded.getManifest();
		if(loaded.isSessionManifest()) {
			if(!manifest.getTests().isEmpty() || !manifest.getGroups().isEmpty()) {
				throw new ManifestException(loaded.getFile(), "The session manifest may only declare fixtures");
			}

			for(var fixture : manifest.getFixtures()) {
				fixtures.add(toFixture(loaded, fixture, ScopeNode.SESSION));
			}
			return;
		}

		var modulePath = loaded.getModulePath();
		for(var fixture : manifest.getFixtures()) {
			fixtures.add(toFixture(loaded, fixture, ScopeNode.module(modulePath)));
		}

		for(var test : manifest.getTests()) {
			items.add(toItem(loaded, test, null));
		}

		for(var group : manifest.getGroups()) {
			var groupName = requireName(loaded, group.getName(), "Group");
			for(var fixture : group.getFixtures()) {
				fixtures.add(toFixture(loaded, fixture, ScopeNode.group(modulePath, groupName)));
			}

			for(var test : group.getTests()) {
				items.add(toItem(loaded, test, groupName));
			}
		}
	}

	private FixtureDef toFixture(LoadedManifest loaded, FixtureElement element, ScopeNode node) throws ManifestException {
		var name = requireName(loaded, element.getName(), "Fixture");

		FixtureScope scope;
		try {
			scope = FixtureScope.fromId(element.getScope());
		}
		catch(IllegalArgumentException e) {
			throw new ManifestException(loaded.getFile(), "Fixture " + name + ": " + e.getMessage(), e);
		}

		var operation = new CommandFixtureOperation(commandRunner, loaded.getWorkingDirectory(), element.getSetUp(), element.getTearDown());
		try {
			return FixtureDef.builder(name, node)
				.scope(scope)
				.requires(element.getRequires())
				.parameters(element.getParams())
				.autoUse(element.isAutoUse())
				.operation(operation)
				.build();
		}
		catch(InvalidFixtureException e) {
			throw new ManifestException(loaded.getFile(), e.getMessage(), e);
		}
	}

	private TestItem toItem(LoadedManifest loaded, TestElement element, @Nullable String group) throws ManifestException {
		var name = requireName(loaded, element.getName(), "Test");
		if(element.getRun() == null || element.getRun().isBlank()) {
			throw new ManifestException(loaded.getFile(), "Test " + name + " has no Run command");
		}

		var builder = TestItem.builder(new TestIdentity(loaded.getModulePath(), group, name))
			.body(new CommandTestBody(commandRunner, loaded.getWorkingDirectory(), element.getRun().strip(), outputListener))
			.tags(element.getTags())
			.requires(element.getRequires());

		if(element.getExpectFailure() != null) {
			builder.expectFailure(emptyToNull(element.getExpectFailure()));
		}

		if(element.getSkip() != null) {
			builder.skip(SkipCondition.always(emptyToNull(element.getSkip())));
		}

		for(var parameters : element.getParameters()) {
			var arguments = new LinkedHashMap<String, Object>();
			for(var argument : parameters.getArguments()) {
				var argumentName = requireName(loaded, argument.getName(), "Arg");
				arguments.put(argumentName, argument.getValue() == null ? "" : argument.getValue());
			}
			builder.parameters(arguments);
		}

		return builder.build();
	}

	private static String requireName(LoadedManifest loaded, String name, String element) throws ManifestException {
		if(name == null || name.isBlank()) {
			throw new ManifestException(loaded.getFile(), element + " without a name");
		}
		return name;
	}

	private static @Nullable String emptyToNull(String text) {
		var stripped = text.strip();
		return stripped.isEmpty() ? null : stripped;
	}
}
