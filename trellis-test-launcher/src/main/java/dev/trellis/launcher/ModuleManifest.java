package dev.trellis.launcher;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import java.util.List;

@JacksonXmlRootElement(localName = "TrellisModule")
public class ModuleManifest {

	@JacksonXmlElementWrapper(useWrapping = false)
	@JacksonXmlProperty(localName = "Fixture")
	private List<FixtureElement> fixtures = List.of();

	@JacksonXmlElementWrapper(useWrapping = false)
	@JacksonXmlProperty(localName = "Group")
	private List<GroupElement> groups = List.of();

	@JacksonXmlElementWrapper(useWrapping = false)
	@JacksonXmlProperty(localName = "Test")
	private List<TestElement> tests = List.of();

	public List<FixtureElement> getFixtures() {
		return fixtures;
	}

	public void setFixtures(List<FixtureElement> fixtures) {
		this.fixtures = fixtures;
	}

	public List<GroupElement> getGroups() {
		return groups;
	}

	public void setGroups(List<GroupElement> groups) {
		this.groups = groups;
	}

	public List<TestElement> getTests() {
		return tests;
	}

	public void setTests(List<TestElement> tests) {
		this.tests = tests;
	}

	@Override
	public String toString() {
		return "ModuleManifest{" +
			"fixtures=" + fixtures +
			", groups=" + groups +
			", tests=" + tests +
			'}';
	}
}
