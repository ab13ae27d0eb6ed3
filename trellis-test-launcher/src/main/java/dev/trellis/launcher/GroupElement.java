package dev.trellis.launcher;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

import java.util.List;

public class GroupElement {

	@JacksonXmlProperty(isAttribute = true, localName = "name")
	private String name;

	@JacksonXmlElementWrapper(useWrapping = false)
	@JacksonXmlProperty(localName = "Fixture")
	private List<FixtureElement> fixtures = List.of();

	@JacksonXmlElementWrapper(useWrapping = false)
	@JacksonXmlProperty(localName = "Test")
	private List<TestElement> tests = List.of();

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public List<FixtureElement> getFixtures() {
		return fixtures;
	}

	public void setFixtures(List<FixtureElement> fixtures) {
		this.fixtures = fixtures;
	}

	public List<TestElement> getTests() {
		return tests;
	}

	public void setTests(List<TestElement> tests) {
		this.tests = tests;
	}

	@Override
	public String toString() {
		return "GroupElement{" +
			"name='" + name + '\'' +
			", fixtures=" + fixtures +
			", tests=" + tests +
			'}';
	}
}
