package dev.trellis.launcher;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

import java.util.List;

public class TestElement {

	@JacksonXmlProperty(isAttribute = true, localName = "name")
	private String name;

	@JacksonXmlElementWrapper(useWrapping = false)
	@JacksonXmlProperty(localName = "Tag")
	private List<String> tags = List.of();

	@JacksonXmlElementWrapper(useWrapping = false)
	@JacksonXmlProperty(localName = "Requires")
	private List<String> requires = List.of();

	@JacksonXmlElementWrapper(useWrapping = false)
	@JacksonXmlProperty(localName = "Parameters")
	private List<ParametersElement> parameters = List.of();

	// Present (possibly empty) when the test is expected to fail; the text is the reason.
	@JacksonXmlProperty(localName = "ExpectFailure")
	private String expectFailure;

	@JacksonXmlProperty(localName = "Skip")
	private String skip;

	@JacksonXmlProperty(localName = "Run")
	private String run;

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public List<String> getTags() {
		return tags;
	}

	public void setTags(List<String> tags) {
		this.tags = tags;
	}

	public List<String> getRequires() {
		return requires;
	}

	public void setRequires(List<String> requires) {
		this.requires = requires;
	}

	public List<ParametersElement> getParameters() {
		return parameters;
	}

	public void setParameters(List<ParametersElement> parameters) {
		this.parameters = parameters;
	}

	public String getExpectFailure() {
		return expectFailure;
	}

	public void setExpectFailure(String expectFailure) {
		this.expectFailure = expectFailure;
	}

	public String getSkip() {
		return skip;
	}

	public void setSkip(String skip) {
		this.skip = skip;
	}

	public String getRun() {
		return run;
	}

	public void setRun(String run) {
		this.run = run;
	}

	@Override
	public String toString() {
		return "TestElement{" +
			"name='" + name + '\'' +
			", tags=" + tags +
			", requires=" + requires +
			", parameters=" + parameters +
			", expectFailure='" + expectFailure + '\'' +
			", skip='" + skip + '\'' +
			", run='" + run + '\'' +
			'}';
	}
}
