package dev.trellis.launcher;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

import java.util.List;

// One argument set of a parametrized test.
public class ParametersElement {

	@JacksonXmlElementWrapper(useWrapping = false)
	@JacksonXmlProperty(localName = "Arg")
	private List<ArgumentElement> arguments = List.of();

	public List<ArgumentElement> getArguments() {
		return arguments;
	}

	public void setArguments(List<ArgumentElement> arguments) {
		this.arguments = arguments;
	}

	@Override
	public String toString() {
		return "ParametersElement{" +
			"arguments=" + arguments +
			'}';
	}
}
