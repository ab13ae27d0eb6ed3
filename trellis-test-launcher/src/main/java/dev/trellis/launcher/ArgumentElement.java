package dev.trellis.launcher;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;

public class ArgumentElement {

	@JacksonXmlProperty(isAttribute = true, localName = "name")
	private String name;

	@JacksonXmlText
	private String value;

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getValue() {
		return value;
	}

	public void setValue(String value) {
		this.value = value;
	}

	@Override
	public String toString() {
		return "ArgumentElement{" +
			"name='" + name + '\'' +
			", value='" + value + '\'' +
			'}';
	}
}
