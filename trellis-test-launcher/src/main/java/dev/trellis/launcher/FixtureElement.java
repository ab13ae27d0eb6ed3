package dev.trellis.launcher;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

import java.util.List;

public class FixtureElement {

	@JacksonXmlProperty(isAttribute = true, localName = "name")
	private String name;

	@JacksonXmlProperty(isAttribute = true, localName = "scope")
	private String scope = "function";

	@JacksonXmlProperty(isAttribute = true, localName = "autoUse")
	private boolean autoUse = false;

	@JacksonXmlElementWrapper(useWrapping = false)
	@JacksonXmlProperty(localName = "Requires")
	private List<String> requires = List.of();

	@JacksonXmlElementWrapper(useWrapping = false)
	@JacksonXmlProperty(localName = "Param")
	private List<String> params = List.of();

	@JacksonXmlProperty(localName = "SetUp")
	private String setUp;

	@JacksonXmlProperty(localName = "TearDown")
	private String tearDown;

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getScope() {
		return scope;
	}

	public void setScope(String scope) {
		this.scope = scope;
	}

	public boolean isAutoUse() {
		return autoUse;
	}

	public void setAutoUse(boolean autoUse) {
		this.autoUse = autoUse;
	}

	public List<String> getRequires() {
		return requires;
	}

	public void setRequires(List<String> requires) {
		this.requires = requires;
	}

	public List<String> getParams() {
		return params;
	}

	public void setParams(List<String> params) {
		this.params = params;
	}

	public String getSetUp() {
		return setUp;
	}

	public void setSetUp(String setUp) {
		this.setUp = setUp;
	}

	public String getTearDown() {
		return tearDown;
	}

	public void setTearDown(String tearDown) {
		this.tearDown = tearDown;
	}

	@Override
	public String toString() {
		return "FixtureElement{" +
			"name='" + name + '\'' +
			", scope='" + scope + '\'' +
			", autoUse=" + autoUse +
			", requires=" + requires +
			", params=" + params +
			'}';
	}
}
