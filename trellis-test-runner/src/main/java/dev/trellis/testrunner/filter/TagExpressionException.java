package dev.trellis.testrunner.filter;

public class TagExpressionException extends Exception {
	public TagExpressionException(String message, String expression, int position) {
		super(message + " at position " + position + " in tag expression '" + expression + "'");
		this.expression = expression;
		this.position = position;
	}

	private final String expression;
	private final int position;

	public String getExpression() {
		return expression;
	}

	public int getPosition() {
		return position;
	}
}
