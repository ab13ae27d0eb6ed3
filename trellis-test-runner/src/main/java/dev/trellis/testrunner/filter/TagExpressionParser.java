package dev.trellis.testrunner.filter;

import java.util.ArrayList;
import java.util.List;

// or  := and ("or" and)*
// and := not ("and" not)*
// not := "not" not | primary
// primary := "(" or ")" | TAG
final class TagExpressionParser {

	TagExpressionParser(String expression) {
		this.expression = expression;
	}

	private final String expression;
	private List<Token> tokens;
	private int index;

	private enum TokenKind {
		TAG,
		AND,
		OR,
		NOT,
		LEFT_PAREN,
		RIGHT_PAREN,
		END,
	}

	private record Token(TokenKind kind, String text, int position) {}

	TagExpression parse() throws TagExpressionException {
		tokens = tokenize();
		index = 0;

		if(peek().kind() == TokenKind.END) {
			throw new TagExpressionException("Empty expression", expression, 0);
		}

		var result = parseOr();
		var trailing = peek();
		if(trailing.kind() != TokenKind.END) {
			throw new TagExpressionException("Unexpected '" + trailing.text() + "'", expression, trailing.position());
		}
		return result;
	}

	private TagExpression parseOr() throws TagExpressionException {
		var left = parseAnd();
		while(peek().kind() == TokenKind.OR) {
			next();
			left = new TagExpression.Or(left, parseAnd());
		}
		return left;
	}

	private TagExpression parseAnd() throws TagExpressionException {
		var left = parseNot();
		while(peek().kind() == TokenKind.AND) {
			next();
			left = new TagExpression.And(left, parseNot());
		}
		return left;
	}

	private TagExpression parseNot() throws TagExpressionException {
		if(peek().kind() == TokenKind.NOT) {
			next();
			return new TagExpression.Not(parseNot());
		}
		return parsePrimary();
	}

	private TagExpression parsePrimary() throws TagExpressionException {
		var token = next();
		return switch(token.kind()) {
			case TAG -> new TagExpression.Tag(token.text());
			case LEFT_PAREN -> {
				var inner = parseOr();
				var close = next();
				if(close.kind() != TokenKind.RIGHT_PAREN) {
					throw new TagExpressionException("Expected ')'", expression, close.position());
				}
				yield inner;
			}
			case END -> throw new TagExpressionException("Unexpected end of expression", expression, token.position());
			default -> throw new TagExpressionException("Unexpected '" + token.text() + "'", expression, token.position());
		};
	}

	private Token peek() {
		return tokens.get(index);
	}

	private Token next() {
		var token = tokens.get(index);
		if(token.kind() != TokenKind.END) {
			++index;
		}
		return token;
	}

	private List<Token> tokenize() throws TagExpressionException {
		var result = new ArrayList<Token>();
		int i = 0;
		while(i < expression.length()) {
			char c = expression.charAt(i);
			if(Character.isWhitespace(c)) {
				++i;
			}
			else if(c == '(') {
				result.add(new Token(TokenKind.LEFT_PAREN, "(", i));
				++i;
			}
			else if(c == ')') {
				result.add(new Token(TokenKind.RIGHT_PAREN, ")", i));
				++i;
			}
			else if(isTagChar(c)) {
				int start = i;
				while(i < expression.length() && isTagChar(expression.charAt(i))) {
					++i;
				}

				var word = expression.substring(start, i);
				var kind = switch(word) {
					case "and" -> TokenKind.AND;
					case "or" -> TokenKind.OR;
					case "not" -> TokenKind.NOT;
					default -> TokenKind.TAG;
				};
				result.add(new Token(kind, word, start));
			}
			else {
				throw new TagExpressionException("Invalid character '" + c + "'", expression, i);
			}
		}
		result.add(new Token(TokenKind.END, "", expression.length()));
		return result;
	}

	private static boolean isTagChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' || c == ':';
	}
}
