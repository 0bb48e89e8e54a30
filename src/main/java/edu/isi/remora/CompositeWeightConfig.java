package edu.isi.remora;

// textual layout of composite weights: the element separator and, optionally, the pair of
// parentheses wrapped around each composite so nested composites can be told apart.
// immutable; handed to the writers and readers that need it
public final class CompositeWeightConfig {
	public static final char DEFAULT_SEPARATOR = ',';
	public static final char DEFAULT_OPEN = '(';
	public static final char DEFAULT_CLOSE = ')';

	// separator ',', no parentheses
	public static final CompositeWeightConfig DEFAULT =
		new CompositeWeightConfig(DEFAULT_SEPARATOR, false, DEFAULT_OPEN, DEFAULT_CLOSE);

	private final char separator;
	private final boolean parentheses;
	private final char openParen;
	private final char closeParen;

	private CompositeWeightConfig(char sep, boolean parens, char open, char close) {
		separator = sep;
		parentheses = parens;
		openParen = open;
		closeParen = close;
	}

	public static CompositeWeightConfig get(char sep) throws ConfigureException {
		return get(sep, false, DEFAULT_OPEN, DEFAULT_CLOSE);
	}

	public static CompositeWeightConfig get(char sep, boolean parens, char open, char close) throws ConfigureException {
		if (Character.isWhitespace(sep))
			throw new ConfigureException("Weight separator may not be whitespace");
		if (parens) {
			if (open == close)
				throw new ConfigureException("Open and close parentheses must differ; got "+open+" twice");
			if (Character.isWhitespace(open) || Character.isWhitespace(close))
				throw new ConfigureException("Weight parentheses may not be whitespace");
			if (open == sep || close == sep)
				throw new ConfigureException("Weight parentheses may not be the separator "+sep);
		}
		return new CompositeWeightConfig(sep, parens, open, close);
	}

	// from the option strings: separator is exactly one character; parentheses is empty (off)
	// or exactly two characters, open then close
	public static CompositeWeightConfig parse(String sep, String parens) throws ConfigureException {
		if (sep == null || sep.length() != 1)
			throw new ConfigureException("Weight separator must be a single character; got \""+sep+"\"");
		if (parens == null || parens.length() == 0)
			return get(sep.charAt(0));
		if (parens.length() != 2)
			throw new ConfigureException("Weight parentheses must be empty or two characters; got \""+parens+"\"");
		return get(sep.charAt(0), true, parens.charAt(0), parens.charAt(1));
	}

	public char getSeparator() { return separator; }
	public boolean hasParentheses() { return parentheses; }
	public char getOpenParen() { return openParen; }
	public char getCloseParen() { return closeParen; }

	public boolean equals(Object o) {
		if (!(o instanceof CompositeWeightConfig))
			return false;
		CompositeWeightConfig c = (CompositeWeightConfig)o;
		return separator == c.separator && parentheses == c.parentheses &&
			openParen == c.openParen && closeParen == c.closeParen;
	}
	public int hashCode() {
		return (separator * 31 + (parentheses ? 1 : 0)) * 961 + openParen * 31 + closeParen;
	}
	public String toString() {
		return "separator '"+separator+"'"+(parentheses ? ", parentheses "+openParen+closeParen : ", no parentheses");
	}
}
