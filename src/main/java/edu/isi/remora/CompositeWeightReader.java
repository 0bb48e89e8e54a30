package edu.isi.remora;

import java.io.IOException;
import java.io.PushbackReader;

/**
 * Reads the textual form of a composite weight, one element at a time.
 * Elements are separated by the configured separator and there must be at
 * least one of them. Parentheses should be turned on whenever the elements
 * are themselves composite, otherwise a nested separator can't be told from
 * one of ours.
 * <p>
 * Typical use:
 * <pre>
 *   reader.readBegin();
 *   a = reader.readElement(sr1);
 *   b = reader.readElement(sr2, true);
 *   reader.readEnd();
 * </pre>
 * or, for a variable number of elements, read until {@link #hasMore()} is
 * false. A scan failure (empty element, unmatched close parenthesis) leaves
 * the reader bad; every later read fails too.
 */
public class CompositeWeightReader {
	private static final int EOF = -1;

	private final PushbackReader r;
	private final CompositeWeightConfig config;
	// last character read, or EOF
	private int c;
	// parentheses depth
	private int depth;
	// whether readBegin saw an open paren
	private boolean opened;
	// character that ended the last element
	private int terminator;
	private boolean more;
	private boolean bad;

	// readEnd hands the lookahead back to reader, so the caller can go on reading from it
	public CompositeWeightReader(PushbackReader reader, CompositeWeightConfig conf) {
		r = reader;
		config = conf;
		c = 0;
		depth = 0;
		opened = false;
		terminator = EOF;
		more = false;
		bad = false;
	}

	// skips leading whitespace and the open paren, if any
	public void readBegin() throws IOException {
		do {
			c = r.read();
		} while (c != EOF && Character.isWhitespace(c));
		if (config.hasParentheses() && c == config.getOpenParen()) {
			++depth;
			opened = true;
			c = r.read();
		}
		more = c != EOF && !Character.isWhitespace(c);
	}

	public <T extends Weight> T readElement(Semiring<T> sr) throws DataFormatException, IOException {
		return readElement(sr, false);
	}

	// reads one element. last means separators are taken as part of the element, so the
	// final element may contain them unescaped
	public <T extends Weight> T readElement(Semiring<T> sr, boolean last) throws DataFormatException, IOException {
		boolean debug = false;
		if (bad)
			throw new DataFormatException("CompositeWeightReader: reading from a bad stream");
		StringBuffer s = new StringBuffer();
		while (c != EOF && !Character.isWhitespace(c) &&
				(c != config.getSeparator() || depth > 1 || last) &&
				(c != config.getCloseParen() || depth != 1 || !config.hasParentheses())) {
			s.append((char)c);
			// parentheses seen before the separator must be matched
			if (config.hasParentheses() && c == config.getOpenParen()) {
				++depth;
			}
			else if (config.hasParentheses() && c == config.getCloseParen()) {
				if (depth == 0)
					fail("Unmatched close paren: are the weight parentheses set correctly?");
				--depth;
			}
			c = r.read();
		}
		if (s.length() == 0)
			fail("Empty element: are the weight parentheses set correctly?");
		if (debug) Debug.debug(debug, "element \""+s+"\" ended by "+c);
		T elem;
		try {
			elem = sr.parse(s.toString());
		}
		catch (DataFormatException e) {
			bad = true;
			throw e;
		}
		terminator = c;
		// skip separator/close paren
		if (c != EOF && !Character.isWhitespace(c))
			c = r.read();
		more = c != EOF && !Character.isWhitespace(c);
		return elem;
	}

	// true iff the lookahead says there's another element
	public boolean hasMore() {
		return more && !bad;
	}

	public boolean isBad() {
		return bad;
	}

	// checks the open paren was closed and hands unread lookahead back to the stream
	public void readEnd() throws DataFormatException, IOException {
		if (bad)
			throw new DataFormatException("CompositeWeightReader: reading from a bad stream");
		if (opened) {
			if (terminator != config.getCloseParen())
				fail("Unmatched open paren: composite weight never closed");
			--depth;
		}
		if (c != EOF && !Character.isWhitespace(c))
			r.unread(c);
		more = false;
	}

	private void fail(String msg) throws DataFormatException {
		bad = true;
		more = false;
		Debug.error("CompositeWeightReader: "+msg);
		throw new DataFormatException("CompositeWeightReader: "+msg);
	}
}
