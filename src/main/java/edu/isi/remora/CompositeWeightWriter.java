package edu.isi.remora;

import java.io.IOException;
import java.io.Writer;

// writes the textual form of a composite weight:
//   writeBegin(); writeElement(e1); ... writeElement(ek); writeEnd();
// gives e1<sep>e2<sep>...<sep>ek, wrapped in parentheses if the config says so
public class CompositeWeightWriter {
	private final Writer w;
	private final CompositeWeightConfig config;
	// element position
	private int i;

	public CompositeWeightWriter(Writer writer, CompositeWeightConfig c) {
		w = writer;
		config = c;
		i = 0;
	}

	public void writeBegin() throws IOException {
		if (config.hasParentheses())
			w.write(config.getOpenParen());
	}

	public <T extends Weight> void writeElement(Semiring<T> sr, T elem) throws IOException {
		writeElement(sr.print(elem));
	}

	// an element already in textual form
	public void writeElement(String elem) throws IOException {
		if (i++ > 0)
			w.write(config.getSeparator());
		w.write(elem);
	}

	public void writeEnd() throws IOException {
		if (config.hasParentheses())
			w.write(config.getCloseParen());
	}
}
