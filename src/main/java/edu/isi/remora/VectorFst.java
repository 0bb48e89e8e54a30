package edu.isi.remora;

import java.io.BufferedReader;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;

/**
 * Array-backed mutable transducer.
 * <p>
 * Binary layout (big-endian): magic int, weight type (modified UTF-8), start
 * state, state count, then for each state its final weight, its arc count and
 * its arcs as ilabel, olabel, weight, nextstate.
 * <p>
 * Text layout (AT&amp;T style, tab separated): one line per arc
 * <code>src dst ilabel olabel [weight]</code> and one per final state
 * <code>state [weight]</code>, weights left out when they're ONE(). The source
 * of the first line is the start state.
 */
public class VectorFst<W extends Weight> implements MutableFst<W> {
	public static final int MAGIC = 2125659606;

	private static class State<W extends Weight> {
		W finalWeight;
		ArrayList<Arc<W>> arcs;
		State(W f) {
			finalWeight = f;
			arcs = new ArrayList<Arc<W>>();
		}
	}

	private final Semiring<W> semiring;
	private final ArrayList<State<W>> states;
	private int start;

	public VectorFst(Semiring<W> s) {
		semiring = s;
		states = new ArrayList<State<W>>();
		start = Arc.NO_STATE;
	}

	public Semiring<W> getSemiring() { return semiring; }

	public int getStart() { return start; }
	public void setStart(int s) {
		checkState(s);
		start = s;
	}

	public int numStates() { return states.size(); }
	public int addState() {
		states.add(new State<W>(semiring.ZERO()));
		return states.size()-1;
	}

	public W finalWeight(int s) {
		checkState(s);
		return states.get(s).finalWeight;
	}
	public void setFinal(int s, W w) {
		checkState(s);
		states.get(s).finalWeight = w;
	}

	public int numArcs(int s) {
		checkState(s);
		return states.get(s).arcs.size();
	}
	public Arc<W> getArc(int s, int i) {
		checkState(s);
		return states.get(s).arcs.get(i);
	}
	public void setArc(int s, int i, Arc<W> a) {
		checkState(s);
		states.get(s).arcs.set(i, a);
	}
	public void addArc(int s, Arc<W> a) {
		checkState(s);
		states.get(s).arcs.add(a);
	}

	public void deleteArcs(int s, int n) {
		checkState(s);
		ArrayList<Arc<W>> arcs = states.get(s).arcs;
		if (n < 0 || n > arcs.size())
			throw new IndexOutOfBoundsException("Can't delete "+n+" of the "+arcs.size()+" arcs of state "+s);
		arcs.subList(arcs.size()-n, arcs.size()).clear();
	}

	public void deleteStates(int n) {
		if (n < 0 || n > states.size())
			throw new IndexOutOfBoundsException("Can't delete "+n+" of "+states.size()+" states");
		states.subList(states.size()-n, states.size()).clear();
		if (start >= states.size())
			start = Arc.NO_STATE;
	}

	// total arcs over all states
	public int numArcs() {
		int n = 0;
		for (State<W> st : states)
			n += st.arcs.size();
		return n;
	}

	private void checkState(int s) {
		if (s < 0 || s >= states.size())
			throw new IndexOutOfBoundsException("No state "+s+" in transducer with "+states.size()+" states");
	}

	// binary i/o

	public void write(OutputStream os) throws IOException {
		DataOutputStream out = new DataOutputStream(os);
		out.writeInt(MAGIC);
		out.writeUTF(semiring.type());
		out.writeInt(start);
		out.writeInt(states.size());
		for (State<W> st : states) {
			st.finalWeight.write(out);
			out.writeInt(st.arcs.size());
			for (Arc<W> a : st.arcs) {
				out.writeInt(a.getIlabel());
				out.writeInt(a.getOlabel());
				a.getWeight().write(out);
				out.writeInt(a.getNextState());
			}
		}
		out.flush();
	}

	// weight type taken from the header
	public static VectorFst<? extends Weight> read(InputStream is, CompositeWeightConfig config) throws IOException, DataFormatException {
		DataInputStream in = new DataInputStream(is);
		String type = readHeader(in);
		Semiring<? extends Weight> sr;
		try {
			sr = SemiringFactory.getSemiring(type, config);
		}
		catch (ConfigureException e) {
			throw new DataFormatException("Transducer has unknown weight type "+type, e);
		}
		return readBody(in, sr);
	}

	// weight type given; the header must agree
	public static <W extends Weight> VectorFst<W> read(InputStream is, Semiring<W> sr) throws IOException, DataFormatException {
		DataInputStream in = new DataInputStream(is);
		String type = readHeader(in);
		if (!type.equals(sr.type()))
			throw new DataFormatException("Transducer weight type "+type+" doesn't match expected "+sr.type());
		return readBody(in, sr);
	}

	private static String readHeader(DataInputStream in) throws IOException, DataFormatException {
		int magic = in.readInt();
		if (magic != MAGIC)
			throw new DataFormatException("Bad transducer magic number "+magic+"; not a transducer file?");
		return in.readUTF();
	}

	private static <W extends Weight> VectorFst<W> readBody(DataInputStream in, Semiring<W> sr) throws IOException, DataFormatException {
		boolean debug = false;
		VectorFst<W> fst = new VectorFst<W>(sr);
		int st = in.readInt();
		int n = in.readInt();
		if (n < 0 || st < Arc.NO_STATE || st >= n)
			throw new DataFormatException("Bad transducer header: start "+st+", "+n+" states");
		for (int s = 0; s < n; s++)
			fst.addState();
		if (st != Arc.NO_STATE)
			fst.setStart(st);
		for (int s = 0; s < n; s++) {
			fst.setFinal(s, sr.read(in));
			int na = in.readInt();
			for (int i = 0; i < na; i++) {
				int il = in.readInt();
				int ol = in.readInt();
				W w = sr.read(in);
				int next = in.readInt();
				if (next < 0 || next >= n)
					throw new DataFormatException("Arc from state "+s+" to nonexistent state "+next);
				fst.addArc(s, new Arc<W>(il, ol, w, next));
			}
		}
		if (debug) Debug.debug(debug, "read "+n+" states, "+fst.numArcs()+" arcs");
		return fst;
	}

	// text i/o

	public void printText(Writer w) throws IOException {
		if (start == Arc.NO_STATE) {
			w.flush();
			return;
		}
		// start state first
		printState(w, start);
		for (int s = 0; s < states.size(); s++)
			if (s != start)
				printState(w, s);
		w.flush();
	}

	private void printState(Writer w, int s) throws IOException {
		State<W> st = states.get(s);
		for (Arc<W> a : st.arcs) {
			w.write(s+"\t"+a.getNextState()+"\t"+a.getIlabel()+"\t"+a.getOlabel());
			if (!a.getWeight().equals(semiring.ONE()))
				w.write("\t"+semiring.print(a.getWeight()));
			w.write("\n");
		}
		if (!st.finalWeight.equals(semiring.ZERO())) {
			w.write(Integer.toString(s));
			if (!st.finalWeight.equals(semiring.ONE()))
				w.write("\t"+semiring.print(st.finalWeight));
			w.write("\n");
		}
	}

	public static <W extends Weight> VectorFst<W> readText(Reader r, Semiring<W> sr) throws IOException, DataFormatException {
		BufferedReader br = new BufferedReader(r);
		VectorFst<W> fst = new VectorFst<W>(sr);
		String line;
		int lineno = 0;
		while ((line = br.readLine()) != null) {
			lineno++;
			String t = line.trim();
			if (t.length() == 0)
				continue;
			String[] f = t.split("\\s+");
			try {
				int src = Integer.parseInt(f[0]);
				fst.ensureState(src);
				if (fst.start == Arc.NO_STATE)
					fst.start = src;
				if (f.length <= 2) {
					fst.setFinal(src, f.length == 2 ? sr.parse(f[1]) : sr.ONE());
				}
				else if (f.length == 4 || f.length == 5) {
					int dst = Integer.parseInt(f[1]);
					fst.ensureState(dst);
					W w = f.length == 5 ? sr.parse(f[4]) : sr.ONE();
					fst.addArc(src, new Arc<W>(Integer.parseInt(f[2]), Integer.parseInt(f[3]), w, dst));
				}
				else
					throw new DataFormatException("Line "+lineno+": expected 1, 2, 4 or 5 fields; got "+f.length+": "+line);
			}
			catch (NumberFormatException e) {
				throw new DataFormatException("Line "+lineno+": bad number in "+line, e);
			}
		}
		return fst;
	}

	private void ensureState(int s) {
		if (s < 0)
			throw new NumberFormatException("negative state "+s);
		while (states.size() <= s)
			addState();
	}

	public boolean equals(Object o) {
		if (!(o instanceof VectorFst))
			return false;
		VectorFst<?> f = (VectorFst<?>)o;
		if (start != f.start || states.size() != f.states.size() || !semiring.type().equals(f.semiring.type()))
			return false;
		for (int s = 0; s < states.size(); s++) {
			State<W> a = states.get(s);
			State<?> b = f.states.get(s);
			if (!a.finalWeight.equals(b.finalWeight) || !a.arcs.equals(b.arcs))
				return false;
		}
		return true;
	}

	public int hashCode() {
		int h = start;
		for (State<W> st : states)
			h = h * 31 + st.arcs.hashCode();
		return h;
	}

	public String toString() {
		java.io.StringWriter sw = new java.io.StringWriter();
		try {
			printText(sw);
		}
		catch (IOException e) {
			throw new IllegalStateException("StringWriter failed", e);
		}
		return sw.toString();
	}
}
