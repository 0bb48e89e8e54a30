package edu.isi.remora;

// (ilabel, olabel, weight) as seen by an encode table. fields not being encoded are
// held at fixed placeholders so they don't split otherwise equal keys
public final class EncodeTuple<W extends Weight> {
	private final int ilabel;
	private final int olabel;
	private final W weight;

	public EncodeTuple(int i, int o, W w) {
		ilabel = i;
		olabel = o;
		weight = w;
	}

	public int getIlabel() { return ilabel; }
	public int getOlabel() { return olabel; }
	public W getWeight() { return weight; }

	public boolean equals(Object o) {
		if (!(o instanceof EncodeTuple))
			return false;
		EncodeTuple<?> t = (EncodeTuple<?>)o;
		if (ilabel != t.ilabel || olabel != t.olabel)
			return false;
		return weight == t.weight || weight.equals(t.weight);
	}

	public int hashCode() {
		return ilabel + olabel * 7853 + weight.hashCode() * 7867;
	}

	public String toString() {
		return "("+ilabel+", "+olabel+", "+weight+")";
	}
}
