package edu.isi.remora;

// a transition: input label, output label, weight, destination state. label 0 is epsilon
public final class Arc<W extends Weight> {
	public static final int EPSILON = 0;
	public static final int NO_STATE = -1;

	private final int ilabel;
	private final int olabel;
	private final W weight;
	private final int nextstate;

	public Arc(int i, int o, W w, int next) {
		ilabel = i;
		olabel = o;
		weight = w;
		nextstate = next;
	}

	public int getIlabel() { return ilabel; }
	public int getOlabel() { return olabel; }
	public W getWeight() { return weight; }
	public int getNextState() { return nextstate; }

	public boolean equals(Object o) {
		if (!(o instanceof Arc))
			return false;
		Arc<?> a = (Arc<?>)o;
		return ilabel == a.ilabel && olabel == a.olabel && nextstate == a.nextstate && weight.equals(a.weight);
	}
	public int hashCode() {
		return ((ilabel * 31 + olabel) * 31 + nextstate) * 31 + weight.hashCode();
	}
	public String toString() {
		return ilabel+":"+olabel+"/"+weight+" -> "+nextstate;
	}
}
