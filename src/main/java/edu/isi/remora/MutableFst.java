package edu.isi.remora;

/**
 * The part of a weighted transducer that encoding needs: its states, their
 * final weights, and read/replace access to each arc by position. States are
 * numbered 0..numStates()-1.
 */
public interface MutableFst<W extends Weight> {
	Semiring<W> getSemiring();

	/** start state, or {@link Arc#NO_STATE} if the transducer is empty */
	int getStart();
	void setStart(int s);

	int numStates();
	/** adds a non-final state with no arcs and returns its number */
	int addState();

	/** ZERO() for non-final states */
	W finalWeight(int s);
	void setFinal(int s, W w);

	int numArcs(int s);
	Arc<W> getArc(int s, int i);
	/** replaces the i'th arc leaving s */
	void setArc(int s, int i, Arc<W> a);
	void addArc(int s, Arc<W> a);
	/** removes the last n arcs leaving s */
	void deleteArcs(int s, int n);
	/** removes the last n states; the start state is cleared if it was one of them */
	void deleteStates(int n);
}
