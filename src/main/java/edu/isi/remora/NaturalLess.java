package edu.isi.remora;

/**
 * Strict version of the natural order: a &lt;= b iff a + b = a.
 * <p>
 * The natural order is a negative partial order iff the semiring is
 * idempotent. It is trivially monotonic for plus. It is left (resp. right)
 * monotonic for times iff the semiring is left (resp. right) distributive. It
 * is a total order iff the semiring has the path property.
 * <p>
 * Building one over a non-idempotent semiring reports an error but still
 * gives a usable comparator; its answers just aren't an order.
 *
 * @see "Mohri, M. 2002. Semiring framework and algorithms for shortest-distance
 *      problems. Journal of Automata, Languages and Combinatorics 7(3): 321-350."
 */
public class NaturalLess<W extends Weight> {
	private final Semiring<W> semiring;

	public NaturalLess(Semiring<W> s) {
		semiring = s;
		if (!s.hasProperties(Semiring.IDEMPOTENT))
			Debug.error("NaturalLess: Weight type is not idempotent: "+s.type());
	}

	public Semiring<W> getSemiring() { return semiring; }

	public boolean less(W w1, W w2) {
		return semiring.plus(w1, w2).equals(w1) && !w1.equals(w2);
	}

	// true if the order is guaranteed total
	public boolean isTotal() {
		return semiring.hasProperties(Semiring.IDEMPOTENT | Semiring.PATH);
	}
}
