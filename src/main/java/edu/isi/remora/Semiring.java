package edu.isi.remora;

import java.io.DataInput;
import java.io.IOException;

// the general semiring. Subclasses do the operations
// a semiring is specified by plus and times and two designated elements ZERO and ONE:
//   plus: associative, commutative, ZERO is its identity
//   times: associative, ONE is its identity, distributes w.r.t. plus, ZERO is an annihilator:
//          times(ZERO, a) == times(a, ZERO) == ZERO
// a left semiring distributes on the left; a right semiring similarly.
// operations handed a non-member return NOWEIGHT() and report an error through Debug; they
// never throw.
public abstract class Semiring<W extends Weight> {

	// for all a, b, c: times(c, plus(a, b)) = plus(times(c, a), times(c, b))
	public static final long LEFT_SEMIRING = 0x1L;
	// for all a, b, c: times(plus(a, b), c) = plus(times(a, c), times(b, c))
	public static final long RIGHT_SEMIRING = 0x2L;
	public static final long SEMIRING = LEFT_SEMIRING | RIGHT_SEMIRING;
	// for all a, b: times(a, b) = times(b, a)
	public static final long COMMUTATIVE = 0x4L;
	// for all a: plus(a, a) = a
	public static final long IDEMPOTENT = 0x8L;
	// for all a, b: plus(a, b) = a or plus(a, b) = b
	public static final long PATH = 0x10L;

	// a representable float near .001
	public static final float DELTA = 1.0F / 1024.0F;

	// direction of division
	public enum DivideType {
		LEFT,
		RIGHT,
		// only meaningful in a commutative semiring
		ANY
	}

	// unique per concrete type. used in file headers and the conversion/generation registries
	public abstract String type();
	// fixed per type, never per value
	public abstract long properties();

	public abstract W plus(W a, W b);
	public abstract W times(W a, W b);

	// LEFT:  b' = divide(c, a, LEFT) s.t. times(a, b') == c (left semiring)
	// RIGHT: a' = divide(c, b, RIGHT) s.t. times(a', b) == c (right semiring)
	// ANY:   for commutative semirings all three agree
	public abstract W divide(W c, W a, DivideType side);

	public abstract W ZERO();
	public abstract W ONE();
	// not a member; returned to signal an error
	public abstract W NOWEIGHT();

	// the reverse weight type. the identity for (both left and right) semirings
	public abstract Semiring<? extends Weight> reverseSemiring();
	// reverse(reverse(a)) = a
	// reverse(plus(a, b)) = plus(reverse(a), reverse(b))
	// reverse(times(a, b)) = times(reverse(b), reverse(a))
	public abstract Weight reverse(W a);

	// text form. parse(print(w)) must equal w
	public abstract W parse(String s) throws DataFormatException;
	public String print(W w) {
		return w.toString();
	}

	// binary form, as written by Weight.write
	public abstract W read(DataInput in) throws IOException;

	public boolean member(W w) {
		return w != null && w.member();
	}

	public boolean hasProperties(long props) {
		return (properties() & props) == props;
	}

	// iterated product: power(w, 0) is ONE, power(w, n) = times(power(w, n-1), w)
	public W power(W w, long n) {
		W result = ONE();
		for (long i = 0; i < n; i++)
			result = times(result, w);
		return result;
	}

	// convenience for the commutative case
	public W divide(W c, W a) {
		return divide(c, a, DivideType.ANY);
	}

	public String toString() {
		return type();
	}
}
