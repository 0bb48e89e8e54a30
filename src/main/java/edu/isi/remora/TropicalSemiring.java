package edu.isi.remora;

// tropical is min, +, +INF, 0
public class TropicalSemiring extends FloatSemiring {
	public static final String TYPE = "tropical";
	private static final FloatWeight ZERO = new FloatWeight(Float.POSITIVE_INFINITY);
	private static final FloatWeight ONE = new FloatWeight(0.0F);

	public String type() { return TYPE; }
	public long properties() {
		return SEMIRING | COMMUTATIVE | IDEMPOTENT | PATH;
	}

	public FloatWeight plus(FloatWeight a, FloatWeight b) {
		if (!checkMembers("plus", a, b))
			return NOWEIGHT();
		return a.getValue() < b.getValue() ? a : b;
	}
	public FloatWeight times(FloatWeight a, FloatWeight b) {
		if (!checkMembers("times", a, b))
			return NOWEIGHT();
		float f1 = a.getValue();
		float f2 = b.getValue();
		if (f1 == Float.POSITIVE_INFINITY)
			return a;
		if (f2 == Float.POSITIVE_INFINITY)
			return b;
		return new FloatWeight(f1+f2);
	}
	public FloatWeight divide(FloatWeight c, FloatWeight a, DivideType side) {
		return subtract(c, a);
	}
	public FloatWeight ZERO() { return ZERO; }
	public FloatWeight ONE() { return ONE; }
}
