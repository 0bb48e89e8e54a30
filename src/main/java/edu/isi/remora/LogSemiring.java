package edu.isi.remora;

// log is -log(e^-a + e^-b), +, +INF, 0
// same representation as tropical, but plus accumulates instead of choosing
public class LogSemiring extends FloatSemiring {
	public static final String TYPE = "log";
	private static final FloatWeight ZERO = new FloatWeight(Float.POSITIVE_INFINITY);
	private static final FloatWeight ONE = new FloatWeight(0.0F);
	// beyond this difference the smaller term doesn't register
	static private int TOLERANCE=16;

	public String type() { return TYPE; }
	public long properties() {
		return SEMIRING | COMMUTATIVE;
	}

	public FloatWeight plus(FloatWeight a, FloatWeight b) {
		if (!checkMembers("plus", a, b))
			return NOWEIGHT();
		if (a.getValue() == Float.POSITIVE_INFINITY) return b;
		if (b.getValue() == Float.POSITIVE_INFINITY) return a;
		double x, y;
		if ((-a.getValue()) > (-b.getValue())) {
			x = -a.getValue();
			y = -b.getValue();
		}
		else {
			x = -b.getValue();
			y = -a.getValue();
		}
		// x>=y. If x>>y, estimate as x
		if (x >= y+TOLERANCE)
			return new FloatWeight(-x);
		double logtotal = Math.log1p(Math.exp(y-x));
		return new FloatWeight(-(x + logtotal));
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
