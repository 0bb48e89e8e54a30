package edu.isi.remora;

// real is +, *, 0, 1
// values are stored as-is, so this underflows where log doesn't
public class RealSemiring extends FloatSemiring {
	public static final String TYPE = "real";
	private static final FloatWeight ZERO = new FloatWeight(0.0F);
	private static final FloatWeight ONE = new FloatWeight(1.0F);

	public String type() { return TYPE; }
	public long properties() {
		return SEMIRING | COMMUTATIVE;
	}

	public boolean member(FloatWeight w) {
		return w != null && w.member() && !Float.isInfinite(w.getValue());
	}

	public FloatWeight plus(FloatWeight a, FloatWeight b) {
		if (!checkMembers("plus", a, b))
			return NOWEIGHT();
		return new FloatWeight(a.getValue()+b.getValue());
	}
	public FloatWeight times(FloatWeight a, FloatWeight b) {
		if (!checkMembers("times", a, b))
			return NOWEIGHT();
		if (a.getValue() == 0.0F || b.getValue() == 0.0F)
			return ZERO;
		return new FloatWeight(a.getValue()*b.getValue());
	}
	public FloatWeight divide(FloatWeight c, FloatWeight a, DivideType side) {
		if (!checkMembers("divide", c, a))
			return NOWEIGHT();
		if (a.getValue() == 0.0F) {
			Debug.error(type()+" divide: division by zero");
			return NOWEIGHT();
		}
		return new FloatWeight(c.getValue()/a.getValue());
	}
	public FloatWeight ZERO() { return ZERO; }
	public FloatWeight ONE() { return ONE; }
}
