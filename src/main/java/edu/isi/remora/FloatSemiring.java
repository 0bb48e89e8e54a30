package edu.isi.remora;

import java.io.DataInput;
import java.io.IOException;

// common parts of the semirings whose weights are single floats.
// reverse is the identity; text and binary forms are those of FloatWeight
public abstract class FloatSemiring extends Semiring<FloatWeight> {
	private static final FloatWeight NO_WEIGHT = new FloatWeight(Float.NaN);

	public FloatWeight NOWEIGHT() { return NO_WEIGHT; }

	public Semiring<FloatWeight> reverseSemiring() { return this; }
	public FloatWeight reverse(FloatWeight a) { return a; }

	public FloatWeight parse(String s) throws DataFormatException {
		return FloatWeight.parse(s);
	}

	public FloatWeight read(DataInput in) throws IOException {
		return new FloatWeight(in.readFloat());
	}

	// reports and returns false if either operand is outside the carrier set
	protected boolean checkMembers(String op, FloatWeight a, FloatWeight b) {
		if (member(a) && member(b))
			return true;
		Debug.error(type()+" "+op+": non-member operand ("+a+", "+b+")");
		return false;
	}

	// a - b in the negated log domain; shared by tropical and log division
	protected FloatWeight subtract(FloatWeight c, FloatWeight a) {
		if (!checkMembers("divide", c, a))
			return NOWEIGHT();
		float f1 = c.getValue();
		float f2 = a.getValue();
		if (f2 == Float.POSITIVE_INFINITY) {
			Debug.error(type()+" divide: division by zero");
			return NOWEIGHT();
		}
		if (f1 == Float.POSITIVE_INFINITY)
			return ZERO();
		return new FloatWeight(f1 - f2);
	}
}
