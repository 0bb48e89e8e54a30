package edu.isi.remora;

import java.io.DataOutput;
import java.io.IOException;

// a weight represented by a single float. shared by the tropical, log and real semirings;
// the semiring decides what the value means
public final class FloatWeight implements Weight {
	private final float value;

	public FloatWeight(float v) {
		value = v;
	}
	public FloatWeight(double v) {
		value = (float)v;
	}

	public float getValue() { return value; }

	public boolean member() {
		return !Float.isNaN(value) && value != Float.NEGATIVE_INFINITY;
	}

	public boolean approxEqual(Weight w, float delta) {
		if (!(w instanceof FloatWeight))
			return false;
		float v = ((FloatWeight)w).value;
		if (value == v)
			return true;
		return value <= v + delta && v <= value + delta;
	}

	public FloatWeight quantize(float delta) {
		if (Float.isInfinite(value) || Float.isNaN(value))
			return this;
		return new FloatWeight((float)Math.floor(value/delta + 0.5F) * delta);
	}

	public void write(DataOutput out) throws IOException {
		out.writeFloat(value);
	}

	// NaN never equals anything, itself included
	public boolean equals(Object o) {
		if (!(o instanceof FloatWeight))
			return false;
		return value == ((FloatWeight)o).value;
	}

	public int hashCode() {
		// 0.0 == -0.0
		if (value == 0.0F)
			return 0;
		return Float.floatToIntBits(value);
	}

	// integral values print without a fraction so "3" reads back as 3
	public String toString() {
		if (Float.isNaN(value))
			return "BadNumber";
		if (Float.isInfinite(value))
			return value > 0 ? "Infinity" : "-Infinity";
		if (value == Math.rint(value) && Math.abs(value) < 1e15)
			return Long.toString((long)value);
		return Float.toString(value);
	}

	public static FloatWeight parse(String s) throws DataFormatException {
		String t = s.trim();
		if (t.equals("Infinity") || t.equals("inf"))
			return new FloatWeight(Float.POSITIVE_INFINITY);
		if (t.equals("-Infinity") || t.equals("-inf"))
			return new FloatWeight(Float.NEGATIVE_INFINITY);
		if (t.equals("BadNumber"))
			return new FloatWeight(Float.NaN);
		try {
			return new FloatWeight(Float.parseFloat(t));
		}
		catch (NumberFormatException e) {
			throw new DataFormatException("Not a float weight: \""+s+"\"", e);
		}
	}
}
