package edu.isi.remora;

import java.io.DataOutput;
import java.io.IOException;
import java.io.StringWriter;

// pair of weights from two (possibly different) semirings. the operations are in ProductSemiring
public final class ProductWeight<W1 extends Weight, W2 extends Weight> implements Weight {
	private final W1 value1;
	private final W2 value2;

	public ProductWeight(W1 v1, W2 v2) {
		value1 = v1;
		value2 = v2;
	}

	public W1 getValue1() { return value1; }
	public W2 getValue2() { return value2; }

	public boolean member() {
		return value1.member() && value2.member();
	}

	public boolean approxEqual(Weight w, float delta) {
		if (!(w instanceof ProductWeight))
			return false;
		ProductWeight<?, ?> p = (ProductWeight<?, ?>)w;
		return value1.approxEqual(p.value1, delta) && value2.approxEqual(p.value2, delta);
	}

	public ProductWeight<W1, W2> quantize(float delta) {
		return new ProductWeight<W1, W2>((W1)value1.quantize(delta), (W2)value2.quantize(delta));
	}

	public void write(DataOutput out) throws IOException {
		value1.write(out);
		value2.write(out);
	}

	public boolean equals(Object o) {
		if (!(o instanceof ProductWeight))
			return false;
		ProductWeight<?, ?> p = (ProductWeight<?, ?>)o;
		return value1.equals(p.value1) && value2.equals(p.value2);
	}

	public int hashCode() {
		return Integer.rotateLeft(value1.hashCode(), 5) ^ value2.hashCode();
	}

	// default layout; ProductSemiring.print honors its own config
	public String toString() {
		StringWriter sw = new StringWriter();
		CompositeWeightWriter w = new CompositeWeightWriter(sw, CompositeWeightConfig.DEFAULT);
		try {
			w.writeBegin();
			w.writeElement(value1.toString());
			w.writeElement(value2.toString());
			w.writeEnd();
		}
		catch (IOException e) {
			throw new IllegalStateException("StringWriter failed", e);
		}
		return sw.toString();
	}
}
