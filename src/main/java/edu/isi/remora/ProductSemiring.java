package edu.isi.remora;

import java.io.DataInput;
import java.io.IOException;
import java.io.PushbackReader;
import java.io.StringReader;
import java.io.StringWriter;

// cartesian product of two semirings; every operation is componentwise.
// text form is a two-element composite weight laid out per the config given at construction
public class ProductSemiring<W1 extends Weight, W2 extends Weight> extends Semiring<ProductWeight<W1, W2>> {
	public static final String SEPARATOR = "_X_";

	private final Semiring<W1> s1;
	private final Semiring<W2> s2;
	private final CompositeWeightConfig config;
	private final ProductWeight<W1, W2> zero;
	private final ProductWeight<W1, W2> one;
	private final ProductWeight<W1, W2> noWeight;

	public ProductSemiring(Semiring<W1> first, Semiring<W2> second) {
		this(first, second, CompositeWeightConfig.DEFAULT);
	}

	public ProductSemiring(Semiring<W1> first, Semiring<W2> second, CompositeWeightConfig c) {
		s1 = first;
		s2 = second;
		config = c;
		zero = new ProductWeight<W1, W2>(s1.ZERO(), s2.ZERO());
		one = new ProductWeight<W1, W2>(s1.ONE(), s2.ONE());
		noWeight = new ProductWeight<W1, W2>(s1.NOWEIGHT(), s2.NOWEIGHT());
	}

	public Semiring<W1> getFirst() { return s1; }
	public Semiring<W2> getSecond() { return s2; }
	public CompositeWeightConfig getConfig() { return config; }

	public String type() {
		return s1.type()+SEPARATOR+s2.type();
	}

	// the path property never survives a product
	public long properties() {
		return s1.properties() & s2.properties() & (SEMIRING | COMMUTATIVE | IDEMPOTENT);
	}

	public boolean member(ProductWeight<W1, W2> w) {
		return w != null && s1.member(w.getValue1()) && s2.member(w.getValue2());
	}

	public ProductWeight<W1, W2> plus(ProductWeight<W1, W2> a, ProductWeight<W1, W2> b) {
		return new ProductWeight<W1, W2>(s1.plus(a.getValue1(), b.getValue1()),
				s2.plus(a.getValue2(), b.getValue2()));
	}
	public ProductWeight<W1, W2> times(ProductWeight<W1, W2> a, ProductWeight<W1, W2> b) {
		return new ProductWeight<W1, W2>(s1.times(a.getValue1(), b.getValue1()),
				s2.times(a.getValue2(), b.getValue2()));
	}
	public ProductWeight<W1, W2> divide(ProductWeight<W1, W2> c, ProductWeight<W1, W2> a, DivideType side) {
		return new ProductWeight<W1, W2>(s1.divide(c.getValue1(), a.getValue1(), side),
				s2.divide(c.getValue2(), a.getValue2(), side));
	}

	public ProductWeight<W1, W2> ZERO() { return zero; }
	public ProductWeight<W1, W2> ONE() { return one; }
	public ProductWeight<W1, W2> NOWEIGHT() { return noWeight; }

	public Semiring<? extends Weight> reverseSemiring() {
		if (s1.reverseSemiring() == s1 && s2.reverseSemiring() == s2)
			return this;
		return new ProductSemiring(s1.reverseSemiring(), s2.reverseSemiring(), config);
	}
	public Weight reverse(ProductWeight<W1, W2> a) {
		if (reverseSemiring() == this)
			return a;
		return new ProductWeight<Weight, Weight>(s1.reverse(a.getValue1()), s2.reverse(a.getValue2()));
	}

	public String print(ProductWeight<W1, W2> w) {
		StringWriter sw = new StringWriter();
		CompositeWeightWriter writer = new CompositeWeightWriter(sw, config);
		try {
			writer.writeBegin();
			writer.writeElement(s1, w.getValue1());
			writer.writeElement(s2, w.getValue2());
			writer.writeEnd();
		}
		catch (IOException e) {
			throw new IllegalStateException("StringWriter failed", e);
		}
		return sw.toString();
	}

	public ProductWeight<W1, W2> parse(String s) throws DataFormatException {
		CompositeWeightReader reader = new CompositeWeightReader(new PushbackReader(new StringReader(s)), config);
		try {
			reader.readBegin();
			W1 v1 = reader.readElement(s1);
			if (!reader.hasMore())
				throw new DataFormatException("Product weight \""+s+"\" has only one element");
			W2 v2 = reader.readElement(s2, true);
			reader.readEnd();
			return new ProductWeight<W1, W2>(v1, v2);
		}
		catch (IOException e) {
			throw new DataFormatException("Couldn't read product weight \""+s+"\"", e);
		}
	}

	public ProductWeight<W1, W2> read(DataInput in) throws IOException {
		W1 v1 = s1.read(in);
		W2 v2 = s2.read(in);
		return new ProductWeight<W1, W2>(v1, v2);
	}
}
