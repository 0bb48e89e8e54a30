package edu.isi.remora;

// maps weight type names (as found in file headers and on the command line) to semirings
public class SemiringFactory {
	private static final TropicalSemiring tropical = new TropicalSemiring();
	private static final LogSemiring log = new LogSemiring();
	private static final RealSemiring real = new RealSemiring();

	public static Semiring<? extends Weight> getSemiring(String type) throws ConfigureException {
		return getSemiring(type, CompositeWeightConfig.DEFAULT);
	}

	// products are given as <first>_X_<second>, each half a simple type
	public static Semiring<? extends Weight> getSemiring(String type, CompositeWeightConfig config) throws ConfigureException {
		int x = type.indexOf(ProductSemiring.SEPARATOR);
		if (x >= 0) {
			Semiring first = getSimple(type.substring(0, x));
			Semiring second = getSimple(type.substring(x+ProductSemiring.SEPARATOR.length()));
			return new ProductSemiring(first, second, config);
		}
		return getSimple(type);
	}

	private static Semiring<FloatWeight> getSimple(String type) throws ConfigureException {
		if (type.equals(TropicalSemiring.TYPE))
			return tropical;
		else if (type.equals(LogSemiring.TYPE))
			return log;
		else if (type.equals(RealSemiring.TYPE))
			return real;
		throw new ConfigureException("Unexpected weight type: "+type+"; valid values are "+
				TropicalSemiring.TYPE+", "+LogSemiring.TYPE+", "+RealSemiring.TYPE+" and products of two of them");
	}
}
