package edu.isi.remora;

import java.util.HashMap;

// registry of weight conversions, keyed by source and target type.
// converting a type to itself is always the identity; any other pair without a
// registered converter reports an error and returns the target's NOWEIGHT(). callers
// check member() on the result
public class WeightConvert {
	static private HashMap<String, HashMap<String, WeightConverter<?, ?>>> converters;
	static {
		converters = new HashMap<String, HashMap<String, WeightConverter<?, ?>>>();
		// tropical and log share a representation
		WeightConverter<FloatWeight, FloatWeight> same = new WeightConverter<FloatWeight, FloatWeight>() {
			public FloatWeight convert(FloatWeight w, Semiring<FloatWeight> to) {
				return w;
			}
		};
		register(TropicalSemiring.TYPE, LogSemiring.TYPE, same);
		register(LogSemiring.TYPE, TropicalSemiring.TYPE, same);
		// probabilities to negated logs and back
		WeightConverter<FloatWeight, FloatWeight> fromReal = new WeightConverter<FloatWeight, FloatWeight>() {
			public FloatWeight convert(FloatWeight w, Semiring<FloatWeight> to) {
				return new FloatWeight(-Math.log(w.getValue()));
			}
		};
		register(RealSemiring.TYPE, LogSemiring.TYPE, fromReal);
		register(RealSemiring.TYPE, TropicalSemiring.TYPE, fromReal);
		register(LogSemiring.TYPE, RealSemiring.TYPE, new WeightConverter<FloatWeight, FloatWeight>() {
			public FloatWeight convert(FloatWeight w, Semiring<FloatWeight> to) {
				return new FloatWeight(Math.exp(-w.getValue()));
			}
		});
	}

	public static synchronized void register(String from, String to, WeightConverter<?, ?> c) {
		HashMap<String, WeightConverter<?, ?>> m = converters.get(from);
		if (m == null)
			converters.put(from, m = new HashMap<String, WeightConverter<?, ?>>());
		m.put(to, c);
	}

	public static synchronized boolean isRegistered(String from, String to) {
		if (from.equals(to))
			return true;
		return converters.containsKey(from) && converters.get(from).containsKey(to);
	}

	public static <W1 extends Weight, W2 extends Weight> W2 convert(W1 w, Semiring<W1> from, Semiring<W2> to) {
		boolean debug = false;
		if (from.type().equals(to.type())) {
			if (debug) Debug.debug(debug, "identity conversion of "+from.type());
			return (W2)(Weight)w;
		}
		WeightConverter<W1, W2> c = null;
		synchronized (WeightConvert.class) {
			if (converters.containsKey(from.type()))
				c = (WeightConverter<W1, W2>)converters.get(from.type()).get(to.type());
		}
		if (c == null) {
			Debug.error("WeightConvert: Can't convert weight from \""+from.type()+"\" to \""+to.type()+"\"");
			return to.NOWEIGHT();
		}
		if (!from.member(w)) {
			Debug.error("WeightConvert: non-member "+w+" of "+from.type());
			return to.NOWEIGHT();
		}
		return c.convert(w, to);
	}
}
