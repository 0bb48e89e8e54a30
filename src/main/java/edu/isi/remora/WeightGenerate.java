package edu.isi.remora;

import java.util.HashMap;
import java.util.Random;

// registry of random weight generators, keyed by weight type. a type with nothing
// registered gets a generator that reports an error and hands back NOWEIGHT()
public class WeightGenerate {
	// default number of distinct weights
	public static final int NUM_RANDOM_WEIGHTS = 5;

	static private HashMap<String, WeightGenerator.Factory> factories;
	static {
		factories = new HashMap<String, WeightGenerator.Factory>();
		register(TropicalSemiring.TYPE, new FloatFactory(0));
		register(LogSemiring.TYPE, new FloatFactory(0));
		// no zero-valued reals unless zero is allowed
		register(RealSemiring.TYPE, new FloatFactory(1));
	}

	public static synchronized void register(String type, WeightGenerator.Factory f) {
		factories.put(type, f);
	}

	public static synchronized boolean isRegistered(Semiring<?> sr) {
		if (sr instanceof ProductSemiring)
			return isRegistered(((ProductSemiring<?, ?>)sr).getFirst()) &&
				isRegistered(((ProductSemiring<?, ?>)sr).getSecond());
		return factories.containsKey(sr.type());
	}

	public static <W extends Weight> WeightGenerator<W> get(Semiring<W> sr, long seed) {
		return get(sr, seed, true, NUM_RANDOM_WEIGHTS);
	}

	public static <W extends Weight> WeightGenerator<W> get(final Semiring<W> sr, long seed, boolean allowZero, int numRandomWeights) {
		WeightGenerator.Factory f;
		synchronized (WeightGenerate.class) {
			f = factories.get(sr.type());
		}
		if (f != null)
			return f.create(sr, seed, allowZero, numRandomWeights);
		if (sr instanceof ProductSemiring) {
			ProductSemiring p = (ProductSemiring)sr;
			// distinct seeds so the two halves aren't in lockstep
			final WeightGenerator g1 = get(p.getFirst(), seed, allowZero, numRandomWeights);
			final WeightGenerator g2 = get(p.getSecond(), seed+1, allowZero, numRandomWeights);
			return new WeightGenerator<W>() {
				public W generate() {
					return (W)new ProductWeight((Weight)g1.generate(), (Weight)g2.generate());
				}
			};
		}
		return new WeightGenerator<W>() {
			public W generate() {
				Debug.error("WeightGenerate: No random generator for "+sr.type());
				return sr.NOWEIGHT();
			}
		};
	}

	// integral float weights in [offset, offset+n), or ZERO() one time in n+1 when allowed
	static class FloatFactory implements WeightGenerator.Factory {
		private final int offset;
		FloatFactory(int o) {
			offset = o;
		}
		public <W extends Weight> WeightGenerator<W> create(final Semiring<W> sr, long seed, final boolean allowZero, final int n) {
			final Random rand = new Random(seed);
			return new WeightGenerator<W>() {
				public W generate() {
					int sample = rand.nextInt(n + (allowZero ? 1 : 0));
					if (allowZero && sample == n)
						return sr.ZERO();
					return (W)new FloatWeight((float)(sample+offset));
				}
			};
		}
	}
}
