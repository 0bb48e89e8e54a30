package edu.isi.remora;

// source of random weights for one semiring, for randomized testing of algorithms
public interface WeightGenerator<W extends Weight> {
	W generate();

	// builds a generator for a semiring. registered with WeightGenerate
	public interface Factory {
		<W extends Weight> WeightGenerator<W> create(Semiring<W> sr, long seed, boolean allowZero, int numRandomWeights);
	}
}
