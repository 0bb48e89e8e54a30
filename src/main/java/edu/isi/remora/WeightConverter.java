package edu.isi.remora;

// converts weights of one semiring into another. registered with WeightConvert
public interface WeightConverter<W1 extends Weight, W2 extends Weight> {
	W2 convert(W1 w, Semiring<W2> to);
}
