package edu.isi.remora;

import java.io.DataOutput;
import java.io.IOException;

/**
 * A single value of some semiring's carrier set. The operations that combine
 * weights (plus, times, divide, ...) live on the {@link Semiring} that the
 * weight belongs to; the weight itself only knows how to compare, hash, round
 * and write itself. equals() and hashCode() must agree, since weights are used
 * as lookup keys when encoding.
 */
public interface Weight {
	/** true iff this value is in the carrier set. NOWEIGHT() never is */
	boolean member();

	/** equality up to delta, for inexact (floating) weights */
	boolean approxEqual(Weight w, float delta);

	/** canonical representative of this weight within delta */
	Weight quantize(float delta);

	/** binary form, read back by {@link Semiring#read} */
	void write(DataOutput out) throws IOException;
}
