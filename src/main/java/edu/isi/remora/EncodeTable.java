package edu.isi.remora;

import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.ArrayList;

// bijection between tuples and codes. codes are handed out densely from 1 in order of
// first encounter, so code k is tuples.get(k-1). 0 is never a code (trove's "absent" value)
public class EncodeTable<W extends Weight> {
	public static final int FIRST_CODE = 1;

	private final TObjectIntHashMap<EncodeTuple<W>> codes;
	private final ArrayList<EncodeTuple<W>> tuples;

	public EncodeTable() {
		codes = new TObjectIntHashMap<EncodeTuple<W>>();
		tuples = new ArrayList<EncodeTuple<W>>();
	}

	// existing code for t, or the next free one
	public int encode(EncodeTuple<W> t) {
		int code = codes.get(t);
		if (code != codes.getNoEntryValue())
			return code;
		tuples.add(t);
		code = tuples.size() - 1 + FIRST_CODE;
		codes.put(t, code);
		return code;
	}

	// null if the code was never handed out
	public EncodeTuple<W> decode(int code) {
		if (code < FIRST_CODE || code >= FIRST_CODE + tuples.size())
			return null;
		return tuples.get(code - FIRST_CODE);
	}

	// code for t, or 0 if t isn't in the table. doesn't add anything
	public int lookup(EncodeTuple<W> t) {
		return codes.get(t);
	}

	public int size() {
		return tuples.size();
	}
}
