package edu.isi.remora;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;

// encodes and decodes every arc of a transducer in place. arc order is kept.
// when weights are encoded the final weights move too: each final state gets an epsilon
// arc carrying the code of (0, 0, final weight) into one added superfinal state, and is
// made non-final. decoding puts them back and drops the superfinal state
public class Encoder {

	// encodes with a fresh mapper, or extends the one in codex if reuse is set, then
	// writes the mapper to codex
	public static <W extends Weight> EncodeMapper<W> encode(MutableFst<W> fst, int flags, boolean reuse, File codex)
	throws IOException, DataFormatException, ConfigureException {
		boolean debug = false;
		EncodeMapper<W> mapper;
		if (reuse) {
			mapper = EncodeMapper.read(codex, fst.getSemiring());
			if (mapper.getFlags() != (flags & EncodeMapper.ENCODE_FLAGS))
				throw new ConfigureException("Codex "+codex+" was built with flags "+mapper.getFlags()+
						"; can't reuse it with flags "+flags);
			if (debug) Debug.debug(debug, "reusing codex with "+mapper.size()+" codes");
		}
		else
			mapper = new EncodeMapper<W>(fst.getSemiring(), flags);
		encode(fst, mapper);
		mapper.write(codex);
		return mapper;
	}

	public static <W extends Weight> void encode(MutableFst<W> fst, EncodeMapper<W> mapper) {
		boolean debug = false;
		int n = fst.numStates();
		for (int s = 0; s < n; s++) {
			int na = fst.numArcs(s);
			for (int i = 0; i < na; i++)
				fst.setArc(s, i, mapper.encode(fst.getArc(s, i)));
		}
		if (!mapper.encodesWeights())
			return;
		Semiring<W> sr = fst.getSemiring();
		int superfinal = Arc.NO_STATE;
		for (int s = 0; s < n; s++) {
			W fw = fst.finalWeight(s);
			if (fw.equals(sr.ZERO()))
				continue;
			if (superfinal == Arc.NO_STATE) {
				superfinal = fst.addState();
				fst.setFinal(superfinal, sr.ONE());
			}
			fst.addArc(s, mapper.encode(new Arc<W>(Arc.EPSILON, Arc.EPSILON, fw, superfinal)));
			fst.setFinal(s, sr.ZERO());
		}
		if (debug) Debug.debug(debug, "superfinal state is "+superfinal);
	}

	public static <W extends Weight> void decode(MutableFst<W> fst, File codex)
	throws IOException, DataFormatException, UnusualConditionException {
		decode(fst, EncodeMapper.read(codex, fst.getSemiring()));
	}

	// all or nothing: if any code is unknown the transducer is left as it was
	public static <W extends Weight> void decode(MutableFst<W> fst, EncodeMapper<W> mapper) throws UnusualConditionException {
		ArrayList<ArrayList<Arc<W>>> decoded = new ArrayList<ArrayList<Arc<W>>>();
		for (int s = 0; s < fst.numStates(); s++) {
			int n = fst.numArcs(s);
			ArrayList<Arc<W>> arcs = new ArrayList<Arc<W>>(n);
			for (int i = 0; i < n; i++) {
				try {
					arcs.add(mapper.decode(fst.getArc(s, i)));
				}
				catch (UnusualConditionException e) {
					throw new UnusualConditionException("Arc "+i+" of state "+s+": "+e.getMessage(), e);
				}
			}
			decoded.add(arcs);
		}
		int superfinal = mapper.encodesWeights() ? findSuperfinal(fst, decoded) : Arc.NO_STATE;
		for (int s = 0; s < fst.numStates(); s++) {
			ArrayList<Arc<W>> arcs = decoded.get(s);
			for (int i = 0; i < arcs.size(); i++)
				fst.setArc(s, i, arcs.get(i));
		}
		if (superfinal == Arc.NO_STATE)
			return;
		for (int s = 0; s < superfinal; s++) {
			int last = fst.numArcs(s) - 1;
			if (last >= 0 && fst.getArc(s, last).getNextState() == superfinal) {
				fst.setFinal(s, fst.getArc(s, last).getWeight());
				fst.deleteArcs(s, 1);
			}
		}
		fst.deleteStates(1);
	}

	// the superfinal state encode added, or NO_STATE if there isn't one. it's the last
	// state, not the start, has no arcs and final weight ONE, is the only final state, and
	// is reached only by epsilon arcs that come last on their source state
	private static <W extends Weight> int findSuperfinal(MutableFst<W> fst, ArrayList<ArrayList<Arc<W>>> decoded) {
		Semiring<W> sr = fst.getSemiring();
		int sf = fst.numStates() - 1;
		if (sf < 1 || sf == fst.getStart() || fst.numArcs(sf) != 0 || !fst.finalWeight(sf).equals(sr.ONE()))
			return Arc.NO_STATE;
		for (int s = 0; s < sf; s++) {
			if (!fst.finalWeight(s).equals(sr.ZERO()))
				return Arc.NO_STATE;
			ArrayList<Arc<W>> arcs = decoded.get(s);
			for (int i = 0; i < arcs.size(); i++) {
				Arc<W> a = arcs.get(i);
				if (a.getNextState() != sf)
					continue;
				if (i != arcs.size()-1 || a.getIlabel() != Arc.EPSILON || a.getOlabel() != Arc.EPSILON)
					return Arc.NO_STATE;
			}
		}
		return sf;
	}
}
