package edu.isi.remora;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Collapses the labels and/or weight of an arc into a single integer code and
 * back again. The flags say which fields take part; they are fixed for the
 * life of the mapper and travel with it when it's written to a codex file.
 * <p>
 * An encoded arc has the code as its input label, and also as its output label
 * if labels are encoded; its weight becomes ONE() if weights are encoded.
 * Unencoded fields pass through. Decoding reverses this exactly.
 * <p>
 * Codex file layout (big-endian): magic int, weight type (modified UTF-8),
 * flags int, tuple count int, then the tuples in code order, each as ilabel
 * int, olabel int and the weight's binary form.
 * <p>
 * Not thread safe; give each thread its own mapper.
 */
public class EncodeMapper<W extends Weight> {
	public static final int ENCODE_LABELS = 0x1;
	public static final int ENCODE_WEIGHTS = 0x2;
	public static final int ENCODE_FLAGS = ENCODE_LABELS | ENCODE_WEIGHTS;

	public static final int MAGIC = 2129983209;

	private final Semiring<W> semiring;
	private final int flags;
	private final EncodeTable<W> table;

	public EncodeMapper(Semiring<W> sr, int f) {
		this(sr, f, new EncodeTable<W>());
	}

	private EncodeMapper(Semiring<W> sr, int f, EncodeTable<W> t) {
		semiring = sr;
		flags = f & ENCODE_FLAGS;
		table = t;
	}

	public static int getFlags(boolean encodeLabels, boolean encodeWeights) {
		return (encodeLabels ? ENCODE_LABELS : 0) | (encodeWeights ? ENCODE_WEIGHTS : 0);
	}

	public Semiring<W> getSemiring() { return semiring; }
	public int getFlags() { return flags; }
	public boolean encodesLabels() { return (flags & ENCODE_LABELS) != 0; }
	public boolean encodesWeights() { return (flags & ENCODE_WEIGHTS) != 0; }
	// number of codes handed out so far
	public int size() { return table.size(); }

	// the lookup key: only the selected fields take part
	public EncodeTuple<W> key(int ilabel, int olabel, W weight) {
		return new EncodeTuple<W>(ilabel,
				encodesLabels() ? olabel : 0,
				encodesWeights() ? weight : semiring.ONE());
	}

	public int encode(int ilabel, int olabel, W weight) {
		return table.encode(key(ilabel, olabel, weight));
	}

	public EncodeTuple<W> decode(int code) throws UnusualConditionException {
		EncodeTuple<W> t = table.decode(code);
		if (t == null)
			throw new UnusualConditionException("EncodeMapper: decode failed: code "+code+
					" isn't in a table of "+table.size()+" codes; wrong or corrupt codex?");
		return t;
	}

	public Arc<W> encode(Arc<W> a) {
		int code = encode(a.getIlabel(), a.getOlabel(), a.getWeight());
		return new Arc<W>(code,
				encodesLabels() ? code : a.getOlabel(),
				encodesWeights() ? semiring.ONE() : a.getWeight(),
				a.getNextState());
	}

	public Arc<W> decode(Arc<W> a) throws UnusualConditionException {
		EncodeTuple<W> t = decode(a.getIlabel());
		return new Arc<W>(t.getIlabel(),
				encodesLabels() ? t.getOlabel() : a.getOlabel(),
				encodesWeights() ? t.getWeight() : a.getWeight(),
				a.getNextState());
	}

	// persistence

	public void write(File f) throws IOException {
		OutputStream os = new BufferedOutputStream(new FileOutputStream(f));
		try {
			write(os);
		}
		finally {
			os.close();
		}
	}

	public void write(OutputStream os) throws IOException {
		DataOutputStream out = new DataOutputStream(os);
		out.writeInt(MAGIC);
		out.writeUTF(semiring.type());
		out.writeInt(flags);
		out.writeInt(table.size());
		for (int code = EncodeTable.FIRST_CODE; code < EncodeTable.FIRST_CODE + table.size(); code++) {
			EncodeTuple<W> t = table.decode(code);
			out.writeInt(t.getIlabel());
			out.writeInt(t.getOlabel());
			t.getWeight().write(out);
		}
		out.flush();
	}

	public static <W extends Weight> EncodeMapper<W> read(File f, Semiring<W> sr) throws IOException, DataFormatException {
		InputStream is = new BufferedInputStream(new FileInputStream(f));
		try {
			return read(is, sr);
		}
		finally {
			is.close();
		}
	}

	// codes come back exactly as they were handed out: position in the file is the code
	public static <W extends Weight> EncodeMapper<W> read(InputStream is, Semiring<W> sr) throws IOException, DataFormatException {
		boolean debug = false;
		DataInputStream in = new DataInputStream(is);
		int magic = in.readInt();
		if (magic != MAGIC)
			throw new DataFormatException("Bad codex magic number "+magic+"; not an encoder file?");
		String type = in.readUTF();
		if (!type.equals(sr.type()))
			throw new DataFormatException("Codex weight type "+type+" doesn't match "+sr.type());
		int f = in.readInt();
		if ((f & ~ENCODE_FLAGS) != 0)
			throw new DataFormatException("Bad codex flags "+f);
		int n = in.readInt();
		if (n < 0)
			throw new DataFormatException("Bad codex size "+n);
		EncodeTable<W> t = new EncodeTable<W>();
		for (int i = 0; i < n; i++) {
			int il = in.readInt();
			int ol = in.readInt();
			W w = sr.read(in);
			int code = t.encode(new EncodeTuple<W>(il, ol, w));
			if (code != i + EncodeTable.FIRST_CODE)
				throw new DataFormatException("Duplicate tuple ("+il+", "+ol+", "+w+") in codex at position "+i);
		}
		if (debug) Debug.debug(debug, "read codex of "+n+" tuples with flags "+f);
		return new EncodeMapper<W>(sr, f, t);
	}
}
