package edu.isi.remora;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.StringReader;

import junit.framework.TestCase;

public class TestFstEncode extends TestCase {
	private final TropicalSemiring tropical = new TropicalSemiring();
	private File dir;
	private File in;
	private File codex;
	private File out;

	protected void setUp() throws Exception {
		dir = File.createTempFile("fstencode", "");
		dir.delete();
		dir.mkdir();
		in = new File(dir, "in.fst");
		codex = new File(dir, "codex");
		out = new File(dir, "out.fst");
		writeFst(VectorFst.readText(new StringReader(TestEncoder.FST_A), tropical), in);
	}

	protected void tearDown() throws Exception {
		File[] files = dir.listFiles();
		if (files != null)
			for (File f : files)
				f.delete();
		dir.delete();
	}

	private static void writeFst(VectorFst<? extends Weight> f, File file) throws Exception {
		OutputStream os = new FileOutputStream(file);
		try {
			f.write(os);
		}
		finally {
			os.close();
		}
	}

	private static VectorFst<? extends Weight> readFst(File file) throws Exception {
		InputStream is = new FileInputStream(file);
		try {
			return VectorFst.read(is, CompositeWeightConfig.DEFAULT);
		}
		finally {
			is.close();
		}
	}

	private int runEncode(String... argv) {
		return FstEncode.run(argv, new ByteArrayInputStream(new byte[0]), new ByteArrayOutputStream());
	}

	public void testArgumentCount() {
		assertEquals(1, runEncode(in.getPath()));
		assertEquals(1, runEncode(in.getPath(), codex.getPath(), out.getPath(), "extra"));
		assertEquals(1, runEncode());
	}

	public void testHelp() {
		assertEquals(0, runEncode("--help"));
	}

	public void testEncodeThenDecode() throws Exception {
		File back = new File(dir, "back.fst");
		assertEquals(0, runEncode("--encode_labels", "--encode_weights", in.getPath(), codex.getPath(), out.getPath()));
		assertTrue(codex.exists());
		VectorFst<? extends Weight> encoded = readFst(out);
		assertFalse(readFst(in).equals(encoded));
		assertEquals(5, EncodeMapper.read(codex, tropical).size());

		assertEquals(0, runEncode("--decode", out.getPath(), codex.getPath(), back.getPath()));
		assertEquals(readFst(in), readFst(back));
	}

	public void testStdinToStdout() throws Exception {
		ByteArrayOutputStream fstBytes = new ByteArrayOutputStream();
		VectorFst.readText(new StringReader(TestEncoder.FST_A), tropical).write(fstBytes);
		ByteArrayOutputStream stdout = new ByteArrayOutputStream();
		assertEquals(0, FstEncode.run(new String[] { "--encode_weights", "-", codex.getPath() },
				new ByteArrayInputStream(fstBytes.toByteArray()), stdout));
		VectorFst<FloatWeight> encoded = VectorFst.read(new ByteArrayInputStream(stdout.toByteArray()), tropical);
		for (int i = 0; i < encoded.numArcs(0); i++)
			assertEquals(tropical.ONE(), encoded.getArc(0, i).getWeight());

		ByteArrayOutputStream decoded = new ByteArrayOutputStream();
		assertEquals(0, FstEncode.run(new String[] { "--decode", "-", codex.getPath() },
				new ByteArrayInputStream(stdout.toByteArray()), decoded));
		assertEquals(fstBytes.size(), decoded.size());
		assertEquals(readFst(in), VectorFst.read(new ByteArrayInputStream(decoded.toByteArray()), tropical));
	}

	public void testReuse() throws Exception {
		assertEquals(0, runEncode("--encode_labels", in.getPath(), codex.getPath(), out.getPath()));
		assertEquals(0, runEncode("--encode_labels", "--encode_reuse", in.getPath(), codex.getPath(), out.getPath()));
		assertEquals(4, EncodeMapper.read(codex, tropical).size());
		// flags differ from the codex
		assertEquals(1, runEncode("--encode_weights", "--encode_reuse", in.getPath(), codex.getPath(), out.getPath()));
		// nothing to reuse
		assertEquals(1, runEncode("--encode_labels", "--encode_reuse", in.getPath(), new File(dir, "none").getPath()));
	}

	public void testBadOptions() {
		assertEquals(1, runEncode("--weight_parentheses", "(", in.getPath(), codex.getPath()));
		assertEquals(1, runEncode("--weight_separator", " ", in.getPath(), codex.getPath()));
		assertEquals(1, runEncode("--weight_separator", ";;", in.getPath(), codex.getPath()));
		assertEquals(1, runEncode("--no_such_flag", in.getPath(), codex.getPath()));
	}

	public void testDecodeIgnoresReuse() throws Exception {
		File back = new File(dir, "back.fst");
		assertEquals(0, runEncode("--encode_labels", in.getPath(), codex.getPath(), out.getPath()));
		assertEquals(0, runEncode("--decode", "--encode_reuse", out.getPath(), codex.getPath(), back.getPath()));
		assertEquals(readFst(in), readFst(back));
		// the codex is only read
		assertEquals(4, EncodeMapper.read(codex, tropical).size());
	}

	public void testMissingInput() {
		assertEquals(1, runEncode(new File(dir, "missing.fst").getPath(), codex.getPath(), out.getPath()));
		assertFalse(out.exists());
	}

	public void testDecodeWithWrongCodex() throws Exception {
		assertEquals(0, runEncode("--encode_labels", in.getPath(), codex.getPath(), out.getPath()));
		File logFst = new File(dir, "log.fst");
		writeFst(VectorFst.readText(new StringReader(TestEncoder.FST_B), new LogSemiring()), logFst);
		assertEquals(1, runEncode("--decode", logFst.getPath(), codex.getPath(), out.getPath()));
	}

	public void testDecodeUnknownCode() throws Exception {
		assertEquals(0, runEncode("--encode_labels", in.getPath(), codex.getPath(), out.getPath()));
		File big = new File(dir, "big.fst");
		writeFst(VectorFst.readText(new StringReader("0\t1\t9\t9\n1\n"), tropical), big);
		assertEquals(1, runEncode("--decode", big.getPath(), codex.getPath(), out.getPath()));
	}
}
