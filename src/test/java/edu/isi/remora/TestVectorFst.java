package edu.isi.remora;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.StringReader;
import java.io.StringWriter;

import junit.framework.TestCase;

public class TestVectorFst extends TestCase {
	private final TropicalSemiring tropical = new TropicalSemiring();

	public void testTextRoundTrip() throws Exception {
		String text = "1\t2\t3\t4\t0.5\n1\t0\t5\t5\n0\t1.5\n2\n";
		VectorFst<FloatWeight> f = VectorFst.readText(new StringReader(text), tropical);
		assertEquals(1, f.getStart());
		assertEquals(3, f.numStates());
		assertEquals(2, f.numArcs(1));
		assertEquals(2, f.numArcs());
		assertEquals(new Arc<FloatWeight>(3, 4, new FloatWeight(0.5F), 2), f.getArc(1, 0));
		assertEquals(tropical.ONE(), f.getArc(1, 1).getWeight());
		assertEquals(new FloatWeight(1.5F), f.finalWeight(0));
		assertEquals(tropical.ONE(), f.finalWeight(2));
		assertEquals(tropical.ZERO(), f.finalWeight(1));

		StringWriter sw = new StringWriter();
		f.printText(sw);
		assertEquals(text, sw.toString());
	}

	public void testBadText() throws Exception {
		String[] bad = { "0\t1\t2\n", "0\tx\t1\t1\n", "0\t1\t1\t1\tnope\n", "-1\n" };
		for (String text : bad) {
			try {
				VectorFst.readText(new StringReader(text), tropical);
				fail("read "+text);
			}
			catch (DataFormatException e) {
				// expected
			}
		}
	}

	public void testBinaryRoundTrip() throws Exception {
		ProductSemiring<FloatWeight, FloatWeight> p = new ProductSemiring<FloatWeight, FloatWeight>(tropical, new RealSemiring());
		VectorFst<ProductWeight<FloatWeight, FloatWeight>> f =
			VectorFst.readText(new StringReader("0\t1\t1\t2\t1,0.25\n0\t0\t3\t3\n1\t2,2\n"), p);
		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		f.write(bos);

		VectorFst<ProductWeight<FloatWeight, FloatWeight>> g = VectorFst.read(new ByteArrayInputStream(bos.toByteArray()), p);
		assertEquals(f, g);

		// type from the header
		VectorFst<? extends Weight> h = VectorFst.read(new ByteArrayInputStream(bos.toByteArray()), CompositeWeightConfig.DEFAULT);
		assertEquals("tropical_X_real", h.getSemiring().type());
		assertEquals(f, h);
	}

	public void testBinaryTypeMismatch() throws Exception {
		VectorFst<FloatWeight> f = VectorFst.readText(new StringReader("0\t1\t1\t1\n1\n"), tropical);
		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		f.write(bos);
		try {
			VectorFst.read(new ByteArrayInputStream(bos.toByteArray()), new LogSemiring());
			fail("read tropical transducer as log");
		}
		catch (DataFormatException e) {
			// expected
		}
	}

	public void testBadMagic() throws Exception {
		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		DataOutputStream out = new DataOutputStream(bos);
		out.writeInt(EncodeMapper.MAGIC);
		out.writeUTF("tropical");
		out.writeInt(0);
		out.writeInt(1);
		try {
			VectorFst.read(new ByteArrayInputStream(bos.toByteArray()), CompositeWeightConfig.DEFAULT);
			fail("read a codex as a transducer");
		}
		catch (DataFormatException e) {
			// expected
		}
	}

	public void testUnknownTypeInHeader() throws Exception {
		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		DataOutputStream out = new DataOutputStream(bos);
		out.writeInt(VectorFst.MAGIC);
		out.writeUTF("boolean");
		out.writeInt(-1);
		out.writeInt(0);
		try {
			VectorFst.read(new ByteArrayInputStream(bos.toByteArray()), CompositeWeightConfig.DEFAULT);
			fail("read a transducer of unknown weight type");
		}
		catch (DataFormatException e) {
			// expected
		}
	}

	public void testBadState() {
		VectorFst<FloatWeight> f = new VectorFst<FloatWeight>(tropical);
		f.addState();
		try {
			f.setStart(1);
			fail("set start to missing state");
		}
		catch (IndexOutOfBoundsException e) {
			// expected
		}
	}

	public void testDeleteFromTheEnd() throws Exception {
		VectorFst<FloatWeight> f = VectorFst.readText(new StringReader("0\t1\t1\t1\n0\t1\t2\t2\n1\n"), tropical);
		f.deleteArcs(0, 1);
		assertEquals(1, f.numArcs(0));
		assertEquals(1, f.getArc(0, 0).getIlabel());
		f.deleteStates(1);
		assertEquals(1, f.numStates());
		assertEquals(0, f.getStart());
		f.deleteStates(1);
		assertEquals(Arc.NO_STATE, f.getStart());
		try {
			f.deleteStates(1);
			fail("deleted a state from an empty transducer");
		}
		catch (IndexOutOfBoundsException e) {
			// expected
		}
	}
}
