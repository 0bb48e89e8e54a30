package edu.isi.remora;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.File;

import junit.framework.TestCase;

public class TestEncodeMapper extends TestCase {
	private final TropicalSemiring tropical = new TropicalSemiring();

	private static FloatWeight w(float f) {
		return new FloatWeight(f);
	}

	public void testCodesAreDenseAndInjective() {
		EncodeMapper<FloatWeight> m = new EncodeMapper<FloatWeight>(tropical, EncodeMapper.ENCODE_FLAGS);
		assertEquals(1, m.encode(1, 2, w(0.5F)));
		assertEquals(2, m.encode(1, 2, w(1.5F)));
		assertEquals(3, m.encode(2, 1, w(0.5F)));
		// seen before
		assertEquals(1, m.encode(1, 2, w(0.5F)));
		assertEquals(2, m.encode(1, 2, w(1.5F)));
		assertEquals(3, m.size());
	}

	public void testUnselectedFieldsDontSplitKeys() {
		EncodeMapper<FloatWeight> labels = new EncodeMapper<FloatWeight>(tropical, EncodeMapper.ENCODE_LABELS);
		assertEquals(1, labels.encode(1, 2, w(0.5F)));
		assertEquals(1, labels.encode(1, 2, w(7)));
		assertEquals(2, labels.encode(1, 3, w(0.5F)));

		EncodeMapper<FloatWeight> weights = new EncodeMapper<FloatWeight>(tropical, EncodeMapper.ENCODE_WEIGHTS);
		assertEquals(1, weights.encode(1, 2, w(0.5F)));
		assertEquals(1, weights.encode(1, 9, w(0.5F)));
		assertEquals(2, weights.encode(1, 2, w(1)));

		EncodeMapper<FloatWeight> neither = new EncodeMapper<FloatWeight>(tropical, 0);
		assertEquals(1, neither.encode(4, 2, w(0.5F)));
		assertEquals(1, neither.encode(4, 3, w(1)));
		assertEquals(2, neither.encode(5, 3, w(1)));
	}

	public void testArcMapping() throws Exception {
		EncodeMapper<FloatWeight> m = new EncodeMapper<FloatWeight>(tropical, EncodeMapper.ENCODE_WEIGHTS);
		Arc<FloatWeight> a = new Arc<FloatWeight>(3, 4, w(2), 7);
		Arc<FloatWeight> e = m.encode(a);
		assertEquals(1, e.getIlabel());
		assertEquals(4, e.getOlabel());
		assertEquals(tropical.ONE(), e.getWeight());
		assertEquals(7, e.getNextState());
		assertEquals(a, m.decode(e));

		EncodeMapper<FloatWeight> both = new EncodeMapper<FloatWeight>(tropical, EncodeMapper.ENCODE_FLAGS);
		e = both.encode(a);
		assertEquals(e.getIlabel(), e.getOlabel());
		assertEquals(a, both.decode(e));
	}

	public void testUnknownCode() {
		EncodeMapper<FloatWeight> m = new EncodeMapper<FloatWeight>(tropical, EncodeMapper.ENCODE_LABELS);
		m.encode(1, 1, tropical.ONE());
		int[] bad = { 0, 2, -1 };
		for (int code : bad) {
			try {
				m.decode(code);
				fail("decoded unknown code "+code);
			}
			catch (UnusualConditionException ex) {
				// expected
			}
		}
	}

	public void testPersistenceKeepsCodes() throws Exception {
		EncodeMapper<FloatWeight> m = new EncodeMapper<FloatWeight>(tropical, EncodeMapper.ENCODE_FLAGS);
		m.encode(5, 6, w(1));
		m.encode(0, 0, tropical.ONE());
		m.encode(1, 2, tropical.ZERO());
		File f = File.createTempFile("codex", ".enc");
		f.deleteOnExit();
		m.write(f);

		EncodeMapper<FloatWeight> r = EncodeMapper.read(f, tropical);
		assertEquals(EncodeMapper.ENCODE_FLAGS, r.getFlags());
		assertEquals(3, r.size());
		for (int code = 1; code <= 3; code++) {
			EncodeTuple<FloatWeight> t = m.decode(code);
			assertEquals(t, r.decode(code));
			assertEquals(code, r.encode(t.getIlabel(), t.getOlabel(), t.getWeight()));
		}
		// extends after the last code
		assertEquals(4, r.encode(9, 9, w(9)));
	}

	public void testReadRejectsWrongType() throws Exception {
		EncodeMapper<FloatWeight> m = new EncodeMapper<FloatWeight>(tropical, EncodeMapper.ENCODE_LABELS);
		m.encode(1, 2, w(1));
		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		m.write(bos);
		try {
			EncodeMapper.read(new ByteArrayInputStream(bos.toByteArray()), new LogSemiring());
			fail("read a tropical codex as log");
		}
		catch (DataFormatException e) {
			// expected
		}
	}

	public void testReadRejectsBadMagic() throws Exception {
		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		DataOutputStream out = new DataOutputStream(bos);
		out.writeInt(12345);
		out.writeUTF("tropical");
		out.writeInt(0);
		out.writeInt(0);
		try {
			EncodeMapper.read(new ByteArrayInputStream(bos.toByteArray()), tropical);
			fail("read a codex with a bad magic number");
		}
		catch (DataFormatException e) {
			// expected
		}
	}

	public void testProductWeightsAsKeys() throws Exception {
		ProductSemiring<FloatWeight, FloatWeight> p = new ProductSemiring<FloatWeight, FloatWeight>(tropical, new LogSemiring());
		EncodeMapper<ProductWeight<FloatWeight, FloatWeight>> m =
			new EncodeMapper<ProductWeight<FloatWeight, FloatWeight>>(p, EncodeMapper.ENCODE_WEIGHTS);
		ProductWeight<FloatWeight, FloatWeight> a = new ProductWeight<FloatWeight, FloatWeight>(w(1), w(2));
		assertEquals(1, m.encode(1, 1, a));
		assertEquals(1, m.encode(1, 1, new ProductWeight<FloatWeight, FloatWeight>(w(1), w(2))));
		assertEquals(2, m.encode(1, 1, p.ONE()));
		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		m.write(bos);
		EncodeMapper<ProductWeight<FloatWeight, FloatWeight>> r = EncodeMapper.read(new ByteArrayInputStream(bos.toByteArray()), p);
		assertEquals(a, r.decode(1).getWeight());
	}
}
