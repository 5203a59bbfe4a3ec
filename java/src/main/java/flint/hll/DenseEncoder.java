/**
 * DenseEncoder.java
 */
package flint.hll;

/**
 * PipelineDB dense payload: 6-bit registers packed LSB first across byte
 * boundaries, followed by one guard byte.
 * 
 * <pre>
 * register r occupies bits [r*6, r*6+6) of the payload
 * 
 * byte    :  0        1        2
 * bits    :  11000000 22221111 33333322
 * </pre>
 */
final class DenseEncoder {
	static final int BITS_PER_REGISTER = 6;
	static final int REGISTER_MAX = (1 << BITS_PER_REGISTER) - 1;

	private DenseEncoder() {
	}

	/**
	 * Payload length for m registers: 1 + ceil(m * 6 / 8).
	 */
	static int payloadLength(final int m) {
		return 1 + (int) ((((long) m * BITS_PER_REGISTER) + 7) / 8);
	}

	/**
	 * Packs every register of {@code hll} into a new payload buffer.
	 */
	static byte[] encode(final Estimator hll) throws HllException {
		final int m = hll.registerCount();
		final byte[] data = new byte[payloadLength(m)];
		for (RegisterIterator it = RegisterIterator.of(hll); !it.done();) {
			final Register r = it.next();
			if (r.index() >= m)
				throw new HllException(ErrorCode.INVALID_REGISTER, r + " of " + m);
			setRegister(data, r.index(), r.value());
		}
		return data;
	}

	/**
	 * Port of PipelineDB's HLL_DENSE_SET_REGISTER macro.
	 */
	static void setRegister(final byte[] p, final int regnum, final int val) {
		final int _byte = regnum * BITS_PER_REGISTER / 8;
		final int _fb = regnum * BITS_PER_REGISTER & 7;
		final int _fb8 = 8 - _fb;
		final int v = val;

		p[_byte] &= (byte) ~(REGISTER_MAX << _fb);
		p[_byte] |= (byte) (v << _fb);
		p[_byte + 1] &= (byte) ~(REGISTER_MAX >>> _fb8);
		p[_byte + 1] |= (byte) (v >>> _fb8);
	}
}
