/**
 * ExplicitEncoder.java
 */
package flint.hll;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * PipelineDB explicit payload: the touched registers, sorted by index, one
 * little-endian 32-bit word each.
 * 
 * <pre>
 * word = (index &lt;&lt; 8) | (value &amp; 0xFF)     index &lt; 2^24
 * </pre>
 */
final class ExplicitEncoder {
	static final int WORD_BYTES = Integer.BYTES;

	private ExplicitEncoder() {
	}

	/**
	 * Collects and packs the registers of a sparse estimator.
	 * 
	 * @return the payload, or null as soon as more than {@code maxRegisters}
	 *         registers have been collected (the caller falls back to dense)
	 * @throws HllException if a register lies outside the m registers of {@code hll}
	 */
	static byte[] encode(final Estimator hll, final int maxRegisters) throws HllException {
		final int m = hll.registerCount();
		final List<Register> registers = new ArrayList<>(Math.min(maxRegisters, 64) + 1);
		for (RegisterIterator it = RegisterIterator.of(hll); !it.done();) {
			final Register r = it.next();
			if (r.index() >= m)
				throw new HllException(ErrorCode.INVALID_REGISTER, r + " of " + m);
			registers.add(r);
			if (registers.size() > maxRegisters)
				return null;
		}
		Collections.sort(registers);

		final LittleEndianBuffer buf = LittleEndianBuffer.allocate(registers.size() * WORD_BYTES);
		for (Register r : registers) {
			buf.putInt(word(r));
		}
		return buf.array();
	}

	static int word(final Register r) {
		return (r.index() << 8) | (r.value() & 0xFF);
	}
}
