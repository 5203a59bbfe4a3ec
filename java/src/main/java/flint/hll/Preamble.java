/**
 * Preamble.java
 */
package flint.hll;

/**
 * Fixed-size head of PipelineDB's HyperLogLog struct (0.8.5, x64), as laid out
 * by the C compiler:
 * 
 * <pre>
 * offset size
 *   0    1B  encoding tag
 *   1    3B  padding
 *   4    8B  cardinality (LE)
 *  12    1B  precision
 *  13    3B  padding
 *  16    4B  payload length (LE)
 *  20    +B  payload (not part of the preamble)
 * </pre>
 */
public final class Preamble {
	public static final int BYTES = 1 + 3 + 8 + 1 + 3 + 4;

	final Encoding encoding;
	final long cardinality;
	final int precision;
	final int payloadLength;

	Preamble(final Encoding encoding, final long cardinality, final int precision, final int payloadLength) {
		this.encoding = encoding;
		this.cardinality = cardinality;
		this.precision = precision;
		this.payloadLength = payloadLength;
	}

	public Encoding encoding() {
		return encoding;
	}

	/** unsigned */
	public long cardinality() {
		return cardinality;
	}

	public int precision() {
		return precision;
	}

	public int payloadLength() {
		return payloadLength;
	}

	@Override
	public String toString() {
		return "Preamble{tag=" + (char) encoding.tag() //
				+ ", cardinality=" + Long.toUnsignedString(cardinality) //
				+ ", precision=" + precision //
				+ ", payloadLength=" + payloadLength + "}";
	}
}
