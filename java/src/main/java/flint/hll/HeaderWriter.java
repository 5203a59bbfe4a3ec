/**
 * HeaderWriter.java
 */
package flint.hll;

/**
 * Writes a {@link Preamble} field by field, padding included, so the bytes do
 * not depend on any platform struct layout.
 */
final class HeaderWriter {

	private HeaderWriter() {
	}

	static void write(final Preamble p, final LittleEndianBuffer bb) {
		bb.put(p.encoding.tag());
		bb.pad(3);
		bb.putLong(p.cardinality);
		bb.put((byte) p.precision);
		bb.pad(3);
		bb.putInt(p.payloadLength);
	}

	static byte[] toBytes(final Preamble p) {
		final LittleEndianBuffer bb = LittleEndianBuffer.allocate(Preamble.BYTES);
		write(p, bb);
		return bb.array();
	}
}
