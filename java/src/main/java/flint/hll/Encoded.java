/**
 * Encoded.java
 */
package flint.hll;

import java.nio.ByteBuffer;

/**
 * Immutable result of a conversion: the 20-byte preamble followed by the payload.
 */
public final class Encoded {
	private final Preamble preamble;
	private final byte[] bytes;

	Encoded(final Preamble preamble, final byte[] bytes) {
		this.preamble = preamble;
		this.bytes = bytes;
	}

	public Preamble preamble() {
		return preamble;
	}

	public Encoding encoding() {
		return preamble.encoding();
	}

	public Encoding.Mode mode() {
		return preamble.encoding().mode();
	}

	/** total bytes, preamble included */
	public int size() {
		return bytes.length;
	}

	public int payloadLength() {
		return preamble.payloadLength();
	}

	public byte get(final int index) {
		return bytes[index];
	}

	/**
	 * @return a copy of the full byte sequence
	 */
	public byte[] toByteArray() {
		return bytes.clone();
	}

	/**
	 * @return a copy of the payload only
	 */
	public byte[] payload() {
		final byte[] a = new byte[bytes.length - Preamble.BYTES];
		System.arraycopy(bytes, Preamble.BYTES, a, 0, a.length);
		return a;
	}

	/**
	 * @return a read-only little-endian view of the full byte sequence
	 */
	public ByteBuffer asByteBuffer() {
		return LittleEndianBuffer.wrap(bytes).asReadOnly().unwrap();
	}

	public String toHexString() {
		return IO.Hex.encode(bytes);
	}

	@Override
	public String toString() {
		return "Encoded{" + preamble + ", size=" + bytes.length + "}";
	}
}
