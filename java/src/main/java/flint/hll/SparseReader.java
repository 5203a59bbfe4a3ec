/**
 * SparseReader.java
 */
package flint.hll;

import java.util.NoSuchElementException;

/**
 * Forward-only decoder over a varint stream of sparse encodings.
 */
public final class SparseReader {
	private final byte[] data;
	private final int limit;
	private int pos;

	SparseReader(final byte[] data, final int limit) {
		this.data = data;
		this.limit = limit;
		this.pos = 0;
	}

	public boolean done() {
		return pos >= limit;
	}

	public int next() {
		if (done())
			throw new NoSuchElementException();
		int v = 0;
		for (int shift = 0;; shift += 7) {
			final int b = data[pos++] & 0xFF;
			v |= (b & 0x7F) << shift;
			if ((b & 0x80) == 0)
				return v;
		}
	}
}
