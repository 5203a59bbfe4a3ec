/**
 * SparseList.java
 */
package flint.hll;

import java.util.Arrays;

/**
 * Immutable, sorted list of sparse encodings stored as unsigned LEB128 varints.
 * 
 * <pre>
 * entry : 1 ~ 5 bytes (7 bits per byte, high bit = continuation)
 * order : ascending by idx' ({@link SparseCodec#sparseIndex(int)}), one entry per idx'
 * </pre>
 */
final class SparseList {
	static final SparseList EMPTY = new SparseList(new byte[0], 0, 0);

	private final byte[] data;
	private final int length;
	private final int size;

	private SparseList(final byte[] data, final int length, final int size) {
		this.data = data;
		this.length = length;
		this.size = size;
	}

	/** number of entries */
	int size() {
		return size;
	}

	/** encoded size in bytes */
	int sizeInBytes() {
		return length;
	}

	SparseReader reader() {
		return new SparseReader(data, length);
	}

	/**
	 * Returns a new list holding this list's entries and {@code pending}.
	 * Entries sharing an idx' keep the larger rank. This list is not modified.
	 */
	SparseList merge(final int[] pending, final int count) {
		if (count == 0)
			return this;
		final long[] keys = new long[size + count];
		int n = 0;
		for (SparseReader r = reader(); !r.done();)
			keys[n++] = key(r.next());
		for (int i = 0; i < count; i++)
			keys[n++] = key(pending[i]);
		Arrays.sort(keys, 0, n);

		final byte[] out = new byte[n * 5];
		int len = 0;
		int entries = 0;
		for (int i = 0; i < n; i++) {
			// within one idx' the larger encoding carries the larger rank, so keep the last
			if (i + 1 < n && (keys[i] >>> 32) == (keys[i + 1] >>> 32))
				continue;
			len = putVarint(out, len, (int) keys[i]);
			entries++;
		}
		return new SparseList(Arrays.copyOf(out, len), len, entries);
	}

	private static long key(final int k) {
		return ((long) SparseCodec.sparseIndex(k) << 32) | (k & 0xFFFFFFFFL);
	}

	private static int putVarint(final byte[] out, int pos, int v) {
		while ((v & ~0x7F) != 0) {
			out[pos++] = (byte) ((v & 0x7F) | 0x80);
			v >>>= 7;
		}
		out[pos++] = (byte) v;
		return pos;
	}
}
