/**
 * DenseRegisters.java
 */
package flint.hll;

import java.util.Arrays;

/**
 * Fixed-width registers packed least-significant-bit first into a byte array.
 * 
 * <pre>
 * bits = 6, m = 16 → 16 * 6 / 8 = 12 bytes + 1 guard byte
 * bits = 6, m = 2^14 → 12,288 bytes + 1 guard byte
 * </pre>
 * 
 * The trailing guard byte lets every access read two bytes unconditionally.
 */
public final class DenseRegisters {
	private final int m;
	private final int bits;
	private final int mask;
	private final byte[] data;

	public DenseRegisters(final int m, final int bitsPerRegister) {
		if (m <= 0)
			throw new IllegalArgumentException("register count : " + m);
		if (bitsPerRegister < 4 || bitsPerRegister > 8)
			throw new IllegalArgumentException("bits per register must be between 4 and 8");
		this.m = m;
		this.bits = bitsPerRegister;
		this.mask = (1 << bitsPerRegister) - 1;
		this.data = new byte[bytes(m, bitsPerRegister)];
	}

	/**
	 * Bytes needed for m registers of the given width, guard byte included.
	 */
	static int bytes(final int m, final int bitsPerRegister) {
		return (int) ((((long) m * bitsPerRegister) + 7) / 8) + 1;
	}

	public int registerCount() {
		return m;
	}

	public int bitsPerRegister() {
		return bits;
	}

	public int get(final int index) {
		final long pos = checkIndex(index) * (long) bits;
		final int i = (int) (pos >>> 3);
		final int off = (int) (pos & 7);
		final int word = (data[i] & 0xFF) | ((data[i + 1] & 0xFF) << 8);
		return (word >>> off) & mask;
	}

	public void set(final int index, final int value) {
		if (value < 0 || value > mask)
			throw new IllegalArgumentException("value " + value + " does not fit in " + bits + " bits");
		final long pos = checkIndex(index) * (long) bits;
		final int i = (int) (pos >>> 3);
		final int off = (int) (pos & 7);
		int word = (data[i] & 0xFF) | ((data[i + 1] & 0xFF) << 8);
		word = (word & ~(mask << off)) | (value << off);
		data[i] = (byte) word;
		data[i + 1] = (byte) (word >>> 8);
	}

	/**
	 * Raises the register to {@code value} if it is currently lower.
	 * @return true if the register changed
	 */
	public boolean max(final int index, final int value) {
		if (get(index) >= value)
			return false;
		set(index, value);
		return true;
	}

	public int sizeInBytes() {
		return data.length;
	}

	private int checkIndex(final int index) {
		if (index < 0 || index >= m)
			throw new IndexOutOfBoundsException("register " + index + " of " + m);
		return index;
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		final DenseRegisters other = (DenseRegisters) obj;
		return m == other.m && bits == other.bits && Arrays.equals(data, other.data);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(data) * 31 + m;
	}
}
