/**
 * Register.java
 */
package flint.hll;

/**
 * One HyperLogLog register: a slot index and the largest observed rank.
 * Ordered by index (unsigned), which is the order of every emitted payload.
 */
public final class Register implements Comparable<Register> {
	/** Largest value a 6-bit register can hold. */
	public static final int MAX_VALUE = (1 << 6) - 1;

	final int index;
	final byte value;

	public Register(final int index, final int value) {
		if (index < 0)
			throw new IllegalArgumentException("register index : " + index);
		if (value < 0 || value > MAX_VALUE)
			throw new IllegalArgumentException("register value : " + value);
		this.index = index;
		this.value = (byte) value;
	}

	public int index() {
		return index;
	}

	public int value() {
		return value;
	}

	@Override
	public int compareTo(final Register o) {
		return Integer.compareUnsigned(index, o.index);
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof Register)) return false;
		final Register other = (Register) obj;
		return index == other.index && value == other.value;
	}

	@Override
	public int hashCode() {
		return index * 31 + value;
	}

	@Override
	public String toString() {
		return "Register(" + index + "=" + value + ")";
	}
}
