/**
 * Encoding.java
 */
package flint.hll;

/**
 * PipelineDB HyperLogLog encoding tags.
 * 
 * <pre>
 * 'd' dense, dirty      'D' dense, clean
 * 'e' explicit, dirty   'E' explicit, clean
 * 's' sparse, dirty     'S' sparse, clean (reserved, never written)
 * </pre>
 * 
 * A dirty tag tells PipelineDB to recompute the cardinality lazily; a clean tag
 * asserts the embedded cardinality is authoritative.
 */
public enum Encoding {
	DENSE_DIRTY('d', Mode.DENSE, true), //
	DENSE_CLEAN('D', Mode.DENSE, false), //
	EXPLICIT_DIRTY('e', Mode.EXPLICIT, true), //
	EXPLICIT_CLEAN('E', Mode.EXPLICIT, false), //
	SPARSE_DIRTY('s', Mode.SPARSE, true), //
	SPARSE_CLEAN('S', Mode.SPARSE, false);

	/**
	 * Payload layouts. Only DENSE and EXPLICIT are ever emitted.
	 */
	public enum Mode {
		DENSE, EXPLICIT, SPARSE
	}

	private final byte tag;
	private final Mode mode;
	private final boolean dirty;

	Encoding(final char tag, final Mode mode, final boolean dirty) {
		this.tag = (byte) tag;
		this.mode = mode;
		this.dirty = dirty;
	}

	public byte tag() {
		return tag;
	}

	public Mode mode() {
		return mode;
	}

	public boolean dirty() {
		return dirty;
	}

	/**
	 * The tag always follows the mode actually written.
	 */
	public static Encoding of(final Mode mode, final boolean dirty) {
		switch (mode) {
		case DENSE:
			return dirty ? DENSE_DIRTY : DENSE_CLEAN;
		case EXPLICIT:
			return dirty ? EXPLICIT_DIRTY : EXPLICIT_CLEAN;
		case SPARSE:
			return dirty ? SPARSE_DIRTY : SPARSE_CLEAN;
		}
		throw new IllegalArgumentException("mode : " + mode);
	}

	public static Encoding valueOf(final byte tag) {
		for (Encoding e : values()) {
			if (e.tag == tag)
				return e;
		}
		throw new IllegalArgumentException("unknown encoding tag : " + (char) tag);
	}
}
