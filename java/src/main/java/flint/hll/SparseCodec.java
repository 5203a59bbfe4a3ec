/**
 * SparseCodec.java
 */
package flint.hll;

/**
 * Sparse hash encoding of HyperLogLog++ (Heule, Nunkesser, Hall 2013).
 * 
 * <pre>
 * sparse precision p' = 25, idx' = top 25 bits of the hash
 * 
 * bits p..p'-1 of the hash are zero (rank must be carried):
 *   [idx':25][rho':6][1]      rho' = rank of the bits after p'
 * otherwise (rank is implied by idx'):
 *   [0:6][idx':25][0]
 * </pre>
 */
public final class SparseCodec {
	public static final int SPARSE_PRECISION = 25;

	private SparseCodec() {
	}

	public static int encodeHash(final long hash, final int p) {
		final int idx = (int) (hash >>> (64 - SPARSE_PRECISION));
		final int low = (1 << (SPARSE_PRECISION - p)) - 1;
		if ((idx & low) == 0) {
			final long w = (hash << SPARSE_PRECISION) | (1L << (SPARSE_PRECISION - 1));
			final int rho = Long.numberOfLeadingZeros(w) + 1;
			return (idx << 7) | (rho << 1) | 1;
		}
		return idx << 1;
	}

	/**
	 * @return idx', the register index at sparse precision
	 */
	public static int sparseIndex(final int k) {
		return (k & 1) != 0 ? k >>> 7 : k >>> 1;
	}

	public static Register decodeHash(final int k, final int p) {
		if ((k & 1) != 0) {
			final int index = k >>> (32 - p);
			final int rho = ((k >>> 1) & 0x3F) + (SPARSE_PRECISION - p);
			return new Register(index, rho);
		}
		final int idx = k >>> 1;
		final int index = idx >>> (SPARSE_PRECISION - p);
		final int rho = Integer.numberOfLeadingZeros(idx << (32 - SPARSE_PRECISION + p)) + 1;
		return new Register(index, rho);
	}

	/**
	 * Dense register index and rank of a 64-bit hash at precision p.
	 */
	static int denseIndex(final long hash, final int p) {
		return (int) (hash >>> (64 - p));
	}

	static int denseRank(final long hash, final int p) {
		final long w = (hash << p) | (1L << (p - 1));
		return Long.numberOfLeadingZeros(w) + 1;
	}
}
