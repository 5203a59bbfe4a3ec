package flint.hll;

import java.io.ByteArrayOutputStream;

/**
 * Estimators and helpers shared by the test cases.
 */
final class Fixtures {

	private Fixtures() {
	}

	/**
	 * A 64-bit hash that lands in register {@code index} with rank {@code rank} at precision p.
	 */
	static long hashFor(final int p, final int index, final int rank) {
		final long h = (long) index << (64 - p);
		return rank <= 64 - p ? h | (1L << (64 - p - rank)) : h;
	}

	/**
	 * Sparse estimator holding the given (index, value) pairs.
	 */
	static HyperLogLogPP sparse(final int p, final int... pairs) {
		final HyperLogLogPP hll = new HyperLogLogPP(p);
		for (int i = 0; i < pairs.length; i += 2)
			hll.addHash(hashFor(p, pairs[i], pairs[i + 1]));
		return hll;
	}

	/**
	 * Reads register r back out of a PipelineDB dense payload.
	 */
	static int unpackDense(final byte[] payload, final int r) {
		final int bit = r * 6;
		final int i = bit / 8;
		final int word = (payload[i] & 0xFF) | ((payload[i + 1] & 0xFF) << 8);
		return (word >>> (bit % 8)) & 0x3F;
	}

	static byte[] varints(final int... values) {
		final ByteArrayOutputStream out = new ByteArrayOutputStream();
		for (int v : values) {
			while ((v & ~0x7F) != 0) {
				out.write((v & 0x7F) | 0x80);
				v >>>= 7;
			}
			out.write(v);
		}
		return out.toByteArray();
	}

	/**
	 * Estimator with hand-picked sparse encodings, in the order given.
	 */
	static class StubEstimator implements Estimator {
		final int p;
		final int[] encodings;
		long count = 42;

		StubEstimator(final int p, final int... encodings) {
			this.p = p;
			this.encodings = encodings;
		}

		@Override
		public long count() {
			return count;
		}

		@Override
		public int precision() {
			return p;
		}

		@Override
		public int registerCount() {
			return 1 << p;
		}

		@Override
		public boolean isSparse() {
			return true;
		}

		@Override
		public DenseRegisters denseRegisters() {
			final DenseRegisters d = new DenseRegisters(registerCount(), 6);
			for (int k : encodings) {
				final Register r = decodeHash(k);
				d.max(r.index(), r.value());
			}
			return d;
		}

		@Override
		public SparseReader sparseReader() {
			final byte[] data = varints(encodings);
			return new SparseReader(data, data.length);
		}

		@Override
		public Register decodeHash(final int encoded) {
			return SparseCodec.decodeHash(encoded, p);
		}
	}

	/**
	 * Delegating estimator that counts traversals.
	 */
	static final class CountingEstimator implements Estimator {
		final Estimator delegate;
		int sparseReads = 0;
		int denseReads = 0;

		CountingEstimator(final Estimator delegate) {
			this.delegate = delegate;
		}

		@Override
		public long count() {
			return delegate.count();
		}

		@Override
		public int precision() {
			return delegate.precision();
		}

		@Override
		public int registerCount() {
			return delegate.registerCount();
		}

		@Override
		public boolean isSparse() {
			return delegate.isSparse();
		}

		@Override
		public DenseRegisters denseRegisters() {
			denseReads++;
			return delegate.denseRegisters();
		}

		@Override
		public SparseReader sparseReader() {
			sparseReads++;
			return delegate.sparseReader();
		}

		@Override
		public Register decodeHash(final int encoded) {
			return delegate.decodeHash(encoded);
		}
	}
}
