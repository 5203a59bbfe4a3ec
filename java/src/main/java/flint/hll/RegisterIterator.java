/**
 * RegisterIterator.java
 */
package flint.hll;

import java.util.NoSuchElementException;

/**
 * Representation-agnostic, forward-only walk over an estimator's registers in
 * ascending index order.
 * 
 * <pre>{@code
 * for (RegisterIterator it = RegisterIterator.of(hll); !it.done();) {
 *     final Register r = it.next();
 *     ...
 * }
 * }</pre>
 * 
 * The variant is fixed at construction. A dense source yields all m registers;
 * a sparse source yields only the registers its entries touch. Sparse entries
 * that collapse onto the same register are coalesced to the largest value.
 * Not restartable: build a new iterator per traversal.
 */
public final class RegisterIterator {

	enum Kind {
		DENSE, SPARSE
	}

	private final Kind kind;
	private final Estimator hll;
	private final DenseRegisters dense;
	private final SparseReader sr;
	private final int m;
	private int idx = 0;
	private Register pending; // SPARSE: decoded but not yet emitted

	private RegisterIterator(final Estimator hll) {
		this.hll = hll;
		this.m = hll.registerCount();
		if (hll.isSparse()) {
			this.kind = Kind.SPARSE;
			this.dense = null;
			this.sr = hll.sparseReader();
			this.pending = sr.done() ? null : hll.decodeHash(sr.next());
		} else {
			this.kind = Kind.DENSE;
			this.dense = hll.denseRegisters();
			this.sr = null;
		}
	}

	public static RegisterIterator of(final Estimator hll) {
		return new RegisterIterator(hll);
	}

	Kind kind() {
		return kind;
	}

	public boolean done() {
		if (kind == Kind.SPARSE)
			return pending == null;
		return idx == m;
	}

	public Register next() {
		if (done())
			throw new NoSuchElementException();
		if (kind == Kind.DENSE) {
			final Register r = new Register(idx, dense.get(idx));
			idx++;
			return r;
		}
		Register r = pending;
		pending = null;
		while (!sr.done()) {
			final Register n = hll.decodeHash(sr.next());
			if (n.index() != r.index()) {
				pending = n;
				break;
			}
			if (n.value() > r.value())
				r = n;
		}
		return r;
	}
}
