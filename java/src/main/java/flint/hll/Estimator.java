/**
 * Estimator.java
 */
package flint.hll;

/**
 * The view of a HyperLogLog++ estimator that {@link PipelineHLL} needs.
 * 
 * <p>Implementations are not required to be thread-safe. The caller must make
 * sure the estimator is not mutated while a conversion is running.</p>
 */
public interface Estimator {

	/**
	 * @return estimated cardinality (unsigned)
	 */
	long count();

	/**
	 * @return precision p, where the register count is 2^p
	 */
	int precision();

	/**
	 * @return number of registers m
	 */
	int registerCount();

	/**
	 * @return true while the estimator is in its sparse representation
	 */
	boolean isSparse();

	/**
	 * Dense register storage. Only meaningful when {@link #isSparse()} is false.
	 */
	DenseRegisters denseRegisters();

	/**
	 * A fresh reader over the sparse encodings, ascending by sparse index.
	 * Only meaningful when {@link #isSparse()} is true. Must not mutate the estimator.
	 */
	SparseReader sparseReader();

	/**
	 * Decodes one sparse encoding into the register it updates at this precision.
	 */
	Register decodeHash(int encoded);
}
