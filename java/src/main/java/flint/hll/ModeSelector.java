/**
 * ModeSelector.java
 */
package flint.hll;

import flint.hll.Encoding.Mode;

/**
 * Chooses the payload layout for one conversion.
 * 
 * <pre>
 * dense source or alwaysWriteDense → DENSE (one traversal)
 * sparse source                    → EXPLICIT, falling back to a fresh DENSE
 *                                    traversal once more than maxExplicitRegisters
 *                                    registers have been seen
 * </pre>
 * 
 * Matching PipelineDB, the fallback should really go to SPARSE; that layout is
 * not written here.
 */
final class ModeSelector {

	private ModeSelector() {
	}

	static Mode select(final Estimator hll, final Options options) {
		if (!hll.isSparse() || options.alwaysWriteDense())
			return Mode.DENSE;
		return Mode.EXPLICIT;
	}
}
