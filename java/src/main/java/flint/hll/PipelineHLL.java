/**
 * PipelineHLL.java
 */
package flint.hll;

import flint.hll.Encoding.Mode;

/**
 * Converts a HyperLogLog++ estimator into the byte layout PipelineDB persists
 * for its own HyperLogLog type.
 * 
 * <pre>{@code
 * HyperLogLogPP hll = new HyperLogLogPP(14);
 * hll.add("a");
 * Encoded e = PipelineHLL.convert(hll, new Options());
 * byte[] column = e.toByteArray(); // bind as bytea
 * }</pre>
 * 
 * <p>A conversion is a pure function of the estimator's state at call time and
 * the given options. It walks the registers once, or twice when an explicit
 * attempt overflows and is redone as dense. Output is staged in a buffer of
 * the exact final size; on any write failure nothing is returned.</p>
 * 
 * <p>Not synchronized. The estimator must not change during the call.</p>
 */
public final class PipelineHLL {

	private PipelineHLL() {
	}

	public static Encoded convert(final Estimator hll, final Options options) throws HllException {
		final Logger logger = options.logger();
		final int p = hll.precision();
		final int m = hll.registerCount();
		if (p < HyperLogLogPP.MIN_PRECISION || p > HyperLogLogPP.MAX_PRECISION || m != (1 << p))
			throw new HllException(ErrorCode.INVALID_PRECISION, "p=" + p + ", m=" + m);

		Mode mode = ModeSelector.select(hll, options);
		byte[] payload = null;
		if (mode == Mode.EXPLICIT) {
			payload = ExplicitEncoder.encode(hll, options.maxExplicitRegisters());
			if (payload == null) {
				logger.log("more than %d explicit registers, writing dense", options.maxExplicitRegisters());
				mode = Mode.DENSE;
			}
		}
		if (mode == Mode.DENSE) {
			payload = DenseEncoder.encode(hll);
		}

		final Preamble preamble = new Preamble( //
				Encoding.of(mode, options.writeDirtyEncoding()), //
				hll.count(), //
				p, //
				payload.length);
		logger.log("pipeline %s", preamble);

		final ByteSink.Memory staging = new ByteSink.Memory(Preamble.BYTES + payload.length);
		writeFully(staging, HeaderWriter.toBytes(preamble), logger);
		writeFully(staging, payload, logger);
		return new Encoded(preamble, staging.toByteArray());
	}

	/**
	 * Converts and hands the complete byte sequence to {@code sink} in a single write.
	 */
	public static Encoded convert(final Estimator hll, final Options options, final ByteSink sink) throws HllException {
		final Encoded e = convert(hll, options);
		writeFully(sink, e.toByteArray(), options.logger());
		return e;
	}

	static void writeFully(final ByteSink sink, final byte[] b, final Logger logger) throws HllException {
		final int n;
		try {
			n = sink.write(b, 0, b.length);
		} catch (java.io.IOException ex) {
			logger.error("write of %d bytes failed : %s", b.length, ex.getMessage());
			throw new HllException(ErrorCode.WRITE_FAILED, b.length + " bytes", ex);
		}
		if (n != b.length) {
			logger.error("short write %d != %d", n, b.length);
			throw new HllException(ErrorCode.SHORT_WRITE, n + " != " + b.length);
		}
	}
}
