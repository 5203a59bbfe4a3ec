package flint.hll;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import flint.hll.Encoding.Mode;

public class TestcasePipelineHLL {

	static final class RecordingLogger implements Logger {
		final List<String> logs = new ArrayList<>();
		final List<String> errors = new ArrayList<>();

		@Override
		public void log(String fmt, Object... args) {
			logs.add(String.format(fmt, args));
		}

		@Override
		public void error(String fmt, Object... args) {
			errors.add(String.format(fmt, args));
		}
	}

	private static Options options() {
		return new Options().logger(new RecordingLogger());
	}

	private static HyperLogLogPP sparseWith(int registers) {
		final int[] pairs = new int[registers * 2];
		for (int i = 0; i < registers; i++) {
			pairs[2 * i] = i * 20;
			pairs[2 * i + 1] = 1 + i % 20;
		}
		return Fixtures.sparse(14, pairs);
	}

	@Test
	public void sparseSourceWritesExplicit() throws Exception {
		final HyperLogLogPP hll = Fixtures.sparse(4, 3, 5, 10, 12);
		final Encoded e = PipelineHLL.convert(hll, options());

		assertEquals(Encoding.EXPLICIT_CLEAN, e.encoding());
		assertEquals(28, e.size());
		final ByteBuffer bb = e.asByteBuffer();
		assertEquals('E', bb.get(0));
		assertEquals(0, bb.get(1) | bb.get(2) | bb.get(3));
		assertEquals(hll.count(), bb.getLong(4));
		assertEquals(4, bb.get(12));
		assertEquals(0, bb.get(13) | bb.get(14) | bb.get(15));
		assertEquals(8, bb.getInt(16));
		assertEquals((3 << 8) | 5, bb.getInt(20));
		assertEquals((10 << 8) | 12, bb.getInt(24));
	}

	@Test
	public void alwaysDenseWritesDenseForSparseSource() throws Exception {
		final HyperLogLogPP hll = Fixtures.sparse(4, 3, 5, 10, 12);
		final Encoded e = PipelineHLL.convert(hll, options().alwaysWriteDense(true));

		assertEquals(Encoding.DENSE_CLEAN, e.encoding());
		assertEquals(13, e.payloadLength());
		assertEquals(Preamble.BYTES + 13, e.size());
		final ByteBuffer bb = e.asByteBuffer();
		assertEquals('D', bb.get(0));
		assertEquals(hll.count(), bb.getLong(4));
		assertEquals(4, bb.get(12));
		assertEquals(13, bb.getInt(16));

		final byte[] expected = new byte[13];
		expected[2] = (byte) 0x14;
		expected[7] = (byte) 0xC0;
		assertArrayEquals(expected, e.payload());
	}

	@Test
	public void denseSourceWritesDense() throws Exception {
		final HyperLogLogPP hll = Fixtures.sparse(10, 1, 1, 1000, 33);
		hll.toDense();
		final Encoded e = PipelineHLL.convert(hll, options());
		assertEquals(Mode.DENSE, e.mode());
		assertEquals(DenseEncoder.payloadLength(1024), e.payloadLength());
		final byte[] payload = e.payload();
		assertEquals(1, Fixtures.unpackDense(payload, 1));
		assertEquals(33, Fixtures.unpackDense(payload, 1000));
		assertEquals(0, Fixtures.unpackDense(payload, 500));
	}

	@Test
	public void dirtyFlagSelectsDirtyTags() throws Exception {
		final HyperLogLogPP hll = Fixtures.sparse(6, 1, 1);
		assertEquals(Encoding.EXPLICIT_DIRTY, PipelineHLL.convert(hll, options().writeDirtyEncoding(true)).encoding());
		assertEquals(Encoding.DENSE_DIRTY,
				PipelineHLL.convert(hll, options().writeDirtyEncoding(true).alwaysWriteDense(true)).encoding());
		assertEquals('e', PipelineHLL.convert(hll, options().writeDirtyEncoding(true)).get(0));
	}

	@Test
	public void limitIsInclusive() throws Exception {
		final Encoded e = PipelineHLL.convert(sparseWith(600), options());
		assertEquals(Mode.EXPLICIT, e.mode());
		assertEquals(600 * 4, e.payloadLength());
	}

	@Test
	public void overflowFallsBackToDense() throws Exception {
		final HyperLogLogPP hll = sparseWith(601);
		assertTrue(hll.isSparse());
		final RecordingLogger logger = new RecordingLogger();
		final Fixtures.CountingEstimator counting = new Fixtures.CountingEstimator(hll);

		final Encoded e = PipelineHLL.convert(counting, new Options().logger(logger));
		assertEquals(Encoding.DENSE_CLEAN, e.encoding());
		assertEquals(DenseEncoder.payloadLength(1 << 14), e.payloadLength());
		assertEquals(2, counting.sparseReads, "explicit attempt and a fresh dense pass");
		assertTrue(logger.errors.isEmpty());
		assertTrue(logger.logs.stream().anyMatch(s -> s.contains("600")));

		final byte[] payload = e.payload();
		for (int i = 0; i < 601; i++)
			assertEquals(1 + i % 20, Fixtures.unpackDense(payload, i * 20));
	}

	@Test
	public void lowerLimitFallsBackSooner() throws Exception {
		final Encoded e = PipelineHLL.convert(Fixtures.sparse(8, 1, 1, 2, 2, 3, 3), options().maxExplicitRegisters(2));
		assertEquals(Mode.DENSE, e.mode());
		assertEquals(Mode.EXPLICIT,
				PipelineHLL.convert(Fixtures.sparse(8, 1, 1, 2, 2, 3, 3), options().maxExplicitRegisters(3)).mode());
	}

	@Test
	public void preambleIsAlwaysTwentyBytes() throws Exception {
		final HyperLogLogPP hll = Fixtures.sparse(9, 5, 5);
		final Encoded explicit = PipelineHLL.convert(hll, options());
		final Encoded dense = PipelineHLL.convert(hll, options().alwaysWriteDense(true));
		assertEquals(Preamble.BYTES + explicit.payloadLength(), explicit.size());
		assertEquals(Preamble.BYTES + dense.payloadLength(), dense.size());
		assertEquals(explicit.payloadLength(), explicit.asByteBuffer().getInt(16));
		assertEquals(dense.payloadLength(), dense.asByteBuffer().getInt(16));
	}

	@Test
	public void resultIsImmutable() throws Exception {
		final Encoded e = PipelineHLL.convert(Fixtures.sparse(4, 3, 5), options());
		final byte[] a = e.toByteArray();
		a[0] = 'X';
		a[20] = 99;
		assertEquals('E', e.get(0));
		assertEquals(5, e.get(20));
		assertTrue(e.asByteBuffer().isReadOnly());
	}

	@Test
	public void conversionDoesNotChangeEstimator() throws Exception {
		final HyperLogLogPP hll = Fixtures.sparse(12, 7, 3, 8, 4);
		final String before = hll.toString();
		final Encoded a = PipelineHLL.convert(hll, options());
		final Encoded b = PipelineHLL.convert(hll, options());
		assertTrue(hll.isSparse());
		assertEquals(before, hll.toString());
		assertArrayEquals(a.toByteArray(), b.toByteArray());
	}

	@Test
	public void sinkReceivesCompleteOutput() throws Exception {
		final ByteSink.Memory sink = new ByteSink.Memory(64);
		final Encoded e = PipelineHLL.convert(Fixtures.sparse(4, 3, 5, 10, 12), options(), sink);
		assertArrayEquals(e.toByteArray(), sink.toByteArray());
	}

	@Test
	public void rejectedWriteFails() {
		final RecordingLogger logger = new RecordingLogger();
		final ByteSink failing = (b, off, len) -> {
			throw new IOException("disk full");
		};
		final HllException e = assertThrows(HllException.class,
				() -> PipelineHLL.convert(Fixtures.sparse(4, 3, 5), new Options().logger(logger), failing));
		assertEquals(ErrorCode.WRITE_FAILED, e.getErrorCode());
		assertInstanceOf(IOException.class, e.getCause());
		assertEquals(1, logger.errors.size());
	}

	@Test
	public void shortWriteFails() {
		final ByteSink.Memory small = new ByteSink.Memory(10);
		final HllException e = assertThrows(HllException.class,
				() -> PipelineHLL.convert(Fixtures.sparse(4, 3, 5), options(), small));
		assertTrue(e.isErrorCode(ErrorCode.SHORT_WRITE));
		assertEquals(10, small.size());
	}

	@Test
	public void invalidPrecisionFails() {
		final Fixtures.StubEstimator hll = new Fixtures.StubEstimator(4) {
			@Override
			public int precision() {
				return 3;
			}
		};
		final HllException e = assertThrows(HllException.class, () -> PipelineHLL.convert(hll, options()));
		assertEquals(ErrorCode.INVALID_PRECISION, e.getErrorCode());
	}

	@Test
	public void registerPastLastIndexFailsInBothModes() {
		final Fixtures.StubEstimator hll = new Fixtures.StubEstimator(4, 1) {
			@Override
			public Register decodeHash(int encoded) {
				return new Register(16, 2);
			}
		};
		final HllException explicit = assertThrows(HllException.class, () -> PipelineHLL.convert(hll, options()));
		assertEquals(ErrorCode.INVALID_REGISTER, explicit.getErrorCode());
		final HllException dense = assertThrows(HllException.class,
				() -> PipelineHLL.convert(hll, options().alwaysWriteDense(true)));
		assertEquals(ErrorCode.INVALID_REGISTER, dense.getErrorCode());
	}
}
