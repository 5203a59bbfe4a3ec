/**
 * ByteSink.java
 */
package flint.hll;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;

/**
 * Destination of converted bytes.
 * 
 * <p>A sink may accept fewer bytes than offered; the converter treats that as
 * a failed conversion and never retries on its own.</p>
 */
public interface ByteSink {

	/**
	 * @return number of bytes accepted
	 * @throws IOException if the sink rejects the write
	 */
	int write(byte[] b, int off, int len) throws IOException;

	static ByteSink of(final OutputStream out) {
		return (b, off, len) -> {
			out.write(b, off, len);
			return len;
		};
	}

	/**
	 * Bounded in-memory sink. Accepts at most {@code capacity} bytes in total.
	 */
	final class Memory implements ByteSink {
		private final byte[] buf;
		private int count = 0;

		public Memory(final int capacity) {
			this.buf = new byte[capacity];
		}

		@Override
		public int write(final byte[] b, final int off, final int len) {
			final int n = Math.min(len, buf.length - count);
			System.arraycopy(b, off, buf, count, n);
			count += n;
			return n;
		}

		public int size() {
			return count;
		}

		public byte[] toByteArray() {
			return count == buf.length ? buf.clone() : Arrays.copyOf(buf, count);
		}
	}
}
