/**
 * IO.java
 */
package flint.hll;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Utility class for stream reading, hex formatting and timing.
 */
public final class IO {

	private IO() {
	}

	public static File path(final String path) {
		final String s = path //
				.replace("~", System.getProperty("user.home")) //
				.replace("${HOME}", System.getProperty("user.home")) //
		;
		return new File(s);
	}

	/**
	 * Feeds every line of {@code istream} to {@code consumer}.
	 * @return number of lines read
	 */
	public static long lines(final InputStream istream, final Consumer<String> consumer) throws IOException {
		long n = 0;
		final BufferedReader reader = new BufferedReader(new InputStreamReader(istream, StandardCharsets.UTF_8));
		for (String line; (line = reader.readLine()) != null;) {
			consumer.accept(line);
			n++;
		}
		return n;
	}

	static final class Hex {
		private static final char[] HEX_ARRAY = "0123456789abcdef".toCharArray();

		static String encode(final byte[] bytes, final int off, final int count) {
			final int l = Math.min(off + count, bytes.length);
			final char[] hexChars = new char[(l - off) * 2];
			for (int j = off; j < l; j++) {
				final int v = bytes[j] & 0xFF;
				hexChars[(j - off) * 2] = HEX_ARRAY[v >>> 4];
				hexChars[(j - off) * 2 + 1] = HEX_ARRAY[v & 0x0F];
			}
			return new String(hexChars);
		}

		static String encode(final byte[] bytes) {
			return encode(bytes, 0, bytes.length);
		}
	}

	public static final class StopWatch {
		private final long start;

		public StopWatch() {
			start = System.currentTimeMillis();
		}

		public long elapsed() {
			return System.currentTimeMillis() - start;
		}

		public static String humanReadableTime(final long ms) {
			if (ms < 1000)
				return ms + "ms";
			if (ms < 60_000)
				return String.format("%.3fs", ms / 1000.0);
			return String.format("%dm %ds", ms / 60_000, (ms % 60_000) / 1000);
		}
	}
}
