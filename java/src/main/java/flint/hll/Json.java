/**
 * Json.java
 */
package flint.hll;

import java.lang.reflect.Type;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;

/**
 * Json description of converted bytes, for inspection only.
 * 
 * <pre>
 * {
 *   "tag": "E", "mode": "EXPLICIT", "dirty": false,
 *   "cardinality": "2", "precision": 4, "payloadLength": 8, "size": 28,
 *   "registers": [[3, 5], [10, 12]],
 *   "payload": "050300000c0a0000"
 * }
 * </pre>
 */
final class Json {

	private static final class EncodedSerializer implements JsonSerializer<Encoded> {
		@Override
		public JsonElement serialize(final Encoded src, final Type typeOfSrc, final JsonSerializationContext context) {
			final Preamble p = src.preamble();
			final JsonObject o = new JsonObject();
			o.addProperty("tag", String.valueOf((char) p.encoding().tag()));
			o.addProperty("mode", p.encoding().mode().name());
			o.addProperty("dirty", p.encoding().dirty());
			o.addProperty("cardinality", Long.toUnsignedString(p.cardinality()));
			o.addProperty("precision", p.precision());
			o.addProperty("payloadLength", p.payloadLength());
			o.addProperty("size", src.size());
			final byte[] payload = src.payload();
			if (p.encoding().mode() == Encoding.Mode.EXPLICIT) {
				final LittleEndianBuffer bb = LittleEndianBuffer.wrap(payload);
				final JsonArray registers = new JsonArray();
				for (int i = 0; i + ExplicitEncoder.WORD_BYTES <= payload.length; i += ExplicitEncoder.WORD_BYTES) {
					final int word = bb.getInt(i);
					final JsonArray pair = new JsonArray();
					pair.add(word >>> 8);
					pair.add(word & 0xFF);
					registers.add(pair);
				}
				o.add("registers", registers);
			}
			o.addProperty("payload", IO.Hex.encode(payload));
			return o;
		}
	}

	static Gson create(final boolean pretty) {
		final GsonBuilder builder = new GsonBuilder() //
				.registerTypeAdapter(Encoded.class, new EncodedSerializer()) //
				.disableHtmlEscaping();
		if (pretty)
			builder.setPrettyPrinting();
		return builder.create();
	}

	static String toJson(final Encoded e, final boolean pretty) {
		return create(pretty).toJson(e, Encoded.class);
	}
}
