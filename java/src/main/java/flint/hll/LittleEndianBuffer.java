package flint.hll;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * A wrapper around ByteBuffer that enforces LITTLE_ENDIAN byte order.
 * Every multi-byte field of the PipelineDB layout is little-endian, and a bare
 * ByteBuffer silently falls back to BIG_ENDIAN on wrap/duplicate.
 */
final class LittleEndianBuffer {
    private final ByteBuffer buffer;

    private LittleEndianBuffer(ByteBuffer buffer) {
        this.buffer = buffer.order(ByteOrder.LITTLE_ENDIAN);
    }

    public static LittleEndianBuffer wrap(byte[] array) {
        return new LittleEndianBuffer(ByteBuffer.wrap(array));
    }

    public static LittleEndianBuffer allocate(int capacity) {
        return new LittleEndianBuffer(ByteBuffer.allocate(capacity));
    }

    public ByteBuffer unwrap() {
        return buffer;
    }

    /** Backing array; valid for heap buffers only. */
    public byte[] array() {
        return buffer.array();
    }

    public LittleEndianBuffer asReadOnly() {
        return new LittleEndianBuffer(buffer.asReadOnlyBuffer());
    }

    // Get operations (automatically LITTLE_ENDIAN)
    public int getInt(int index) {
        return buffer.getInt(index);
    }

    // Put operations (automatically LITTLE_ENDIAN)
    public LittleEndianBuffer put(byte b) {
        buffer.put(b);
        return this;
    }

    public LittleEndianBuffer putInt(int value) {
        buffer.putInt(value);
        return this;
    }

    public LittleEndianBuffer putLong(long value) {
        buffer.putLong(value);
        return this;
    }

    /**
     * Writes {@code count} zero bytes, used for struct padding.
     */
    public LittleEndianBuffer pad(int count) {
        for (int i = 0; i < count; i++)
            buffer.put((byte) 0);
        return this;
    }
}
