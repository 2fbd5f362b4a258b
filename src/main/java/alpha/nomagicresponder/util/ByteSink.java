package alpha.nomagicresponder.util;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;

/**
 * A growable byte buffer that can be frozen into a {@code ByteBuffer} without
 * copying.<p>
 *
 * The purpose is to let a handler write a body of unknown length and then
 * return the sink itself as a response body, without the array-copy of
 * {@link ByteArrayOutputStream#toByteArray()}.<p>
 *
 * {@link #freeze()} may only be called once. After the call, the sink no
 * longer accepts writes.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class ByteSink extends ByteArrayOutputStream
{
    private boolean frozen;

    /**
     * Constructs this object with a default initial capacity.
     */
    public ByteSink() {
        // super()
    }

    /**
     * Constructs this object.
     *
     * @param size the initial capacity
     * @throws IllegalArgumentException if {@code size} is negative
     */
    public ByteSink(int size) {
        super(size);
    }

    /**
     * Returns the number of bytes written.<p>
     *
     * Unlike other methods in ByteArrayOutputStream, this method is not
     * synchronized.
     *
     * @return the number of bytes written
     */
    public int count() {
        return super.count;
    }

    @Override
    public synchronized void write(int b) {
        requireNotFrozen();
        super.write(b);
    }

    @Override
    public synchronized void write(byte[] b, int off, int len) {
        requireNotFrozen();
        super.write(b, off, len);
    }

    /**
     * Returns a read-only view of the written bytes.<p>
     *
     * The view shares the internal array of this sink.
     *
     * @return a read-only view of the written bytes
     * @throws IllegalStateException if already frozen
     */
    public synchronized ByteBuffer freeze() {
        requireNotFrozen();
        frozen = true;
        return ByteBuffer.wrap(super.buf, 0, super.count).asReadOnlyBuffer();
    }

    private void requireNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("Frozen.");
        }
    }
}
