package io.evalsandbox.core.capture;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO byte buffer between a session's runtime (the writer) and its owner (the drainer).
 *
 * <p>
 * Writes block while the buffer is full and resume as soon as a {@link #drain()} frees space; a write larger
 * than the capacity is delivered in capacity-sized pieces across several drains. {@link #drain()} atomically
 * returns and clears everything buffered so far. After {@link #close()} further writes fail, blocked writers
 * are released with an {@link IOException}, and already-buffered bytes stay drainable.
 *
 * <p>
 * Thread-safe: one writer and any number of drainers may use the capture concurrently.
 */
public final class OutputCapture {

    /** Default capacity: 64 KiB. */
    public static final int DEFAULT_CAPACITY = 64 * 1024;

    private static final byte[] EMPTY = new byte[0];

    private final byte[] ring;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final OutputStream sink = new CaptureOutputStream();

    private int head;
    private int size;
    private boolean closed;

    public OutputCapture() {
        this(DEFAULT_CAPACITY);
    }

    public OutputCapture(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.ring = new byte[capacity];
    }

    /** Write side handed to the runtime. Closing the stream does not close the capture. */
    public OutputStream sink() {
        return sink;
    }

    /**
     * Appends {@code len} bytes, blocking while the buffer is full.
     *
     * @throws InterruptedIOException if the writer is interrupted while waiting for space
     * @throws IOException            if the capture is closed before all bytes are buffered
     */
    public void write(byte[] bytes, int off, int len) throws IOException {
        if (off < 0 || len < 0 || off + len > bytes.length) {
            throw new IndexOutOfBoundsException("off=" + off + ", len=" + len + ", length=" + bytes.length);
        }
        lock.lock();
        try {
            int written = 0;
            while (written < len) {
                while (size == ring.length && !closed) {
                    awaitSpace();
                }
                if (closed) {
                    throw new IOException("output capture closed");
                }
                int tail = (head + size) % ring.length;
                int chunk = Math.min(len - written, Math.min(ring.length - size, ring.length - tail));
                System.arraycopy(bytes, off + written, ring, tail, chunk);
                size += chunk;
                written += chunk;
            }
        } finally {
            lock.unlock();
        }
    }

    /** Appends UTF-8 text, blocking while the buffer is full. */
    public void write(String text) throws IOException {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        write(bytes, 0, bytes.length);
    }

    /** Returns all buffered bytes and empties the buffer. Never blocks on writers. */
    public byte[] drain() {
        lock.lock();
        try {
            if (size == 0) {
                return EMPTY;
            }
            byte[] out = new byte[size];
            int first = Math.min(size, ring.length - head);
            System.arraycopy(ring, head, out, 0, first);
            System.arraycopy(ring, 0, out, first, size - first);
            head = 0;
            size = 0;
            notFull.signalAll();
            return out;
        } finally {
            lock.unlock();
        }
    }

    /** {@link #drain()} decoded as UTF-8. */
    public String drainText() {
        return new String(drain(), StandardCharsets.UTF_8);
    }

    /** Number of bytes currently buffered. */
    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return ring.length;
    }

    /** Stops accepting writes and wakes any blocked writer. Idempotent. */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    private void awaitSpace() throws InterruptedIOException {
        try {
            notFull.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while waiting for output capture space");
        }
    }

    private final class CaptureOutputStream extends OutputStream {

        @Override
        public void write(int b) throws IOException {
            OutputCapture.this.write(new byte[] {(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            OutputCapture.this.write(b, off, len);
        }
    }
}
