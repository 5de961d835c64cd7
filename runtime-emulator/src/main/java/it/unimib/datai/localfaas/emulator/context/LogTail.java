package it.unimib.datai.localfaas.emulator.context;

import java.io.OutputStream;
import java.util.Base64;

/**
 * Keeps the most recent {@link #CAPACITY} bytes written to it; older bytes are overwritten.
 */
public final class LogTail extends OutputStream {
    public static final int CAPACITY = 4096;

    private final byte[] ring;
    private int start;
    private int size;

    public LogTail() {
        this(CAPACITY);
    }

    LogTail(int capacity) {
        this.ring = new byte[capacity];
    }

    @Override
    public synchronized void write(int b) {
        append(b);
    }

    @Override
    public synchronized void write(byte[] b, int off, int len) {
        if (len >= ring.length) {
            System.arraycopy(b, off + len - ring.length, ring, 0, ring.length);
            start = 0;
            size = ring.length;
            return;
        }
        for (int i = 0; i < len; i++) {
            append(b[off + i]);
        }
    }

    private void append(int b) {
        int end = (start + size) % ring.length;
        ring[end] = (byte) b;
        if (size < ring.length) {
            size++;
        } else {
            start = (start + 1) % ring.length;
        }
    }

    public synchronized byte[] snapshot() {
        byte[] out = new byte[size];
        int firstChunk = Math.min(size, ring.length - start);
        System.arraycopy(ring, start, out, 0, firstChunk);
        System.arraycopy(ring, 0, out, firstChunk, size - firstChunk);
        return out;
    }

    public String toBase64() {
        return Base64.getEncoder().encodeToString(snapshot());
    }

    public synchronized int size() {
        return size;
    }
}
