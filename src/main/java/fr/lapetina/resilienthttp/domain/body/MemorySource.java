package fr.lapetina.resilienthttp.domain.body;

import java.io.IOException;
import java.net.URI;
import java.util.Arrays;
import java.util.Optional;

/**
 * Growable in-memory byte source. Always readable, writable and seekable.
 */
public final class MemorySource extends ContentLengthSource {

    private static final int INITIAL_CAPACITY = 256;

    private byte[] buffer;
    private int count;
    private int position;
    private boolean closed;

    public MemorySource() {
        this.buffer = new byte[INITIAL_CAPACITY];
    }

    /**
     * Creates a source holding a copy of {@code content}, cursor at 0.
     */
    public MemorySource(byte[] content) {
        this.buffer = Arrays.copyOf(content, Math.max(content.length, INITIAL_CAPACITY));
        this.count = content.length;
    }

    @Override
    public long size() {
        return count;
    }

    @Override
    public long position() {
        return position;
    }

    @Override
    public void seek(long offset) throws IOException {
        ensureOpen();
        if (offset < 0 || offset > count) {
            throw new IOException("Seek offset out of range: " + offset + " (size " + count + ")");
        }
        position = (int) offset;
    }

    @Override
    public int read(byte[] target, int offset, int length) throws IOException {
        ensureOpen();
        if (position >= count) {
            return -1;
        }
        int n = Math.min(length, count - position);
        System.arraycopy(buffer, position, target, offset, n);
        position += n;
        return n;
    }

    @Override
    public void write(byte[] data, int offset, int length) throws IOException {
        ensureOpen();
        int end = position + length;
        if (end > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(end, buffer.length * 2));
        }
        System.arraycopy(data, offset, buffer, position, length);
        position = end;
        count = Math.max(count, end);
    }

    @Override
    public void truncate() throws IOException {
        ensureOpen();
        count = 0;
        position = 0;
    }

    @Override
    public boolean isReadable() {
        return !closed;
    }

    @Override
    public boolean isWritable() {
        return !closed;
    }

    @Override
    public boolean isSeekable() {
        return !closed;
    }

    @Override
    public SourceKind getKind() {
        return SourceKind.TRANSIENT;
    }

    @Override
    public Optional<URI> getUri() {
        return Optional.empty();
    }

    @Override
    public void close() {
        closed = true;
        buffer = new byte[0];
        count = 0;
        position = 0;
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Memory source is closed");
        }
    }

    @Override
    public String toString() {
        return "MemorySource{size=" + count + ", position=" + position + '}';
    }
}
