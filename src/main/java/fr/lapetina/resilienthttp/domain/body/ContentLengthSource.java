package fr.lapetina.resilienthttp.domain.body;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.util.Optional;

/**
 * Uniform byte source behind an {@link EntityBody}.
 *
 * Either a growable in-memory buffer ({@link MemorySource}) or a file handle
 * ({@link FileSource}). Every source has a known length, a cursor, and
 * advertises whether it may be read, written and repositioned.
 *
 * Not thread-safe: callers serialize access to a single instance.
 */
public abstract class ContentLengthSource implements Closeable {

    /**
     * Returns the current length in bytes.
     */
    public abstract long size() throws IOException;

    /**
     * Returns the cursor position.
     */
    public abstract long position() throws IOException;

    /**
     * Moves the cursor.
     *
     * @throws IOException if the source is not seekable or the offset is invalid
     */
    public abstract void seek(long offset) throws IOException;

    /**
     * Reads up to {@code length} bytes at the cursor.
     *
     * @return number of bytes read, or -1 at end of content
     */
    public abstract int read(byte[] buffer, int offset, int length) throws IOException;

    /**
     * Writes bytes at the cursor, growing the source as needed.
     */
    public abstract void write(byte[] data, int offset, int length) throws IOException;

    /**
     * Drops all content and resets the cursor.
     */
    public abstract void truncate() throws IOException;

    public abstract boolean isReadable();

    public abstract boolean isWritable();

    public abstract boolean isSeekable();

    public abstract SourceKind getKind();

    /**
     * Location of the backing resource, present for local files only.
     */
    public abstract Optional<URI> getUri();

    public boolean isLocal() {
        return getKind() == SourceKind.LOCAL_FILE;
    }

    /**
     * Reads the whole content from offset 0 and restores the cursor afterwards.
     */
    public byte[] readAll() throws IOException {
        long restore = position();
        seek(0);
        try {
            long size = size();
            if (size > Integer.MAX_VALUE - 8) {
                throw new IOException("Content too large to buffer: " + size + " bytes");
            }
            byte[] result = new byte[(int) size];
            int filled = 0;
            while (filled < result.length) {
                int n = read(result, filled, result.length - filled);
                if (n < 0) {
                    break;
                }
                filled += n;
            }
            if (filled < result.length) {
                byte[] shorter = new byte[filled];
                System.arraycopy(result, 0, shorter, 0, filled);
                return shorter;
            }
            return result;
        } finally {
            seek(restore);
        }
    }
}
