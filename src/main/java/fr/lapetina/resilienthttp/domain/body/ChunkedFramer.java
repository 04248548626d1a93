package fr.lapetina.resilienthttp.domain.body;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Frames slices of a {@link ContentLengthSource} as HTTP chunked transfer coding.
 */
public final class ChunkedFramer {

    static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] LAST_CHUNK = {'0', '\r', '\n'};

    private final ContentLengthSource source;

    public ChunkedFramer(ContentLengthSource source) {
        this.source = source;
    }

    /**
     * Reads up to {@code length} bytes at the source cursor and frames them as
     * {@code hex(n) CRLF payload}. Returns {@code 0 CRLF} once the source is exhausted.
     *
     * @throws IllegalArgumentException if {@code length} is not positive
     */
    public byte[] readChunk(int length) throws IOException {
        if (length <= 0) {
            throw new IllegalArgumentException("Chunk length must be positive: " + length);
        }
        int capacity = (int) Math.min(length, Math.max(0, source.size() - source.position()));
        if (capacity == 0) {
            return LAST_CHUNK.clone();
        }
        byte[] payload = new byte[capacity];
        int filled = 0;
        while (filled < capacity) {
            int n = source.read(payload, filled, capacity - filled);
            if (n < 0) {
                break;
            }
            filled += n;
        }
        if (filled == 0) {
            return LAST_CHUNK.clone();
        }
        byte[] sizeLine = Integer.toHexString(filled).getBytes(StandardCharsets.US_ASCII);
        ByteArrayOutputStream chunk = new ByteArrayOutputStream(sizeLine.length + CRLF.length + filled);
        chunk.write(sizeLine);
        chunk.write(CRLF);
        chunk.write(payload, 0, filled);
        return chunk.toByteArray();
    }

    /**
     * Reads the chunk at an explicit offset, moving the cursor there first.
     * An offset at or past the end leaves the cursor at the end and yields the last chunk.
     *
     * @throws IllegalArgumentException if {@code length} is not positive
     * @throws IOException if {@code startOffset} is negative or the source cannot be read
     */
    public byte[] readChunk(int length, long startOffset) throws IOException {
        if (length <= 0) {
            throw new IllegalArgumentException("Chunk length must be positive: " + length);
        }
        long size = source.size();
        if (startOffset >= size) {
            source.seek(size);
            return LAST_CHUNK.clone();
        }
        source.seek(startOffset);
        return readChunk(length);
    }

    /**
     * Writes the remainder of the source as a complete chunked message body:
     * each chunk followed by CRLF, then the last chunk and the empty trailer.
     *
     * @return number of payload bytes written
     */
    public long writeTo(OutputStream out, int chunkSize) throws IOException {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        long total = 0;
        while (true) {
            byte[] chunk = readChunk(chunkSize);
            out.write(chunk);
            if (isLastChunk(chunk)) {
                break;
            }
            total += payloadLength(chunk);
            out.write(CRLF);
        }
        out.write(CRLF);
        out.flush();
        return total;
    }

    private static boolean isLastChunk(byte[] chunk) {
        return chunk.length == LAST_CHUNK.length && chunk[0] == '0';
    }

    private static int payloadLength(byte[] chunk) {
        int i = 0;
        while (chunk[i] != '\r') {
            i++;
        }
        return chunk.length - i - CRLF.length;
    }
}
