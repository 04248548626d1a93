package fr.lapetina.resilienthttp.domain.body;

import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.Inflater;

/**
 * Registry of named compression filters.
 *
 * Built-in filters:
 * - zlib.deflate / zlib.inflate: raw DEFLATE (RFC 1951), advertised as gzip
 * - gzip.encode / gzip.decode: gzip container (RFC 1952)
 * - bzip2.compress / bzip2.decompress: bzip2 via Apache Commons Compress, advertised as compress
 *
 * Custom filters can be registered at runtime.
 */
public final class CompressionFilters {

    public static final String ZLIB_DEFLATE = "zlib.deflate";
    public static final String ZLIB_INFLATE = "zlib.inflate";
    public static final String GZIP_ENCODE = "gzip.encode";
    public static final String GZIP_DECODE = "gzip.decode";
    public static final String BZIP2_COMPRESS = "bzip2.compress";
    public static final String BZIP2_DECOMPRESS = "bzip2.decompress";

    private static final int BUFFER_SIZE = 8192;

    private static final Map<String, CompressionFilter> REGISTRY = new ConcurrentHashMap<>();

    static {
        register(new StreamFilter(ZLIB_DEFLATE, CompressionFilter.Direction.ENCODE, "gzip") {
            @Override
            public byte[] apply(byte[] input) {
                return deflateRaw(input);
            }
        });
        register(new StreamFilter(ZLIB_INFLATE, CompressionFilter.Direction.DECODE, null) {
            @Override
            public byte[] apply(byte[] input) throws IOException {
                return inflateRaw(input);
            }
        });
        register(new StreamFilter(GZIP_ENCODE, CompressionFilter.Direction.ENCODE, "gzip") {
            @Override
            public byte[] apply(byte[] input) throws IOException {
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                try (OutputStream gzip = new GZIPOutputStream(out)) {
                    gzip.write(input);
                }
                return out.toByteArray();
            }
        });
        register(new StreamFilter(GZIP_DECODE, CompressionFilter.Direction.DECODE, null) {
            @Override
            public byte[] apply(byte[] input) throws IOException {
                try (InputStream gzip = new GZIPInputStream(new ByteArrayInputStream(input))) {
                    return gzip.readAllBytes();
                }
            }
        });
        register(new StreamFilter(BZIP2_COMPRESS, CompressionFilter.Direction.ENCODE, "compress") {
            @Override
            public byte[] apply(byte[] input) throws IOException {
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                try (OutputStream bzip2 = new BZip2CompressorOutputStream(out)) {
                    bzip2.write(input);
                }
                return out.toByteArray();
            }
        });
        register(new StreamFilter(BZIP2_DECOMPRESS, CompressionFilter.Direction.DECODE, null) {
            @Override
            public byte[] apply(byte[] input) throws IOException {
                try (InputStream bzip2 = new BZip2CompressorInputStream(new ByteArrayInputStream(input))) {
                    return bzip2.readAllBytes();
                }
            }
        });
    }

    private CompressionFilters() {
        // Utility class
    }

    /**
     * Registers a filter, replacing any filter with the same name.
     */
    public static void register(CompressionFilter filter) {
        REGISTRY.put(filter.getName().toLowerCase(Locale.ROOT), filter);
    }

    /**
     * Looks up a filter by name.
     *
     * @return the filter, or empty if none is registered under that name
     */
    public static Optional<CompressionFilter> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(REGISTRY.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * Returns all registered filter names.
     */
    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }

    static byte[] deflateRaw(byte[] input) {
        Deflater deflater = new Deflater(Deflater.DEFAULT_COMPRESSION, true);
        try {
            deflater.setInput(input);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, input.length / 2));
            byte[] buffer = new byte[BUFFER_SIZE];
            while (!deflater.finished()) {
                int n = deflater.deflate(buffer);
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    static byte[] inflateRaw(byte[] input) throws IOException {
        Inflater inflater = new Inflater(true);
        try {
            inflater.setInput(input);
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, input.length * 2));
            byte[] buffer = new byte[BUFFER_SIZE];
            // Trailing bytes after the end of the deflate stream (e.g. a gzip trailer) are ignored
            while (!inflater.finished()) {
                int n = inflater.inflate(buffer);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new IOException("Truncated or invalid deflate stream");
                }
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new IOException("Invalid deflate data: " + e.getMessage(), e);
        } finally {
            inflater.end();
        }
    }

    private abstract static class StreamFilter implements CompressionFilter {
        private final String name;
        private final Direction direction;
        private final String contentEncoding;

        StreamFilter(String name, Direction direction, String contentEncoding) {
            this.name = name;
            this.direction = direction;
            this.contentEncoding = contentEncoding;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public Direction getDirection() {
            return direction;
        }

        @Override
        public Optional<String> getContentEncoding() {
            return Optional.ofNullable(contentEncoding);
        }

        @Override
        public String toString() {
            return "CompressionFilter{" + name + ", " + direction + '}';
        }
    }
}
