package fr.lapetina.resilienthttp.domain.body;

import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Payload of an HTTP request or response, independent of where the bytes live.
 *
 * Wraps exactly one {@link ContentLengthSource}. Compression runs eagerly:
 * the whole content is passed through a {@link CompressionFilter} and the
 * result replaces the source with an in-memory one. The active content
 * encoding is empty exactly when no encoding filter has been applied.
 *
 * Instances are not thread-safe. A body takes ownership of its source and
 * closes any source it replaces.
 */
public final class EntityBody implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(EntityBody.class);

    public static final String DEFAULT_COMPRESSION_FILTER = CompressionFilters.ZLIB_DEFLATE;
    public static final String DEFAULT_DECOMPRESSION_FILTER = CompressionFilters.ZLIB_INFLATE;

    private static final Set<String> COMPRESSIBLE_EXTENSIONS = Set.of(
            "txt", "text", "log", "csv", "tsv", "htm", "html", "xhtml", "css", "js", "mjs",
            "json", "xml", "xsl", "xsd", "svg", "md", "markdown", "rtf", "yaml", "yml",
            "php", "java", "py", "rb", "c", "h", "cpp", "sh", "sql", "properties", "ini", "conf"
    );

    private static final Set<String> PRECOMPRESSED_EXTENSIONS = Set.of(
            "gz", "tgz", "bz2", "zip", "7z", "rar", "xz", "zst", "br"
    );

    private ContentLengthSource source;
    private ChunkedFramer framer;
    private String contentEncoding;
    private long cachedLength = -1;

    private EntityBody(ContentLengthSource source) {
        this.source = source;
        this.framer = new ChunkedFramer(source);
    }

    /**
     * Normalizes any supported input into an entity body.
     *
     * Accepts a {@code String}, {@code byte[]}, {@code InputStream}, {@code Path},
     * {@code File}, {@link ContentLengthSource} or an existing {@code EntityBody},
     * which is returned as-is.
     *
     * @throws InvalidBodyException for any other input, including null
     */
    public static EntityBody factory(Object input) {
        if (input instanceof EntityBody) {
            return (EntityBody) input;
        }
        if (input instanceof String) {
            return factory((String) input);
        }
        if (input instanceof byte[]) {
            return factory((byte[]) input);
        }
        if (input instanceof ContentLengthSource) {
            return factory((ContentLengthSource) input);
        }
        if (input instanceof Path) {
            return factory((Path) input);
        }
        if (input instanceof File) {
            return factory(((File) input).toPath());
        }
        if (input instanceof InputStream) {
            return factory((InputStream) input);
        }
        throw new InvalidBodyException(input);
    }

    public static EntityBody factory(EntityBody body) {
        if (body == null) {
            throw new InvalidBodyException(null);
        }
        return body;
    }

    public static EntityBody factory(String content) {
        if (content == null) {
            throw new InvalidBodyException(null);
        }
        return new EntityBody(new MemorySource(content.getBytes(StandardCharsets.UTF_8)));
    }

    public static EntityBody factory(byte[] content) {
        if (content == null) {
            throw new InvalidBodyException(null);
        }
        return new EntityBody(new MemorySource(content));
    }

    public static EntityBody factory(ContentLengthSource source) {
        if (source == null) {
            throw new InvalidBodyException(null);
        }
        return new EntityBody(source);
    }

    /**
     * Opens a local file read-only.
     */
    public static EntityBody factory(Path path) {
        if (path == null) {
            throw new InvalidBodyException(null);
        }
        try {
            return new EntityBody(FileSource.open(path));
        } catch (IOException e) {
            throw new InvalidBodyException("Cannot open entity body file: " + path, e);
        }
    }

    /**
     * Drains a stream into memory. The stream is not closed.
     */
    public static EntityBody factory(InputStream stream) {
        if (stream == null) {
            throw new InvalidBodyException(null);
        }
        try {
            return new EntityBody(new MemorySource(stream.readAllBytes()));
        } catch (IOException e) {
            throw new InvalidBodyException("Cannot read entity body stream", e);
        }
    }

    /**
     * Checks whether a file name carries an extension worth compressing.
     * Only the text after the last dot counts; names without an extension and
     * already-compressed formats are rejected.
     */
    public static boolean shouldCompress(String filename) {
        String extension = MimeTypes.extensionOf(filename).toLowerCase(Locale.ROOT);
        if (extension.isEmpty() || PRECOMPRESSED_EXTENSIONS.contains(extension)) {
            return false;
        }
        return COMPRESSIBLE_EXTENSIONS.contains(extension);
    }

    /**
     * Returns the content length in bytes, recomputed after any mutation.
     */
    public long getContentLength() {
        if (cachedLength < 0) {
            try {
                cachedLength = source.size();
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot determine entity body length", e);
            }
        }
        return cachedLength;
    }

    /**
     * Compresses the body with {@link #DEFAULT_COMPRESSION_FILTER}.
     */
    public boolean compress() {
        return compress(DEFAULT_COMPRESSION_FILTER);
    }

    /**
     * Replaces the content with its encoding through the named filter.
     *
     * @return false, leaving the body untouched, if the filter is unknown or
     *         not an encoder, the source is unreadable, or encoding fails
     */
    public boolean compress(String filterName) {
        Optional<CompressionFilter> filter = CompressionFilters.lookup(filterName)
                .filter(f -> f.getDirection() == CompressionFilter.Direction.ENCODE);
        if (filter.isEmpty()) {
            log.debug("No compression filter named '{}'", filterName);
            return false;
        }
        return handleCompression(filter.get(), filter.get().getContentEncoding().orElse(null));
    }

    /**
     * Decompresses the body with {@link #DEFAULT_DECOMPRESSION_FILTER}.
     */
    public boolean uncompress() {
        return uncompress(DEFAULT_DECOMPRESSION_FILTER);
    }

    /**
     * Replaces the content with its decoding through the named filter. A
     * container header the filter does not understand itself (such as a gzip
     * header before raw deflate data) is skipped first.
     *
     * @return true once the restored content is in place; false, leaving the
     *         body untouched, if the filter is unknown or not a decoder, the
     *         source is unreadable, or decoding fails
     */
    public boolean uncompress(String filterName) {
        Optional<CompressionFilter> filter = CompressionFilters.lookup(filterName)
                .filter(f -> f.getDirection() == CompressionFilter.Direction.DECODE);
        if (filter.isEmpty()) {
            log.debug("No decompression filter named '{}'", filterName);
            return false;
        }
        return handleCompression(filter.get(), null);
    }

    private boolean handleCompression(CompressionFilter filter, String newEncoding) {
        if (!source.isReadable() || !source.isSeekable()) {
            log.debug("Entity body not readable, skipping filter: filter={}, source={}", filter.getName(), source);
            return false;
        }
        byte[] transformed;
        try {
            byte[] content = source.readAll();
            int offsetStart = filter.getDirection() == CompressionFilter.Direction.DECODE
                    ? CompressedFormats.payloadOffset(filter.getName(), content)
                    : 0;
            if (offsetStart > 0) {
                byte[] payload = new byte[content.length - offsetStart];
                System.arraycopy(content, offsetStart, payload, 0, payload.length);
                content = payload;
            }
            transformed = filter.apply(content);
        } catch (IOException e) {
            log.warn("Compression filter failed: filter={}, error={}", filter.getName(), e.getMessage());
            return false;
        }

        replaceSource(new MemorySource(transformed));
        contentEncoding = newEncoding;
        log.debug("Applied compression filter: filter={}, contentLength={}, contentEncoding={}",
                filter.getName(), transformed.length, newEncoding);
        return true;
    }

    private void replaceSource(ContentLengthSource replacement) {
        ContentLengthSource previous = source;
        source = replacement;
        framer = new ChunkedFramer(replacement);
        cachedLength = -1;
        try {
            previous.close();
        } catch (IOException e) {
            log.warn("Error closing replaced entity body source: {}", previous, e);
        }
    }

    /**
     * Returns the active {@code Content-Encoding} token, empty when the content is not encoded.
     */
    public Optional<String> getContentEncoding() {
        return Optional.ofNullable(contentEncoding);
    }

    /**
     * Marks the current content as already encoded by the named filter,
     * without transforming it.
     *
     * @throws IllegalArgumentException if no filter has that name
     */
    public EntityBody setContentEncodingFromFilter(String filterName) {
        CompressionFilter filter = CompressionFilters.lookup(filterName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown compression filter: " + filterName));
        this.contentEncoding = filter.getContentEncoding().orElse(null);
        return this;
    }

    /**
     * Returns the MIME type inferred from the file name for local files,
     * {@value MimeTypes#DEFAULT_TYPE} otherwise.
     */
    public String getContentType() {
        if (!source.isLocal()) {
            return MimeTypes.DEFAULT_TYPE;
        }
        return source.getUri()
                .flatMap(uri -> MimeTypes.fromFilename(uri.getPath()))
                .orElse(MimeTypes.DEFAULT_TYPE);
    }

    /**
     * Returns the lowercase hex MD5 of the current content, computed on every call.
     */
    public String getContentMd5() {
        return DigestUtils.md5Hex(getBytes());
    }

    /**
     * Returns the raw MD5 digest of the current content.
     */
    public byte[] getContentMd5Digest() {
        return DigestUtils.md5(getBytes());
    }

    /**
     * Returns the base64 MD5 of the current content, as sent in a {@code Content-MD5} header.
     */
    public String getContentMd5Base64() {
        return Base64.encodeBase64String(getContentMd5Digest());
    }

    /**
     * Reads the next chunk from the current cursor position.
     *
     * @see ChunkedFramer#readChunk(int)
     */
    public byte[] readChunked(int length) {
        try {
            return framer.readChunk(length);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read chunk from entity body", e);
        }
    }

    /**
     * Reads a chunk starting at {@code startOffset}, which becomes the new cursor position.
     * An offset past the end yields the last chunk.
     */
    public byte[] readChunked(int length, long startOffset) {
        try {
            return framer.readChunk(length, startOffset);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read chunk from entity body", e);
        }
    }

    /**
     * Writes the content from the current cursor as a complete chunked message body.
     *
     * @return number of payload bytes written
     */
    public long writeChunked(OutputStream out, int chunkSize) throws IOException {
        return framer.writeTo(out, chunkSize);
    }

    /**
     * Returns the full content without moving the cursor.
     */
    public byte[] getBytes() {
        try {
            return source.readAll();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read entity body", e);
        }
    }

    public int read(byte[] buffer, int offset, int length) throws IOException {
        return source.read(buffer, offset, length);
    }

    public void write(byte[] data) throws IOException {
        source.write(data, 0, data.length);
        cachedLength = -1;
    }

    public void seek(long offset) throws IOException {
        source.seek(offset);
    }

    public long getPosition() throws IOException {
        return source.position();
    }

    public boolean isLocal() {
        return source.isLocal();
    }

    public SourceKind getSourceKind() {
        return source.getKind();
    }

    public Optional<URI> getUri() {
        return source.getUri();
    }

    public boolean isReadable() {
        return source.isReadable();
    }

    public boolean isWritable() {
        return source.isWritable();
    }

    public boolean isSeekable() {
        return source.isSeekable();
    }

    @Override
    public void close() throws IOException {
        source.close();
    }

    /**
     * Returns the full content decoded as UTF-8, or an empty string if the
     * source cannot be read.
     */
    @Override
    public String toString() {
        if (!source.isReadable()) {
            return "";
        }
        try {
            return new String(source.readAll(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Cannot render entity body: {}", e.getMessage());
            return "";
        }
    }
}
