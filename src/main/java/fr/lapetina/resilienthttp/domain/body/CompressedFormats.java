package fr.lapetina.resilienthttp.domain.body;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Framing adjustments applied before a decoding filter runs.
 *
 * A body can hold bytes produced by a different container than the one the
 * requested filter expects, e.g. a full gzip member handed to the raw
 * {@code zlib.inflate} filter. Each hook recognises one container header
 * and returns the offset at which the filter's own payload starts.
 */
public final class CompressedFormats {

    private static final Logger log = LoggerFactory.getLogger(CompressedFormats.class);

    /**
     * Recognises a container header.
     */
    @FunctionalInterface
    public interface HeaderHook {

        /**
         * @return number of leading bytes to skip, or 0 if the header is not present
         */
        int headerLength(byte[] content);
    }

    private static final int GZIP_FTEXT = 0x01;
    private static final int GZIP_FHCRC = 0x02;
    private static final int GZIP_FEXTRA = 0x04;
    private static final int GZIP_FNAME = 0x08;
    private static final int GZIP_FCOMMENT = 0x10;

    /** gzip member header (RFC 1952): 1f 8b 08, flags, mtime, xfl, os, optional fields */
    public static final HeaderHook GZIP_HEADER = CompressedFormats::gzipHeaderLength;

    private static final Map<String, List<HeaderHook>> HOOKS = new ConcurrentHashMap<>();

    static {
        register(CompressionFilters.ZLIB_INFLATE, GZIP_HEADER);
    }

    private CompressedFormats() {
        // Utility class
    }

    /**
     * Adds a header hook for a decoding filter. Hooks are tried in registration order.
     */
    public static void register(String filterName, HeaderHook hook) {
        HOOKS.computeIfAbsent(filterName.toLowerCase(Locale.ROOT), k -> new CopyOnWriteArrayList<>()).add(hook);
    }

    /**
     * Returns the offset at which the payload for {@code filterName} starts.
     */
    public static int payloadOffset(String filterName, byte[] content) {
        List<HeaderHook> hooks = HOOKS.get(filterName.toLowerCase(Locale.ROOT));
        if (hooks == null) {
            return 0;
        }
        for (HeaderHook hook : hooks) {
            int skip = hook.headerLength(content);
            if (skip > 0) {
                log.debug("Skipping container header: filter={}, headerBytes={}", filterName, skip);
                return skip;
            }
        }
        return 0;
    }

    static int gzipHeaderLength(byte[] content) {
        if (content.length < 10
                || (content[0] & 0xff) != 0x1f
                || (content[1] & 0xff) != 0x8b
                || content[2] != 0x08) {
            return 0;
        }
        int flags = content[3] & 0xff;
        if ((flags & ~(GZIP_FTEXT | GZIP_FHCRC | GZIP_FEXTRA | GZIP_FNAME | GZIP_FCOMMENT)) != 0) {
            return 0;
        }
        int offset = 10;
        if ((flags & GZIP_FEXTRA) != 0) {
            if (offset + 2 > content.length) {
                return 0;
            }
            int extraLength = (content[offset] & 0xff) | ((content[offset + 1] & 0xff) << 8);
            offset += 2 + extraLength;
        }
        if ((flags & GZIP_FNAME) != 0) {
            offset = skipZeroTerminated(content, offset);
        }
        if ((flags & GZIP_FCOMMENT) != 0) {
            offset = skipZeroTerminated(content, offset);
        }
        if ((flags & GZIP_FHCRC) != 0) {
            offset += 2;
        }
        return offset <= content.length ? offset : 0;
    }

    private static int skipZeroTerminated(byte[] content, int offset) {
        int i = offset;
        while (i < content.length && content[i] != 0) {
            i++;
        }
        return i + 1;
    }
}
