package fr.lapetina.resilienthttp.domain.body;

import java.io.IOException;
import java.util.Optional;

/**
 * Named byte transform applied eagerly to an entity body's full content.
 *
 * Implementations must be stateless and thread-safe; the registry shares
 * one instance across all bodies.
 */
public interface CompressionFilter {

    enum Direction {
        /** Produces encoded bytes from plain content */
        ENCODE,

        /** Restores plain content from encoded bytes */
        DECODE
    }

    /**
     * Registry name, e.g. {@code zlib.deflate}.
     */
    String getName();

    Direction getDirection();

    /**
     * HTTP {@code Content-Encoding} token produced by an encoding filter.
     * Empty for decoding filters.
     */
    Optional<String> getContentEncoding();

    /**
     * Transforms the complete input.
     *
     * @throws IOException if the input is not valid for this filter
     */
    byte[] apply(byte[] input) throws IOException;
}
