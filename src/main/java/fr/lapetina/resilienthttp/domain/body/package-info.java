/**
 * Entity bodies over memory or files, with eager compression and chunked framing.
 *
 * <p>{@link fr.lapetina.resilienthttp.domain.body.EntityBody#factory(Object)} normalizes
 * strings, byte arrays, streams, files and sources. Compression filters are looked up by
 * name in {@link fr.lapetina.resilienthttp.domain.body.CompressionFilters}; container
 * headers a decoder cannot read itself are skipped through hooks in
 * {@link fr.lapetina.resilienthttp.domain.body.CompressedFormats}.
 *
 * <pre>{@code
 * EntityBody body = EntityBody.factory("some text");
 * body.compress();                       // zlib.deflate, Content-Encoding: gzip
 * byte[] chunk = body.readChunked(1024, 0);
 * body.uncompress();                     // back to "some text"
 * }</pre>
 */
package fr.lapetina.resilienthttp.domain.body;
