package fr.lapetina.resilienthttp.domain.body;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;

class CompressedFormatsTest {

    @Test
    @DisplayName("should measure a plain gzip header")
    void shouldMeasurePlainHeader() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write("payload".getBytes(StandardCharsets.UTF_8));
        }

        assertThat(CompressedFormats.gzipHeaderLength(out.toByteArray())).isEqualTo(10);
    }

    @Test
    @DisplayName("should skip FEXTRA, FNAME and FCOMMENT fields")
    void shouldSkipOptionalFields() {
        byte[] header = {
                0x1f, (byte) 0x8b, 0x08, 0x04 | 0x08 | 0x10, 0, 0, 0, 0, 0, 3,
                2, 0, 'a', 'b',          // FEXTRA: length 2
                'f', '.', 't', 'x', 't', 0, // FNAME
                'c', 0,                  // FCOMMENT
                0x7f                     // first payload byte
        };

        assertThat(CompressedFormats.gzipHeaderLength(header)).isEqualTo(header.length - 1);
    }

    @Test
    @DisplayName("should not match content without the gzip magic")
    void shouldIgnoreOtherContent() {
        assertThat(CompressedFormats.gzipHeaderLength("plain text content".getBytes(StandardCharsets.UTF_8)))
                .isZero();
        assertThat(CompressedFormats.gzipHeaderLength(new byte[]{0x1f, (byte) 0x8b})).isZero();
    }

    @Test
    @DisplayName("should apply hooks only to the filter they were registered for")
    void shouldScopeHooksByFilter() {
        byte[] content = {0x1f, (byte) 0x8b, 0x08, 0, 0, 0, 0, 0, 0, 3, 0x55};

        assertThat(CompressedFormats.payloadOffset(CompressionFilters.ZLIB_INFLATE, content)).isEqualTo(10);
        assertThat(CompressedFormats.payloadOffset(CompressionFilters.BZIP2_DECOMPRESS, content)).isZero();
    }

    @Test
    @DisplayName("should use a custom hook registered for a decoder")
    void shouldUseCustomHook() {
        CompressedFormats.register("test.framed", content -> content.length > 4 && content[0] == 'F' ? 4 : 0);

        assertThat(CompressedFormats.payloadOffset("test.framed", "FRM:data".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo(4);
        assertThat(CompressedFormats.payloadOffset("TEST.FRAMED", "data".getBytes(StandardCharsets.UTF_8)))
                .isZero();
    }

    @Test
    @DisplayName("should resolve upper-case filter names regardless of the default locale")
    void shouldIgnoreDefaultLocale() {
        byte[] content = {0x1f, (byte) 0x8b, 0x08, 0, 0, 0, 0, 0, 0, 3, 0x55};
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertThat(CompressionFilters.lookup("ZLIB.INFLATE"))
                    .hasValueSatisfying(f -> assertThat(f.getName()).isEqualTo(CompressionFilters.ZLIB_INFLATE));
            assertThat(CompressedFormats.payloadOffset("ZLIB.INFLATE", content)).isEqualTo(10);
        } finally {
            Locale.setDefault(previous);
        }
    }
}
