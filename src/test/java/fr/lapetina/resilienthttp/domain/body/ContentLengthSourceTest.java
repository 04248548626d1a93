package fr.lapetina.resilienthttp.domain.body;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentLengthSourceTest {

    @Nested
    @DisplayName("MemorySource")
    class Memory {

        @Test
        @DisplayName("should grow past its initial capacity")
        void shouldGrow() throws IOException {
            MemorySource source = new MemorySource();
            byte[] data = "z".repeat(1000).getBytes(StandardCharsets.UTF_8);

            source.write(data, 0, data.length);

            assertThat(source.size()).isEqualTo(1000);
            assertThat(source.position()).isEqualTo(1000);
            assertThat(source.readAll()).isEqualTo(data);
        }

        @Test
        @DisplayName("should restore the cursor after readAll")
        void shouldRestoreCursor() throws IOException {
            MemorySource source = new MemorySource("abcdef".getBytes(StandardCharsets.UTF_8));
            source.seek(4);

            assertThat(source.readAll()).hasSize(6);
            assertThat(source.position()).isEqualTo(4);
        }

        @Test
        @DisplayName("should reject a seek beyond the end")
        void shouldRejectSeekBeyondEnd() {
            MemorySource source = new MemorySource("abc".getBytes(StandardCharsets.UTF_8));

            assertThatThrownBy(() -> source.seek(4)).isInstanceOf(IOException.class);
            assertThatThrownBy(() -> source.seek(-1)).isInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("should be empty after truncate")
        void shouldTruncate() throws IOException {
            MemorySource source = new MemorySource("abc".getBytes(StandardCharsets.UTF_8));

            source.truncate();

            assertThat(source.size()).isZero();
            assertThat(source.read(new byte[4], 0, 4)).isEqualTo(-1);
        }
    }

    @Nested
    @DisplayName("FileSource")
    class File {

        @Test
        @DisplayName("should open read-only by default")
        void shouldOpenReadOnly(@TempDir Path dir) throws IOException {
            Path path = dir.resolve("a.txt");
            Files.writeString(path, "hello");

            try (FileSource source = FileSource.open(path)) {
                assertThat(source.isReadable()).isTrue();
                assertThat(source.isWritable()).isFalse();
                assertThat(source.isSeekable()).isTrue();
                assertThat(source.isLocal()).isTrue();
                assertThat(source.size()).isEqualTo(5);
                assertThatThrownBy(() -> source.write(new byte[]{1}, 0, 1)).isInstanceOf(IOException.class);
            }
        }

        @Test
        @DisplayName("should refuse reads when opened for writing only")
        void shouldRefuseReadsWhenWriteOnly(@TempDir Path dir) throws IOException {
            Path path = dir.resolve("b.txt");
            Files.writeString(path, "hello");

            try (FileSource source = FileSource.open(path, StandardOpenOption.WRITE)) {
                assertThat(source.isReadable()).isFalse();
                assertThat(source.isWritable()).isTrue();
                assertThatThrownBy(() -> source.read(new byte[4], 0, 4)).isInstanceOf(IOException.class);
            }
        }

        @Test
        @DisplayName("should read and write when opened for both")
        void shouldReadAndWrite(@TempDir Path dir) throws IOException {
            Path path = dir.resolve("c.txt");

            try (FileSource source = FileSource.open(path,
                    StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
                byte[] data = "written".getBytes(StandardCharsets.UTF_8);
                source.write(data, 0, data.length);

                assertThat(source.readAll()).isEqualTo(data);
                assertThat(source.getPath()).isEqualTo(path.toAbsolutePath());
            }
        }
    }
}
