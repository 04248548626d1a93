package fr.lapetina.resilienthttp.domain.body;

import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Byte source backed by a local file channel.
 *
 * Readability and writability follow the options the file was opened with,
 * so a file opened with {@code WRITE} only refuses to be read.
 */
public final class FileSource extends ContentLengthSource {

    private final Path path;
    private final FileChannel channel;
    private final boolean readable;
    private final boolean writable;

    private FileSource(Path path, FileChannel channel, boolean readable, boolean writable) {
        this.path = path;
        this.channel = channel;
        this.readable = readable;
        this.writable = writable;
    }

    /**
     * Opens a file for reading.
     */
    public static FileSource open(Path path) throws IOException {
        return open(path, StandardOpenOption.READ);
    }

    /**
     * Opens a file with explicit options. Without {@code READ} or {@code WRITE}
     * the channel is read-only, as with {@link FileChannel#open}.
     */
    public static FileSource open(Path path, OpenOption... options) throws IOException {
        List<OpenOption> optionSet = Arrays.asList(options);
        boolean writable = optionSet.contains(StandardOpenOption.WRITE)
                || optionSet.contains(StandardOpenOption.APPEND);
        boolean readable = optionSet.contains(StandardOpenOption.READ) || !writable;
        FileChannel channel = FileChannel.open(path, options);
        return new FileSource(path.toAbsolutePath(), channel, readable, writable);
    }

    @Override
    public long size() throws IOException {
        return channel.size();
    }

    @Override
    public long position() throws IOException {
        return channel.position();
    }

    @Override
    public void seek(long offset) throws IOException {
        if (offset < 0) {
            throw new IOException("Negative seek offset: " + offset);
        }
        channel.position(offset);
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        if (!readable) {
            throw new IOException("File not open for reading: " + path);
        }
        return channel.read(ByteBuffer.wrap(buffer, offset, length));
    }

    @Override
    public void write(byte[] data, int offset, int length) throws IOException {
        if (!writable) {
            throw new IOException("File not open for writing: " + path);
        }
        ByteBuffer source = ByteBuffer.wrap(data, offset, length);
        while (source.hasRemaining()) {
            channel.write(source);
        }
    }

    @Override
    public void truncate() throws IOException {
        if (!writable) {
            throw new IOException("File not open for writing: " + path);
        }
        channel.truncate(0);
        channel.position(0);
    }

    @Override
    public boolean isReadable() {
        return readable && channel.isOpen();
    }

    @Override
    public boolean isWritable() {
        return writable && channel.isOpen();
    }

    @Override
    public boolean isSeekable() {
        return channel.isOpen();
    }

    @Override
    public SourceKind getKind() {
        return SourceKind.LOCAL_FILE;
    }

    @Override
    public Optional<URI> getUri() {
        return Optional.of(path.toUri());
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    @Override
    public String toString() {
        return "FileSource{path=" + path + ", readable=" + readable + ", writable=" + writable + '}';
    }
}
