package org.chatvault.archive.chunk;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Read-only file channel that remembers the path it was opened from.
 */
public final class NamedChannel implements SeekableByteChannel, NamedSource {

    private final SeekableByteChannel delegate;
    private final String name;

    NamedChannel(SeekableByteChannel delegate, String name) {
        this.delegate = delegate;
        this.name = name;
    }

    /**
     * Opens {@code path} for reading.
     */
    public static NamedChannel open(Path path) throws IOException {
        return new NamedChannel(FileChannel.open(path, StandardOpenOption.READ), path.toString());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        return delegate.read(dst);
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        throw new IOException("chunk log is opened read-only: " + name);
    }

    @Override
    public long position() throws IOException {
        return delegate.position();
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        delegate.position(newPosition);
        return this;
    }

    @Override
    public long size() throws IOException {
        return delegate.size();
    }

    @Override
    public SeekableByteChannel truncate(long size) throws IOException {
        throw new IOException("chunk log is opened read-only: " + name);
    }

    @Override
    public boolean isOpen() {
        return delegate.isOpen();
    }

    @Override
    public void close() throws IOException {
        delegate.close();
    }
}
