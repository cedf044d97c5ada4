/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.arbor.reconnect;

import dev.mars.arbor.core.Node;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.ArborExceptions;
import dev.mars.arbor.core.exceptions.ErrorKind;
import dev.mars.arbor.path.NodePath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Read stream that outlives disconnections.
 *
 * <p>Counts the bytes it has delivered. When a read fails with a disconnection it
 * has the proxy rebuild the backend, reopens the node, skips the bytes already
 * delivered and repeats the read, so the caller sees one unbroken byte sequence.
 * A second failure of the repeated read propagates.</p>
 */
final class ReconnectingInputStream extends InputStream {
    private static final Logger logger = LoggerFactory.getLogger(ReconnectingInputStream.class);

    private final ReconnectingFileSystem fileSystem;
    private final NodePath path;
    private ReconnectingFileSystem.Bound<InputStream> current;
    private long position;
    private boolean closed;

    ReconnectingInputStream(ReconnectingFileSystem fileSystem, NodePath path) throws ArborException {
        this.fileSystem = fileSystem;
        this.path = path;
        this.current = fileSystem.invoke("open for reading", path,
                node -> ReconnectingNode.readable(node).openForReading());
    }

    @Override
    public int read() throws IOException {
        byte[] single = new byte[1];
        int n;
        do {
            n = read(single, 0, 1);
        } while (n == 0);
        return n < 0 ? -1 : single[0] & 0xff;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
        int n;
        try {
            n = current.value().read(buffer, offset, length);
        } catch (IOException e) {
            if (!current.connection().backend().isDisconnection(e)) {
                throw e;
            }
            resume(e);
            n = current.value().read(buffer, offset, length);
        }
        if (n > 0) {
            position += n;
        }
        return n;
    }

    private void resume(IOException cause) throws ArborException {
        logger.warn("Read of {} interrupted at offset {}: {}", path, position, cause.getMessage());
        closeQuietly(current.value());
        ReconnectingFileSystem.Connection fresh = fileSystem.reconnect(current.connection(),
                ArborExceptions.translate(cause, path));
        Node<?> node = fresh.backend().resolve(path);
        InputStream reopened = ReconnectingNode.readable(node).openForReading();
        try {
            skipFully(reopened, position);
        } catch (IOException e) {
            closeQuietly(reopened);
            throw ArborExceptions.translate(e, path);
        }
        current = new ReconnectingFileSystem.Bound<>(reopened, fresh);
        logger.info("Resumed reading {} at offset {}", path, position);
    }

    private void skipFully(InputStream input, long count) throws IOException {
        long remaining = count;
        while (remaining > 0) {
            long skipped = input.skip(remaining);
            if (skipped <= 0) {
                if (input.read() < 0) {
                    throw new ArborException(ErrorKind.IO_FAILURE, path,
                            "Content shrank below offset " + count + " across the reconnect");
                }
                skipped = 1;
            }
            remaining -= skipped;
        }
    }

    private void closeQuietly(InputStream input) {
        try {
            input.close();
        } catch (IOException e) {
            logger.debug("Closing severed stream of {} failed: {}", path, e.getMessage());
        }
    }

    @Override
    public int available() throws IOException {
        return closed ? 0 : current.value().available();
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            current.value().close();
        } catch (IOException e) {
            if (!current.connection().backend().isDisconnection(e)) {
                throw e;
            }
            logger.debug("Read stream of {} was already severed at close", path);
        }
    }
}
