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
import dev.mars.arbor.core.WriteResumeMode;
import dev.mars.arbor.core.capability.Readable;
import dev.mars.arbor.core.capability.Sizable;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.ArborExceptions;
import dev.mars.arbor.core.exceptions.DisconnectedException;
import dev.mars.arbor.core.exceptions.ErrorKind;
import dev.mars.arbor.path.NodePath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Write stream that outlives disconnections.
 *
 * <p>Counts the bytes acknowledged by the backend, that is, written by calls that
 * returned normally. When a write fails with a disconnection it has the proxy
 * rebuild the backend, reopens the node in append mode and writes the interrupted
 * chunk again. What happens to the part of that chunk that had already landed
 * depends on the backend's {@link WriteResumeMode}:</p>
 * <ul>
 *   <li>{@code RECONCILE_BY_SIZE}: the node's size tells how much landed, and only
 *       the rest is written. If the size is below the acknowledged total, the stream
 *       fails instead of leaving a hole.</li>
 *   <li>{@code RESEND}: the whole chunk is written again and may be duplicated.</li>
 * </ul>
 */
final class ReconnectingOutputStream extends OutputStream {
    private static final Logger logger = LoggerFactory.getLogger(ReconnectingOutputStream.class);
    private static final byte[] NOTHING = new byte[0];

    private final ReconnectingFileSystem fileSystem;
    private final NodePath path;
    private final long baseSize;
    private ReconnectingFileSystem.Bound<OutputStream> current;
    private long acknowledged;
    private boolean closed;

    private ReconnectingOutputStream(ReconnectingFileSystem fileSystem, NodePath path, long baseSize,
                                     ReconnectingFileSystem.Bound<OutputStream> current) {
        this.fileSystem = fileSystem;
        this.path = path;
        this.baseSize = baseSize;
        this.current = current;
    }

    static ReconnectingOutputStream open(ReconnectingFileSystem fileSystem, NodePath path, boolean append)
            throws ArborException {
        long baseSize = 0;
        if (append && fileSystem.getWriteResumeMode() == WriteResumeMode.RECONCILE_BY_SIZE) {
            baseSize = fileSystem.call("size before append", path, ReconnectingOutputStream::sizeOf);
        }
        ReconnectingFileSystem.Bound<OutputStream> opened = fileSystem.invoke("open for writing", path,
                node -> ReconnectingNode.writable(node).openForWriting(append));
        return new ReconnectingOutputStream(fileSystem, path, baseSize, opened);
    }

    @Override
    public void write(int b) throws IOException {
        write(new byte[]{(byte) b}, 0, 1);
    }

    @Override
    public void write(byte[] buffer, int offset, int length) throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
        try {
            current.value().write(buffer, offset, length);
        } catch (IOException e) {
            if (!current.connection().backend().isDisconnection(e)) {
                throw e;
            }
            resume(e, buffer, offset, length);
        }
        acknowledged += length;
    }

    @Override
    public void flush() throws IOException {
        if (closed) {
            return;
        }
        try {
            current.value().flush();
        } catch (IOException e) {
            if (!current.connection().backend().isDisconnection(e)) {
                throw e;
            }
            resume(e, NOTHING, 0, 0);
            current.value().flush();
        }
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
            resume(e, NOTHING, 0, 0);
            current.value().close();
        }
    }

    private void resume(IOException cause, byte[] chunk, int offset, int length) throws IOException {
        logger.warn("Write to {} interrupted after {} acknowledged bytes: {}", path, acknowledged, cause.getMessage());
        closeQuietly(current.value());
        ReconnectingFileSystem.Connection fresh = fileSystem.reconnect(current.connection(),
                ArborExceptions.translate(cause, path));
        Node<?> node = fresh.backend().resolve(path);

        int landed = 0;
        if (fresh.backend().getWriteResumeMode() == WriteResumeMode.RECONCILE_BY_SIZE && node.supports(Sizable.class)) {
            long surplus = sizeOf(node) - baseSize - acknowledged;
            if (surplus < 0) {
                throw new DisconnectedException(path, -surplus + " acknowledged bytes were lost across the reconnect",
                        cause);
            }
            if (surplus > length) {
                throw new ArborException(ErrorKind.IO_FAILURE, path,
                        "Node holds " + (surplus - length) + " more bytes than were written", cause);
            }
            landed = (int) surplus;
        } else if (length > 0) {
            logger.warn("Re-sending {} bytes to {}; some may be duplicated", length, path);
        }

        OutputStream reopened = ReconnectingNode.writable(node).openForWriting(true);
        current = new ReconnectingFileSystem.Bound<>(reopened, fresh);
        if (length > landed) {
            reopened.write(chunk, offset + landed, length - landed);
        }
        logger.info("Resumed writing {} at offset {}", path, acknowledged + length);
    }

    private static long sizeOf(Node<?> node) throws ArborException {
        Readable<?> readable = ReconnectingNode.readable(node);
        if (!node.supports(Sizable.class) || !readable.exists()) {
            return 0;
        }
        Sizable<?> sizable = node.as(Sizable.class);
        return sizable.getSize();
    }

    private void closeQuietly(OutputStream output) {
        try {
            output.close();
        } catch (IOException e) {
            logger.debug("Closing severed stream of {} failed: {}", path, e.getMessage());
        }
    }
}
