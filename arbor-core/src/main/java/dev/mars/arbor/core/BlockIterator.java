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
package dev.mars.arbor.core;

import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.ArborExceptions;
import dev.mars.arbor.path.NodePath;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Reads a stream in fixed-size blocks. Every block is full except possibly the last.
 * Owns the stream: close it, preferably with try-with-resources.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class BlockIterator implements RemoteIterator<byte[]>, Closeable {

    private final InputStream input;
    private final int blockSize;
    private final NodePath path;

    private byte[] pending;
    private boolean exhausted;
    private boolean closed;

    public BlockIterator(InputStream input, int blockSize, NodePath path) {
        if (blockSize <= 0) {
            throw new IllegalArgumentException("Block size must be positive: " + blockSize);
        }
        this.input = input;
        this.blockSize = blockSize;
        this.path = path;
    }

    @Override
    public boolean hasNext() throws ArborException {
        if (pending == null && !exhausted) {
            pending = fetch();
        }
        return pending != null;
    }

    @Override
    public byte[] next() throws ArborException {
        if (!hasNext()) {
            throw new NoSuchElementException("No more blocks in " + path);
        }
        byte[] block = pending;
        pending = null;
        return block;
    }

    private byte[] fetch() throws ArborException {
        if (closed) {
            throw new IllegalStateException("Block iterator is closed");
        }
        byte[] buffer = new byte[blockSize];
        int filled;
        try {
            filled = input.readNBytes(buffer, 0, blockSize);
        } catch (IOException e) {
            throw ArborExceptions.translate(e, path);
        }
        if (filled < blockSize) {
            exhausted = true;
        }
        if (filled == 0) {
            return null;
        }
        return filled == blockSize ? buffer : Arrays.copyOf(buffer, filled);
    }

    @Override
    public void close() throws ArborException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            input.close();
        } catch (IOException e) {
            throw ArborExceptions.translate(e, path);
        }
    }
}
