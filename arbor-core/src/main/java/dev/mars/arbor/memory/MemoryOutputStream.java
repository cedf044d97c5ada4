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
package dev.mars.arbor.memory;

import dev.mars.arbor.path.NodePath;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Unbuffered: every write lands in the store before it returns.
 */
class MemoryOutputStream extends OutputStream {

    private final MemoryFileSystem session;
    private final NodePath path;
    private boolean closed;

    MemoryOutputStream(MemoryFileSystem session, NodePath path) {
        this.session = session;
        this.path = path;
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
        session.getStore().write(session, path, buffer, offset, length);
    }

    @Override
    public void close() {
        closed = true;
    }
}
