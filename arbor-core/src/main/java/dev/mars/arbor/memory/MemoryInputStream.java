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
import java.io.InputStream;

/**
 * Reads a snapshot taken when the stream was opened. Each read is admitted by the
 * store, which may sever the session part way through.
 */
class MemoryInputStream extends InputStream {

    private final MemoryFileSystem session;
    private final NodePath path;
    private final byte[] content;
    private int position;
    private boolean closed;

    MemoryInputStream(MemoryFileSystem session, NodePath path, byte[] content) {
        this.session = session;
        this.path = path;
        this.content = content;
    }

    @Override
    public int read() throws IOException {
        byte[] single = new byte[1];
        int n = read(single, 0, 1);
        return n < 0 ? -1 : single[0] & 0xff;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
        if (length == 0) {
            return 0;
        }
        int remaining = content.length - position;
        if (remaining <= 0) {
            return -1;
        }
        int allowed = session.getStore().admitRead(session, path, Math.min(length, remaining));
        System.arraycopy(content, position, buffer, offset, allowed);
        position += allowed;
        return allowed;
    }

    @Override
    public void close() {
        closed = true;
    }
}
