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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.function.Supplier;

/**
 * Protocol-level streams that break off after a fixed number of bytes, the way a
 * socket does when the peer resets the connection.
 */
public final class CutOffStreams {

    private CutOffStreams() {
    }

    /**
     * Delivers the first {@code limit} bytes of {@code content}, then fails every read.
     */
    public static InputStream input(byte[] content, int limit, Supplier<? extends IOException> failure) {
        return new InputStream() {
            private int position;

            @Override
            public int read() throws IOException {
                byte[] single = new byte[1];
                int n = read(single, 0, 1);
                return n < 0 ? -1 : single[0] & 0xff;
            }

            @Override
            public int read(byte[] buffer, int offset, int length) throws IOException {
                if (position >= limit) {
                    throw failure.get();
                }
                int n = Math.min(length, limit - position);
                System.arraycopy(content, position, buffer, offset, n);
                position += n;
                return n;
            }
        };
    }

    /**
     * Accepts {@code limit} bytes into {@code sink}, then fails every write. The write
     * that crosses the limit lands partially.
     */
    public static OutputStream output(ByteArrayOutputStream sink, int limit, Supplier<? extends IOException> failure) {
        return new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                write(new byte[]{(byte) b}, 0, 1);
            }

            @Override
            public void write(byte[] buffer, int offset, int length) throws IOException {
                int room = limit - sink.size();
                if (length > room) {
                    sink.write(buffer, offset, Math.max(room, 0));
                    throw failure.get();
                }
                sink.write(buffer, offset, length);
            }
        };
    }
}
