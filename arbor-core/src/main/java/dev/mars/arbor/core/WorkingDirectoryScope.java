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

/**
 * A temporary switch of the session's working directory. Closing it switches back
 * to the folder that was current before, on every exit path when used with
 * try-with-resources.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class WorkingDirectoryScope<N extends Node<N>> implements AutoCloseable {

    private final N folder;
    private final N previous;
    private boolean closed;

    public WorkingDirectoryScope(N folder, N previous) {
        this.folder = folder;
        this.previous = previous;
    }

    public N getFolder() {
        return folder;
    }

    public N getPrevious() {
        return previous;
    }

    @Override
    public void close() throws ArborException {
        if (closed) {
            return;
        }
        closed = true;
        Capabilities.workingDirectory(previous).changeTo();
    }
}
