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
package dev.mars.arbor.core.capability;

import dev.mars.arbor.core.Node;
import dev.mars.arbor.core.WorkingDirectoryScope;
import dev.mars.arbor.core.exceptions.ArborException;

/**
 * A session-scoped current folder, against which relative paths are parsed.
 *
 * @param <N> the backend's node type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface WorkingDirectory<N extends Node<N>> extends Node<N> {

    /**
     * Makes this folder the session's working directory.
     */
    void changeTo() throws ArborException;

    /**
     * The session's current working directory.
     */
    N getWorkingDirectory() throws ArborException;

    default void cd() throws ArborException {
        changeTo();
    }

    /**
     * Switches to this folder until the returned scope is closed:
     * <pre>{@code
     * try (WorkingDirectoryScope<LocalNode> scope = folder.asWorking()) {
     *     fileSystem.resolve("relative/name");
     * }
     * }</pre>
     */
    default WorkingDirectoryScope<N> asWorking() throws ArborException {
        N previous = getWorkingDirectory();
        changeTo();
        return new WorkingDirectoryScope<>(self(), previous);
    }
}
