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

import dev.mars.arbor.config.ArborConfiguration;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.ArborExceptions;
import dev.mars.arbor.path.NodePath;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;

/**
 * Backend-scoped authority over a set of node hierarchies.
 *
 * <p>A filesystem enumerates its roots (the only nodes without a parent) and its
 * mountpoints, and turns paths into nodes. Every filesystem exposes at least one
 * mountpoint whose location is one of its roots.</p>
 *
 * @param <N> the node type this filesystem produces
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface FileSystem<N extends Node<N>> extends Closeable {

    /**
     * One node per distinct hierarchy, without duplicates.
     */
    List<N> getRoots() throws ArborException;

    /**
     * The node at {@code path}. Backends that can build nodes for paths that do not
     * exist do so; others raise a not-found error.
     */
    N resolve(NodePath path) throws ArborException;

    List<MountPoint<N>> getMountPoints() throws ArborException;

    /**
     * Parses a textual path in this backend's syntax. Relative text is taken
     * relative to the session's working directory where the backend has one.
     */
    NodePath parsePath(String path) throws ArborException;

    String getSeparator();

    ArborConfiguration getConfiguration();

    default N getRoot() throws ArborException {
        return getRoots().get(0);
    }

    default N resolve(String path) throws ArborException {
        return resolve(parsePath(path));
    }

    default Optional<N> getTemporaryDirectory() throws ArborException {
        return Optional.empty();
    }

    /**
     * Classifies a failure raised by this backend. True means the connection is gone
     * and a fresh backend instance may succeed where this one failed.
     */
    default boolean isDisconnection(Throwable failure) {
        return ArborExceptions.isDisconnection(failure);
    }

    /**
     * What this backend guarantees about the last chunk written before a disconnect.
     */
    default WriteResumeMode getWriteResumeMode() {
        return WriteResumeMode.RESEND;
    }

    @Override
    default void close() throws ArborException {
    }
}
