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

import dev.mars.arbor.core.exceptions.UnsupportedCapabilityException;
import dev.mars.arbor.path.NodePath;

/**
 * A single addressable location in a {@link FileSystem}.
 *
 * <p>A node is nothing more than a path plus the filesystem that produced it. What
 * can be done with it depends on which capability interfaces its backend implements
 * ({@code Hierarchy}, {@code Readable}, {@code Writable} and so on). Code written
 * against a capability either declares it as a bound or asks for it at runtime
 * through {@link #supports(Class)} and {@link #as(Class)}.</p>
 *
 * <p>Two nodes are equal when they come from the same filesystem instance and have
 * equal paths.</p>
 *
 * @param <N> the backend's node type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface Node<N extends Node<N>> {

    FileSystem<N> getFileSystem();

    NodePath getPath();

    /**
     * Whether this node offers the given capability interface.
     */
    default boolean supports(Class<?> capability) {
        return capability.isInstance(this);
    }

    /**
     * This node viewed as {@code capability}.
     *
     * @throws UnsupportedCapabilityException if {@link #supports(Class)} is false
     */
    default <C> C as(Class<C> capability) throws UnsupportedCapabilityException {
        if (!supports(capability)) {
            throw new UnsupportedCapabilityException(getPath(), capability);
        }
        return capability.cast(this);
    }

    @SuppressWarnings("unchecked")
    default N self() {
        return (N) this;
    }
}
