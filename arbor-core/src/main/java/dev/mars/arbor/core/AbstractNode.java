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

import dev.mars.arbor.path.NodePath;

import java.util.Objects;

/**
 * Path-based identity shared by every node implementation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public abstract class AbstractNode<N extends Node<N>> implements Node<N> {

    protected final NodePath path;

    protected AbstractNode(NodePath path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    @Override
    public NodePath getPath() {
        return path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node)) return false;
        Node<?> that = (Node<?>) o;
        return getFileSystem() == that.getFileSystem() && path.equals(that.getPath());
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(getFileSystem()), path);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + path.format(getFileSystem().getSeparator()) + "}";
    }
}
