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

import dev.mars.arbor.core.Capabilities;
import dev.mars.arbor.core.MountPoint;
import dev.mars.arbor.core.Node;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.NodeNotFoundException;
import dev.mars.arbor.core.exceptions.PathTraversalException;
import dev.mars.arbor.path.NodePath;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Navigation between a node, its parent and its children.
 *
 * <p>Backends supply {@link #getParent()}, {@link #child(String)} and
 * {@link #getPathComponents()}; everything else is derived from those. Navigation
 * is pure: it never checks that the nodes it returns exist.</p>
 *
 * @param <N> the backend's node type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface Hierarchy<N extends Node<N>> extends Node<N> {

    /**
     * The parent node, empty exactly when this node is one of its filesystem's roots.
     */
    Optional<N> getParent();

    /**
     * The node reached from this one by {@code name}, which may contain several
     * components, {@code ..} segments or be absolute in the backend's syntax.
     */
    N child(String name);

    /**
     * Components below the root, outermost first. Empty for a root.
     */
    List<String> getPathComponents();

    /**
     * Ancestors from the nearest outwards, ending with the root.
     */
    default List<N> getAncestors(boolean includingSelf) {
        List<N> ancestors = new ArrayList<>();
        Optional<N> current = includingSelf ? Optional.of(self()) : getParent();
        while (current.isPresent()) {
            N node = current.get();
            ancestors.add(node);
            current = Capabilities.navigable(node).getParent();
        }
        return ancestors;
    }

    default List<N> getAncestors() {
        return getAncestors(false);
    }

    default boolean isDescendantOf(Node<?> other, boolean includingSelf) {
        for (N ancestor : getAncestors(includingSelf)) {
            if (ancestor.equals(other)) {
                return true;
            }
        }
        return false;
    }

    default boolean isAncestorOf(Hierarchy<?> other, boolean includingSelf) {
        return other.isDescendantOf(this, includingSelf);
    }

    default String getPathString() {
        return getPathString(getFileSystem().getSeparator());
    }

    default String getPathString(String separator) {
        return getPath().format(separator);
    }

    /**
     * Last path component, or the empty string for a root.
     */
    default String getName() {
        List<String> components = getPathComponents();
        return components.isEmpty() ? "" : components.get(components.size() - 1);
    }

    /**
     * @throws IllegalStateException for a root, which has no siblings
     */
    default N sibling(String name) {
        N parent = getParent().orElseThrow(() -> new IllegalStateException("A root has no siblings: " + getPath()));
        return Capabilities.navigable(parent).child(name);
    }

    /**
     * Like {@link #child(String)} for names that come from an untrusted source: the
     * result must lie strictly below this node.
     *
     * @throws PathTraversalException if {@code name} escapes this node or does not move below it
     */
    default N safeChild(String name) throws PathTraversalException {
        N candidate = child(name);
        if (!isAncestorOf(Capabilities.navigable(candidate), false)) {
            throw new PathTraversalException(getPath(), "Name escapes its parent: " + name);
        }
        return candidate;
    }

    /**
     * The mountpoint this node lives on: the one whose location is the nearest of this
     * node and its ancestors.
     */
    default MountPoint<N> getMountPoint() throws ArborException {
        Map<NodePath, MountPoint<N>> byLocation = new HashMap<>();
        for (MountPoint<N> mountPoint : getFileSystem().getMountPoints()) {
            byLocation.put(mountPoint.getLocation().getPath(), mountPoint);
        }
        for (N candidate : getAncestors(true)) {
            MountPoint<N> mountPoint = byLocation.get(candidate.getPath());
            if (mountPoint != null) {
                return mountPoint;
            }
        }
        throw new NodeNotFoundException(getPath(), "No mountpoint covers this node");
    }

    /**
     * True when {@code other} denotes the same location in the same kind of backend,
     * even if it comes from another filesystem instance.
     */
    default boolean isSameAs(Hierarchy<?> other) {
        return getClass() == other.getClass() && getPath().equals(other.getPath());
    }
}
