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

package dev.mars.arbor.path;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable location of a node within a filesystem: a root marker plus an ordered
 * list of components.
 *
 * <p>The root marker is whatever string the owning filesystem uses to tell its
 * hierarchies apart, e.g. {@code "/"} for a POSIX tree, {@code "C:\"} for a drive
 * or {@code "https://example.com:443"} for a URL origin. An empty component list
 * denotes the root itself. Paths are pure values; no method here touches a backend.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class NodePath implements Comparable<NodePath> {

    public static final String CURRENT = ".";
    public static final String PARENT = "..";

    private final String root;
    private final List<String> components;

    private NodePath(String root, List<String> components) {
        this.root = Objects.requireNonNull(root, "root");
        this.components = components;
    }

    public static NodePath root(String root) {
        return new NodePath(root, Collections.emptyList());
    }

    public static NodePath of(String root, String... components) {
        return of(root, List.of(components));
    }

    public static NodePath of(String root, List<String> components) {
        List<String> copy = new ArrayList<>(components.size());
        for (String component : components) {
            copy.add(validateComponent(component));
        }
        return new NodePath(root, Collections.unmodifiableList(copy));
    }

    public String getRoot() {
        return root;
    }

    public List<String> components() {
        return components;
    }

    public boolean isRoot() {
        return components.isEmpty();
    }

    public int depth() {
        return components.size();
    }

    /**
     * Last component, or the empty string for a root.
     */
    public String getName() {
        return components.isEmpty() ? "" : components.get(components.size() - 1);
    }

    /**
     * Appends exactly one plain component. Never mutates this path.
     *
     * @throws IllegalArgumentException if the component is empty, {@code .}, {@code ..}
     *                                  or contains a separator
     */
    public NodePath join(String component) {
        validateComponent(component);
        List<String> joined = new ArrayList<>(components.size() + 1);
        joined.addAll(components);
        joined.add(component);
        return new NodePath(root, Collections.unmodifiableList(joined));
    }

    public NodePath resolve(String relative) {
        return resolve(relative, '/');
    }

    /**
     * Lexically resolves a relative name against this path. Empty and {@code .}
     * segments are dropped, {@code ..} moves up one level but never above the root,
     * and a leading separator restarts from the root.
     */
    public NodePath resolve(String relative, char separator) {
        Objects.requireNonNull(relative, "relative");
        List<String> resolved = new ArrayList<>(components);
        if (!relative.isEmpty() && (relative.charAt(0) == separator || relative.charAt(0) == '/')) {
            resolved.clear();
        }
        int start = 0;
        int length = relative.length();
        for (int i = 0; i <= length; i++) {
            if (i == length || relative.charAt(i) == separator || relative.charAt(i) == '/') {
                String segment = relative.substring(start, i);
                start = i + 1;
                if (segment.isEmpty() || CURRENT.equals(segment)) {
                    continue;
                }
                if (PARENT.equals(segment)) {
                    if (!resolved.isEmpty()) {
                        resolved.remove(resolved.size() - 1);
                    }
                    continue;
                }
                resolved.add(segment);
            }
        }
        return new NodePath(root, Collections.unmodifiableList(resolved));
    }

    public Optional<NodePath> parent() {
        if (components.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new NodePath(root, components.subList(0, components.size() - 1)));
    }

    /**
     * True iff both paths share a root and this path's components are a strict
     * prefix of the other's.
     */
    public boolean isAncestorOf(NodePath other) {
        return other.components.size() > components.size() && other.startsWith(this);
    }

    /**
     * Non-strict version of {@link #isAncestorOf(NodePath)} seen from the descendant.
     */
    public boolean startsWith(NodePath prefix) {
        if (!root.equals(prefix.root) || prefix.components.size() > components.size()) {
            return false;
        }
        return components.subList(0, prefix.components.size()).equals(prefix.components);
    }

    /**
     * Components of {@code descendant} below this path.
     *
     * @throws IllegalArgumentException if {@code descendant} does not start with this path
     */
    public List<String> relativize(NodePath descendant) {
        if (!descendant.startsWith(this)) {
            throw new IllegalArgumentException(descendant + " is not below " + this);
        }
        return descendant.components.subList(components.size(), descendant.components.size());
    }

    public String format(String separator) {
        StringBuilder builder = new StringBuilder(root);
        for (int i = 0; i < components.size(); i++) {
            if (i > 0 || !root.endsWith(separator)) {
                builder.append(separator);
            }
            builder.append(components.get(i));
        }
        return builder.toString();
    }

    private static String validateComponent(String component) {
        if (component == null || component.isEmpty()) {
            throw new IllegalArgumentException("Path component must not be empty");
        }
        if (CURRENT.equals(component) || PARENT.equals(component)) {
            throw new IllegalArgumentException("Path component must not be a relative marker: " + component);
        }
        if (component.indexOf('/') >= 0) {
            throw new IllegalArgumentException("Path component must not contain a separator: " + component);
        }
        return component;
    }

    @Override
    public int compareTo(NodePath other) {
        int byRoot = root.compareTo(other.root);
        if (byRoot != 0) {
            return byRoot;
        }
        int shared = Math.min(components.size(), other.components.size());
        for (int i = 0; i < shared; i++) {
            int byComponent = components.get(i).compareTo(other.components.get(i));
            if (byComponent != 0) {
                return byComponent;
            }
        }
        return Integer.compare(components.size(), other.components.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodePath that = (NodePath) o;
        return root.equals(that.root) && components.equals(that.components);
    }

    @Override
    public int hashCode() {
        return Objects.hash(root, components);
    }

    @Override
    public String toString() {
        return format("/");
    }
}
