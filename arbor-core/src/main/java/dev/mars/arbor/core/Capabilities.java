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

import dev.mars.arbor.core.capability.ExtendedAttributes;
import dev.mars.arbor.core.capability.Hierarchy;
import dev.mars.arbor.core.capability.Listable;
import dev.mars.arbor.core.capability.Readable;
import dev.mars.arbor.core.capability.Sizable;
import dev.mars.arbor.core.capability.WorkingDirectory;
import dev.mars.arbor.core.capability.Writable;
import dev.mars.arbor.core.exceptions.UnsupportedCapabilityException;

/**
 * Typed capability lookups. Each one fails with
 * {@link UnsupportedCapabilityException} when the node's backend lacks the capability.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
@SuppressWarnings("unchecked")
public final class Capabilities {

    private Capabilities() {
    }

    public static <N extends Node<N>> Hierarchy<N> hierarchy(N node) throws UnsupportedCapabilityException {
        return node.as(Hierarchy.class);
    }

    public static <N extends Node<N>> Readable<N> readable(N node) throws UnsupportedCapabilityException {
        return node.as(Readable.class);
    }

    public static <N extends Node<N>> Listable<N> listable(N node) throws UnsupportedCapabilityException {
        return node.as(Listable.class);
    }

    public static <N extends Node<N>> Writable<N> writable(N node) throws UnsupportedCapabilityException {
        return node.as(Writable.class);
    }

    public static <N extends Node<N>> Sizable<N> sizable(N node) throws UnsupportedCapabilityException {
        return node.as(Sizable.class);
    }

    public static <N extends Node<N>> WorkingDirectory<N> workingDirectory(N node) throws UnsupportedCapabilityException {
        return node.as(WorkingDirectory.class);
    }

    public static <N extends Node<N>> ExtendedAttributes<N> extendedAttributes(N node)
            throws UnsupportedCapabilityException {
        return node.as(ExtendedAttributes.class);
    }

    /**
     * Navigation from a hierarchy node always lands on nodes of the same backend, so
     * a parent or child of a {@code Hierarchy} is a {@code Hierarchy} as well.
     */
    public static <N extends Node<N>> Hierarchy<N> navigable(N node) {
        if (!(node instanceof Hierarchy)) {
            throw new IllegalStateException(node.getClass().getName() + " is not navigable");
        }
        return (Hierarchy<N>) node;
    }
}
