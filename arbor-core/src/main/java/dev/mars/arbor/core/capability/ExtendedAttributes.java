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
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.NodeNotFoundException;

import java.util.Set;

/**
 * Named binary attributes attached to a node.
 *
 * @param <N> the backend's node type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface ExtendedAttributes<N extends Node<N>> extends Node<N> {

    /**
     * @throws NodeNotFoundException if the attribute is not set
     */
    byte[] getXattr(String name) throws ArborException;

    void setXattr(String name, byte[] value) throws ArborException;

    /**
     * @throws NodeNotFoundException if the attribute is not set
     */
    void deleteXattr(String name) throws ArborException;

    /**
     * Names of the attributes currently set, sorted.
     */
    Set<String> listXattrs() throws ArborException;

    default boolean hasXattr(String name) throws ArborException {
        return listXattrs().contains(name);
    }

    default void checkXattr(String name) throws ArborException {
        if (!hasXattr(name)) {
            throw new NodeNotFoundException(getPath(), "No such extended attribute: " + name);
        }
    }

    /**
     * Makes the target's attributes an exact copy of this node's.
     */
    default void copyXattrsTo(ExtendedAttributes<?> target) throws ArborException {
        Set<String> names = listXattrs();
        for (String stale : target.listXattrs()) {
            if (!names.contains(stale)) {
                target.deleteXattr(stale);
            }
        }
        for (String name : names) {
            target.setXattr(name, getXattr(name));
        }
    }
}
