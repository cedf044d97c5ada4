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
import dev.mars.arbor.core.Node;
import dev.mars.arbor.core.RemoteIterator;
import dev.mars.arbor.core.exceptions.ArborException;

/**
 * Content size in bytes.
 *
 * @param <N> the backend's node type
 */
public interface Sizable<N extends Node<N>> extends Node<N> {

    /**
     * Size of a file's content. Backends that can list report the recursive total of
     * a folder's files.
     */
    long getSize() throws ArborException;

    /**
     * Sum of the sizes of every file below {@code folder}. Links are not followed.
     */
    static <N extends Node<N>> long totalSize(Listable<N> folder) throws ArborException {
        long total = 0;
        RemoteIterator<N> children = folder.children();
        while (children.hasNext()) {
            N child = children.next();
            Readable<N> readable = Capabilities.readable(child);
            if (readable.isLink()) {
                continue;
            }
            total += Capabilities.sizable(child).getSize();
        }
        return total;
    }
}
