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

import dev.mars.arbor.core.GlobPattern;
import dev.mars.arbor.core.Node;
import dev.mars.arbor.core.RecurseFilter;
import dev.mars.arbor.core.RemoteIterator;
import dev.mars.arbor.core.exceptions.ArborException;

import java.util.List;

/**
 * Enumeration of a folder's children.
 *
 * <p>The only new primitive is {@link #getChildNames()}; children, globbing and
 * recursive walks are lazy sequences built on it and on {@link #child(String)}.</p>
 *
 * @param <N> the backend's node type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface Listable<N extends Node<N>> extends Readable<N>, Hierarchy<N> {

    /**
     * Names of this folder's children, sorted.
     */
    List<String> getChildNames() throws ArborException;

    /**
     * Children in name order; empty for anything that is not a folder.
     */
    default RemoteIterator<N> children() throws ArborException {
        if (!isFolder()) {
            return RemoteIterator.empty();
        }
        List<String> names = getChildNames();
        return RemoteIterator.of(names.stream().map(this::child).iterator());
    }

    /**
     * Descendants matching a slash-separated pattern, one component at a time.
     *
     * @see GlobPattern
     */
    default RemoteIterator<N> glob(String pattern) throws ArborException {
        return new GlobbingIterator<>(self(), pattern);
    }

    /**
     * This node and every descendant, depth first, parents before their children.
     */
    default RemoteIterator<N> recurse() throws ArborException {
        return recurse(RecurseFilter.ALL, true);
    }

    default RemoteIterator<N> recurse(RecurseFilter filter, boolean includeSelf) throws ArborException {
        return new RecursingIterator<>(self(), filter, includeSelf);
    }
}
