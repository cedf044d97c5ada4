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

import dev.mars.arbor.core.exceptions.ArborException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy, single-pass sequence whose elements may have to be fetched from a backend.
 *
 * @param <E> element type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface RemoteIterator<E> {

    /**
     * @throws ArborException if fetching the next element fails
     */
    boolean hasNext() throws ArborException;

    /**
     * @throws NoSuchElementException if the sequence is exhausted
     * @throws ArborException         if fetching the element fails
     */
    E next() throws ArborException;

    /**
     * Drains the remaining elements into a list.
     */
    default List<E> toList() throws ArborException {
        List<E> result = new ArrayList<>();
        while (hasNext()) {
            result.add(next());
        }
        return result;
    }

    static <E> RemoteIterator<E> empty() {
        return of(Collections.emptyIterator());
    }

    static <E> RemoteIterator<E> of(Iterator<E> iterator) {
        return new RemoteIterator<E>() {
            @Override
            public boolean hasNext() {
                return iterator.hasNext();
            }

            @Override
            public E next() {
                return iterator.next();
            }
        };
    }
}
