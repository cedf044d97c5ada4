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
import dev.mars.arbor.core.RecurseDecision;
import dev.mars.arbor.core.RecurseFilter;
import dev.mars.arbor.core.RemoteIterator;
import dev.mars.arbor.core.exceptions.ArborException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.NoSuchElementException;

/**
 * Pre-order walk that keeps one open child sequence per level.
 */
final class RecursingIterator<N extends Node<N>> implements RemoteIterator<N> {

    private final RecurseFilter filter;
    private final Deque<RemoteIterator<N>> levels = new ArrayDeque<>();
    private N pending;

    RecursingIterator(N start, RecurseFilter filter, boolean includeSelf) throws ArborException {
        this.filter = filter;
        RecurseDecision decision = filter.decide(start);
        if (decision.descends()) {
            levels.push(Capabilities.listable(start).children());
        }
        if (includeSelf && decision.yields()) {
            pending = start;
        }
    }

    @Override
    public boolean hasNext() throws ArborException {
        while (pending == null && !levels.isEmpty()) {
            RemoteIterator<N> level = levels.peek();
            if (!level.hasNext()) {
                levels.pop();
                continue;
            }
            N node = level.next();
            RecurseDecision decision = filter.decide(node);
            if (decision.descends() && node.supports(Listable.class)) {
                levels.push(Capabilities.listable(node).children());
            }
            if (decision.yields()) {
                pending = node;
            }
        }
        return pending != null;
    }

    @Override
    public N next() throws ArborException {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        N node = pending;
        pending = null;
        return node;
    }
}
