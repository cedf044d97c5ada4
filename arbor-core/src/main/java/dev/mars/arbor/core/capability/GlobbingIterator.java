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
import dev.mars.arbor.core.GlobPattern;
import dev.mars.arbor.core.Node;
import dev.mars.arbor.core.RemoteIterator;
import dev.mars.arbor.core.exceptions.ArborException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Matches a pattern one component per level. Literal components are looked up
 * directly; wildcard components filter the listing.
 */
final class GlobbingIterator<N extends Node<N>> implements RemoteIterator<N> {

    private final List<GlobPattern> segments = new ArrayList<>();
    private final List<String> literals = new ArrayList<>();
    private final Deque<Level<N>> levels = new ArrayDeque<>();
    private N pending;

    GlobbingIterator(N start, String pattern) throws ArborException {
        for (String segment : pattern.split("/")) {
            if (!segment.isEmpty()) {
                GlobPattern glob = new GlobPattern(segment);
                segments.add(glob);
                literals.add(glob.hasWildcard() ? null : unescape(segment));
            }
        }
        if (!segments.isEmpty()) {
            levels.push(new Level<>(matches(start, 0), 0));
        }
    }

    @Override
    public boolean hasNext() throws ArborException {
        while (pending == null && !levels.isEmpty()) {
            Level<N> level = levels.peek();
            if (!level.candidates.hasNext()) {
                levels.pop();
                continue;
            }
            N node = level.candidates.next();
            if (level.depth == segments.size() - 1) {
                pending = node;
            } else if (Capabilities.readable(node).isFolder()) {
                levels.push(new Level<>(matches(node, level.depth + 1), level.depth + 1));
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

    private RemoteIterator<N> matches(N folder, int depth) throws ArborException {
        Listable<N> listable = Capabilities.listable(folder);
        String literal = literals.get(depth);
        if (literal != null) {
            N child = listable.child(literal);
            boolean found = listable.isFolder() && Capabilities.readable(child).exists();
            return RemoteIterator.of(found ? List.of(child).iterator() : Collections.<N>emptyIterator());
        }
        if (!listable.isFolder()) {
            return RemoteIterator.empty();
        }
        GlobPattern glob = segments.get(depth);
        List<N> matched = new ArrayList<>();
        for (String name : listable.getChildNames()) {
            if (glob.matches(name)) {
                matched.add(listable.child(name));
            }
        }
        return RemoteIterator.of(matched.iterator());
    }

    private static String unescape(String segment) {
        StringBuilder plain = new StringBuilder(segment.length());
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c == '\\' && i + 1 < segment.length()) {
                c = segment.charAt(++i);
            }
            plain.append(c);
        }
        return plain.toString();
    }

    private static final class Level<N> {
        final RemoteIterator<N> candidates;
        final int depth;

        Level(RemoteIterator<N> candidates, int depth) {
            this.candidates = candidates;
            this.depth = depth;
        }
    }
}
