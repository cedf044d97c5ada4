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

import java.util.function.Predicate;

/**
 * Decides, node by node, what a recursive walk yields and where it descends.
 */
@FunctionalInterface
public interface RecurseFilter {

    RecurseFilter ALL = node -> RecurseDecision.INCLUDE;

    RecurseDecision decide(Node<?> node) throws ArborException;

    /**
     * Yields the nodes matching {@code predicate} and descends into every folder,
     * matching or not.
     */
    static RecurseFilter matching(Predicate<Node<?>> predicate) {
        return node -> predicate.test(node) ? RecurseDecision.INCLUDE : RecurseDecision.DESCEND;
    }
}
