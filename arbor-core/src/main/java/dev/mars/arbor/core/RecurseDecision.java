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

/**
 * What a recursive walk does with one node.
 */
public enum RecurseDecision {
    INCLUDE(true, true),
    YIELD(true, false),
    DESCEND(false, true),
    SKIP(false, false);

    private final boolean yields;
    private final boolean descends;

    RecurseDecision(boolean yields, boolean descends) {
        this.yields = yields;
        this.descends = descends;
    }

    public boolean yields() {
        return yields;
    }

    public boolean descends() {
        return descends;
    }
}
