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

import java.util.EnumSet;
import java.util.Set;

/**
 * Options for copying nodes.
 */
public enum CopyOption {
    /** Delete an existing destination instead of failing. */
    OVERWRITE,
    /** Recreate links as links rather than copying what they point to. */
    PRESERVE_LINKS,
    /** Copy extended attributes where both sides support them. */
    COPY_XATTRS;

    public static Set<CopyOption> setOf(CopyOption... options) {
        Set<CopyOption> set = EnumSet.noneOf(CopyOption.class);
        for (CopyOption option : options) {
            set.add(option);
        }
        return set;
    }
}
