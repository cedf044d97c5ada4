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
import dev.mars.arbor.core.exceptions.ArborExceptions;
import dev.mars.arbor.path.NodePath;

import java.io.IOException;

/**
 * Classifies a failure raised by a backend's data stream.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
@FunctionalInterface
public interface StreamFailures {

    ArborException translate(IOException failure);

    /**
     * The generic mapping of {@link ArborExceptions#translate(IOException, NodePath)}.
     */
    static StreamFailures forPath(NodePath path) {
        return failure -> ArborExceptions.translate(failure, path);
    }
}
