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

package dev.mars.arbor.core.exceptions;

import dev.mars.arbor.path.NodePath;

import java.io.IOException;

/**
 * Base exception for every failure raised by nodes, filesystems and their streams.
 *
 * <p>Extends {@link IOException} so that failures raised inside {@code InputStream}
 * and {@code OutputStream} implementations keep their kind.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ArborException extends IOException {

    private final ErrorKind kind;
    private final NodePath path;

    public ArborException(ErrorKind kind, String message) {
        this(kind, null, message, null);
    }

    public ArborException(ErrorKind kind, String message, Throwable cause) {
        this(kind, null, message, cause);
    }

    public ArborException(ErrorKind kind, NodePath path, String message) {
        this(kind, path, message, null);
    }

    public ArborException(ErrorKind kind, NodePath path, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.path = path;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * The path the failure relates to, or {@code null} when it is not tied to one node.
     */
    public NodePath getPath() {
        return path;
    }

    @Override
    public String getMessage() {
        if (path == null) {
            return String.format("[%s] %s", kind, super.getMessage());
        }
        return String.format("[%s] %s: %s", kind, path, super.getMessage());
    }
}
