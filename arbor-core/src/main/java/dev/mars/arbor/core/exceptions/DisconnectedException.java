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

/**
 * Thrown when connectivity to a backend is lost.
 *
 * <p>A backend raises this for anything it classifies as a severed session, so a
 * reconnecting proxy can rebuild the connection and retry once. Seeing it outside
 * a proxy, or after the proxy's single retry, means the backend is unreachable.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class DisconnectedException extends ArborException {

    public DisconnectedException(String message) {
        super(ErrorKind.DISCONNECTED, message);
    }

    public DisconnectedException(String message, Throwable cause) {
        super(ErrorKind.DISCONNECTED, message, cause);
    }

    public DisconnectedException(NodePath path, String message, Throwable cause) {
        super(ErrorKind.DISCONNECTED, path, message, cause);
    }
}
