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
package dev.mars.arbor.protocol;

import dev.mars.arbor.config.ArborConfiguration;
import dev.mars.arbor.core.FileSystemFactory;
import dev.mars.arbor.core.exceptions.ArborException;

import java.net.URI;

/**
 * Knows how to reach one kind of backend from a URI.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface FileSystemProvider {

    String getScheme();

    /**
     * Whether the backend holds a session that can drop. Sessions opened through
     * {@link ProtocolFactory} for such backends are wrapped in a reconnecting proxy
     * when reconnection is enabled.
     */
    boolean isSessionBased();

    /**
     * A factory that connects a fresh backend for {@code uri} each time it is called.
     *
     * @throws ArborException if the URI does not describe a usable endpoint
     */
    FileSystemFactory<?> factory(URI uri, ArborConfiguration configuration) throws ArborException;
}
