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
 * Thrown when a node does not offer a capability, or its backend cannot perform
 * one operation of a capability it otherwise offers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class UnsupportedCapabilityException extends ArborException {

    private final Class<?> capability;

    public UnsupportedCapabilityException(NodePath path, Class<?> capability) {
        super(ErrorKind.UNSUPPORTED_OPERATION, path, capability.getSimpleName() + " is not supported by this node");
        this.capability = capability;
    }

    public UnsupportedCapabilityException(NodePath path, Class<?> capability, String message) {
        super(ErrorKind.UNSUPPORTED_OPERATION, path, message);
        this.capability = capability;
    }

    public UnsupportedCapabilityException(NodePath path, Class<?> capability, String message, Throwable cause) {
        super(ErrorKind.UNSUPPORTED_OPERATION, path, message, cause);
        this.capability = capability;
    }

    public Class<?> getCapability() {
        return capability;
    }
}
