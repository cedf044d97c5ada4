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

/**
 * Failure kinds a caller needs to tell apart, because each one calls for a
 * different remedy.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public enum ErrorKind {
    NOT_FOUND,
    ALREADY_EXISTS,
    UNSUPPORTED_OPERATION,
    PERMISSION_DENIED,
    BROKEN_LINK,
    /** Connectivity to the backend was lost. The only kind a reconnecting proxy recovers from. */
    DISCONNECTED,
    IO_FAILURE,
    INVALID_PATH
}
