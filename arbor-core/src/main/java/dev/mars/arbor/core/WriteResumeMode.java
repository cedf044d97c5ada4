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
 * Backend-declared guarantee about bytes in flight when a write stream loses its
 * connection. Decides how a reconnecting write stream resumes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public enum WriteResumeMode {

    /**
     * The backend reports a file's size truthfully after a reconnect. The part of the
     * interrupted chunk that already landed is skipped, so every byte is written
     * exactly once.
     */
    RECONCILE_BY_SIZE,

    /**
     * The backend cannot say how much of the interrupted chunk landed. The whole chunk
     * is written again after reconnecting, so its bytes may be duplicated.
     */
    RESEND
}
