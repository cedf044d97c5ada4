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
package dev.mars.arbor.reconnect;

/**
 * Lifecycle of the backend connection held by a {@link ReconnectingFileSystem}.
 * <p>
 * <pre>
 *   CONNECTED → RECONNECTING → CONNECTED     (rebuilt after a disconnection)
 *   RECONNECTING → DISCONNECTED              (the factory failed)
 *   DISCONNECTED → RECONNECTING              (next call tries again)
 *   CONNECTED, DISCONNECTED → CLOSED
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public enum ConnectionState {

    /**
     * A live backend instance is held; calls are delegated to it directly.
     */
    CONNECTED,

    /**
     * The factory is building a replacement backend. Other callers wait for the outcome.
     */
    RECONNECTING,

    /**
     * The last rebuild failed. The next call makes a fresh attempt.
     */
    DISCONNECTED,

    /**
     * Closed by its owner. Terminal state.
     */
    CLOSED;

    public boolean isTerminal() {
        return this == CLOSED;
    }

    /**
     * Checks whether a transition from this state to the given target state is valid.
     *
     * <p><strong>Valid transitions:</strong></p>
     * <pre>
     *   CONNECTED    → RECONNECTING, CLOSED
     *   RECONNECTING → CONNECTED, DISCONNECTED
     *   DISCONNECTED → RECONNECTING, CLOSED
     *   CLOSED       → (terminal, no transitions)
     * </pre>
     *
     * @param target the target state
     * @return {@code true} if the transition is valid
     */
    public boolean canTransitionTo(ConnectionState target) {
        return switch (this) {
            case CONNECTED -> target == RECONNECTING || target == CLOSED;
            case RECONNECTING -> target == CONNECTED || target == DISCONNECTED;
            case DISCONNECTED -> target == RECONNECTING || target == CLOSED;
            case CLOSED -> false;
        };
    }

    /**
     * @return valid target states (empty for the terminal state)
     */
    public ConnectionState[] getValidTransitions() {
        return switch (this) {
            case CONNECTED -> new ConnectionState[]{RECONNECTING, CLOSED};
            case RECONNECTING -> new ConnectionState[]{CONNECTED, DISCONNECTED};
            case DISCONNECTED -> new ConnectionState[]{RECONNECTING, CLOSED};
            case CLOSED -> new ConnectionState[0];
        };
    }
}
