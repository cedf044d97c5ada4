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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Covers every (source, target) pair of the connection lifecycle.
 */
class ConnectionStateTransitionTest {

    private static EnumSet<ConnectionState> validTargets(ConnectionState from) {
        return switch (from) {
            case CONNECTED -> EnumSet.of(ConnectionState.RECONNECTING, ConnectionState.CLOSED);
            case RECONNECTING -> EnumSet.of(ConnectionState.CONNECTED, ConnectionState.DISCONNECTED);
            case DISCONNECTED -> EnumSet.of(ConnectionState.RECONNECTING, ConnectionState.CLOSED);
            case CLOSED -> EnumSet.noneOf(ConnectionState.class);
        };
    }

    static Stream<Arguments> allStatePairs() {
        List<Arguments> pairs = new ArrayList<>();
        for (ConnectionState from : ConnectionState.values()) {
            Set<ConnectionState> valid = validTargets(from);
            for (ConnectionState to : ConnectionState.values()) {
                pairs.add(Arguments.of(from, to, valid.contains(to)));
            }
        }
        return pairs.stream();
    }

    @ParameterizedTest(name = "{0} → {1} should be {2}")
    @MethodSource("allStatePairs")
    void canTransitionTo_coversAllPairs(ConnectionState from, ConnectionState to, boolean expected) {
        assertEquals(expected, from.canTransitionTo(to),
                () -> String.format("%s → %s should be %s", from, to, expected ? "valid" : "invalid"));
    }

    @ParameterizedTest(name = "getValidTransitions consistent for {0}")
    @EnumSource(ConnectionState.class)
    void getValidTransitions_matchesCanTransitionTo(ConnectionState from) {
        Set<ConnectionState> fromMethod = EnumSet.noneOf(ConnectionState.class);
        fromMethod.addAll(Arrays.asList(from.getValidTransitions()));

        Set<ConnectionState> fromCanTransition = EnumSet.noneOf(ConnectionState.class);
        for (ConnectionState to : ConnectionState.values()) {
            if (from.canTransitionTo(to)) {
                fromCanTransition.add(to);
            }
        }

        assertEquals(fromCanTransition, fromMethod);
    }

    @ParameterizedTest(name = "{0} → {0} self-transition should be invalid")
    @EnumSource(ConnectionState.class)
    void selfTransition_isNeverValid(ConnectionState state) {
        assertFalse(state.canTransitionTo(state));
    }

    // --- CLOSED is terminal ---

    @Test
    void closed_hasNoTransitions() {
        assertTrue(ConnectionState.CLOSED.isTerminal());
        assertEquals(0, ConnectionState.CLOSED.getValidTransitions().length);
    }

    @Test
    void reconnecting_cannotBeClosedMidway() {
        assertFalse(ConnectionState.RECONNECTING.canTransitionTo(ConnectionState.CLOSED));
        assertFalse(ConnectionState.RECONNECTING.isTerminal());
    }
}
