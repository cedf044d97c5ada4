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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.regex.PatternSyntaxException;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GlobPattern Tests")
class GlobPatternTest {

    @ParameterizedTest(name = "{0} vs {1} -> {2}")
    @CsvSource({
            "*.txt,     notes.txt,  true",
            "*.txt,     notes.txt~, false",
            "data?.csv, data1.csv,  true",
            "data?.csv, data10.csv, false",
            "[abc]*,    beta,       true",
            "[abc]*,    delta,      false",
            "[!abc]*,   delta,      true",
            "[a-c]x,    bx,         true",
            "'{foo,bar}.log', bar.log, true",
            "'{foo,bar}.log', baz.log, false",
            "a.b,       a.b,        true",
            "a.b,       axb,        false",
            "a+b(c),    a+b(c),     true"
    })
    @DisplayName("Should match shell-style patterns")
    void testMatches(String pattern, String name, boolean expected) {
        assertThat(new GlobPattern(pattern).matches(name)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Escaped wildcard matches only itself")
    void testEscape() {
        GlobPattern star = new GlobPattern("\\*");
        assertThat(star.matches("*")).isTrue();
        assertThat(star.matches("x")).isFalse();
        assertThat(star.hasWildcard()).isFalse();
    }

    @Test
    @DisplayName("Literal patterns report no wildcard")
    void testHasWildcard() {
        assertThat(new GlobPattern("readme.md").hasWildcard()).isFalse();
        assertThat(new GlobPattern("*.md").hasWildcard()).isTrue();
        assertThat(new GlobPattern("{a,b}").hasWildcard()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"[abc", "{a,b", "trailing\\", "[a[b]]"})
    @DisplayName("Should reject malformed patterns")
    void testMalformed(String pattern) {
        assertThatThrownBy(() -> new GlobPattern(pattern))
                .isInstanceOf(PatternSyntaxException.class);
    }
}
