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
package dev.mars.arbor.local;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Mount Table Tests")
class MountTableTest {

    @Test
    @DisplayName("Should read device, location and type from each line")
    void testParse() {
        List<MountTable.Entry> entries = MountTable.parse(List.of(
                "/dev/sda1 / ext4 rw,relatime 0 0",
                "proc /proc proc rw,nosuid 0 0",
                "",
                "# comment line",
                "tmpfs /run/user/1000 tmpfs rw 0 0"));

        assertThat(entries).containsExactly(
                new MountTable.Entry("/dev/sda1", "/", "ext4"),
                new MountTable.Entry("proc", "/proc", "proc"),
                new MountTable.Entry("tmpfs", "/run/user/1000", "tmpfs"));
    }

    @Test
    @DisplayName("Should skip lines with too few fields")
    void testShortLines() {
        assertThat(MountTable.parse(List.of("garbage", "/dev/sdb1 /mnt"))).isEmpty();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "/media/My\\040Disk  | /media/My Disk",
            "tab\\011here       | tab\there",
            "no\\escape         | no\\escape",
            "short\\04          | short\\04",
            "plain               | plain"
    })
    @DisplayName("Should decode three-digit octal escapes only")
    void testUnescape(String raw, String expected) {
        assertThat(MountTable.unescape(raw)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Escaped spaces keep a location in one field")
    void testEscapedLocation() {
        List<MountTable.Entry> entries = MountTable.parse(List.of("//server/share /mnt/team\\040files cifs rw 0 0"));

        assertThat(entries).singleElement()
                .extracting(MountTable.Entry::location)
                .isEqualTo("/mnt/team files");
    }
}
