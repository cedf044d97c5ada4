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
package dev.mars.arbor.core.capability;

import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.ErrorKind;
import dev.mars.arbor.core.exceptions.NodeAlreadyExistsException;
import dev.mars.arbor.core.exceptions.NodeNotFoundException;
import dev.mars.arbor.core.exceptions.NodePermissionException;
import dev.mars.arbor.memory.MemoryFileSystem;
import dev.mars.arbor.memory.MemoryNode;
import dev.mars.arbor.memory.MemoryStore;
import dev.mars.arbor.memory.MemoryStore.FailureMode;
import dev.mars.arbor.path.NodePath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Writable Tests")
class WritableTest {

    private MemoryStore store;
    private MemoryFileSystem fs;

    @BeforeEach
    void setUp() {
        store = new MemoryStore();
        store.createFile(NodePath.of("/", "project", "a.txt"), "alpha".getBytes(StandardCharsets.UTF_8));
        store.createFile(NodePath.of("/", "project", "sub", "b.txt"), "beta".getBytes(StandardCharsets.UTF_8));
        store.createFile(NodePath.of("/", "keep", "target.txt"), "kept".getBytes(StandardCharsets.UTF_8));
        store.createLink(NodePath.of("/", "project", "shortcut"), "/keep");
        fs = store.connect();
    }

    @Nested
    @DisplayName("Writing Content")
    class WriteTests {

        @Test
        @DisplayName("write replaces, append extends")
        void testWriteAndAppend() throws ArborException {
            MemoryNode notes = fs.resolve("/project/notes.txt");

            notes.write("one");
            notes.append(" two".getBytes(StandardCharsets.UTF_8));
            assertThat(new String(notes.read(), StandardCharsets.UTF_8)).isEqualTo("one two");

            notes.write("three");
            assertThat(new String(notes.read(), StandardCharsets.UTF_8)).isEqualTo("three");
        }

        @Test
        @DisplayName("Content is visible once the stream is closed")
        void testStreamWrite() throws ArborException, IOException {
            MemoryNode out = fs.resolve("/project/stream.bin");
            try (OutputStream stream = out.openForWriting()) {
                stream.write(new byte[]{1, 2});
                stream.write(3);
            }

            assertThat(out.read()).containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("Writing needs an existing parent")
        void testMissingParent() {
            assertThatThrownBy(() -> fs.resolve("/nowhere/file.txt").write("x"))
                    .isInstanceOf(NodeNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Folders")
    class FolderTests {

        @Test
        @DisplayName("mkdir fails on an existing folder, mkdirs does not")
        void testMkdir() throws ArborException {
            assertThatThrownBy(() -> fs.resolve("/project/sub").mkdir())
                    .isInstanceOf(NodeAlreadyExistsException.class);

            fs.resolve("/project/sub").mkdirs();
            fs.resolve("/project/x/y/z").mkdirs();

            assertThat(fs.resolve("/project/x/y/z").isFolder()).isTrue();
        }

        @Test
        @DisplayName("mkdir without recursion needs the parent")
        void testMkdirMissingParent() {
            assertThatThrownBy(() -> fs.resolve("/project/p/q").mkdir())
                    .isInstanceOf(NodeNotFoundException.class);
        }

        @Test
        @DisplayName("Temporary folders get fresh names under the parent")
        void testTemporaryFolder() throws ArborException {
            MemoryNode first = fs.resolve("/project").createTemporaryFolder("job-");
            MemoryNode second = fs.resolve("/project").createTemporaryFolder("job-");

            assertThat(first).isNotEqualTo(second);
            assertThat(first.getName()).startsWith("job-");
            assertThat(first.getParent()).contains(fs.resolve("/project"));
            assertThat(first.isFolder()).isTrue();
        }
    }

    @Nested
    @DisplayName("Deleting")
    class DeleteTests {

        @Test
        @DisplayName("Recursive delete removes everything below and the folder itself")
        void testRecursiveDelete() throws ArborException {
            fs.resolve("/project").delete();

            assertThat(fs.resolve("/project").exists()).isFalse();
            assertThat(fs.resolve("/keep/target.txt").exists()).isTrue();
        }

        @Test
        @DisplayName("Deleting a link leaves its target alone")
        void testDeleteLink() throws ArborException {
            fs.resolve("/project/shortcut").delete();

            assertThat(fs.resolve("/project/shortcut").exists()).isFalse();
            assertThat(fs.resolve("/keep/target.txt").read()).isEqualTo("kept".getBytes(StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("The first failure stops the delete and nothing is rolled back")
        void testFailFast() throws ArborException {
            store.setPathFailure(NodePath.of("/", "project", "sub", "b.txt"), FailureMode.PERMISSION_DENIED);

            assertThatThrownBy(() -> fs.resolve("/project").delete())
                    .isInstanceOf(NodePermissionException.class);

            store.clearPathFailure(NodePath.of("/", "project", "sub", "b.txt"));
            assertThat(fs.resolve("/project/a.txt").exists()).isFalse();
            assertThat(fs.resolve("/project/sub").isFolder()).isTrue();
            assertThat(fs.resolve("/project/sub/b.txt").exists()).isTrue();
            assertThat(fs.resolve("/project").isFolder()).isTrue();
        }

        @Test
        @DisplayName("A missing node is an error unless ignored")
        void testDeleteMissing() throws ArborException {
            assertThatThrownBy(() -> fs.resolve("/project/ghost").delete())
                    .isInstanceOf(NodeNotFoundException.class);

            fs.resolve("/project/ghost").delete(true);
        }

        @Test
        @DisplayName("A non-empty folder cannot be deleted on its own")
        void testDeleteJustThisThing() {
            assertThatThrownBy(() -> fs.resolve("/project/sub").deleteJustThisThing())
                    .isInstanceOfSatisfying(ArborException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.IO_FAILURE));
        }
    }

    @Nested
    @DisplayName("Links and Moves")
    class LinkAndMoveTests {

        @Test
        @DisplayName("Linking to a node stores its absolute path")
        void testLinkToNode() throws ArborException {
            MemoryNode link = fs.resolve("/project/to-b");
            link.linkTo(fs.resolve("/project/sub/b.txt"));

            assertThat(link.getLinkTarget()).contains("/project/sub/b.txt");
            assertThat(link.read()).isEqualTo("beta".getBytes(StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("Links cannot cross filesystems")
        void testLinkAcrossFileSystems() {
            MemoryFileSystem elsewhere = new MemoryStore().connect();

            assertThatThrownBy(() -> fs.resolve("/project/bad").linkTo(elsewhere.resolve("/")))
                    .isInstanceOfSatisfying(ArborException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_PATH));
        }

        @Test
        @DisplayName("Linking over an existing node fails")
        void testLinkOverExisting() {
            assertThatThrownBy(() -> fs.resolve("/project/a.txt").linkTo("sub/b.txt"))
                    .isInstanceOf(NodeAlreadyExistsException.class);
        }

        @Test
        @DisplayName("renameTo moves a tree and keeps links as links")
        void testRename() throws ArborException {
            fs.resolve("/project").renameTo(fs.resolve("/moved"));

            assertThat(fs.resolve("/project").exists()).isFalse();
            assertThat(fs.resolve("/moved/sub/b.txt").read()).isEqualTo("beta".getBytes(StandardCharsets.UTF_8));
            assertThat(fs.resolve("/moved/shortcut").getLinkTarget()).contains("/keep");
        }
    }
}
