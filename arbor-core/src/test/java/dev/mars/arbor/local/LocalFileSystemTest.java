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

import dev.mars.arbor.config.ArborConfiguration;
import dev.mars.arbor.core.MountPoint;
import dev.mars.arbor.core.WorkingDirectoryScope;
import dev.mars.arbor.core.WriteResumeMode;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.ErrorKind;
import dev.mars.arbor.core.exceptions.NodeAlreadyExistsException;
import dev.mars.arbor.core.exceptions.NodeNotFoundException;
import dev.mars.arbor.core.exceptions.UnsupportedCapabilityException;
import dev.mars.arbor.path.NodePath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.UserDefinedFileAttributeView;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@DisplayName("Local FileSystem Tests")
class LocalFileSystemTest {

    @TempDir
    Path tempDir;

    private LocalFileSystem fs;
    private LocalNode base;

    @BeforeEach
    void setUp() throws IOException {
        fs = new LocalFileSystem();
        Files.createDirectories(tempDir.resolve("docs/drafts"));
        Files.writeString(tempDir.resolve("docs/readme.md"), "# Readme");
        Files.writeString(tempDir.resolve("docs/drafts/plan.txt"), "plan");
        base = fs.resolve(tempDir);
    }

    @Nested
    @DisplayName("Paths")
    class PathTests {

        @Test
        @DisplayName("Platform and node paths map onto each other")
        void testPathMapping() {
            LocalNode readme = base.child("docs").child("readme.md");

            assertThat(readme.toPlatformPath()).isEqualTo(tempDir.resolve("docs/readme.md"));
            assertThat(fs.resolve(tempDir.resolve("docs/../docs/readme.md"))).isEqualTo(readme);
        }

        @Test
        @DisplayName("Roots have no parent and are the filesystem's roots")
        void testRoots() {
            LocalNode top = base;
            while (top.getParent().isPresent()) {
                top = top.getParent().get();
            }
            assertThat(fs.getRoots()).contains(top);
        }

        @Test
        @DisplayName("Unknown roots are rejected")
        void testUnknownRoot() {
            assertThatThrownBy(() -> fs.resolve(NodePath.of("no-such-root:", "x")))
                    .isInstanceOf(NodeNotFoundException.class);
        }

        @Test
        @DisplayName("Separator, temporary directory and resume mode come from the platform")
        void testPlatformFacts() {
            assertThat(fs.getSeparator()).isEqualTo(tempDir.getFileSystem().getSeparator());
            assertThat(fs.getTemporaryDirectory()).isPresent();
            assertThat(fs.getWriteResumeMode()).isEqualTo(WriteResumeMode.RECONCILE_BY_SIZE);
            assertThat(LocalFileSystem.getInstance()).isSameAs(LocalFileSystem.getInstance());
        }
    }

    @Nested
    @DisplayName("Reading and Writing")
    class ReadWriteTests {

        @Test
        @DisplayName("Kinds, content and listing")
        void testReadAndList() throws ArborException {
            LocalNode docs = base.child("docs");

            assertThat(docs.isFolder()).isTrue();
            assertThat(docs.getChildNames()).containsExactly("drafts", "readme.md");
            assertThat(new String(docs.child("readme.md").read(), StandardCharsets.UTF_8)).isEqualTo("# Readme");
            assertThat(docs.getSize()).isEqualTo(12);
            assertThat(docs.child("missing").exists()).isFalse();
        }

        @Test
        @DisplayName("Write, append and delete a tree")
        void testWriteAndDelete() throws ArborException {
            LocalNode out = base.child("out");
            out.mkdirs();
            out.child("log.txt").write("a");
            out.child("log.txt").append("b".getBytes(StandardCharsets.UTF_8));

            assertThat(Files.exists(tempDir.resolve("out/log.txt"))).isTrue();
            assertThat(out.child("log.txt").read()).isEqualTo("ab".getBytes(StandardCharsets.UTF_8));

            out.delete();
            assertThat(Files.exists(tempDir.resolve("out"))).isFalse();
        }

        @Test
        @DisplayName("Platform failures become arbor errors")
        void testErrorTranslation() {
            assertThatThrownBy(() -> base.child("docs").mkdir())
                    .isInstanceOf(NodeAlreadyExistsException.class);
            assertThatThrownBy(() -> base.child("nope").read())
                    .isInstanceOf(NodeNotFoundException.class);
            assertThatThrownBy(() -> base.child("docs").deleteJustThisThing())
                    .isInstanceOfSatisfying(ArborException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.IO_FAILURE));
        }

        @Test
        @DisplayName("Globbing matches on the real tree")
        void testGlob() throws ArborException {
            assertThat(base.glob("docs/*/*.txt").toList())
                    .containsExactly(base.child("docs").child("drafts").child("plan.txt"));
        }
    }

    @Nested
    @DisplayName("Links")
    @DisabledOnOs(OS.WINDOWS)
    class LinkTests {

        @Test
        @DisplayName("Symbolic links are created, followed and deleted without their target")
        void testSymlinks() throws ArborException {
            LocalNode link = base.child("current");
            link.linkTo("docs/drafts");

            assertThat(Files.isSymbolicLink(tempDir.resolve("current"))).isTrue();
            assertThat(link.getLinkTarget()).contains("docs/drafts");
            assertThat(link.isFolder()).isTrue();
            assertThat(link.dereference()).isEqualTo(base.child("docs").child("drafts"));
            assertThat(link.getChildNames()).containsExactly("plan.txt");

            link.delete();
            assertThat(link.exists()).isFalse();
            assertThat(Files.exists(tempDir.resolve("docs/drafts/plan.txt"))).isTrue();
        }

        @Test
        @DisplayName("A dangling link exists but is broken")
        void testDanglingLink() throws ArborException {
            LocalNode link = base.child("dangling");
            link.linkTo("gone");

            assertThat(link.exists()).isTrue();
            assertThat(link.isBroken()).isTrue();
            assertThat(link.isFile()).isFalse();
        }
    }

    @Nested
    @DisplayName("Working Directory")
    class WorkingDirectoryTests {

        @Test
        @DisplayName("Relative paths follow the working directory inside a scope")
        void testScope() throws ArborException {
            LocalNode before = base.getWorkingDirectory();

            try (WorkingDirectoryScope<LocalNode> scope = base.child("docs").asWorking()) {
                assertThat(fs.resolve("readme.md")).isEqualTo(base.child("docs").child("readme.md"));
                assertThat(scope.getPrevious()).isEqualTo(before);
            }
            assertThat(base.getWorkingDirectory()).isEqualTo(before);
        }

        @Test
        @DisplayName("A file cannot become the working directory")
        void testChangeToFile() {
            assertThatThrownBy(() -> base.child("docs").child("readme.md").changeTo())
                    .isInstanceOf(ArborException.class);
        }
    }

    @Nested
    @DisplayName("Extended Attributes")
    class ExtendedAttributeTests {

        @Test
        @DisplayName("User attributes round trip where the file store supports them")
        void testXattrs() throws IOException {
            Path readme = tempDir.resolve("docs/readme.md");
            assumeTrue(Files.getFileStore(readme).supportsFileAttributeView(UserDefinedFileAttributeView.class));
            LocalNode node = fs.resolve(readme);
            try {
                node.setXattr("arbor.test", new byte[]{1, 2, 3});
            } catch (ArborException e) {
                assumeTrue(false, "File store refused user attributes: " + e.getMessage());
            }

            assertThat(node.getXattr("arbor.test")).containsExactly(1, 2, 3);
            assertThat(node.listXattrs()).contains("arbor.test");
            node.deleteXattr("arbor.test");
            assertThatThrownBy(() -> node.getXattr("arbor.test")).isInstanceOf(NodeNotFoundException.class);
        }

        @Test
        @DisplayName("Unsupported file stores report a missing capability")
        void testUnsupportedStore() throws IOException {
            Path readme = tempDir.resolve("docs/readme.md");
            assumeTrue(!Files.getFileStore(readme).supportsFileAttributeView(UserDefinedFileAttributeView.class));

            assertThatThrownBy(() -> fs.resolve(readme).listXattrs())
                    .isInstanceOf(UnsupportedCapabilityException.class);
        }
    }

    @Nested
    @DisplayName("Mountpoints")
    @DisabledOnOs(OS.WINDOWS)
    class MountPointTests {

        @Test
        @DisplayName("Mount table entries become mountpoints, later lines winning")
        void testMountTable() throws IOException {
            Path table = tempDir.resolve("mounts");
            Files.write(table, List.of(
                    "/dev/sda1 / ext4 rw 0 0",
                    "tmpfs " + tempDir + " tmpfs rw 0 0",
                    "/dev/sdb1 " + tempDir + " ext4 rw 0 0",
                    "weird relative/location ext4 rw 0 0"));
            ArborConfiguration config = ArborConfiguration.defaults();
            config.setProperty(ArborConfiguration.LOCAL_MOUNT_TABLE, table.toString());
            LocalFileSystem configured = new LocalFileSystem(config);

            List<MountPoint<LocalNode>> mountPoints = configured.getMountPoints();
            LocalNode location = configured.resolve(tempDir);

            assertThat(mountPoints).extracting(MountPoint::getLocation).doesNotHaveDuplicates();
            MountPoint<LocalNode> mount = location.child("docs").getMountPoint();
            assertThat(mount.getLocation()).isEqualTo(location);
            assertThat(mount.getDevice()).map(LocalNode::toPlatformPath).contains(Path.of("/dev/sdb1"));
        }

        @Test
        @DisplayName("Without a readable table every root is a mountpoint")
        void testMissingTable() throws ArborException {
            ArborConfiguration config = ArborConfiguration.defaults();
            config.setProperty(ArborConfiguration.LOCAL_MOUNT_TABLE, tempDir.resolve("absent").toString());
            LocalFileSystem configured = new LocalFileSystem(config);

            assertThat(configured.getMountPoints()).extracting(MountPoint::getLocation)
                    .containsExactlyElementsOf(configured.getRoots());
        }
    }
}
