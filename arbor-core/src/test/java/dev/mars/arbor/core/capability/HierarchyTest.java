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

import dev.mars.arbor.core.MountPoint;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.PathTraversalException;
import dev.mars.arbor.memory.MemoryFileSystem;
import dev.mars.arbor.memory.MemoryNode;
import dev.mars.arbor.memory.MemoryStore;
import dev.mars.arbor.path.NodePath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Hierarchy Tests")
class HierarchyTest {

    private MemoryStore store;
    private MemoryFileSystem fs;

    @BeforeEach
    void setUp() {
        store = new MemoryStore();
        store.createFile(NodePath.of("/", "etc", "hosts"), new byte[0]);
        store.createFile(NodePath.of("/", "mnt", "usb", "photos", "cat.jpg"), new byte[3]);
        store.createFolders(NodePath.of("/", "srv", "www"));
        store.addMount(NodePath.of("/", "mnt", "usb"), NodePath.of("/", "dev", "sdb1"));
        store.addMount(NodePath.of("/", "mnt"), null);
        fs = store.connect();
    }

    @Nested
    @DisplayName("Structural Properties")
    class StructuralPropertyTests {

        @Test
        @DisplayName("A node has no parent exactly when it is a root")
        void testParentAbsentIffRoot() throws ArborException {
            List<MemoryNode> roots = fs.getRoots();
            for (MemoryNode node : fs.getRoot().recurse().toList()) {
                assertThat(node.getParent().isEmpty())
                        .as("parent of %s", node)
                        .isEqualTo(roots.contains(node));
            }
        }

        @Test
        @DisplayName("Resolving a node's path gives the node back")
        void testResolveRoundTrip() throws ArborException {
            for (MemoryNode node : fs.getRoot().recurse().toList()) {
                assertThat(fs.resolve(node.getPath())).isEqualTo(node);
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {"etc", "missing", "with space", "ünïcode"})
        @DisplayName("child(name).parent is the node itself")
        void testChildParentIdempotence(String name) {
            MemoryNode root = fs.getRoots().get(0);
            assertThat(root.child(name).getParent()).contains(root);
            assertThat(root.child("srv").child(name).getParent()).contains(root.child("srv"));
        }
    }

    @Nested
    @DisplayName("Navigation")
    class NavigationTests {

        @Test
        @DisplayName("Ancestors run from the nearest to the root")
        void testAncestors() throws ArborException {
            MemoryNode hosts = fs.resolve("/etc/hosts");

            assertThat(hosts.getAncestors()).extracting(MemoryNode::getPathString)
                    .containsExactly("/etc", "/");
            assertThat(hosts.getAncestors(true)).first().isEqualTo(hosts);
            assertThat(hosts.isDescendantOf(fs.resolve("/etc"), false)).isTrue();
            assertThat(fs.resolve("/etc").isAncestorOf(hosts, false)).isTrue();
            assertThat(hosts.isDescendantOf(hosts, false)).isFalse();
            assertThat(hosts.isDescendantOf(hosts, true)).isTrue();
        }

        @Test
        @DisplayName("Names, path strings and siblings")
        void testNamesAndSiblings() throws ArborException {
            MemoryNode hosts = fs.resolve("/etc/hosts");

            assertThat(hosts.getName()).isEqualTo("hosts");
            assertThat(fs.getRoot().getName()).isEmpty();
            assertThat(hosts.getPathString()).isEqualTo("/etc/hosts");
            assertThat(hosts.sibling("passwd").getPath()).isEqualTo(NodePath.of("/", "etc", "passwd"));
            assertThatThrownBy(() -> fs.getRoot().sibling("x"))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Same location from another session is the same place but not the same node")
        void testIsSameAs() throws ArborException {
            MemoryNode here = fs.resolve("/etc/hosts");
            MemoryNode there = store.connect().resolve("/etc/hosts");

            assertThat(here.isSameAs(there)).isTrue();
            assertThat(here).isNotEqualTo(there);
        }
    }

    @Nested
    @DisplayName("Safe Children")
    class SafeChildTests {

        @ParameterizedTest
        @ValueSource(strings = {"../../etc", "..", ".", "sub/../..", "/etc/passwd"})
        @DisplayName("Should reject names that escape the node")
        void testTraversalRejected(String name) throws ArborException {
            MemoryNode www = fs.resolve("/srv/www");

            assertThatThrownBy(() -> www.safeChild(name))
                    .isInstanceOf(PathTraversalException.class);
        }

        @Test
        @DisplayName("Should accept names that stay below the node")
        void testNestedNameAccepted() throws ArborException {
            MemoryNode www = fs.resolve("/srv/www");

            assertThat(www.safeChild("static/../index.html").getPath())
                    .isEqualTo(NodePath.of("/", "srv", "www", "index.html"));
        }
    }

    @Nested
    @DisplayName("Mountpoints")
    class MountPointTests {

        @Test
        @DisplayName("The nearest mount location wins")
        void testLongestMatch() throws ArborException {
            MountPoint<MemoryNode> usb = fs.resolve("/mnt/usb/photos/cat.jpg").getMountPoint();

            assertThat(usb.getLocation().getPath()).isEqualTo(NodePath.of("/", "mnt", "usb"));
            assertThat(usb.getDevice()).map(MemoryNode::getPath).contains(NodePath.of("/", "dev", "sdb1"));
            assertThat(fs.resolve("/mnt/other").getMountPoint().getLocation().getPath())
                    .isEqualTo(NodePath.of("/", "mnt"));
            assertThat(fs.resolve("/etc/hosts").getMountPoint().getLocation()).isEqualTo(fs.getRoot());
        }

        @Test
        @DisplayName("Every node's mount location is itself or an ancestor")
        void testMountLocationIsAncestor() throws ArborException {
            for (MemoryNode node : fs.getRoot().recurse().toList()) {
                MemoryNode location = node.getMountPoint().getLocation();
                assertThat(location.getPath().startsWith(NodePath.root("/"))).isTrue();
                assertThat(node.getPath().startsWith(location.getPath())).isTrue();
            }
        }

        @Test
        @DisplayName("A mount location counts for the node itself")
        void testMountLocationItself() throws ArborException {
            MemoryNode usb = fs.resolve("/mnt/usb");
            assertThat(usb.getMountPoint().getLocation()).isEqualTo(usb);
        }
    }
}
