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

import dev.mars.arbor.core.AbstractNode;
import dev.mars.arbor.core.Node;
import dev.mars.arbor.core.capability.ExtendedAttributes;
import dev.mars.arbor.core.capability.Hierarchy;
import dev.mars.arbor.core.capability.Listable;
import dev.mars.arbor.core.capability.Readable;
import dev.mars.arbor.core.capability.Sizable;
import dev.mars.arbor.core.capability.WorkingDirectory;
import dev.mars.arbor.core.capability.Writable;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.path.NodePath;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Node of a {@link ReconnectingFileSystem}.
 *
 * <p>Holds only its path. Each primitive resolves the path on the proxy's live
 * backend and runs there; derived operations come from the capability interfaces
 * and so go through the same primitives. The node is typed with every capability,
 * but {@link #supports(Class)} answers for the backend node, so {@link #as(Class)}
 * refuses capabilities the backend lacks.</p>
 *
 * <p>Identity is the proxy plus the path, and stays stable across reconnects.</p>
 */
public class ReconnectingNode extends AbstractNode<ReconnectingNode> implements Listable<ReconnectingNode>,
        Sizable<ReconnectingNode>, Writable<ReconnectingNode>, WorkingDirectory<ReconnectingNode>,
        ExtendedAttributes<ReconnectingNode> {

    private final ReconnectingFileSystem fileSystem;

    ReconnectingNode(ReconnectingFileSystem fileSystem, NodePath path) {
        super(path);
        this.fileSystem = fileSystem;
    }

    @Override
    public ReconnectingFileSystem getFileSystem() {
        return fileSystem;
    }

    @Override
    public boolean supports(Class<?> capability) {
        if (!capability.isInstance(this)) {
            return false;
        }
        return fileSystem.navigate("query capability", path, node -> node.supports(capability));
    }

    // Hierarchy

    @Override
    public Optional<ReconnectingNode> getParent() {
        Optional<NodePath> parent = fileSystem.navigate("parent", path,
                node -> hierarchy(node).getParent().map(p -> p.getPath()));
        return parent.map(fileSystem::node);
    }

    @Override
    public ReconnectingNode child(String name) {
        return fileSystem.node(fileSystem.navigate("child", path, node -> hierarchy(node).child(name).getPath()));
    }

    @Override
    public List<String> getPathComponents() {
        return path.components();
    }

    // Readable

    @Override
    public boolean isFile() throws ArborException {
        return fileSystem.call("is file", path, node -> readable(node).isFile());
    }

    @Override
    public boolean isFolder() throws ArborException {
        return fileSystem.call("is folder", path, node -> readable(node).isFolder());
    }

    @Override
    public boolean exists() throws ArborException {
        return fileSystem.call("exists", path, node -> readable(node).exists());
    }

    @Override
    public Optional<String> getLinkTarget() throws ArborException {
        return fileSystem.call("read link", path, node -> readable(node).getLinkTarget());
    }

    @Override
    public InputStream openForReading() throws ArborException {
        return new ReconnectingInputStream(fileSystem, path);
    }

    // Listable

    @Override
    public List<String> getChildNames() throws ArborException {
        return fileSystem.call("list", path, node -> {
            Listable<?> listable = node.as(Listable.class);
            return listable.getChildNames();
        });
    }

    // Sizable

    @Override
    public long getSize() throws ArborException {
        return fileSystem.call("size", path, node -> {
            Sizable<?> sizable = node.as(Sizable.class);
            return sizable.getSize();
        });
    }

    // Writable

    @Override
    public OutputStream openForWriting(boolean append) throws ArborException {
        return ReconnectingOutputStream.open(fileSystem, path, append);
    }

    @Override
    public void createFolder() throws ArborException {
        fileSystem.call("create folder", path, node -> {
            writable(node).createFolder();
            return null;
        });
    }

    @Override
    public void linkTo(String target) throws ArborException {
        fileSystem.call("link", path, node -> {
            writable(node).linkTo(target);
            return null;
        });
    }

    @Override
    public void deleteJustThisThing() throws ArborException {
        fileSystem.call("delete", path, node -> {
            writable(node).deleteJustThisThing();
            return null;
        });
    }

    // WorkingDirectory

    @Override
    public void changeTo() throws ArborException {
        fileSystem.changeWorkingDirectory(path);
    }

    @Override
    public ReconnectingNode getWorkingDirectory() throws ArborException {
        NodePath current = fileSystem.call("working directory", path, node -> {
            WorkingDirectory<?> directory = node.as(WorkingDirectory.class);
            return directory.getWorkingDirectory().getPath();
        });
        return fileSystem.node(current);
    }

    // ExtendedAttributes

    @Override
    public byte[] getXattr(String name) throws ArborException {
        return fileSystem.call("get xattr", path, node -> xattrs(node).getXattr(name));
    }

    @Override
    public void setXattr(String name, byte[] value) throws ArborException {
        fileSystem.call("set xattr", path, node -> {
            xattrs(node).setXattr(name, value);
            return null;
        });
    }

    @Override
    public void deleteXattr(String name) throws ArborException {
        fileSystem.call("delete xattr", path, node -> {
            xattrs(node).deleteXattr(name);
            return null;
        });
    }

    @Override
    public Set<String> listXattrs() throws ArborException {
        return fileSystem.call("list xattrs", path, node -> xattrs(node).listXattrs());
    }

    static Hierarchy<?> hierarchy(Node<?> node) throws ArborException {
        return node.as(Hierarchy.class);
    }

    static Readable<?> readable(Node<?> node) throws ArborException {
        return node.as(Readable.class);
    }

    static Writable<?> writable(Node<?> node) throws ArborException {
        return node.as(Writable.class);
    }

    private static ExtendedAttributes<?> xattrs(Node<?> node) throws ArborException {
        return node.as(ExtendedAttributes.class);
    }
}
