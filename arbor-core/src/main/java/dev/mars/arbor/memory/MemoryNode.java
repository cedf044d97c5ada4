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
package dev.mars.arbor.memory;

import dev.mars.arbor.core.AbstractNode;
import dev.mars.arbor.core.capability.ExtendedAttributes;
import dev.mars.arbor.core.capability.Listable;
import dev.mars.arbor.core.capability.Sizable;
import dev.mars.arbor.core.capability.WorkingDirectory;
import dev.mars.arbor.core.capability.Writable;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.ErrorKind;
import dev.mars.arbor.core.exceptions.NodeNotFoundException;
import dev.mars.arbor.path.NodePath;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Node of a {@link MemoryFileSystem}. Offers every capability.
 */
public class MemoryNode extends AbstractNode<MemoryNode> implements Listable<MemoryNode>, Sizable<MemoryNode>,
        Writable<MemoryNode>, WorkingDirectory<MemoryNode>, ExtendedAttributes<MemoryNode> {

    private final MemoryFileSystem fileSystem;

    MemoryNode(MemoryFileSystem fileSystem, NodePath path) {
        super(path);
        this.fileSystem = fileSystem;
    }

    @Override
    public MemoryFileSystem getFileSystem() {
        return fileSystem;
    }

    private MemoryStore store() {
        return fileSystem.getStore();
    }

    private void begin(boolean write) throws ArborException {
        store().beginOperation(fileSystem, path, write);
    }

    // Hierarchy

    @Override
    public Optional<MemoryNode> getParent() {
        return path.parent().map(parent -> new MemoryNode(fileSystem, parent));
    }

    @Override
    public MemoryNode child(String name) {
        return new MemoryNode(fileSystem, path.resolve(name));
    }

    @Override
    public List<String> getPathComponents() {
        return path.components();
    }

    // Readable

    @Override
    public boolean isFile() throws ArborException {
        begin(false);
        return store().typeOf(path, true) == MemoryStore.EntryType.FILE;
    }

    @Override
    public boolean isFolder() throws ArborException {
        begin(false);
        return store().typeOf(path, true) == MemoryStore.EntryType.FOLDER;
    }

    @Override
    public boolean exists() throws ArborException {
        begin(false);
        return store().typeOf(path, false) != null;
    }

    @Override
    public Optional<String> getLinkTarget() throws ArborException {
        begin(false);
        return store().linkTarget(path);
    }

    @Override
    public InputStream openForReading() throws ArborException {
        begin(false);
        return new MemoryInputStream(fileSystem, path, store().content(path));
    }

    // Listable

    @Override
    public List<String> getChildNames() throws ArborException {
        begin(false);
        return store().childNames(path);
    }

    // Sizable

    @Override
    public long getSize() throws ArborException {
        if (isFolder()) {
            return Sizable.totalSize(this);
        }
        begin(false);
        return store().size(path);
    }

    // Writable

    @Override
    public OutputStream openForWriting(boolean append) throws ArborException {
        begin(true);
        store().openForWriting(path, append);
        return new MemoryOutputStream(fileSystem, path);
    }

    @Override
    public void createFolder() throws ArborException {
        begin(true);
        store().createFolder(path);
    }

    @Override
    public void linkTo(String target) throws ArborException {
        begin(true);
        store().makeLink(path, target);
    }

    @Override
    public void deleteJustThisThing() throws ArborException {
        begin(true);
        store().delete(path);
    }

    // WorkingDirectory

    @Override
    public void changeTo() throws ArborException {
        checkFolder();
        fileSystem.setWorkingDirectoryPath(path);
    }

    @Override
    public MemoryNode getWorkingDirectory() throws ArborException {
        fileSystem.checkConnected(path);
        return new MemoryNode(fileSystem, fileSystem.getWorkingDirectoryPath());
    }

    // ExtendedAttributes

    @Override
    public byte[] getXattr(String name) throws ArborException {
        begin(false);
        byte[] value = store().xattrs(path).get(name);
        if (value == null) {
            throw new NodeNotFoundException(path, "No such extended attribute: " + name);
        }
        return value.clone();
    }

    @Override
    public void setXattr(String name, byte[] value) throws ArborException {
        if (name == null || name.isEmpty()) {
            throw new ArborException(ErrorKind.INVALID_PATH, path, "Attribute name must not be empty");
        }
        begin(true);
        Map<String, byte[]> xattrs = store().xattrs(path);
        synchronized (store()) {
            xattrs.put(name, Arrays.copyOf(value, value.length));
        }
    }

    @Override
    public void deleteXattr(String name) throws ArborException {
        begin(true);
        Map<String, byte[]> xattrs = store().xattrs(path);
        synchronized (store()) {
            if (xattrs.remove(name) == null) {
                throw new NodeNotFoundException(path, "No such extended attribute: " + name);
            }
        }
    }

    @Override
    public Set<String> listXattrs() throws ArborException {
        begin(false);
        Map<String, byte[]> xattrs = store().xattrs(path);
        synchronized (store()) {
            return new TreeSet<>(xattrs.keySet());
        }
    }
}
