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

import dev.mars.arbor.core.AbstractNode;
import dev.mars.arbor.core.capability.ExtendedAttributes;
import dev.mars.arbor.core.capability.Listable;
import dev.mars.arbor.core.capability.Sizable;
import dev.mars.arbor.core.capability.WorkingDirectory;
import dev.mars.arbor.core.capability.Writable;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.ArborExceptions;
import dev.mars.arbor.core.exceptions.ErrorKind;
import dev.mars.arbor.core.exceptions.NodeNotFoundException;
import dev.mars.arbor.core.exceptions.UnsupportedCapabilityException;
import dev.mars.arbor.path.NodePath;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.UserDefinedFileAttributeView;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Node of a {@link LocalFileSystem}. Extended attributes are only available where
 * the underlying file store supports user-defined attributes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class LocalNode extends AbstractNode<LocalNode> implements Listable<LocalNode>, Sizable<LocalNode>,
        Writable<LocalNode>, WorkingDirectory<LocalNode>, ExtendedAttributes<LocalNode> {

    private final LocalFileSystem fileSystem;

    LocalNode(LocalFileSystem fileSystem, NodePath path) {
        super(path);
        this.fileSystem = fileSystem;
    }

    @Override
    public LocalFileSystem getFileSystem() {
        return fileSystem;
    }

    /**
     * This node as a {@code java.nio.file} path.
     */
    public Path toPlatformPath() {
        return fileSystem.toPlatformPath(path);
    }

    @Override
    public Optional<LocalNode> getParent() {
        return path.parent().map(parent -> new LocalNode(fileSystem, parent));
    }

    @Override
    public LocalNode child(String name) {
        return new LocalNode(fileSystem, path.resolve(name, fileSystem.getSeparator().charAt(0)));
    }

    @Override
    public List<String> getPathComponents() {
        return path.components();
    }

    @Override
    public boolean isFile() throws ArborException {
        return attributes(true).map(BasicFileAttributes::isRegularFile).orElse(false);
    }

    @Override
    public boolean isFolder() throws ArborException {
        return attributes(true).map(BasicFileAttributes::isDirectory).orElse(false);
    }

    @Override
    public boolean exists() throws ArborException {
        return attributes(false).isPresent();
    }

    private Optional<BasicFileAttributes> attributes(boolean followLinks) throws ArborException {
        LinkOption[] options = followLinks ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
        try {
            return Optional.of(Files.readAttributes(toPlatformPath(), BasicFileAttributes.class, options));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw ArborExceptions.translate(e, path);
        }
    }

    @Override
    public Optional<String> getLinkTarget() throws ArborException {
        Path platformPath = toPlatformPath();
        if (!Files.isSymbolicLink(platformPath)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readSymbolicLink(platformPath).toString());
        } catch (IOException e) {
            throw ArborExceptions.translate(e, path);
        }
    }

    @Override
    public InputStream openForReading() throws ArborException {
        try {
            return Files.newInputStream(toPlatformPath());
        } catch (IOException e) {
            throw ArborExceptions.translate(e, path);
        }
    }

    @Override
    public List<String> getChildNames() throws ArborException {
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(toPlatformPath())) {
            for (Path entry : entries) {
                names.add(entry.getFileName().toString());
            }
        } catch (IOException e) {
            throw ArborExceptions.translate(e, path);
        }
        Collections.sort(names);
        return names;
    }

    @Override
    public long getSize() throws ArborException {
        if (isFolder()) {
            return Sizable.totalSize(this);
        }
        try {
            return Files.size(toPlatformPath());
        } catch (IOException e) {
            throw ArborExceptions.translate(e, path);
        }
    }

    @Override
    public OutputStream openForWriting(boolean append) throws ArborException {
        StandardOpenOption mode = append ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING;
        try {
            return Files.newOutputStream(toPlatformPath(), StandardOpenOption.CREATE, StandardOpenOption.WRITE, mode);
        } catch (IOException e) {
            throw ArborExceptions.translate(e, path);
        }
    }

    @Override
    public void createFolder() throws ArborException {
        try {
            Files.createDirectory(toPlatformPath());
        } catch (IOException e) {
            throw ArborExceptions.translate(e, path);
        }
    }

    @Override
    public void linkTo(String target) throws ArborException {
        try {
            Files.createSymbolicLink(toPlatformPath(), toPlatformPath().getFileSystem().getPath(target));
        } catch (UnsupportedOperationException e) {
            throw new UnsupportedCapabilityException(path, Writable.class, "Links are not supported here", e);
        } catch (IOException e) {
            throw ArborExceptions.translate(e, path);
        }
    }

    @Override
    public void deleteJustThisThing() throws ArborException {
        try {
            Files.delete(toPlatformPath());
        } catch (IOException e) {
            throw ArborExceptions.translate(e, path);
        }
    }

    @Override
    public void changeTo() throws ArborException {
        checkFolder();
        fileSystem.setWorkingDirectoryPath(toPlatformPath());
    }

    @Override
    public LocalNode getWorkingDirectory() {
        return fileSystem.resolve(fileSystem.getWorkingDirectoryPath());
    }

    // Extended attributes

    @Override
    public byte[] getXattr(String name) throws ArborException {
        UserDefinedFileAttributeView view = xattrView();
        try {
            if (!view.list().contains(name)) {
                throw new NodeNotFoundException(path, "No such extended attribute: " + name);
            }
            ByteBuffer buffer = ByteBuffer.allocate(view.size(name));
            view.read(name, buffer);
            buffer.flip();
            byte[] value = new byte[buffer.remaining()];
            buffer.get(value);
            return value;
        } catch (IOException e) {
            throw ArborExceptions.translate(e, path);
        }
    }

    @Override
    public void setXattr(String name, byte[] value) throws ArborException {
        if (name == null || name.isEmpty()) {
            throw new ArborException(ErrorKind.INVALID_PATH, path, "Attribute name must not be empty");
        }
        try {
            xattrView().write(name, ByteBuffer.wrap(value));
        } catch (IOException e) {
            throw ArborExceptions.translate(e, path);
        }
    }

    @Override
    public void deleteXattr(String name) throws ArborException {
        UserDefinedFileAttributeView view = xattrView();
        try {
            if (!view.list().contains(name)) {
                throw new NodeNotFoundException(path, "No such extended attribute: " + name);
            }
            view.delete(name);
        } catch (IOException e) {
            throw ArborExceptions.translate(e, path);
        }
    }

    @Override
    public Set<String> listXattrs() throws ArborException {
        try {
            return new TreeSet<>(xattrView().list());
        } catch (IOException e) {
            throw ArborExceptions.translate(e, path);
        }
    }

    private UserDefinedFileAttributeView xattrView() throws ArborException {
        Path platformPath = toPlatformPath();
        try {
            if (!Files.getFileStore(platformPath).supportsFileAttributeView(UserDefinedFileAttributeView.class)) {
                throw new UnsupportedCapabilityException(path, ExtendedAttributes.class,
                        "File store does not support user-defined attributes");
            }
        } catch (IOException e) {
            throw ArborExceptions.translate(e, path);
        }
        UserDefinedFileAttributeView view = Files.getFileAttributeView(platformPath, UserDefinedFileAttributeView.class);
        if (view == null) {
            throw new UnsupportedCapabilityException(path, ExtendedAttributes.class);
        }
        return view;
    }
}
