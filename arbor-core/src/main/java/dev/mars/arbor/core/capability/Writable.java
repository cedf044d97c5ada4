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

import dev.mars.arbor.core.Capabilities;
import dev.mars.arbor.core.CopyOption;
import dev.mars.arbor.core.Node;
import dev.mars.arbor.core.RemoteIterator;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.ArborExceptions;
import dev.mars.arbor.core.exceptions.ErrorKind;
import dev.mars.arbor.core.exceptions.NodeAlreadyExistsException;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Optional;

/**
 * Creating, writing and deleting nodes.
 *
 * <p>Derived operations stop at the first failing primitive and propagate its
 * failure; nothing already done is rolled back.</p>
 *
 * @param <N> the backend's node type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface Writable<N extends Node<N>> extends Node<N> {

    int TEMPORARY_NAME_ATTEMPTS = 20;

    /**
     * Opens the node for writing, creating it if needed. Without {@code append} any
     * existing content is replaced. The caller owns and must close the stream.
     */
    OutputStream openForWriting(boolean append) throws ArborException;

    /**
     * Creates this node as an empty folder. The parent must exist.
     */
    void createFolder() throws ArborException;

    /**
     * Creates this node as a link to {@code target}, taken verbatim.
     */
    void linkTo(String target) throws ArborException;

    /**
     * Deletes this single node: a file, a link or an empty folder.
     */
    void deleteJustThisThing() throws ArborException;

    default OutputStream openForWriting() throws ArborException {
        return openForWriting(false);
    }

    default void write(byte[] data) throws ArborException {
        writeAll(data, false);
    }

    default void write(String text) throws ArborException {
        write(text.getBytes(StandardCharsets.UTF_8));
    }

    default void append(byte[] data) throws ArborException {
        writeAll(data, true);
    }

    private void writeAll(byte[] data, boolean append) throws ArborException {
        try (OutputStream output = openForWriting(append)) {
            output.write(data);
        } catch (IOException e) {
            throw ArborExceptions.translate(e, getPath());
        }
    }

    /**
     * Deletes this node and, for a folder, everything below it, children first.
     * Links are removed, never followed. Stops at the first failure.
     */
    default void delete() throws ArborException {
        Readable<N> readable = Capabilities.readable(self());
        if (!readable.isLink() && readable.isFolder()) {
            RemoteIterator<N> children = Capabilities.listable(self()).children();
            while (children.hasNext()) {
                Capabilities.writable(children.next()).delete();
            }
        }
        deleteJustThisThing();
    }

    default void delete(boolean ignoreMissing) throws ArborException {
        if (ignoreMissing && !Capabilities.readable(self()).exists()) {
            return;
        }
        delete();
    }

    /**
     * @param ignoreExisting succeed quietly if the folder already exists
     * @param recursive      create missing ancestors first
     */
    default void createFolder(boolean ignoreExisting, boolean recursive) throws ArborException {
        Readable<N> readable = Capabilities.readable(self());
        if (readable.isFolder()) {
            if (ignoreExisting) {
                return;
            }
            throw new NodeAlreadyExistsException(getPath(), "Folder already exists");
        }
        if (recursive) {
            Optional<N> parent = Capabilities.hierarchy(self()).getParent();
            if (parent.isPresent() && !Capabilities.readable(parent.get()).isFolder()) {
                Capabilities.writable(parent.get()).createFolder(true, true);
            }
        }
        createFolder();
    }

    default void mkdir() throws ArborException {
        createFolder(false, false);
    }

    default void mkdirs() throws ArborException {
        createFolder(true, true);
    }

    /**
     * Links to another node of the same filesystem by its absolute path.
     */
    default void linkTo(Node<?> target) throws ArborException {
        if (target.getFileSystem() != getFileSystem()) {
            throw new ArborException(ErrorKind.INVALID_PATH, getPath(), "Cannot link across filesystems");
        }
        linkTo(target.getPath().format(getFileSystem().getSeparator()));
    }

    /**
     * Moves this node to {@code destination} by copying it there and deleting the
     * original. Links are moved as links.
     */
    default void renameTo(Node<?> destination) throws ArborException {
        Capabilities.readable(self()).copyTo(destination, CopyOption.PRESERVE_LINKS);
        delete();
    }

    /**
     * Creates a child folder with a fresh random name.
     */
    default N createTemporaryFolder(String prefix) throws ArborException {
        SecureRandom random = new SecureRandom();
        Hierarchy<N> parent = Capabilities.hierarchy(self());
        NodeAlreadyExistsException collision = null;
        for (int attempt = 0; attempt < TEMPORARY_NAME_ATTEMPTS; attempt++) {
            N candidate = parent.child(prefix + Long.toUnsignedString(random.nextLong(), 36));
            try {
                Capabilities.writable(candidate).createFolder();
                return candidate;
            } catch (NodeAlreadyExistsException e) {
                collision = e;
            }
        }
        throw new NodeAlreadyExistsException(getPath(), "Could not find a free temporary folder name", collision);
    }
}
