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

import dev.mars.arbor.core.BlockIterator;
import dev.mars.arbor.core.Capabilities;
import dev.mars.arbor.core.CopyOption;
import dev.mars.arbor.core.Node;
import dev.mars.arbor.core.RemoteIterator;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.ArborExceptions;
import dev.mars.arbor.core.exceptions.BrokenLinkException;
import dev.mars.arbor.core.exceptions.ErrorKind;
import dev.mars.arbor.core.exceptions.NodeAlreadyExistsException;
import dev.mars.arbor.core.exceptions.NodeNotFoundException;
import dev.mars.arbor.storage.ChecksumCalculator;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Optional;
import java.util.Set;

/**
 * Type queries, link resolution and content access.
 *
 * <p>Backends supply the five primitives. {@link #isFile()} and {@link #isFolder()}
 * look through links; {@link #exists()} and {@link #getLinkTarget()} look at the
 * node itself.</p>
 *
 * @param <N> the backend's node type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface Readable<N extends Node<N>> extends Node<N> {

    /** Hops after which recursive dereferencing gives up. */
    int MAX_LINK_DEPTH = 40;

    boolean isFile() throws ArborException;

    boolean isFolder() throws ArborException;

    /**
     * Whether anything, including a broken link, exists at this path.
     */
    boolean exists() throws ArborException;

    /**
     * The raw target of a link, or empty when this node is not a link.
     */
    Optional<String> getLinkTarget() throws ArborException;

    /**
     * Opens the content for reading. The caller owns and must close the stream.
     */
    InputStream openForReading() throws ArborException;

    default boolean isDirectory() throws ArborException {
        return isFolder();
    }

    default boolean isLink() throws ArborException {
        return getLinkTarget().isPresent();
    }

    default N dereference() throws ArborException {
        return dereference(false);
    }

    /**
     * The node this link points at, resolved against the link's parent; this node if
     * it is not a link. With {@code recursive}, follows chains of links.
     *
     * @throws BrokenLinkException if a chain is longer than {@link #MAX_LINK_DEPTH}
     */
    default N dereference(boolean recursive) throws ArborException {
        N current = self();
        int hops = 0;
        while (true) {
            Optional<String> target = Capabilities.readable(current).getLinkTarget();
            if (target.isEmpty()) {
                return current;
            }
            if (++hops > MAX_LINK_DEPTH) {
                throw new BrokenLinkException(getPath(), "Too many levels of links");
            }
            Hierarchy<N> link = Capabilities.hierarchy(current);
            N base = link.getParent().orElse(current);
            current = Capabilities.navigable(base).child(target.get());
            if (!recursive) {
                return current;
            }
        }
    }

    /**
     * True for a link whose final target does not exist, or that loops.
     */
    default boolean isBroken() throws ArborException {
        if (!isLink()) {
            return false;
        }
        try {
            return !Capabilities.readable(dereference(true)).exists();
        } catch (BrokenLinkException e) {
            return true;
        }
    }

    default boolean isValid() throws ArborException {
        return exists() && !(isLink() && isBroken());
    }

    default void checkFile() throws ArborException {
        checkExisting();
        if (!isFile()) {
            throw new ArborException(ErrorKind.IO_FAILURE, getPath(), "Not a file");
        }
    }

    default void checkFolder() throws ArborException {
        checkExisting();
        if (!isFolder()) {
            throw new ArborException(ErrorKind.IO_FAILURE, getPath(), "Not a folder");
        }
    }

    private void checkExisting() throws ArborException {
        if (!exists()) {
            throw new NodeNotFoundException(getPath(), "Does not exist");
        }
        if (isBroken()) {
            throw new BrokenLinkException(getPath(), "Link target does not exist");
        }
    }

    /**
     * The whole content. Prefer {@link #readBlocks()} for content of unknown size.
     */
    default byte[] read() throws ArborException {
        try (InputStream input = openForReading()) {
            return input.readAllBytes();
        } catch (IOException e) {
            throw ArborExceptions.translate(e, getPath());
        }
    }

    default BlockIterator readBlocks() throws ArborException {
        return readBlocks(getFileSystem().getConfiguration().getBlockSize());
    }

    default BlockIterator readBlocks(int blockSize) throws ArborException {
        return new BlockIterator(openForReading(), blockSize, getPath());
    }

    default String hash() throws ArborException {
        return hash(getFileSystem().getConfiguration().getChecksumAlgorithm());
    }

    /**
     * Hex digest of the content, streamed block by block.
     */
    default String hash(String algorithm) throws ArborException {
        try (BlockIterator blocks = readBlocks()) {
            return ChecksumCalculator.calculate(blocks, algorithm);
        }
    }

    /**
     * Copies this node to {@code destination}, which may belong to another backend.
     * Files are streamed block by block; folders are created and filled child by child.
     *
     * @throws NodeAlreadyExistsException if the destination exists and
     *                                    {@link CopyOption#OVERWRITE} is not given
     * @throws BrokenLinkException        if this is a broken link being followed
     */
    default void copyTo(Node<?> destination, CopyOption... options) throws ArborException {
        Set<CopyOption> selected = CopyOption.setOf(options);
        Readable<?> existing = destination.as(Readable.class);
        Writable<?> target = destination.as(Writable.class);
        if (existing.exists()) {
            if (!selected.contains(CopyOption.OVERWRITE)) {
                throw new NodeAlreadyExistsException(destination.getPath(), "Copy destination exists");
            }
            target.delete();
        }

        if (selected.contains(CopyOption.PRESERVE_LINKS) && isLink()) {
            target.linkTo(getLinkTarget().orElseThrow());
            return;
        }
        if (!exists()) {
            throw new NodeNotFoundException(getPath(), "Copy source does not exist");
        }
        Readable<N> source = Capabilities.readable(dereference(true));
        if (!source.exists()) {
            throw new BrokenLinkException(getPath(), "Copy source is a broken link");
        }

        if (source.isFolder()) {
            target.createFolder();
            Listable<N> folder = Capabilities.listable(source.self());
            RemoteIterator<N> children = folder.children();
            while (children.hasNext()) {
                Capabilities.readable(children.next()).copyInto(destination, options);
            }
        } else {
            try (BlockIterator blocks = source.readBlocks(); OutputStream output = target.openForWriting(false)) {
                while (blocks.hasNext()) {
                    output.write(blocks.next());
                }
            } catch (IOException e) {
                throw ArborExceptions.translate(e, destination.getPath());
            }
        }

        if (selected.contains(CopyOption.COPY_XATTRS)
                && source.supports(ExtendedAttributes.class) && destination.supports(ExtendedAttributes.class)) {
            ExtendedAttributes<N> attributes = Capabilities.extendedAttributes(source.self());
            attributes.copyXattrsTo(destination.as(ExtendedAttributes.class));
        }
    }

    /**
     * Copies this node to the child of {@code folder} that has this node's name.
     *
     * @return the new child
     */
    default Node<?> copyInto(Node<?> folder, CopyOption... options) throws ArborException {
        String name = Capabilities.hierarchy(self()).getName();
        Hierarchy<?> parent = folder.as(Hierarchy.class);
        Node<?> destination = parent.child(name);
        copyTo(destination, options);
        return destination;
    }
}
