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

import dev.mars.arbor.config.ArborConfiguration;
import dev.mars.arbor.core.WriteResumeMode;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.BrokenLinkException;
import dev.mars.arbor.core.exceptions.DisconnectedException;
import dev.mars.arbor.core.exceptions.ErrorKind;
import dev.mars.arbor.core.exceptions.NodeAlreadyExistsException;
import dev.mars.arbor.core.exceptions.NodeNotFoundException;
import dev.mars.arbor.core.exceptions.NodePermissionException;
import dev.mars.arbor.path.NodePath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared in-memory state behind any number of {@link MemoryFileSystem} sessions.
 *
 * <p>The store plays the part of a remote server: sessions come and go, the data
 * stays. It holds files, folders, links and extended attributes under one or more
 * roots, and supports failure injection so that callers can be tested against a
 * backend that drops connections or refuses operations:</p>
 * <ul>
 *   <li>{@link #failOperation(int, FailureMode)} fails the N-th operation from now</li>
 *   <li>{@link #setPathFailure(NodePath, FailureMode)} fails every operation on a path</li>
 *   <li>{@link #disconnectAfterBytesRead(long)} and {@link #disconnectAfterBytesWritten(long)}
 *       sever the session part way through a stream</li>
 *   <li>{@link #setFailureMode(FailureMode)} with {@code READ_ONLY} rejects every write</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * MemoryStore store = new MemoryStore();
 * store.createFile(NodePath.of("/", "data.bin"), content);
 * store.failOperation(2, FailureMode.DISCONNECT);
 * FileSystem<ReconnectingNode> fs = ReconnectingFileSystem.wrap(store::connect);
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class MemoryStore {
    private static final Logger logger = LoggerFactory.getLogger(MemoryStore.class);

    private static final int MAX_LINK_DEPTH = 40;

    /**
     * Ways an injected failure shows itself.
     */
    public enum FailureMode {
        /** Normal operation */
        NONE,
        /** The session is severed and the operation fails as a disconnection */
        DISCONNECT,
        /** The operation is refused */
        PERMISSION_DENIED,
        /** Generic I/O error */
        IO_ERROR,
        /** Writes are refused, reads succeed */
        READ_ONLY
    }

    enum EntryType {
        FILE,
        FOLDER,
        LINK
    }

    private final List<String> roots;
    private final Map<NodePath, Entry> entries = new HashMap<>();
    private final Map<NodePath, NodePath> mounts = new LinkedHashMap<>();
    private final ArborConfiguration configuration;
    private volatile WriteResumeMode writeResumeMode = WriteResumeMode.RECONCILE_BY_SIZE;

    // Failure injection
    private volatile FailureMode failureMode = FailureMode.NONE;
    private final Map<NodePath, FailureMode> pathFailures = new ConcurrentHashMap<>();
    private final Map<Long, FailureMode> scheduledFailures = new ConcurrentHashMap<>();
    private long readBudget = -1;
    private long writeBudget = -1;

    // Statistics
    private final AtomicLong operations = new AtomicLong();
    private final AtomicLong bytesRead = new AtomicLong();
    private final AtomicLong bytesWritten = new AtomicLong();
    private final AtomicInteger sessions = new AtomicInteger();

    public MemoryStore() {
        this(ArborConfiguration.defaults(), "/");
    }

    public MemoryStore(ArborConfiguration configuration, String... roots) {
        if (roots.length == 0) {
            throw new IllegalArgumentException("A store needs at least one root");
        }
        this.configuration = configuration;
        this.roots = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(roots)));
        for (String root : roots) {
            entries.put(NodePath.root(root), Entry.folder());
        }
    }

    /**
     * Opens a new session on this store. Usable directly as a filesystem factory.
     */
    public MemoryFileSystem connect() {
        int id = sessions.incrementAndGet();
        logger.debug("Opening memory session {}", id);
        return new MemoryFileSystem(this, id, configuration);
    }

    // ==================== Setup ====================

    public synchronized void createFolders(NodePath path) {
        if (!roots.contains(path.getRoot())) {
            throw new IllegalArgumentException("Unknown root: " + path.getRoot());
        }
        NodePath current = NodePath.root(path.getRoot());
        for (String component : path.components()) {
            current = current.join(component);
            Entry existing = entries.get(current);
            if (existing == null) {
                entries.put(current, Entry.folder());
                entries.get(current.parent().orElseThrow()).children.add(component);
            } else if (existing.type != EntryType.FOLDER) {
                throw new IllegalStateException("Not a folder: " + current);
            }
        }
    }

    public synchronized void createFile(NodePath path, byte[] content) {
        path.parent().ifPresent(this::createFolders);
        Entry entry = Entry.file();
        entry.append(content, 0, content.length);
        put(path, entry);
    }

    public synchronized void createLink(NodePath path, String target) {
        path.parent().ifPresent(this::createFolders);
        put(path, Entry.link(target));
    }

    /**
     * Registers an extra mounted hierarchy at {@code location}, optionally backed by
     * the node at {@code device}.
     */
    public synchronized void addMount(NodePath location, NodePath device) {
        mounts.put(location, device);
    }

    public List<String> getRoots() {
        return roots;
    }

    /**
     * The resume guarantee every session of this store reports. Sizes are always
     * exact here; {@code RESEND} makes sessions behave like a backend that cannot
     * vouch for partially stored data.
     */
    public void setWriteResumeMode(WriteResumeMode mode) {
        this.writeResumeMode = mode;
    }

    public WriteResumeMode getWriteResumeMode() {
        return writeResumeMode;
    }

    synchronized Map<NodePath, Optional<NodePath>> getMounts() {
        Map<NodePath, Optional<NodePath>> all = new LinkedHashMap<>();
        for (String root : roots) {
            all.put(NodePath.root(root), Optional.empty());
        }
        mounts.forEach((location, device) -> all.put(location, Optional.ofNullable(device)));
        return all;
    }

    // ==================== Failure injection ====================

    public void setFailureMode(FailureMode mode) {
        this.failureMode = mode;
    }

    public void setPathFailure(NodePath path, FailureMode mode) {
        pathFailures.put(path, mode);
    }

    public void clearPathFailure(NodePath path) {
        pathFailures.remove(path);
    }

    /**
     * Fails the {@code n}-th operation counted from now ({@code 1} is the next one).
     */
    public void failOperation(int n, FailureMode mode) {
        scheduledFailures.put(operations.get() + n, mode);
    }

    /**
     * Lets {@code bytes} more bytes be read, then severs the reading session once.
     */
    public synchronized void disconnectAfterBytesRead(long bytes) {
        this.readBudget = bytes;
    }

    /**
     * Lets {@code bytes} more bytes land, then severs the writing session once. The
     * write that crosses the limit lands partially.
     */
    public synchronized void disconnectAfterBytesWritten(long bytes) {
        this.writeBudget = bytes;
    }

    public void resetChaos() {
        failureMode = FailureMode.NONE;
        pathFailures.clear();
        scheduledFailures.clear();
        synchronized (this) {
            readBudget = -1;
            writeBudget = -1;
        }
    }

    // ==================== Statistics ====================

    public long getOperations() {
        return operations.get();
    }

    public long getBytesRead() {
        return bytesRead.get();
    }

    public long getBytesWritten() {
        return bytesWritten.get();
    }

    public int getSessionCount() {
        return sessions.get();
    }

    // ==================== Operations used by sessions ====================

    void beginOperation(MemoryFileSystem session, NodePath path, boolean write) throws ArborException {
        session.checkConnected(path);
        long number = operations.incrementAndGet();
        FailureMode scheduled = scheduledFailures.remove(number);
        if (scheduled != null) {
            fail(session, scheduled, path, write);
        }
        FailureMode forPath = pathFailures.get(path);
        if (forPath != null) {
            fail(session, forPath, path, write);
        }
        if (write && failureMode == FailureMode.READ_ONLY) {
            throw new NodePermissionException(path, "Store is read-only");
        }
    }

    private void fail(MemoryFileSystem session, FailureMode mode, NodePath path, boolean write)
            throws ArborException {
        switch (mode) {
            case DISCONNECT -> {
                session.sever();
                throw new DisconnectedException(path, "Connection reset by peer", null);
            }
            case PERMISSION_DENIED -> throw new NodePermissionException(path, "Permission denied");
            case IO_ERROR -> throw new ArborException(ErrorKind.IO_FAILURE, path, "I/O error");
            case READ_ONLY -> {
                if (write) {
                    throw new NodePermissionException(path, "Store is read-only");
                }
            }
            default -> {
            }
        }
    }

    /**
     * How many of {@code requested} bytes a read may deliver; severs the session when
     * the read budget is used up.
     */
    synchronized int admitRead(MemoryFileSystem session, NodePath path, int requested) throws ArborException {
        session.checkConnected(path);
        int allowed = requested;
        if (readBudget == 0) {
            readBudget = -1;
            session.sever();
            throw new DisconnectedException(path, "Connection reset while reading", null);
        }
        if (readBudget > 0) {
            allowed = (int) Math.min(requested, readBudget);
            readBudget -= allowed;
        }
        bytesRead.addAndGet(allowed);
        return allowed;
    }

    synchronized void write(MemoryFileSystem session, NodePath path, byte[] data, int offset, int length)
            throws ArborException {
        session.checkConnected(path);
        Entry entry = find(path, true);
        if (entry == null || entry.type != EntryType.FILE) {
            throw new NodeNotFoundException(path, "File vanished while writing");
        }
        int allowed = length;
        if (writeBudget >= 0) {
            allowed = (int) Math.min(length, writeBudget);
            writeBudget -= allowed;
        }
        entry.append(data, offset, allowed);
        bytesWritten.addAndGet(allowed);
        if (allowed < length) {
            writeBudget = -1;
            session.sever();
            throw new DisconnectedException(path, "Connection reset while writing", null);
        }
    }

    synchronized EntryType typeOf(NodePath path, boolean follow) throws ArborException {
        Entry entry = find(path, follow);
        return entry == null ? null : entry.type;
    }

    synchronized Optional<String> linkTarget(NodePath path) throws ArborException {
        Entry entry = find(path, false);
        return entry != null && entry.type == EntryType.LINK ? Optional.of(entry.target) : Optional.empty();
    }

    synchronized byte[] content(NodePath path) throws ArborException {
        Entry entry = require(path, true);
        if (entry.type != EntryType.FILE) {
            throw new ArborException(ErrorKind.IO_FAILURE, path, "Not a file");
        }
        return Arrays.copyOf(entry.content, entry.length);
    }

    synchronized List<String> childNames(NodePath path) throws ArborException {
        Entry entry = require(path, true);
        if (entry.type != EntryType.FOLDER) {
            throw new ArborException(ErrorKind.IO_FAILURE, path, "Not a folder");
        }
        return new ArrayList<>(entry.children);
    }

    synchronized long size(NodePath path) throws ArborException {
        Entry entry = require(path, true);
        return entry.type == EntryType.FILE ? entry.length : 0;
    }

    synchronized void openForWriting(NodePath path, boolean append) throws ArborException {
        Entry entry = find(path, true);
        if (entry == null) {
            create(path, Entry.file());
        } else if (entry.type != EntryType.FILE) {
            throw new ArborException(ErrorKind.IO_FAILURE, path, "Is a folder");
        } else if (!append) {
            entry.truncate();
        }
    }

    synchronized void createFolder(NodePath path) throws ArborException {
        create(path, Entry.folder());
    }

    synchronized void makeLink(NodePath path, String target) throws ArborException {
        create(path, Entry.link(target));
    }

    synchronized void delete(NodePath path) throws ArborException {
        Entry entry = require(path, false);
        if (entry.type == EntryType.FOLDER && !entry.children.isEmpty()) {
            throw new ArborException(ErrorKind.IO_FAILURE, path, "Folder is not empty");
        }
        NodePath real = canonicalParent(path);
        entries.remove(real);
        entries.get(real.parent().orElseThrow()).children.remove(real.getName());
    }

    synchronized Map<String, byte[]> xattrs(NodePath path) throws ArborException {
        return require(path, true).xattrs;
    }

    // ==================== Private helpers ====================

    private void put(NodePath path, Entry entry) {
        entries.put(path, entry);
        entries.get(path.parent().orElseThrow()).children.add(path.getName());
    }

    private void create(NodePath path, Entry entry) throws ArborException {
        if (path.isRoot()) {
            throw new NodeAlreadyExistsException(path, "Roots always exist");
        }
        NodePath real = canonicalParent(path);
        if (entries.containsKey(real)) {
            throw new NodeAlreadyExistsException(path, "Already exists");
        }
        Entry parent = entries.get(real.parent().orElseThrow());
        if (parent == null) {
            throw new NodeNotFoundException(path, "Parent folder does not exist");
        }
        if (parent.type != EntryType.FOLDER) {
            throw new ArborException(ErrorKind.IO_FAILURE, path, "Parent is not a folder");
        }
        put(real, entry);
    }

    private Entry require(NodePath path, boolean follow) throws ArborException {
        Entry entry = find(path, follow);
        if (entry == null) {
            throw new NodeNotFoundException(path, "No such file or folder");
        }
        return entry;
    }

    private Entry find(NodePath path, boolean follow) throws ArborException {
        NodePath real = canonicalParent(path);
        Entry entry = entries.get(real);
        int hops = 0;
        while (follow && entry != null && entry.type == EntryType.LINK) {
            if (++hops > MAX_LINK_DEPTH) {
                throw new BrokenLinkException(path, "Too many levels of links");
            }
            real = canonicalParent(real.parent().orElse(real).resolve(entry.target));
            entry = entries.get(real);
        }
        return entry;
    }

    /**
     * {@code path} with every link above its last component replaced by its target.
     */
    private NodePath canonicalParent(NodePath path) throws ArborException {
        NodePath current = NodePath.root(path.getRoot());
        List<String> components = path.components();
        int hops = 0;
        for (int i = 0; i < components.size(); i++) {
            current = current.join(components.get(i));
            if (i == components.size() - 1) {
                break;
            }
            Entry entry = entries.get(current);
            while (entry != null && entry.type == EntryType.LINK) {
                if (++hops > MAX_LINK_DEPTH) {
                    throw new BrokenLinkException(path, "Too many levels of links");
                }
                current = current.parent().orElse(current).resolve(entry.target);
                entry = entries.get(current);
            }
        }
        return current;
    }

    private static final class Entry {
        final EntryType type;
        final String target;
        final TreeSet<String> children;
        final Map<String, byte[]> xattrs = new TreeMap<>();
        byte[] content = new byte[0];
        int length;

        private Entry(EntryType type, String target) {
            this.type = type;
            this.target = target;
            this.children = type == EntryType.FOLDER ? new TreeSet<>() : null;
        }

        static Entry file() {
            return new Entry(EntryType.FILE, null);
        }

        static Entry folder() {
            return new Entry(EntryType.FOLDER, null);
        }

        static Entry link(String target) {
            return new Entry(EntryType.LINK, target);
        }

        void append(byte[] data, int offset, int count) {
            if (length + count > content.length) {
                content = Arrays.copyOf(content, Math.max(length + count, content.length * 2));
            }
            System.arraycopy(data, offset, content, length, count);
            length += count;
        }

        void truncate() {
            content = new byte[0];
            length = 0;
        }
    }
}
