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

import dev.mars.arbor.config.ArborConfiguration;
import dev.mars.arbor.core.FileSystem;
import dev.mars.arbor.core.FileSystemFactory;
import dev.mars.arbor.core.MountPoint;
import dev.mars.arbor.core.Node;
import dev.mars.arbor.core.WriteResumeMode;
import dev.mars.arbor.core.capability.WorkingDirectory;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.DisconnectedException;
import dev.mars.arbor.core.exceptions.InvalidTransitionException;
import dev.mars.arbor.path.NodePath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A filesystem that survives its backend's disconnections.
 *
 * <p>Wraps a factory for the real backend and keeps one live instance of it. Every
 * operation on a {@link ReconnectingNode} or on one of its streams is resolved by
 * path against the live instance. When the backend classifies a failure as a
 * disconnection, the proxy builds a fresh instance through the factory and issues
 * the operation once more; if that fails too, the failure propagates. Any other
 * failure propagates untouched.</p>
 *
 * <p>Rebuilding is serialized by one lock. Each instance carries a generation
 * number, so a caller that saw generation <em>g</em> fail only rebuilds if
 * <em>g</em> is still live; otherwise it picks up the instance another caller
 * already built.</p>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * FileSystem<ReconnectingNode> fs = ReconnectingFileSystem.wrap(
 *         () -> SftpFileSystem.connect(info, configuration));
 * try (BlockIterator blocks = fs.resolve("/var/log/syslog").readBlocks()) {
 *     ...
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class ReconnectingFileSystem implements FileSystem<ReconnectingNode> {
    private static final Logger logger = LoggerFactory.getLogger(ReconnectingFileSystem.class);

    private final FileSystemFactory<?> factory;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong reconnects = new AtomicLong();

    private volatile Connection connection;
    private volatile ConnectionState state;
    private volatile NodePath workingDirectory;
    private volatile ArborException lastFailure;
    private volatile long failedGeneration = -1;

    private ReconnectingFileSystem(FileSystemFactory<?> factory) throws ArborException {
        this.factory = factory;
        this.connection = new Connection(factory.create(), 0);
        this.state = ConnectionState.CONNECTED;
        logger.info("Connected {}", connection.backend());
    }

    /**
     * Builds the first backend instance through {@code factory} and wraps it.
     *
     * @throws ArborException if the first instance cannot be built
     */
    public static <N extends Node<N>> ReconnectingFileSystem wrap(FileSystemFactory<N> factory) throws ArborException {
        return new ReconnectingFileSystem(factory);
    }

    /** A backend instance and the generation it was built in. */
    record Connection(FileSystem<?> backend, long generation) {
    }

    /** The connection a call starts on, and whether the call itself had to rebuild it. */
    private record Live(Connection connection, boolean rebuilt) {
    }

    /** A result together with the connection that produced it. */
    record Bound<T>(T value, Connection connection) {
    }

    @FunctionalInterface
    interface BackendCall<T> {
        T apply(FileSystem<?> backend) throws ArborException;
    }

    @FunctionalInterface
    interface NodeCall<T> {
        T apply(Node<?> node) throws ArborException;
    }

    // ==================== Delegation ====================

    /**
     * Runs {@code call} against the live backend, rebuilding it and retrying once if
     * the call fails with a disconnection. A call that already had to rebuild a
     * disconnected proxy before starting gets no second rebuild.
     */
    <T> Bound<T> invoke(String operation, BackendCall<T> call) throws ArborException {
        Live live = liveConnection();
        Connection current = live.connection();
        try {
            return new Bound<>(call.apply(current.backend()), current);
        } catch (ArborException e) {
            if (!current.backend().isDisconnection(e)) {
                throw e;
            }
            if (live.rebuilt()) {
                logger.warn("Disconnected during {} right after rebuilding generation {}: {}", operation,
                        current.generation(), e.getMessage());
                throw e;
            }
            logger.warn("Disconnected during {} on generation {}: {}", operation, current.generation(), e.getMessage());
            Connection fresh = reconnect(current, e);
            return new Bound<>(call.apply(fresh.backend()), fresh);
        }
    }

    <T> Bound<T> invoke(String operation, NodePath path, NodeCall<T> call) throws ArborException {
        return invoke(operation + " " + path, backend -> call.apply(backend.resolve(path)));
    }

    <T> T call(String operation, NodePath path, NodeCall<T> call) throws ArborException {
        return invoke(operation, path, call).value();
    }

    /**
     * For operations whose signatures carry no checked exceptions, such as navigation.
     */
    <T> T navigate(String operation, NodePath path, NodeCall<T> call) {
        try {
            return call(operation, path, call);
        } catch (ArborException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Live liveConnection() throws ArborException {
        if (state == ConnectionState.CONNECTED) {
            return new Live(connection, false);
        }
        lock.lock();
        try {
            if (state == ConnectionState.CONNECTED) {
                return new Live(connection, false);
            }
            if (state == ConnectionState.CLOSED) {
                throw closed();
            }
            return new Live(rebuild(null), true);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces {@code failed} with a fresh backend, unless another caller already did.
     */
    Connection reconnect(Connection failed, ArborException cause) throws ArborException {
        lock.lock();
        try {
            if (state == ConnectionState.CLOSED) {
                throw closed();
            }
            Connection current = connection;
            if (state == ConnectionState.CONNECTED && current.generation() != failed.generation()) {
                logger.debug("Generation {} already replaced by {}", failed.generation(), current.generation());
                return current;
            }
            if (state == ConnectionState.DISCONNECTED && failedGeneration == failed.generation()) {
                throw new DisconnectedException("Reconnect of generation " + failed.generation() + " already failed",
                        lastFailure);
            }
            return rebuild(cause);
        } finally {
            lock.unlock();
        }
    }

    private Connection rebuild(ArborException cause) throws ArborException {
        transition(ConnectionState.RECONNECTING);
        Connection old = connection;
        logger.info("Reconnecting {} (generation {})", old.backend(), old.generation() + 1);
        try {
            closeQuietly(old);
            Connection fresh = new Connection(factory.create(), old.generation() + 1);
            connection = fresh;
            restoreWorkingDirectory(fresh);
            reconnects.incrementAndGet();
            transition(ConnectionState.CONNECTED);
            logger.info("Reconnected {} (generation {})", fresh.backend(), fresh.generation());
            return fresh;
        } catch (ArborException e) {
            markFailed(old, e, cause);
            throw e;
        } catch (RuntimeException e) {
            markFailed(old, new DisconnectedException("Reconnect failed: " + e.getMessage(), e), cause);
            if (cause != null) {
                e.addSuppressed(cause);
            }
            throw e;
        }
    }

    private void markFailed(Connection old, ArborException failure, ArborException cause)
            throws InvalidTransitionException {
        transition(ConnectionState.DISCONNECTED);
        failedGeneration = old.generation();
        lastFailure = failure;
        if (cause != null) {
            failure.addSuppressed(cause);
        }
        logger.error("Reconnect failed: {}", failure.getMessage());
    }

    private void restoreWorkingDirectory(Connection fresh) throws ArborException {
        NodePath folder = workingDirectory;
        if (folder != null) {
            Node<?> node = fresh.backend().resolve(folder);
            WorkingDirectory<?> directory = node.as(WorkingDirectory.class);
            directory.changeTo();
            logger.debug("Restored working directory {}", folder);
        }
    }

    private void closeQuietly(Connection old) {
        try {
            old.backend().close();
        } catch (ArborException e) {
            logger.debug("Closing severed backend failed: {}", e.getMessage());
        }
    }

    private void transition(ConnectionState target) throws InvalidTransitionException {
        ConnectionState current = state;
        if (!current.canTransitionTo(target)) {
            throw new InvalidTransitionException(toString(), current, target, current.getValidTransitions());
        }
        state = target;
    }

    private InvalidTransitionException closed() {
        return new InvalidTransitionException(toString(), ConnectionState.CLOSED, ConnectionState.RECONNECTING,
                ConnectionState.CLOSED.getValidTransitions());
    }

    void changeWorkingDirectory(NodePath folder) throws ArborException {
        call("change directory", folder, node -> {
            WorkingDirectory<?> directory = node.as(WorkingDirectory.class);
            directory.changeTo();
            return null;
        });
        workingDirectory = folder;
    }

    ReconnectingNode node(NodePath path) {
        return new ReconnectingNode(this, path);
    }

    // ==================== FileSystem ====================

    @Override
    public List<ReconnectingNode> getRoots() throws ArborException {
        List<NodePath> paths = invoke("list roots", backend -> pathsOf(backend.getRoots())).value();
        List<ReconnectingNode> roots = new ArrayList<>(paths.size());
        for (NodePath path : paths) {
            roots.add(node(path));
        }
        return roots;
    }

    @Override
    public ReconnectingNode resolve(NodePath path) throws ArborException {
        return node(invoke("resolve", backend -> backend.resolve(path).getPath()).value());
    }

    @Override
    public List<MountPoint<ReconnectingNode>> getMountPoints() throws ArborException {
        List<NodePath[]> mounts = invoke("list mountpoints", backend -> {
            List<NodePath[]> pairs = new ArrayList<>();
            for (MountPoint<?> mountPoint : backend.getMountPoints()) {
                NodePath device = mountPoint.getDevice().map(d -> d.getPath()).orElse(null);
                pairs.add(new NodePath[]{mountPoint.getLocation().getPath(), device});
            }
            return pairs;
        }).value();
        List<MountPoint<ReconnectingNode>> mountPoints = new ArrayList<>(mounts.size());
        for (NodePath[] mount : mounts) {
            ReconnectingNode device = mount[1] == null ? null : node(mount[1]);
            mountPoints.add(new MountPoint<>(this, node(mount[0]), device));
        }
        return mountPoints;
    }

    @Override
    public NodePath parsePath(String path) throws ArborException {
        return invoke("parse", backend -> backend.parsePath(path)).value();
    }

    @Override
    public Optional<ReconnectingNode> getTemporaryDirectory() throws ArborException {
        Optional<NodePath> path = invoke("find temporary directory",
                backend -> backend.getTemporaryDirectory().map(n -> n.getPath())).value();
        return path.map(this::node);
    }

    @Override
    public String getSeparator() {
        return connection.backend().getSeparator();
    }

    @Override
    public ArborConfiguration getConfiguration() {
        return connection.backend().getConfiguration();
    }

    @Override
    public boolean isDisconnection(Throwable failure) {
        return connection.backend().isDisconnection(failure);
    }

    @Override
    public WriteResumeMode getWriteResumeMode() {
        return connection.backend().getWriteResumeMode();
    }

    @Override
    public void close() throws ArborException {
        lock.lock();
        try {
            if (state == ConnectionState.CLOSED) {
                return;
            }
            transition(ConnectionState.CLOSED);
            logger.info("Closing {}", connection.backend());
            connection.backend().close();
        } finally {
            lock.unlock();
        }
    }

    // ==================== Monitoring ====================

    public ConnectionState getState() {
        return state;
    }

    public long getGeneration() {
        return connection.generation();
    }

    public long getReconnectCount() {
        return reconnects.get();
    }

    /**
     * The backend instance currently in use.
     */
    public FileSystem<?> getBackend() {
        return connection.backend();
    }

    private static List<NodePath> pathsOf(List<? extends Node<?>> nodes) {
        List<NodePath> paths = new ArrayList<>(nodes.size());
        for (Node<?> node : nodes) {
            paths.add(node.getPath());
        }
        return paths;
    }

    @Override
    public String toString() {
        return "ReconnectingFileSystem{" + connection.backend() + ", generation=" + connection.generation()
                + ", state=" + state + "}";
    }
}
