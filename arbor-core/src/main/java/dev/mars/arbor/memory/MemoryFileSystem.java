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
import dev.mars.arbor.core.FileSystem;
import dev.mars.arbor.core.MountPoint;
import dev.mars.arbor.core.WriteResumeMode;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.DisconnectedException;
import dev.mars.arbor.core.exceptions.NodeNotFoundException;
import dev.mars.arbor.path.NodePath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One session on a {@link MemoryStore}. Behaves like a connection to a remote
 * server: once severed or closed it stays dead, and every operation on it fails as
 * a disconnection.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class MemoryFileSystem implements FileSystem<MemoryNode> {
    private static final Logger logger = LoggerFactory.getLogger(MemoryFileSystem.class);

    public static final String SEPARATOR = "/";

    private final MemoryStore store;
    private final int sessionId;
    private final ArborConfiguration configuration;
    private volatile boolean connected = true;
    private volatile NodePath workingDirectory;

    MemoryFileSystem(MemoryStore store, int sessionId, ArborConfiguration configuration) {
        this.store = store;
        this.sessionId = sessionId;
        this.configuration = configuration;
        this.workingDirectory = NodePath.root(store.getRoots().get(0));
    }

    @Override
    public List<MemoryNode> getRoots() {
        List<MemoryNode> roots = new ArrayList<>();
        for (String root : store.getRoots()) {
            roots.add(new MemoryNode(this, NodePath.root(root)));
        }
        return roots;
    }

    @Override
    public MemoryNode resolve(NodePath path) throws ArborException {
        if (!store.getRoots().contains(path.getRoot())) {
            throw new NodeNotFoundException(path, "Unknown root");
        }
        return new MemoryNode(this, path);
    }

    @Override
    public List<MountPoint<MemoryNode>> getMountPoints() {
        List<MountPoint<MemoryNode>> mountPoints = new ArrayList<>();
        for (Map.Entry<NodePath, Optional<NodePath>> mount : store.getMounts().entrySet()) {
            MemoryNode device = mount.getValue().map(path -> new MemoryNode(this, path)).orElse(null);
            mountPoints.add(new MountPoint<>(this, new MemoryNode(this, mount.getKey()), device));
        }
        return mountPoints;
    }

    @Override
    public NodePath parsePath(String path) {
        String matchedRoot = null;
        for (String root : store.getRoots()) {
            if (path.startsWith(root) && (matchedRoot == null || root.length() > matchedRoot.length())) {
                matchedRoot = root;
            }
        }
        if (matchedRoot == null) {
            return workingDirectory.resolve(path);
        }
        return NodePath.root(matchedRoot).resolve(path.substring(matchedRoot.length()));
    }

    @Override
    public String getSeparator() {
        return SEPARATOR;
    }

    @Override
    public ArborConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public Optional<MemoryNode> getTemporaryDirectory() throws ArborException {
        MemoryNode tmp = getRoot().child("tmp");
        return tmp.isFolder() ? Optional.of(tmp) : Optional.empty();
    }

    @Override
    public WriteResumeMode getWriteResumeMode() {
        return store.getWriteResumeMode();
    }

    @Override
    public void close() {
        if (connected) {
            connected = false;
            logger.debug("Closed memory session {}", sessionId);
        }
    }

    public MemoryStore getStore() {
        return store;
    }

    public int getSessionId() {
        return sessionId;
    }

    public boolean isConnected() {
        return connected;
    }

    NodePath getWorkingDirectoryPath() {
        return workingDirectory;
    }

    void setWorkingDirectoryPath(NodePath path) {
        this.workingDirectory = path;
    }

    void checkConnected(NodePath path) throws DisconnectedException {
        if (!connected) {
            throw new DisconnectedException(path, "Memory session " + sessionId + " is disconnected", null);
        }
    }

    void sever() {
        connected = false;
        logger.warn("Memory session {} severed", sessionId);
    }

    @Override
    public String toString() {
        return "MemoryFileSystem{session=" + sessionId + ", connected=" + connected + "}";
    }
}
