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
import dev.mars.arbor.core.FileSystem;
import dev.mars.arbor.core.MountPoint;
import dev.mars.arbor.core.WriteResumeMode;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.ArborExceptions;
import dev.mars.arbor.core.exceptions.ErrorKind;
import dev.mars.arbor.core.exceptions.NodeNotFoundException;
import dev.mars.arbor.path.NodePath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The machine's own files, through {@code java.nio.file}.
 *
 * <p>There is one local hierarchy set per process, so one instance is usually
 * enough; {@link #getInstance()} offers a shared one. Separate instances differ only
 * in configuration and in their working directory, which each instance keeps for
 * itself rather than changing the process's.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class LocalFileSystem implements FileSystem<LocalNode> {
    private static final Logger logger = LoggerFactory.getLogger(LocalFileSystem.class);

    private final ArborConfiguration configuration;
    private final java.nio.file.FileSystem platform;
    private volatile Path workingDirectory;

    public LocalFileSystem() {
        this(new ArborConfiguration());
    }

    public LocalFileSystem(ArborConfiguration configuration) {
        this.configuration = configuration;
        this.platform = FileSystems.getDefault();
        this.workingDirectory = platform.getPath(System.getProperty("user.dir")).toAbsolutePath().normalize();
    }

    private static final class Holder {
        private static final LocalFileSystem INSTANCE = new LocalFileSystem();
    }

    /**
     * A process-wide instance with the default configuration.
     */
    public static LocalFileSystem getInstance() {
        return Holder.INSTANCE;
    }

    @Override
    public List<LocalNode> getRoots() {
        List<LocalNode> roots = new ArrayList<>();
        for (Path root : platform.getRootDirectories()) {
            roots.add(new LocalNode(this, toNodePath(root)));
        }
        return roots;
    }

    @Override
    public LocalNode resolve(NodePath path) throws ArborException {
        for (Path root : platform.getRootDirectories()) {
            if (root.toString().equals(path.getRoot())) {
                return new LocalNode(this, path);
            }
        }
        throw new NodeNotFoundException(path, "Unknown root");
    }

    /**
     * The node for a platform path, made absolute against this filesystem's working
     * directory.
     */
    public LocalNode resolve(Path path) {
        return new LocalNode(this, toNodePath(workingDirectory.resolve(path).normalize()));
    }

    @Override
    public NodePath parsePath(String path) throws ArborException {
        try {
            return toNodePath(workingDirectory.resolve(path).normalize());
        } catch (InvalidPathException e) {
            throw new ArborException(ErrorKind.INVALID_PATH, "Invalid local path: " + path, e);
        }
    }

    /**
     * One mountpoint per mount table entry, plus one for every root the table does
     * not cover. Where the table lists a location twice, the later mount wins.
     */
    @Override
    public List<MountPoint<LocalNode>> getMountPoints() throws ArborException {
        Map<NodePath, MountPoint<LocalNode>> byLocation = new LinkedHashMap<>();
        Path table = platform.getPath(configuration.getLocalMountTable());
        if (Files.isReadable(table)) {
            List<MountTable.Entry> entries;
            try {
                entries = MountTable.read(table);
            } catch (IOException e) {
                throw ArborExceptions.translate(e, null);
            }
            for (MountTable.Entry entry : entries) {
                Path location = platform.getPath(entry.location());
                if (!location.isAbsolute()) {
                    logger.debug("Skipping mount entry with relative location {}", entry.location());
                    continue;
                }
                LocalNode device = entry.device().startsWith(platform.getSeparator())
                        ? resolve(platform.getPath(entry.device()))
                        : null;
                LocalNode node = resolve(location);
                byLocation.remove(node.getPath());
                byLocation.put(node.getPath(), new MountPoint<>(this, node, device));
            }
        } else {
            logger.debug("Mount table {} is not readable; using roots only", table);
        }
        for (LocalNode root : getRoots()) {
            byLocation.putIfAbsent(root.getPath(), new MountPoint<>(this, root));
        }
        return new ArrayList<>(byLocation.values());
    }

    @Override
    public String getSeparator() {
        return platform.getSeparator();
    }

    @Override
    public ArborConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public Optional<LocalNode> getTemporaryDirectory() {
        return Optional.of(resolve(platform.getPath(System.getProperty("java.io.tmpdir"))));
    }

    @Override
    public WriteResumeMode getWriteResumeMode() {
        return WriteResumeMode.RECONCILE_BY_SIZE;
    }

    Path getWorkingDirectoryPath() {
        return workingDirectory;
    }

    void setWorkingDirectoryPath(Path folder) {
        logger.debug("Working directory changed to {}", folder);
        this.workingDirectory = folder;
    }

    Path toPlatformPath(NodePath path) {
        return platform.getPath(path.getRoot(), path.components().toArray(new String[0]));
    }

    NodePath toNodePath(Path absolute) {
        Path root = absolute.getRoot();
        if (root == null) {
            throw new IllegalArgumentException("Not an absolute path: " + absolute);
        }
        List<String> components = new ArrayList<>(absolute.getNameCount());
        for (Path name : absolute) {
            components.add(name.toString());
        }
        return NodePath.of(root.toString(), components);
    }

    @Override
    public String toString() {
        return "LocalFileSystem{workingDirectory=" + workingDirectory + "}";
    }
}
