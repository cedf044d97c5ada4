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
package dev.mars.arbor.sftp;

import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpException;
import dev.mars.arbor.config.ArborConfiguration;
import dev.mars.arbor.core.FileSystem;
import dev.mars.arbor.core.FileSystemFactory;
import dev.mars.arbor.core.MountPoint;
import dev.mars.arbor.core.WriteResumeMode;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.ArborExceptions;
import dev.mars.arbor.core.exceptions.DisconnectedException;
import dev.mars.arbor.core.exceptions.NodeNotFoundException;
import dev.mars.arbor.path.NodePath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * A remote POSIX tree reached over one SFTP channel.
 *
 * <p>The channel is not safe for concurrent requests, so every call is serialized on
 * it. Once the channel drops, the instance is dead: failures surface as
 * disconnections and a {@link dev.mars.arbor.reconnect.ReconnectingFileSystem} built
 * from {@link #factory(SftpConnectionInfo, ArborConfiguration)} opens a new one.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class SftpFileSystem implements FileSystem<SftpNode> {
    private static final Logger logger = LoggerFactory.getLogger(SftpFileSystem.class);

    public static final String ROOT = "/";

    private final ChannelSftp channel;
    private final Session session;
    private final ArborConfiguration configuration;
    private volatile NodePath workingDirectory;
    private volatile boolean closed;

    /**
     * Wraps an already connected channel. {@code session} may be {@code null} when the
     * caller owns it.
     */
    public SftpFileSystem(ChannelSftp channel, Session session, ArborConfiguration configuration) {
        this.channel = channel;
        this.session = session;
        this.configuration = configuration;
    }

    public static SftpFileSystem connect(SftpConnectionInfo info, ArborConfiguration configuration)
            throws ArborException {
        logger.info("Connecting to {}", info);
        JSch jsch = new JSch();
        Session session = null;
        try {
            if (configuration.isSftpStrictHostKeyChecking()) {
                jsch.setKnownHosts(configuration.getSftpKnownHosts());
            }
            session = jsch.getSession(info.getUsername(), info.getHost(), info.getPort());
            if (info.hasPassword()) {
                session.setPassword(info.getPassword());
            }
            session.setConfig("StrictHostKeyChecking", configuration.isSftpStrictHostKeyChecking() ? "yes" : "no");
            session.setTimeout(configuration.getReadTimeoutMs());
            session.connect(configuration.getConnectionTimeoutMs());

            ChannelSftp channel = (ChannelSftp) session.openChannel("sftp");
            channel.connect(configuration.getConnectionTimeoutMs());
            logger.debug("SFTP channel open to {}:{}", info.getHost(), info.getPort());
            return new SftpFileSystem(channel, session, configuration);
        } catch (JSchException e) {
            if (session != null) {
                session.disconnect();
            }
            throw SftpErrors.translate(e, info);
        }
    }

    public static FileSystemFactory<SftpNode> factory(SftpConnectionInfo info, ArborConfiguration configuration) {
        return () -> connect(info, configuration);
    }

    @Override
    public List<SftpNode> getRoots() {
        return List.of(new SftpNode(this, NodePath.root(ROOT)));
    }

    @Override
    public SftpNode resolve(NodePath path) throws ArborException {
        if (!ROOT.equals(path.getRoot())) {
            throw new NodeNotFoundException(path, "Unknown root");
        }
        return new SftpNode(this, path);
    }

    @Override
    public List<MountPoint<SftpNode>> getMountPoints() {
        return List.of(new MountPoint<>(this, getRoot()));
    }

    @Override
    public SftpNode getRoot() {
        return getRoots().get(0);
    }

    @Override
    public NodePath parsePath(String path) throws ArborException {
        if (path.startsWith(ROOT)) {
            return NodePath.root(ROOT).resolve(path);
        }
        return getWorkingDirectoryPath().resolve(path);
    }

    @Override
    public String getSeparator() {
        return ROOT;
    }

    @Override
    public ArborConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public Optional<SftpNode> getTemporaryDirectory() throws ArborException {
        SftpNode tmp = getRoot().child("tmp");
        return tmp.isFolder() ? Optional.of(tmp) : Optional.empty();
    }

    @Override
    public WriteResumeMode getWriteResumeMode() {
        return WriteResumeMode.RECONCILE_BY_SIZE;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        channel.disconnect();
        if (session != null) {
            session.disconnect();
        }
        logger.debug("SFTP filesystem closed");
    }

    @FunctionalInterface
    interface SftpCall<T> {
        T call(ChannelSftp channel) throws SftpException;
    }

    /**
     * Runs one request on the channel, translating its failure for {@code path}.
     */
    <T> T execute(NodePath path, SftpCall<T> call) throws ArborException {
        if (closed || !channel.isConnected()) {
            throw new DisconnectedException(path, "SFTP channel is not connected", null);
        }
        synchronized (channel) {
            try {
                return call.call(channel);
            } catch (SftpException e) {
                throw SftpErrors.translate(e, path, channel.isConnected());
            }
        }
    }

    /**
     * Translates a failure of a data stream opened on the channel. A stream failure
     * after the channel dropped is a disconnection.
     */
    ArborException streamFailure(NodePath path, IOException e) {
        if (e instanceof ArborException) {
            return (ArborException) e;
        }
        boolean connected = !closed && channel.isConnected();
        if (e.getCause() instanceof SftpException) {
            return SftpErrors.translate((SftpException) e.getCause(), path, connected);
        }
        if (!connected) {
            return new DisconnectedException(path, "SFTP channel closed: " + e.getMessage(), e);
        }
        return ArborExceptions.translate(e, path);
    }

    NodePath getWorkingDirectoryPath() throws ArborException {
        NodePath current = workingDirectory;
        if (current == null) {
            NodePath root = NodePath.root(ROOT);
            String pwd = execute(root, ChannelSftp::pwd);
            current = pwd == null ? root : root.resolve(pwd);
            workingDirectory = current;
        }
        return current;
    }

    void changeWorkingDirectory(NodePath folder) throws ArborException {
        String remote = folder.format(ROOT);
        execute(folder, channel -> {
            channel.cd(remote);
            return null;
        });
        workingDirectory = folder;
    }

    @Override
    public String toString() {
        return "SftpFileSystem{connected=" + (!closed && channel.isConnected()) + "}";
    }
}
