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
package dev.mars.arbor.ftp;

import dev.mars.arbor.config.ArborConfiguration;
import dev.mars.arbor.core.FileSystem;
import dev.mars.arbor.core.FileSystemFactory;
import dev.mars.arbor.core.MountPoint;
import dev.mars.arbor.core.TranslatingInputStream;
import dev.mars.arbor.core.TranslatingOutputStream;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.ArborExceptions;
import dev.mars.arbor.core.exceptions.DisconnectedException;
import dev.mars.arbor.core.exceptions.ErrorKind;
import dev.mars.arbor.core.exceptions.NodeNotFoundException;
import dev.mars.arbor.core.exceptions.NodePermissionException;
import dev.mars.arbor.path.NodePath;
import org.apache.commons.net.ftp.FTP;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPConnectionClosedException;
import org.apache.commons.net.ftp.FTPReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;

/**
 * A remote tree reached over one FTP control connection.
 *
 * <p>FTP offers no links, no extended attributes and no reliable acknowledgement of
 * partially stored data, so a resumed upload resends its last chunk. While a stream
 * from this filesystem is open the control connection is busy with the transfer;
 * close the stream before issuing other requests.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class FtpFileSystem implements FileSystem<FtpNode> {
    private static final Logger logger = LoggerFactory.getLogger(FtpFileSystem.class);

    public static final String ROOT = "/";

    private final FTPClient client;
    private final ArborConfiguration configuration;
    private volatile boolean closed;

    /**
     * Wraps a client that is already connected and logged in.
     */
    public FtpFileSystem(FTPClient client, ArborConfiguration configuration) {
        this.client = client;
        this.configuration = configuration;
    }

    public static FtpFileSystem connect(FtpConnectionInfo info, ArborConfiguration configuration)
            throws ArborException {
        logger.info("Connecting to {}", info);
        FTPClient client = new FTPClient();
        client.setConnectTimeout(configuration.getConnectionTimeoutMs());
        client.setDefaultTimeout(configuration.getReadTimeoutMs());
        try {
            client.connect(info.getHost(), info.getPort());
            if (!FTPReply.isPositiveCompletion(client.getReplyCode())) {
                throw new DisconnectedException("FTP server refused connection: " + client.getReplyString().trim());
            }
            if (!client.login(info.getUsername(), info.getPassword())) {
                throw new NodePermissionException(null, "FTP login failed for " + info + ": "
                        + client.getReplyString().trim());
            }
            if (configuration.isFtpPassiveMode()) {
                client.enterLocalPassiveMode();
            }
            client.setFileType(FTP.BINARY_FILE_TYPE);
            return new FtpFileSystem(client, configuration);
        } catch (IOException e) {
            disconnectQuietly(client, e);
            if (e instanceof ArborException) {
                throw (ArborException) e;
            }
            throw new DisconnectedException("Cannot connect to " + info + ": " + e.getMessage(), e);
        }
    }

    public static FileSystemFactory<FtpNode> factory(FtpConnectionInfo info, ArborConfiguration configuration) {
        return () -> connect(info, configuration);
    }

    private static void disconnectQuietly(FTPClient client, IOException reason) {
        if (!client.isConnected()) {
            return;
        }
        try {
            client.disconnect();
        } catch (IOException e) {
            reason.addSuppressed(e);
        }
    }

    @Override
    public List<FtpNode> getRoots() {
        return List.of(new FtpNode(this, NodePath.root(ROOT)));
    }

    @Override
    public FtpNode resolve(NodePath path) throws ArborException {
        if (!ROOT.equals(path.getRoot())) {
            throw new NodeNotFoundException(path, "Unknown root");
        }
        return new FtpNode(this, path);
    }

    @Override
    public List<MountPoint<FtpNode>> getMountPoints() {
        return List.of(new MountPoint<>(this, getRoot()));
    }

    @Override
    public FtpNode getRoot() {
        return getRoots().get(0);
    }

    /**
     * Relative text is taken relative to the root; this backend keeps no working directory.
     */
    @Override
    public NodePath parsePath(String path) {
        return NodePath.root(ROOT).resolve(path);
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
    public void close() throws ArborException {
        if (closed) {
            return;
        }
        closed = true;
        synchronized (client) {
            try {
                if (client.isConnected()) {
                    client.logout();
                }
            } catch (IOException e) {
                logger.debug("FTP logout failed: {}", e.getMessage());
            } finally {
                try {
                    client.disconnect();
                } catch (IOException e) {
                    logger.debug("FTP disconnect failed: {}", e.getMessage());
                }
            }
        }
    }

    @FunctionalInterface
    interface FtpCall<T> {
        T call(FTPClient client) throws IOException;
    }

    <T> T execute(NodePath path, FtpCall<T> call) throws ArborException {
        if (closed || !client.isConnected()) {
            throw new DisconnectedException(path, "FTP connection is closed", null);
        }
        synchronized (client) {
            try {
                return call.call(client);
            } catch (IOException e) {
                throw failure(path, e);
            }
        }
    }

    /**
     * Translates a failure of the control connection or of a data stream.
     */
    ArborException failure(NodePath path, IOException e) {
        if (e instanceof FTPConnectionClosedException) {
            return new DisconnectedException(path, "FTP server closed the connection", e);
        }
        return ArborExceptions.translate(e, path);
    }

    /**
     * Turns a negative reply to the last command into an exception.
     */
    ArborException replyFailure(NodePath path, String action) {
        int code = client.getReplyCode();
        String reply = action + " failed: " + String.valueOf(client.getReplyString()).trim();
        switch (code) {
            case FTPReply.SERVICE_NOT_AVAILABLE:
                return new DisconnectedException(path, reply, null);
            case FTPReply.NOT_LOGGED_IN:
            case FTPReply.NEED_ACCOUNT_FOR_STORING_FILES:
                return new NodePermissionException(path, reply);
            case FTPReply.FILE_UNAVAILABLE:
                return new NodeNotFoundException(path, reply);
            default:
                return new ArborException(ErrorKind.IO_FAILURE, path, reply);
        }
    }

    InputStream download(NodePath path) throws ArborException {
        String remote = path.format(ROOT);
        InputStream stream = execute(path, ftp -> ftp.retrieveFileStream(remote));
        if (stream == null) {
            throw replyFailure(path, "RETR");
        }
        return new TranslatingInputStream(stream, e -> failure(path, e)) {
            private boolean done;

            @Override
            public void close() throws IOException {
                if (done) {
                    return;
                }
                done = true;
                super.close();
                completeTransfer(path, "RETR");
            }
        };
    }

    OutputStream upload(NodePath path, boolean append) throws ArborException {
        String remote = path.format(ROOT);
        OutputStream stream = execute(path, ftp -> append ? ftp.appendFileStream(remote) : ftp.storeFileStream(remote));
        if (stream == null) {
            throw replyFailure(path, append ? "APPE" : "STOR");
        }
        return new TranslatingOutputStream(stream, e -> failure(path, e)) {
            private boolean done;

            @Override
            public void close() throws IOException {
                if (done) {
                    return;
                }
                done = true;
                super.close();
                completeTransfer(path, append ? "APPE" : "STOR");
            }
        };
    }

    private void completeTransfer(NodePath path, String action) throws ArborException {
        boolean completed = execute(path, FTPClient::completePendingCommand);
        if (!completed) {
            throw replyFailure(path, action);
        }
    }

    @Override
    public String toString() {
        return "FtpFileSystem{connected=" + (!closed && client.isConnected()) + "}";
    }
}
