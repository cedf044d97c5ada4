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
package dev.mars.arbor.url;

import dev.mars.arbor.core.AbstractNode;
import dev.mars.arbor.core.TranslatingInputStream;
import dev.mars.arbor.core.capability.Hierarchy;
import dev.mars.arbor.core.capability.Readable;
import dev.mars.arbor.core.capability.Sizable;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.ArborExceptions;
import dev.mars.arbor.core.exceptions.DisconnectedException;
import dev.mars.arbor.path.NodePath;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Node of a {@link UrlFileSystem}. HTTP has no listing, so no node is ever a folder.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class UrlNode extends AbstractNode<UrlNode> implements Hierarchy<UrlNode>, Readable<UrlNode>, Sizable<UrlNode> {

    private static final int BUFFER_SIZE = 8192;

    private final UrlFileSystem fileSystem;

    UrlNode(UrlFileSystem fileSystem, NodePath path) {
        super(path);
        this.fileSystem = fileSystem;
    }

    @Override
    public UrlFileSystem getFileSystem() {
        return fileSystem;
    }

    public URI toUri() throws ArborException {
        return fileSystem.toUri(path);
    }

    @Override
    public Optional<UrlNode> getParent() {
        return path.parent().map(parent -> new UrlNode(fileSystem, parent));
    }

    /**
     * Also accepts an absolute URL, which may lead to another origin.
     */
    @Override
    public UrlNode child(String name) {
        if (name.startsWith("http://") || name.startsWith("https://")) {
            try {
                return new UrlNode(fileSystem, fileSystem.parsePath(name));
            } catch (ArborException e) {
                throw new IllegalArgumentException(e.getMessage(), e);
            }
        }
        return new UrlNode(fileSystem, path.resolve(name));
    }

    @Override
    public List<String> getPathComponents() {
        return path.components();
    }

    private static final class Probe {
        final int status;
        final String location;
        final long contentLength;

        Probe(int status, String location, long contentLength) {
            this.status = status;
            this.location = location;
            this.contentLength = contentLength;
        }

        boolean isSuccess() {
            return status >= 200 && status < 300;
        }

        boolean isRedirect() {
            return status >= 300 && status < 400 && location != null;
        }

        boolean isAbsent() {
            return status == HttpURLConnection.HTTP_NOT_FOUND || status == HttpURLConnection.HTTP_GONE;
        }
    }

    private Probe probe() throws ArborException {
        HttpURLConnection connection = fileSystem.open(path, "HEAD");
        try {
            int status = connection.getResponseCode();
            Probe probe = new Probe(status, connection.getHeaderField("Location"), connection.getContentLengthLong());
            if (probe.isSuccess() || probe.isRedirect() || probe.isAbsent()) {
                return probe;
            }
            throw UrlFileSystem.statusFailure(path, status);
        } catch (IOException e) {
            throw ArborExceptions.translate(e, path);
        } finally {
            connection.disconnect();
        }
    }

    @Override
    public boolean exists() throws ArborException {
        return !probe().isAbsent();
    }

    @Override
    public boolean isFile() throws ArborException {
        return dereference(true).probe().isSuccess();
    }

    @Override
    public boolean isFolder() {
        return false;
    }

    /**
     * The absolute target of a redirect answer.
     */
    @Override
    public Optional<String> getLinkTarget() throws ArborException {
        Probe probe = probe();
        if (!probe.isRedirect()) {
            return Optional.empty();
        }
        return Optional.of(toUri().resolve(probe.location).toString());
    }

    @Override
    public InputStream openForReading() throws ArborException {
        UrlNode target = dereference(true);
        HttpURLConnection connection = fileSystem.open(target.path, "GET");
        try {
            int status = connection.getResponseCode();
            if (status < 200 || status >= 300) {
                connection.disconnect();
                throw UrlFileSystem.statusFailure(target.path, status);
            }
            NodePath source = target.path;
            return new TranslatingInputStream(connection.getInputStream(), failure -> bodyFailure(source, failure));
        } catch (IOException e) {
            connection.disconnect();
            throw ArborExceptions.translate(e, target.path);
        }
    }

    /**
     * Once the status line has arrived, a failing body means the connection broke off.
     */
    private static ArborException bodyFailure(NodePath path, IOException failure) {
        if (failure instanceof ArborException) {
            return (ArborException) failure;
        }
        return new DisconnectedException(path, "Response body cut off: " + failure.getMessage(), failure);
    }

    /**
     * {@code Content-Length} where the server sends one; otherwise the body is read and counted.
     */
    @Override
    public long getSize() throws ArborException {
        UrlNode target = dereference(true);
        Probe probe = target.probe();
        if (probe.isAbsent()) {
            throw UrlFileSystem.statusFailure(target.path, probe.status);
        }
        if (probe.contentLength >= 0) {
            return probe.contentLength;
        }
        long total = 0;
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = target.openForReading()) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                total += read;
            }
        } catch (IOException e) {
            throw ArborExceptions.translate(e, target.path);
        }
        return total;
    }
}
