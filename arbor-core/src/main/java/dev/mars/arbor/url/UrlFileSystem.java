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

import dev.mars.arbor.config.ArborConfiguration;
import dev.mars.arbor.core.FileSystem;
import dev.mars.arbor.core.MountPoint;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.ArborExceptions;
import dev.mars.arbor.core.exceptions.ErrorKind;
import dev.mars.arbor.core.exceptions.NodeNotFoundException;
import dev.mars.arbor.core.exceptions.NodePermissionException;
import dev.mars.arbor.path.NodePath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Read-only view of HTTP and HTTPS resources.
 *
 * <p>Every origin ({@code scheme://host:port}) is a root, registered the first time a
 * path on it is resolved. Redirects are not followed transparently: a 3xx answer
 * makes the node a link to its {@code Location}, which may point at another origin
 * of this same filesystem. No credentials are ever sent. Query strings and fragments
 * are not part of a node's path.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class UrlFileSystem implements FileSystem<UrlNode> {
    private static final Logger logger = LoggerFactory.getLogger(UrlFileSystem.class);

    public static final String SEPARATOR = "/";

    private final ArborConfiguration configuration;
    private final Set<String> origins = Collections.synchronizedSet(new LinkedHashSet<>());

    public UrlFileSystem() {
        this(new ArborConfiguration());
    }

    public UrlFileSystem(ArborConfiguration configuration) {
        this.configuration = configuration;
    }

    /**
     * Known origins in the order they were first seen. Empty until something is resolved.
     */
    @Override
    public List<UrlNode> getRoots() {
        List<UrlNode> roots = new ArrayList<>();
        synchronized (origins) {
            for (String origin : origins) {
                roots.add(new UrlNode(this, NodePath.root(origin)));
            }
        }
        return roots;
    }

    @Override
    public UrlNode getRoot() throws ArborException {
        List<UrlNode> roots = getRoots();
        if (roots.isEmpty()) {
            throw new ArborException(ErrorKind.NOT_FOUND, "No URL has been resolved yet");
        }
        return roots.get(0);
    }

    @Override
    public UrlNode resolve(NodePath path) throws ArborException {
        URI origin = parseUri(path.getRoot());
        register(originOf(origin));
        return new UrlNode(this, NodePath.of(originOf(origin), path.components()));
    }

    public UrlNode resolve(URI uri) throws ArborException {
        return new UrlNode(this, toNodePath(uri));
    }

    @Override
    public List<MountPoint<UrlNode>> getMountPoints() {
        List<MountPoint<UrlNode>> mountPoints = new ArrayList<>();
        for (UrlNode root : getRoots()) {
            mountPoints.add(new MountPoint<>(this, root));
        }
        return mountPoints;
    }

    /**
     * Accepts absolute {@code http} and {@code https} URLs only; there is no working directory.
     */
    @Override
    public NodePath parsePath(String path) throws ArborException {
        return toNodePath(parseUri(path));
    }

    @Override
    public String getSeparator() {
        return SEPARATOR;
    }

    @Override
    public ArborConfiguration getConfiguration() {
        return configuration;
    }

    NodePath toNodePath(URI uri) throws ArborException {
        String origin = originOf(uri);
        register(origin);
        String rawPath = uri.getPath() == null ? "" : uri.getPath();
        return NodePath.root(origin).resolve(rawPath);
    }

    URI toUri(NodePath path) throws ArborException {
        URI origin = parseUri(path.getRoot());
        String joined = SEPARATOR + String.join(SEPARATOR, path.components());
        try {
            return new URI(origin.getScheme(), null, origin.getHost(), origin.getPort(), joined, null, null);
        } catch (URISyntaxException e) {
            throw new ArborException(ErrorKind.INVALID_PATH, path, "Cannot form URL", e);
        }
    }

    private void register(String origin) {
        if (origins.add(origin)) {
            logger.debug("Registered URL origin {}", origin);
        }
    }

    private static URI parseUri(String text) throws ArborException {
        URI uri;
        try {
            uri = new URI(text);
        } catch (URISyntaxException e) {
            throw new ArborException(ErrorKind.INVALID_PATH, "Not a URL: " + text, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new ArborException(ErrorKind.INVALID_PATH, "Only http and https URLs are supported: " + text);
        }
        if (uri.getHost() == null) {
            throw new ArborException(ErrorKind.INVALID_PATH, "URL must specify a host: " + text);
        }
        return uri;
    }

    private static String originOf(URI uri) {
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        if (port == -1) {
            port = scheme.equals("https") ? 443 : 80;
        }
        return scheme + "://" + uri.getHost().toLowerCase(Locale.ROOT) + ":" + port;
    }

    /**
     * Opens a request without following redirects.
     */
    HttpURLConnection open(NodePath path, String method) throws ArborException {
        URI uri = toUri(path);
        try {
            HttpURLConnection connection = (HttpURLConnection) uri.toURL().openConnection();
            connection.setRequestMethod(method);
            connection.setInstanceFollowRedirects(false);
            connection.setConnectTimeout(configuration.getConnectionTimeoutMs());
            connection.setReadTimeout(configuration.getReadTimeoutMs());
            connection.setRequestProperty("User-Agent", "Arbor/1.0");
            return connection;
        } catch (IOException e) {
            throw ArborExceptions.translate(e, path);
        }
    }

    /**
     * Error for a status code that is neither success, redirect nor absence.
     */
    static ArborException statusFailure(NodePath path, int status) {
        if (status == HttpURLConnection.HTTP_UNAUTHORIZED || status == HttpURLConnection.HTTP_FORBIDDEN) {
            return new NodePermissionException(path, "HTTP " + status);
        }
        if (status == HttpURLConnection.HTTP_NOT_FOUND || status == HttpURLConnection.HTTP_GONE) {
            return new NodeNotFoundException(path, "HTTP " + status);
        }
        return new ArborException(ErrorKind.IO_FAILURE, path, "HTTP " + status);
    }

    @Override
    public String toString() {
        return "UrlFileSystem{origins=" + origins + "}";
    }
}
