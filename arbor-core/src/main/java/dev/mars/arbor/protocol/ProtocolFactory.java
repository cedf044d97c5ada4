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
package dev.mars.arbor.protocol;

import dev.mars.arbor.config.ArborConfiguration;
import dev.mars.arbor.core.FileSystem;
import dev.mars.arbor.core.FileSystemFactory;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.ErrorKind;
import dev.mars.arbor.ftp.FtpConnectionInfo;
import dev.mars.arbor.ftp.FtpFileSystem;
import dev.mars.arbor.local.LocalFileSystem;
import dev.mars.arbor.local.LocalNode;
import dev.mars.arbor.reconnect.ReconnectingFileSystem;
import dev.mars.arbor.sftp.SftpConnectionInfo;
import dev.mars.arbor.sftp.SftpFileSystem;
import dev.mars.arbor.url.UrlFileSystem;
import dev.mars.arbor.url.UrlNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of backends by URI scheme.
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * ProtocolFactory protocols = new ProtocolFactory(configuration);
 * try (FileSystem<?> fs = protocols.open(URI.create("sftp://deploy@build-host/"))) {
 *     ...
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ProtocolFactory {
    private static final Logger logger = LoggerFactory.getLogger(ProtocolFactory.class);

    private final Map<String, FileSystemProvider> providers = new ConcurrentHashMap<>();
    private final ArborConfiguration configuration;

    public ProtocolFactory() {
        this(new ArborConfiguration());
    }

    public ProtocolFactory(ArborConfiguration configuration) {
        this.configuration = configuration;
        registerDefaultProviders();
    }

    private void registerDefaultProviders() {
        registerProvider(provider("file", false, (uri, config) -> localFactory(config)));
        registerProvider(provider("sftp", true, (uri, config) -> {
            SftpConnectionInfo info = SftpConnectionInfo.parse(uri);
            return SftpFileSystem.factory(info, config);
        }));
        registerProvider(provider("ftp", true, (uri, config) -> {
            FtpConnectionInfo info = FtpConnectionInfo.parse(uri);
            return FtpFileSystem.factory(info, config);
        }));

        FileSystemProvider url = provider("http", false, (uri, config) -> urlFactory(config));
        registerProvider(url);
        registerProviderAlias("https", url);

        logger.info("Registered default providers: {}", getSupportedSchemes());
    }

    public void registerProvider(FileSystemProvider provider) {
        providers.put(provider.getScheme().toLowerCase(Locale.ROOT), provider);
        logger.debug("Registered provider: {}", provider.getScheme());
    }

    public void registerProviderAlias(String alias, FileSystemProvider provider) {
        providers.put(alias.toLowerCase(Locale.ROOT), provider);
        logger.debug("Registered provider alias: {} -> {}", alias, provider.getScheme());
    }

    public void unregisterProvider(String scheme) {
        if (scheme != null && providers.remove(scheme.toLowerCase(Locale.ROOT)) != null) {
            logger.debug("Unregistered provider: {}", scheme);
        }
    }

    public FileSystemProvider getProvider(String scheme) {
        return scheme == null ? null : providers.get(scheme.toLowerCase(Locale.ROOT));
    }

    public boolean isSchemeSupported(String scheme) {
        return getProvider(scheme) != null;
    }

    public Set<String> getSupportedSchemes() {
        return new TreeSet<>(providers.keySet());
    }

    /**
     * Connects to the backend the URI names. Session-based backends come wrapped in a
     * {@link ReconnectingFileSystem} unless reconnection is disabled.
     *
     * @throws ArborException {@link ErrorKind#UNSUPPORTED_OPERATION} for an unknown scheme,
     *                        or whatever connecting raised
     */
    public FileSystem<?> open(URI uri) throws ArborException {
        FileSystemProvider provider = getProvider(uri.getScheme());
        if (provider == null) {
            throw new ArborException(ErrorKind.UNSUPPORTED_OPERATION, "No provider for scheme: " + uri.getScheme());
        }
        FileSystemFactory<?> factory = provider.factory(uri, configuration);
        if (provider.isSessionBased() && configuration.isReconnectEnabled()) {
            logger.debug("Opening {} with reconnection", uri.getScheme());
            return ReconnectingFileSystem.wrap(factory);
        }
        return factory.create();
    }

    private static FileSystemFactory<LocalNode> localFactory(ArborConfiguration configuration) {
        return () -> new LocalFileSystem(configuration);
    }

    private static FileSystemFactory<UrlNode> urlFactory(ArborConfiguration configuration) {
        return () -> new UrlFileSystem(configuration);
    }

    @FunctionalInterface
    private interface FactoryBuilder {
        FileSystemFactory<?> build(URI uri, ArborConfiguration configuration) throws ArborException;
    }

    private static FileSystemProvider provider(String scheme, boolean sessionBased, FactoryBuilder builder) {
        return new FileSystemProvider() {
            @Override
            public String getScheme() {
                return scheme;
            }

            @Override
            public boolean isSessionBased() {
                return sessionBased;
            }

            @Override
            public FileSystemFactory<?> factory(URI uri, ArborConfiguration configuration) throws ArborException {
                return builder.build(uri, configuration);
            }

            @Override
            public String toString() {
                return "FileSystemProvider{" + scheme + "}";
            }
        };
    }
}
