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
package dev.mars.arbor.core;

import java.util.Objects;
import java.util.Optional;

/**
 * A mounted hierarchy: the node it is rooted at and, where the platform exposes
 * one, the node of its backing device. Immutable.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class MountPoint<N extends Node<N>> {

    private final FileSystem<N> fileSystem;
    private final N location;
    private final N device;

    public MountPoint(FileSystem<N> fileSystem, N location) {
        this(fileSystem, location, null);
    }

    public MountPoint(FileSystem<N> fileSystem, N location, N device) {
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
        this.location = Objects.requireNonNull(location, "location");
        this.device = device;
    }

    public FileSystem<N> getFileSystem() {
        return fileSystem;
    }

    public N getLocation() {
        return location;
    }

    public Optional<N> getDevice() {
        return Optional.ofNullable(device);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MountPoint<?> that = (MountPoint<?>) o;
        return fileSystem == that.fileSystem && location.equals(that.location) && Objects.equals(device, that.device);
    }

    @Override
    public int hashCode() {
        return Objects.hash(location, device);
    }

    @Override
    public String toString() {
        return "MountPoint{location=" + location + ", device=" + device + "}";
    }
}
