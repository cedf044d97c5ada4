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
package dev.mars.arbor.core.exceptions;

import dev.mars.arbor.path.NodePath;

import java.io.IOException;
import java.net.SocketException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.NotLinkException;

/**
 * Maps platform and client exceptions onto {@link ArborException} kinds.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class ArborExceptions {

    private ArborExceptions() {
    }

    /**
     * Converts an I/O failure on {@code path}. Arbor exceptions pass through untouched.
     */
    public static ArborException translate(IOException e, NodePath path) {
        if (e instanceof ArborException) {
            return (ArborException) e;
        }
        if (e instanceof NoSuchFileException) {
            return new NodeNotFoundException(path, "No such file or folder", e);
        }
        if (e instanceof FileAlreadyExistsException) {
            return new NodeAlreadyExistsException(path, "Already exists", e);
        }
        if (e instanceof AccessDeniedException) {
            return new NodePermissionException(path, "Permission denied", e);
        }
        if (e instanceof FileSystemLoopException) {
            return new BrokenLinkException(path, "Too many levels of links", e);
        }
        if (e instanceof NotDirectoryException) {
            return new ArborException(ErrorKind.IO_FAILURE, path, "Not a folder", e);
        }
        if (e instanceof NotLinkException) {
            return new ArborException(ErrorKind.IO_FAILURE, path, "Not a link", e);
        }
        if (e instanceof DirectoryNotEmptyException) {
            return new ArborException(ErrorKind.IO_FAILURE, path, "Folder is not empty", e);
        }
        if (e instanceof SocketException) {
            return new DisconnectedException(path, "Connection lost: " + e.getMessage(), e);
        }
        return new ArborException(ErrorKind.IO_FAILURE, path, String.valueOf(e.getMessage()), e);
    }

    /**
     * True if {@code t} or any of its causes is a disconnection.
     */
    public static boolean isDisconnection(Throwable t) {
        for (Throwable current = t; current != null; current = current.getCause()) {
            if (current instanceof ArborException
                    && ((ArborException) current).getKind() == ErrorKind.DISCONNECTED) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    /**
     * True if {@code t} is an {@link ArborException} of the given kind.
     */
    public static boolean isKind(Throwable t, ErrorKind kind) {
        return t instanceof ArborException && ((ArborException) t).getKind() == kind;
    }
}
