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
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.SftpException;
import dev.mars.arbor.core.capability.Writable;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.DisconnectedException;
import dev.mars.arbor.core.exceptions.ErrorKind;
import dev.mars.arbor.core.exceptions.NodeNotFoundException;
import dev.mars.arbor.core.exceptions.NodePermissionException;
import dev.mars.arbor.core.exceptions.UnsupportedCapabilityException;
import dev.mars.arbor.path.NodePath;

/**
 * SFTP status codes and JSch failures as {@link ArborException} kinds.
 */
final class SftpErrors {

    private SftpErrors() {
    }

    /**
     * @param connected whether the channel was still up after the failure. A failure
     *                  on a dropped channel is a disconnection whatever its status code.
     */
    static ArborException translate(SftpException e, NodePath path, boolean connected) {
        if (!connected) {
            return new DisconnectedException(path, "SFTP channel closed: " + e.getMessage(), e);
        }
        switch (e.id) {
            case ChannelSftp.SSH_FX_NO_SUCH_FILE:
                return new NodeNotFoundException(path, "No such file or folder", e);
            case ChannelSftp.SSH_FX_PERMISSION_DENIED:
                return new NodePermissionException(path, "Permission denied", e);
            case ChannelSftp.SSH_FX_NO_CONNECTION:
            case ChannelSftp.SSH_FX_CONNECTION_LOST:
                return new DisconnectedException(path, "SFTP connection lost", e);
            case ChannelSftp.SSH_FX_OP_UNSUPPORTED:
                return new UnsupportedCapabilityException(path, Writable.class, "Operation not supported by server", e);
            default:
                return new ArborException(ErrorKind.IO_FAILURE, path, "SFTP failure " + e.id + ": " + e.getMessage(), e);
        }
    }

    static ArborException translate(JSchException e, SftpConnectionInfo info) {
        String message = String.valueOf(e.getMessage());
        if (message.startsWith("Auth")) {
            return new NodePermissionException(null, "SFTP authentication failed for " + info, e);
        }
        return new DisconnectedException("Cannot connect to " + info + ": " + message, e);
    }
}
