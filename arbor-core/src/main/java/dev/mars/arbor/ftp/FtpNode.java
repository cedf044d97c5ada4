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

import dev.mars.arbor.core.AbstractNode;
import dev.mars.arbor.core.capability.Listable;
import dev.mars.arbor.core.capability.Sizable;
import dev.mars.arbor.core.capability.Writable;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.ErrorKind;
import dev.mars.arbor.core.exceptions.NodeAlreadyExistsException;
import dev.mars.arbor.core.exceptions.NodeNotFoundException;
import dev.mars.arbor.core.exceptions.UnsupportedCapabilityException;
import dev.mars.arbor.path.NodePath;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Node of an {@link FtpFileSystem}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class FtpNode extends AbstractNode<FtpNode> implements Listable<FtpNode>, Sizable<FtpNode>, Writable<FtpNode> {

    private final FtpFileSystem fileSystem;

    FtpNode(FtpFileSystem fileSystem, NodePath path) {
        super(path);
        this.fileSystem = fileSystem;
    }

    @Override
    public FtpFileSystem getFileSystem() {
        return fileSystem;
    }

    private String remotePath() {
        return path.format(FtpFileSystem.ROOT);
    }

    @Override
    public Optional<FtpNode> getParent() {
        return path.parent().map(parent -> new FtpNode(fileSystem, parent));
    }

    @Override
    public FtpNode child(String name) {
        return new FtpNode(fileSystem, path.resolve(name));
    }

    @Override
    public List<String> getPathComponents() {
        return path.components();
    }

    // CWD is the only portable way to ask whether something is a folder.
    @Override
    public boolean isFolder() throws ArborException {
        String remote = remotePath();
        return fileSystem.execute(path, ftp -> {
            boolean folder = ftp.changeWorkingDirectory(remote);
            if (folder) {
                ftp.changeWorkingDirectory(FtpFileSystem.ROOT);
            }
            return folder;
        });
    }

    @Override
    public boolean isFile() throws ArborException {
        return !isFolder() && remoteSize() != null;
    }

    @Override
    public boolean exists() throws ArborException {
        return isFolder() || remoteSize() != null;
    }

    private String remoteSize() throws ArborException {
        String remote = remotePath();
        return fileSystem.execute(path, ftp -> ftp.getSize(remote));
    }

    @Override
    public Optional<String> getLinkTarget() {
        return Optional.empty();
    }

    @Override
    public InputStream openForReading() throws ArborException {
        return fileSystem.download(path);
    }

    @Override
    public List<String> getChildNames() throws ArborException {
        String remote = remotePath();
        String[] listed = fileSystem.execute(path, ftp -> ftp.listNames(remote));
        if (listed == null) {
            throw fileSystem.replyFailure(path, "NLST");
        }
        List<String> names = new ArrayList<>(listed.length);
        for (String entry : listed) {
            // some servers answer NLST with full paths
            String name = entry.substring(entry.lastIndexOf('/') + 1);
            if (!name.isEmpty() && !NodePath.CURRENT.equals(name) && !NodePath.PARENT.equals(name)) {
                names.add(name);
            }
        }
        Collections.sort(names);
        return names;
    }

    @Override
    public long getSize() throws ArborException {
        if (isFolder()) {
            return Sizable.totalSize(this);
        }
        String size = remoteSize();
        if (size == null) {
            throw new NodeNotFoundException(path, "No such file or folder");
        }
        try {
            return Long.parseLong(size.trim());
        } catch (NumberFormatException e) {
            throw new ArborException(ErrorKind.IO_FAILURE, path, "Unparseable SIZE reply: " + size, e);
        }
    }

    @Override
    public OutputStream openForWriting(boolean append) throws ArborException {
        return fileSystem.upload(path, append);
    }

    @Override
    public void createFolder() throws ArborException {
        if (exists()) {
            throw new NodeAlreadyExistsException(path, "Already exists");
        }
        String remote = remotePath();
        if (!fileSystem.execute(path, ftp -> ftp.makeDirectory(remote))) {
            throw fileSystem.replyFailure(path, "MKD");
        }
    }

    @Override
    public void linkTo(String target) throws ArborException {
        throw new UnsupportedCapabilityException(path, Writable.class, "FTP has no links");
    }

    @Override
    public void deleteJustThisThing() throws ArborException {
        String remote = remotePath();
        boolean folder = isFolder();
        boolean deleted = fileSystem.execute(path, ftp -> folder ? ftp.removeDirectory(remote) : ftp.deleteFile(remote));
        if (!deleted) {
            throw fileSystem.replyFailure(path, folder ? "RMD" : "DELE");
        }
    }
}
