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
import com.jcraft.jsch.SftpATTRS;
import com.jcraft.jsch.SftpException;
import dev.mars.arbor.core.AbstractNode;
import dev.mars.arbor.core.TranslatingInputStream;
import dev.mars.arbor.core.TranslatingOutputStream;
import dev.mars.arbor.core.capability.Listable;
import dev.mars.arbor.core.capability.Sizable;
import dev.mars.arbor.core.capability.WorkingDirectory;
import dev.mars.arbor.core.capability.Writable;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.NodeAlreadyExistsException;
import dev.mars.arbor.core.exceptions.NodeNotFoundException;
import dev.mars.arbor.path.NodePath;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Vector;

/**
 * Node of an {@link SftpFileSystem}. SFTP has no portable extended attributes, so
 * this node does not offer them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class SftpNode extends AbstractNode<SftpNode> implements Listable<SftpNode>, Sizable<SftpNode>,
        Writable<SftpNode>, WorkingDirectory<SftpNode> {

    private final SftpFileSystem fileSystem;

    SftpNode(SftpFileSystem fileSystem, NodePath path) {
        super(path);
        this.fileSystem = fileSystem;
    }

    @Override
    public SftpFileSystem getFileSystem() {
        return fileSystem;
    }

    private String remotePath() {
        return path.format(SftpFileSystem.ROOT);
    }

    @Override
    public Optional<SftpNode> getParent() {
        return path.parent().map(parent -> new SftpNode(fileSystem, parent));
    }

    @Override
    public SftpNode child(String name) {
        return new SftpNode(fileSystem, path.resolve(name));
    }

    @Override
    public List<String> getPathComponents() {
        return path.components();
    }

    @Override
    public boolean isFile() throws ArborException {
        return attributes(true).map(SftpATTRS::isReg).orElse(false);
    }

    @Override
    public boolean isFolder() throws ArborException {
        return attributes(true).map(SftpATTRS::isDir).orElse(false);
    }

    @Override
    public boolean exists() throws ArborException {
        return attributes(false).isPresent();
    }

    private Optional<SftpATTRS> attributes(boolean followLinks) throws ArborException {
        String remote = remotePath();
        return fileSystem.execute(path, channel -> {
            try {
                return Optional.of(followLinks ? channel.stat(remote) : channel.lstat(remote));
            } catch (SftpException e) {
                if (e.id == ChannelSftp.SSH_FX_NO_SUCH_FILE) {
                    return Optional.empty();
                }
                throw e;
            }
        });
    }

    @Override
    public Optional<String> getLinkTarget() throws ArborException {
        Optional<SftpATTRS> attributes = attributes(false);
        if (attributes.isEmpty() || !attributes.get().isLink()) {
            return Optional.empty();
        }
        String remote = remotePath();
        return Optional.of(fileSystem.execute(path, channel -> channel.readlink(remote)));
    }

    @Override
    public InputStream openForReading() throws ArborException {
        String remote = remotePath();
        InputStream stream = fileSystem.execute(path, channel -> channel.get(remote));
        return new TranslatingInputStream(stream, e -> fileSystem.streamFailure(path, e));
    }

    @Override
    public List<String> getChildNames() throws ArborException {
        String remote = remotePath();
        Vector<ChannelSftp.LsEntry> entries = fileSystem.execute(path, channel -> channel.ls(remote));
        List<String> names = new ArrayList<>(entries.size());
        for (ChannelSftp.LsEntry entry : entries) {
            String name = entry.getFilename();
            if (!NodePath.CURRENT.equals(name) && !NodePath.PARENT.equals(name)) {
                names.add(name);
            }
        }
        Collections.sort(names);
        return names;
    }

    @Override
    public long getSize() throws ArborException {
        SftpATTRS attributes = attributes(true).orElseThrow(() ->
                new NodeNotFoundException(path, "No such file or folder"));
        if (attributes.isDir()) {
            return Sizable.totalSize(this);
        }
        return attributes.getSize();
    }

    @Override
    public OutputStream openForWriting(boolean append) throws ArborException {
        String remote = remotePath();
        int mode = append ? ChannelSftp.APPEND : ChannelSftp.OVERWRITE;
        OutputStream stream = fileSystem.execute(path, channel -> channel.put(remote, mode));
        return new TranslatingOutputStream(stream, e -> fileSystem.streamFailure(path, e));
    }

    @Override
    public void createFolder() throws ArborException {
        String remote = remotePath();
        if (exists()) {
            throw new NodeAlreadyExistsException(path, "Already exists");
        }
        fileSystem.execute(path, channel -> {
            channel.mkdir(remote);
            return null;
        });
    }

    @Override
    public void linkTo(String target) throws ArborException {
        String remote = remotePath();
        fileSystem.execute(path, channel -> {
            channel.symlink(target, remote);
            return null;
        });
    }

    @Override
    public void deleteJustThisThing() throws ArborException {
        String remote = remotePath();
        Optional<SftpATTRS> attributes = attributes(false);
        if (attributes.isEmpty()) {
            throw new NodeNotFoundException(path, "No such file or folder");
        }
        boolean folder = attributes.get().isDir();
        fileSystem.execute(path, channel -> {
            if (folder) {
                channel.rmdir(remote);
            } else {
                channel.rm(remote);
            }
            return null;
        });
    }

    @Override
    public void changeTo() throws ArborException {
        checkFolder();
        fileSystem.changeWorkingDirectory(path);
    }

    @Override
    public SftpNode getWorkingDirectory() throws ArborException {
        return new SftpNode(fileSystem, fileSystem.getWorkingDirectoryPath());
    }
}
