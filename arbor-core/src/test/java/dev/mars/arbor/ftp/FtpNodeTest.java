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
import dev.mars.arbor.core.FileSystemFactory;
import dev.mars.arbor.core.WriteResumeMode;
import dev.mars.arbor.core.capability.WorkingDirectory;
import dev.mars.arbor.core.exceptions.ArborException;
import dev.mars.arbor.core.exceptions.DisconnectedException;
import dev.mars.arbor.core.exceptions.ErrorKind;
import dev.mars.arbor.core.exceptions.NodeAlreadyExistsException;
import dev.mars.arbor.core.exceptions.NodeNotFoundException;
import dev.mars.arbor.core.exceptions.NodePermissionException;
import dev.mars.arbor.core.exceptions.UnsupportedCapabilityException;
import dev.mars.arbor.path.NodePath;
import dev.mars.arbor.reconnect.CutOffStreams;
import dev.mars.arbor.reconnect.ReconnectingFileSystem;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPConnectionClosedException;
import org.apache.commons.net.ftp.FTPReply;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Exercises the FTP backend against a mocked commons-net client.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("FTP Node Tests")
class FtpNodeTest {

    @Mock
    private FTPClient client;

    private FtpFileSystem fs;

    @BeforeEach
    void setUp() throws Exception {
        when(client.isConnected()).thenReturn(true);
        when(client.changeWorkingDirectory(anyString())).thenReturn(false);
        when(client.changeWorkingDirectory("/")).thenReturn(true);
        when(client.getSize(anyString())).thenReturn(null);
        fs = new FtpFileSystem(client, ArborConfiguration.defaults());
    }

    private void givenFolder(String remote) throws Exception {
        when(client.changeWorkingDirectory(remote)).thenReturn(true);
    }

    private void givenFile(String remote, long size) throws Exception {
        when(client.getSize(remote)).thenReturn(Long.toString(size));
    }

    private void givenReply(int code, String text) {
        when(client.getReplyCode()).thenReturn(code);
        when(client.getReplyString()).thenReturn(code + " " + text + "\r\n");
    }

    @Nested
    @DisplayName("Reading")
    class ReadTests {

        @Test
        @DisplayName("Folders are detected with CWD, files with SIZE")
        void testKinds() throws Exception {
            givenFolder("/pub");
            givenFile("/pub/readme.txt", 12);

            assertThat(fs.resolve("/pub").isFolder()).isTrue();
            assertThat(fs.resolve("/pub/readme.txt").isFile()).isTrue();
            assertThat(fs.resolve("/pub/readme.txt").exists()).isTrue();
            assertThat(fs.resolve("/pub/missing").exists()).isFalse();
            verify(client, atLeastOnce()).changeWorkingDirectory("/");
        }

        @Test
        @DisplayName("FTP nodes are never links")
        void testNoLinks() throws ArborException {
            assertThat(fs.resolve("/pub").getLinkTarget()).isEmpty();
            assertThat(fs.resolve("/pub").supports(WorkingDirectory.class)).isFalse();
        }

        @Test
        @DisplayName("NLST entries are reduced to sorted base names")
        void testListing() throws Exception {
            givenFolder("/pub");
            when(client.listNames("/pub")).thenReturn(new String[]{"/pub/zeta", "alpha", ".", "..", "/pub/"});

            assertThat(fs.resolve("/pub").getChildNames()).containsExactly("alpha", "zeta");
        }

        @Test
        @DisplayName("A refused listing reports the server's reply")
        void testListingRefused() throws Exception {
            when(client.listNames("/secret")).thenReturn(null);
            givenReply(FTPReply.NOT_LOGGED_IN, "Not logged in");

            assertThatThrownBy(() -> fs.resolve("/secret").getChildNames())
                    .isInstanceOf(NodePermissionException.class)
                    .hasMessageContaining("NLST");
        }

        @Test
        @DisplayName("Size comes from the SIZE reply")
        void testSize() throws Exception {
            givenFile("/pub/readme.txt", 1234);
            when(client.getSize("/pub/bad")).thenReturn("lots");

            assertThat(fs.resolve("/pub/readme.txt").getSize()).isEqualTo(1234);
            assertThatThrownBy(() -> fs.resolve("/pub/missing").getSize()).isInstanceOf(NodeNotFoundException.class);
            assertThatThrownBy(() -> fs.resolve("/pub/bad").getSize())
                    .isInstanceOfSatisfying(ArborException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.IO_FAILURE));
        }

        @Test
        @DisplayName("Downloads complete the pending command once on close")
        void testDownload() throws Exception {
            when(client.retrieveFileStream("/pub/readme.txt")).thenReturn(new ByteArrayInputStream(new byte[]{1, 2}));
            when(client.completePendingCommand()).thenReturn(true);

            InputStream input = fs.resolve("/pub/readme.txt").openForReading();
            assertThat(input.readAllBytes()).containsExactly(1, 2);
            input.close();
            input.close();

            verify(client, times(1)).completePendingCommand();
        }

        @Test
        @DisplayName("A refused download maps the reply code")
        void testDownloadRefused() throws Exception {
            when(client.retrieveFileStream("/pub/gone")).thenReturn(null);
            givenReply(FTPReply.FILE_UNAVAILABLE, "No such file");

            assertThatThrownBy(() -> fs.resolve("/pub/gone").openForReading())
                    .isInstanceOf(NodeNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Writing")
    class WriteTests {

        @Test
        @DisplayName("STOR replaces and APPE appends")
        void testUpload() throws Exception {
            ByteArrayOutputStream stored = new ByteArrayOutputStream();
            ByteArrayOutputStream appended = new ByteArrayOutputStream();
            when(client.storeFileStream("/pub/out.txt")).thenReturn(stored);
            when(client.appendFileStream("/pub/out.txt")).thenReturn(appended);
            when(client.completePendingCommand()).thenReturn(true);

            fs.resolve("/pub/out.txt").write("first");
            fs.resolve("/pub/out.txt").append("second".getBytes());

            assertThat(stored.toString()).isEqualTo("first");
            assertThat(appended.toString()).isEqualTo("second");
            verify(client, times(2)).completePendingCommand();
        }

        @Test
        @DisplayName("A failed transfer completion is reported on close")
        void testUploadNotCompleted() throws Exception {
            when(client.storeFileStream("/pub/out.txt")).thenReturn(new ByteArrayOutputStream());
            when(client.completePendingCommand()).thenReturn(false);
            givenReply(FTPReply.NEED_ACCOUNT_FOR_STORING_FILES, "Need account");

            assertThatThrownBy(() -> fs.resolve("/pub/out.txt").write("x"))
                    .isInstanceOf(NodePermissionException.class)
                    .hasMessageContaining("STOR");
        }

        @Test
        @DisplayName("MKD runs only for nodes that do not exist")
        void testCreateFolder() throws Exception {
            givenFolder("/pub");
            when(client.makeDirectory("/pub/new")).thenReturn(true);

            fs.resolve("/pub/new").createFolder();
            verify(client).makeDirectory("/pub/new");

            assertThatThrownBy(() -> fs.resolve("/pub").createFolder())
                    .isInstanceOf(NodeAlreadyExistsException.class);
        }

        @Test
        @DisplayName("Folders are removed with RMD and files with DELE")
        void testDelete() throws Exception {
            givenFolder("/pub/old");
            when(client.removeDirectory("/pub/old")).thenReturn(true);
            when(client.deleteFile("/pub/a.txt")).thenReturn(true);

            fs.resolve("/pub/old").deleteJustThisThing();
            fs.resolve("/pub/a.txt").deleteJustThisThing();

            verify(client).removeDirectory("/pub/old");
            verify(client).deleteFile("/pub/a.txt");
        }

        @Test
        @DisplayName("Links cannot be created")
        void testNoLinkCreation() {
            assertThatThrownBy(() -> fs.resolve("/pub/link").linkTo("a.txt"))
                    .isInstanceOf(UnsupportedCapabilityException.class);
        }

        @Test
        @DisplayName("Partial uploads are resent")
        void testResumeMode() {
            assertThat(fs.getWriteResumeMode()).isEqualTo(WriteResumeMode.RESEND);
        }
    }

    @Nested
    @DisplayName("Connection")
    class ConnectionTests {

        @Test
        @DisplayName("A closed control connection is a disconnection")
        void testConnectionClosed() throws Exception {
            when(client.getSize("/pub/a.txt")).thenThrow(new FTPConnectionClosedException("Connection closed without indication."));

            assertThatThrownBy(() -> fs.resolve("/pub/a.txt").getSize()).isInstanceOf(DisconnectedException.class);
        }

        @Test
        @DisplayName("Service-not-available replies are disconnections")
        void testServiceNotAvailable() throws Exception {
            when(client.retrieveFileStream("/pub/a.txt")).thenReturn(null);
            givenReply(FTPReply.SERVICE_NOT_AVAILABLE, "Timeout");

            assertThatThrownBy(() -> fs.resolve("/pub/a.txt").openForReading())
                    .isInstanceOf(DisconnectedException.class);
        }

        @Test
        @DisplayName("Closing logs out once and refuses further calls")
        void testClose() throws Exception {
            fs.close();
            fs.close();

            verify(client, times(1)).logout();
            verify(client, times(1)).disconnect();
            assertThatThrownBy(() -> fs.resolve("/pub").isFolder()).isInstanceOf(DisconnectedException.class);
        }

        @Test
        @DisplayName("Paths always resolve from the root")
        void testParsePath() {
            assertThat(fs.parsePath("pub/readme.txt")).isEqualTo(NodePath.of("/", "pub", "readme.txt"));
            assertThat(fs.parsePath("/pub/../etc")).isEqualTo(NodePath.of("/", "etc"));
        }

        @Test
        @DisplayName("Connection info defaults to anonymous on port 21")
        void testConnectionInfo() throws ArborException {
            FtpConnectionInfo anonymous = FtpConnectionInfo.parse(URI.create("ftp://ftp.example.org/pub"));
            FtpConnectionInfo named = FtpConnectionInfo.parse(URI.create("ftp://bob:pw@ftp.example.org:2121"));

            assertThat(anonymous.getPort()).isEqualTo(FtpConnectionInfo.DEFAULT_PORT);
            assertThat(anonymous.getUsername()).isEqualTo(FtpConnectionInfo.ANONYMOUS);
            assertThat(named.getPort()).isEqualTo(2121);
            assertThat(named.getUsername()).isEqualTo("bob");
            assertThat(named.getPassword()).isEqualTo("pw");
            assertThatThrownBy(() -> FtpConnectionInfo.parse(URI.create("sftp://x"))).isInstanceOf(ArborException.class);
        }
    }

    @Nested
    @DisplayName("Reconnection")
    class ReconnectionTests {

        private final byte[] content = "0123456789abcdef".getBytes(StandardCharsets.US_ASCII);

        private FTPClient connectedClient() throws Exception {
            FTPClient fresh = mock(FTPClient.class);
            when(fresh.isConnected()).thenReturn(true);
            when(fresh.completePendingCommand()).thenReturn(true);
            return fresh;
        }

        private ReconnectingFileSystem proxyOver(FTPClient... clients) throws ArborException {
            Deque<FTPClient> remaining = new ArrayDeque<>(Arrays.asList(clients));
            FileSystemFactory<FtpNode> factory = () -> new FtpFileSystem(remaining.removeFirst(),
                    ArborConfiguration.defaults());
            return ReconnectingFileSystem.wrap(factory);
        }

        @Test
        @DisplayName("A download reset in mid-transfer resumes on a new connection")
        void testDownloadResumes() throws Exception {
            FTPClient first = connectedClient();
            FTPClient second = connectedClient();
            when(first.retrieveFileStream("/pub/data.bin"))
                    .thenReturn(CutOffStreams.input(content, 4, () -> new SocketException("Connection reset")));
            when(second.retrieveFileStream("/pub/data.bin")).thenReturn(new ByteArrayInputStream(content));
            ReconnectingFileSystem proxy = proxyOver(first, second);

            byte[] read;
            try (InputStream input = proxy.resolve("/pub/data.bin").openForReading()) {
                read = input.readAllBytes();
            }

            assertThat(read).isEqualTo(content);
            assertThat(proxy.getReconnectCount()).isEqualTo(1);
            verify(first).logout();
        }

        @Test
        @DisplayName("An upload reset in mid-transfer re-sends the interrupted chunk with APPE")
        void testUploadResends() throws Exception {
            FTPClient first = connectedClient();
            FTPClient second = connectedClient();
            ByteArrayOutputStream landed = new ByteArrayOutputStream();
            ByteArrayOutputStream appended = new ByteArrayOutputStream();
            when(first.storeFileStream("/pub/out.bin"))
                    .thenReturn(CutOffStreams.output(landed, 4, () -> new SocketException("Broken pipe")));
            when(second.appendFileStream("/pub/out.bin")).thenReturn(appended);
            ReconnectingFileSystem proxy = proxyOver(first, second);

            try (OutputStream output = proxy.resolve("/pub/out.bin").openForWriting(false)) {
                output.write(content, 0, 4);
                output.write(content, 4, 4);
            }

            assertThat(landed.toString(StandardCharsets.US_ASCII)).isEqualTo("0123");
            assertThat(appended.toString(StandardCharsets.US_ASCII)).isEqualTo("4567");
            assertThat(proxy.getReconnectCount()).isEqualTo(1);
        }
    }
}
