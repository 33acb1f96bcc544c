package com.envkit.devops;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class SshdWaiterTest {

    @Test
    public void returnsOnceTheBannerIsSeen() throws Exception {
        try (ServerSocket server = new ServerSocket(0)) {
            Thread sshd = new Thread(() -> {
                try (Socket client = server.accept()) {
                    OutputStream out = client.getOutputStream();
                    out.write("SSH-2.0-OpenSSH_8.9\r\n".getBytes(StandardCharsets.US_ASCII));
                    out.flush();
                } catch (IOException e) {
                    // test finished
                }
            });
            sshd.start();
            new SshdWaiter(10L).waitForShell("127.0.0.1", server.getLocalPort(), 10);
            sshd.join(5000L);
        }
    }

    @Test
    public void failsWhenNothingListens() throws IOException {
        int port;
        try (ServerSocket free = new ServerSocket(0)) {
            port = free.getLocalPort();
        }
        SshdWaiter waiter = new SshdWaiter(50L);
        UnreachableException e = assertThrows(UnreachableException.class,
                () -> waiter.waitForShell("127.0.0.1", port, 1));
        assertTrue(e.getMessage().contains("127.0.0.1:" + port));
    }

    @Test
    public void aSilentPortIsNotAShell() throws Exception {
        try (ServerSocket server = new ServerSocket(0)) {
            Thread silent = new Thread(() -> {
                try (Socket client = server.accept()) {
                    client.getOutputStream().write("HTTP/1.1 400\r\n".getBytes(StandardCharsets.US_ASCII));
                } catch (IOException e) {
                    // test finished
                }
            });
            silent.start();
            assertFalse(new SshdWaiter(10L).isSshdListening("127.0.0.1", server.getLocalPort()));
            silent.join(5000L);
        }
    }
}
