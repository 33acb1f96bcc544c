package com.envkit.devops;

import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Polls a TCP port until an SSH daemon greets with its protocol banner. An open port alone is not enough:
 * freshly booted images often accept connections before sshd is able to talk.
 */
public class SshdWaiter implements ShellWaiter {
    final static Logger LOG = LogManager.getLogger(SshdWaiter.class);
    private static final int SOCKET_TIMEOUT_MS = 3000;

    private final long intervalMillis;

    public SshdWaiter() {
        this(5000L);
    }

    public SshdWaiter(long intervalMillis) {
        this.intervalMillis = intervalMillis;
    }

    @Override
    public void waitForShell(String host, int port, int timeoutSeconds) throws UnreachableException {
        long stm = System.currentTimeMillis();
        long deadline = stm + timeoutSeconds * 1000L;
        int count = 0;
        while (true) {
            count++;
            if (isSshdListening(host, port)) {
                LOG.info("Time (ms) for sshd on " + host + ":" + port + " to come up: " + (System.currentTimeMillis() - stm));
                return;
            }
            if (System.currentTimeMillis() + intervalMillis > deadline) {
                throw new UnreachableException("No SSH service on " + host + ":" + port + " after "
                        + timeoutSeconds + "s (" + count + " attempts)");
            }
            LOG.info(">>> waiting for sshd on " + host + ":" + port + ", attempt " + count);
            try {
                Thread.sleep(intervalMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UnreachableException("Interrupted while waiting for " + host + ":" + port, e);
            }
        }
    }

    boolean isSshdListening(String host, int port) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), SOCKET_TIMEOUT_MS);
            socket.setSoTimeout(SOCKET_TIMEOUT_MS);
            BufferedReader reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.US_ASCII));
            String banner = reader.readLine();
            return banner != null && banner.startsWith("SSH");
        } catch (IOException e) {
            LOG.debug("sshd probe " + host + ":" + port + " failed: " + e.getMessage());
            return false;
        }
    }
}
