package com.envkit.devops;

import com.jcraft.jsch.*;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

public class SshUtil implements RemoteShell {
    final static Logger LOG = LogManager.getLogger(SshUtil.class);
    private static final int CONNECT_TIMEOUT_MS = 30000;

    private final String host;
    private final int port;
    private final SshCredentials credentials;
    private Session jschSession = null;

    public SshUtil(String host, int port, SshCredentials credentials) {
        this.host = host;
        this.port = port;
        this.credentials = credentials;
    }

    private Session getConnection() throws JSchException {
        if (jschSession != null && jschSession.isConnected()) {
            return jschSession;
        }
        JSch jsch = new JSch();
        if (credentials.getPrivateKeyPath() != null) {
            jsch.addIdentity(credentials.getPrivateKeyPath());
        }
        Session session = jsch.getSession(credentials.getUsername(), host, port);
        if (credentials.getPassword() != null) {
            session.setPassword(credentials.getPassword());
        }
        Properties config = new Properties();
        // ignore host key since it changes for each new cloud instance
        config.put("StrictHostKeyChecking", "no");
        session.setConfig(config);
        session.connect(CONNECT_TIMEOUT_MS);
        LOG.info("SSH session to " + credentials + "@" + host + ":" + port);
        jschSession = session;
        return session;
    }

    @Override
    public String run(String command) throws ProviderException {
        ChannelExec channel = null;
        try {
            Session session = getConnection();
            LOG.info("SSH EXEC: " + command);
            channel = (ChannelExec) session.openChannel("exec");
            channel.setCommand(command);
            channel.setInputStream(null);
            ByteArrayOutputStream err = new ByteArrayOutputStream();
            channel.setErrStream(err);
            InputStream in = channel.getInputStream();
            channel.connect();
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] tmp = new byte[1024];
            while (true) {
                while (in.available() > 0) {
                    int i = in.read(tmp, 0, 1024);
                    if (i < 0) break;
                    out.write(tmp, 0, i);
                }
                if (channel.isClosed()) {
                    if (in.available() > 0) continue;
                    break;
                }
                Thread.sleep(200L);
            }
            String output = out.toString(StandardCharsets.UTF_8);
            if (output.length() > 0) {
                LOG.info(output.trim());
            }
            int exitStatus = channel.getExitStatus();
            // non-zero is reported, not raised: "mkdir .ssh" fails on images that already have one
            if (exitStatus != 0) {
                LOG.warn("exit-status: " + exitStatus + " " + err.toString(StandardCharsets.UTF_8).trim());
            } else {
                LOG.info("exit-status: " + exitStatus);
            }
            return output;
        } catch (JSchException | IOException e) {
            throw new ProviderException("SSH command failed on " + host + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while running SSH command on " + host, e);
        } finally {
            if (channel != null) {
                channel.disconnect();
            }
        }
    }

    @Override
    public void close() {
        if (jschSession != null) {
            jschSession.disconnect();
            jschSession = null;
        }
    }
}
