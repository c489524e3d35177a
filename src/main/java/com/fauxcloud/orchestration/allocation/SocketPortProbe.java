package com.fauxcloud.orchestration.allocation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;

/**
 * Probes a port by binding a server socket on all interfaces and closing it again.
 */
public class SocketPortProbe implements PortProbe {

    private static final Logger log = LoggerFactory.getLogger(SocketPortProbe.class);

    @Override
    public boolean isAvailable(int port) {
        try (var socket = new ServerSocket()) {
            socket.setReuseAddress(false);
            socket.bind(new InetSocketAddress(port));
            return true;
        } catch (IOException e) {
            log.debug("Port {} is bound on the host: {}", port, e.getMessage());
            return false;
        }
    }
}
