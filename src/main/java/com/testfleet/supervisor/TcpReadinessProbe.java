package com.testfleet.supervisor;

import com.testfleet.core.model.ServiceInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;

/**
 * Ready once the published host port holds a TCP connection open.
 *
 * <p>A successful connect alone proves nothing: Docker's userland proxy accepts on the host
 * port as soon as the container starts and closes the connection when the backend is not
 * listening yet. After connecting, the probe reads once. A greeting byte (OrientDB and MySQL
 * send one) or a read timeout (silent protocols) means ready; end of stream or a reset means
 * the connection went nowhere.
 */
public class TcpReadinessProbe implements ReadinessProbe {

    private static final Logger log = LoggerFactory.getLogger(TcpReadinessProbe.class);

    private final Duration connectTimeout;
    private final Duration readTimeout;

    public TcpReadinessProbe(Duration connectTimeout) {
        this(connectTimeout, Duration.ofMillis(500));
    }

    public TcpReadinessProbe(Duration connectTimeout, Duration readTimeout) {
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
    }

    @Override
    public boolean check(ServiceInstance instance) {
        var spec = instance.spec();
        var binding = spec.bindingFor(spec.readiness().port());
        if (binding.isEmpty()) {
            log.warn("Service {} has no published port {} to probe", spec.name(), spec.readiness().port());
            return false;
        }
        String host = binding.get().connectHost();
        int port = binding.get().hostPort();
        try (var socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) connectTimeout.toMillis());
            socket.setSoTimeout((int) readTimeout.toMillis());
            try {
                if (socket.getInputStream().read() == -1) {
                    log.debug("Service {}: {}:{} closed the connection", spec.name(), host, port);
                    return false;
                }
            } catch (SocketTimeoutException silent) {
                log.trace("Service {}: {}:{} connected and silent", spec.name(), host, port);
            }
            return true;
        } catch (IOException e) {
            log.debug("Service {} not accepting on {}:{} yet: {}", spec.name(), host, port, e.getMessage());
            return false;
        }
    }
}
