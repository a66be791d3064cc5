package com.gateway.protocol;

import com.gateway.exception.GatewayException;
import com.gateway.exception.TransportConnectionException;
import com.gateway.exception.TransportTimeoutException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;
import reactor.core.Exceptions;

/**
 * Maps library and I/O failures onto the gateway's transport error kinds by walking the
 * cause chain. Timeouts win over connection failures because Netty's connect timeout is
 * itself a {@link ConnectException}.
 */
public final class TransportErrors {

    private TransportErrors() {
    }

    public static GatewayException translate(String target, Throwable error) {
        Throwable root = Exceptions.unwrap(error);
        if (root instanceof GatewayException gatewayException) {
            return gatewayException;
        }
        for (Throwable t = root; t != null; t = t.getCause()) {
            if (isTimeout(t)) {
                return new TransportTimeoutException("Call to " + target + " timed out", error);
            }
        }
        for (Throwable t = root; t != null; t = t.getCause()) {
            if (t instanceof UnknownHostException) {
                return new TransportConnectionException(TransportConnectionException.Reason.UNKNOWN_HOST,
                        "Unknown host for " + target + ": " + t.getMessage(), error);
            }
            if (t instanceof ConnectException) {
                return new TransportConnectionException(TransportConnectionException.Reason.CONNECTION_REFUSED,
                        "Connection refused by " + target, error);
            }
        }
        return new TransportConnectionException(TransportConnectionException.Reason.IO,
                "Transport failure calling " + target + ": " + root.getMessage(), error);
    }

    private static boolean isTimeout(Throwable t) {
        return t instanceof TimeoutException
                || t instanceof SocketTimeoutException
                || t instanceof io.netty.handler.timeout.TimeoutException
                || t instanceof io.netty.channel.ConnectTimeoutException;
    }
}
