package com.myorg.ebus.rabbitmq.connection;

import com.rabbitmq.client.AlreadyClosedException;

import java.io.IOException;

/** Faults worth retrying on a broker call: the link, not the request, failed. */
public final class ConnectivityFaults {

    private ConnectivityFaults() {
    }

    public static boolean isConnectivityFault(Throwable t) {
        // SocketException and ConnectException are IOExceptions
        return t instanceof IOException
                || t instanceof AlreadyClosedException
                || t instanceof BrokerUnreachableException;
    }
}
