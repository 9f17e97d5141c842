package com.dpstore.network;

import com.dpstore.config.ServerEndpoint;
import com.dpstore.network.protocol.BinaryProtocol;
import com.dpstore.network.protocol.Command;
import com.dpstore.network.protocol.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;

/**
 * One blocking socket to a dps-server process. Not thread-safe: a connection
 * is used by one request at a time and then handed back to its pool.
 */
public class ServerConnection {

    private static final Logger logger = LoggerFactory.getLogger(ServerConnection.class);

    private final ServerEndpoint endpoint;
    private final Socket socket;
    private final DataInputStream in;
    private final OutputStream out;
    private boolean authenticated;

    ServerConnection(ServerEndpoint endpoint, Socket socket) throws IOException {
        this.endpoint = endpoint;
        this.socket = socket;
        this.in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
        this.out = new BufferedOutputStream(socket.getOutputStream());
    }

    /**
     * Open a connection.
     *
     * @param connectTimeoutMs limit for establishing the connection
     * @param readTimeoutMs    limit for waiting on one reply
     */
    static ServerConnection open(ServerEndpoint endpoint, int connectTimeoutMs, int readTimeoutMs)
            throws IOException {
        Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.setKeepAlive(true);
            socket.setSoTimeout(readTimeoutMs);
            socket.connect(new InetSocketAddress(endpoint.getHost(), endpoint.getPort()), connectTimeoutMs);
            ServerConnection connection = new ServerConnection(endpoint, socket);
            logger.debug("Opened connection to {}", endpoint.getAddress());
            return connection;
        } catch (IOException e) {
            closeSocket(socket, endpoint);
            throw new IOException("Failed to connect to " + endpoint.getAddress() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Send one command and wait for its reply.
     *
     * @throws SocketTimeoutException if the server does not answer within the read timeout
     */
    public Response exchange(Command command) throws IOException {
        ByteBuffer frame = BinaryProtocol.encode(command);
        out.write(frame.array(), frame.arrayOffset() + frame.position(), frame.remaining());
        out.flush();
        try {
            return BinaryProtocol.readResponse(in);
        } catch (SocketTimeoutException e) {
            throw new SocketTimeoutException("No reply from " + endpoint.getAddress() + " within "
                    + socket.getSoTimeout() + "ms");
        }
    }

    public ServerEndpoint getEndpoint() {
        return endpoint;
    }

    public boolean isAuthenticated() {
        return authenticated;
    }

    public void markAuthenticated() {
        authenticated = true;
    }

    boolean isUsable() {
        return socket.isConnected() && !socket.isClosed() && !socket.isInputShutdown();
    }

    void closeQuietly() {
        closeSocket(socket, endpoint);
    }

    private static void closeSocket(Socket socket, ServerEndpoint endpoint) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing connection to {}: {}", endpoint.getAddress(), e.getMessage());
        }
    }
}
