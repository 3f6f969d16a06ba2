package com.lumen.server;

import com.lumen.debug.Debug;
import com.lumen.eval.EvaluationEngine;
import com.lumen.middleware.MiddlewareCatalog;
import com.lumen.middleware.Pipeline;
import com.lumen.middleware.Request;
import com.lumen.protocol.FramedJsonTransport;
import com.lumen.protocol.Message;
import com.lumen.protocol.Transport;
import com.lumen.script.ScriptRuntime;
import com.lumen.session.BindingSnapshot;
import com.lumen.session.SessionRegistry;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * REPL server over framed JSON:
 * Frame = uint32_be length + UTF-8 JSON object payload
 *
 * One shared pool runs the accept loop, one receive loop per connection and the
 * sessions' evaluations. Each received message is dispatched through the current
 * {@link Pipeline} on its connection's thread; handlers hand long work to session
 * queues, so dispatch order on a connection is receive order.
 */
public final class ReplServer implements Closeable {

    private static final String TAG = "ReplServer";

    private final ServerConfig config;
    private final ExecutorService pool;
    private final SessionRegistry sessions;
    private final ScriptRuntime runtime;
    private final Pipeline pipeline;
    private final MiddlewareCatalog catalog;
    private final Set<Transport> transports = ConcurrentHashMap.newKeySet();

    private volatile boolean running = true;
    private ServerSocket serverSocket;

    public ReplServer(ServerConfig config) {
        this.config = (config == null) ? ServerConfig.defaults() : config;
        this.pool = (this.config.threads() > 0)
                ? Executors.newFixedThreadPool(this.config.threads())
                : Executors.newCachedThreadPool();
        this.runtime = new ScriptRuntime();
        this.sessions = new SessionRegistry(pool, BindingSnapshot.initial(ScriptRuntime.USER_NS));
        this.pipeline = new Pipeline();
        this.catalog = MiddlewareCatalog.standard(sessions, new EvaluationEngine(runtime), pipeline);
        try {
            pipeline.install(catalog.resolve(this.config.middleware()));
        } catch (RuntimeException e) {
            pool.shutdownNow();
            throw e;
        }
    }

    public ServerConfig config() { return config; }
    public SessionRegistry sessions() { return sessions; }
    public ScriptRuntime runtime() { return runtime; }
    public Pipeline pipeline() { return pipeline; }
    public MiddlewareCatalog catalog() { return catalog; }

    /** Bind and start accepting; returns once the socket is bound. */
    public ReplServer start() throws IOException {
        ServerSocket ss = new ServerSocket();
        ss.setReuseAddress(true);
        ss.bind(new InetSocketAddress(InetAddress.getByName(config.bind()), config.port()));
        serverSocket = ss;
        log("listening on " + config.bind() + ":" + ss.getLocalPort());
        pool.execute(this::acceptLoop);
        return this;
    }

    /** Bound port, or -1 before {@link #start()}. */
    public int port() {
        ServerSocket ss = serverSocket;
        return (ss == null) ? -1 : ss.getLocalPort();
    }

    private void acceptLoop() {
        while (running) {
            Socket s;
            try {
                s = serverSocket.accept();
            } catch (SocketException e) {
                if (running) Debug.get().w(TAG, "accept failed: " + e.getMessage());
                break;
            } catch (IOException e) {
                Debug.get().w(TAG, "accept failed: " + e.getMessage());
                continue;
            }
            try {
                s.setTcpNoDelay(true);
                FramedJsonTransport transport = new FramedJsonTransport(s, config.maxFrame());
                warnIfSaturated();
                pool.execute(() -> serve(transport));
            } catch (IOException | RejectedExecutionException e) {
                Debug.get().w(TAG, "dropping connection " + s.getRemoteSocketAddress() + ": " + e.getMessage());
                closeQuietly(s);
            }
        }
    }

    /**
     * Receive loop for one connection: dispatch every message until end-of-stream or an
     * I/O failure, then close the transport. Usable with any {@link Transport}.
     */
    public void serve(Transport transport) {
        transports.add(transport);
        log("client connected: " + transport);
        try {
            while (running) {
                Message msg = transport.receive();
                if (msg == null) break; // EOF
                try {
                    pipeline.dispatch(new Request(msg, transport));
                } catch (RuntimeException e) {
                    Debug.get().e(TAG, "unhandled error for " + msg, e);
                }
            }
        } catch (IOException e) {
            if (running) Debug.get().w(TAG, "client error " + transport + " : " + e.getMessage());
        } finally {
            transports.remove(transport);
            try {
                transport.close();
            } catch (IOException e) {
                Debug.get().w(TAG, "failed to close " + transport + ": " + e.getMessage());
            }
            log("client disconnected: " + transport);
        }
    }

    // With a fixed pool every open connection pins a thread; evaluations get what is left.
    private void warnIfSaturated() {
        int threads = config.threads();
        if (threads == 0) return;
        int free = threads - 1 - (transports.size() + 1);
        if (free <= 0) {
            Debug.get().w(TAG, "fixed pool of " + threads + " threads is saturated by " + (transports.size() + 1)
                    + " connection(s); evaluations will wait until a connection closes");
        }
    }

    private static void log(String s) {
        Debug.get().i(TAG, s);
    }

    private static void closeQuietly(Socket s) {
        try {
            s.close();
        } catch (IOException e) {
            Debug.get().w(TAG, "failed to close socket: " + e.getMessage());
        }
    }

    @Override
    public void close() throws IOException {
        running = false;
        try {
            if (serverSocket != null) serverSocket.close();
        } finally {
            for (Transport t : transports) {
                try {
                    t.close();
                } catch (IOException e) {
                    Debug.get().w(TAG, "failed to close " + t + ": " + e.getMessage());
                }
            }
            transports.clear();
            pool.shutdownNow();
            log("closed");
        }
    }
}
