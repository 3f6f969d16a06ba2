package com.lumen.server;

import com.lumen.middleware.MiddlewareCatalog;
import com.lumen.protocol.FramedJsonTransport;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Server settings, built from command line flags:
 *   --port=0 --bind=127.0.0.1 --threads=0 --max-frame=33554432
 *   --middleware=session,interruptible-eval,describe
 *
 * {@code threads=0} means a pool that grows as needed. A fixed pool must have room for
 * the accept loop, one thread per open connection and the evaluations running at once.
 */
public final class ServerConfig {

    /** Accept loop + one connection + one evaluation. */
    public static final int MIN_FIXED_THREADS = 3;

    private static final Set<String> FLAGS = new HashSet<>(Arrays.asList(
            "port", "bind", "threads", "max-frame", "middleware"));

    private final int port;
    private final String bind;
    private final int threads;
    private final int maxFrame;
    private final List<String> middleware;

    public ServerConfig(int port, String bind, int threads, int maxFrame, List<String> middleware) {
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (threads < 0) throw new IllegalArgumentException("threads must be >= 0");
        if (threads > 0 && threads < MIN_FIXED_THREADS) {
            throw new IllegalArgumentException("threads must be 0 (grow as needed) or at least " + MIN_FIXED_THREADS
                    + ": the accept loop and each connection hold a thread, leaving none to evaluate");
        }
        if (maxFrame <= 0) throw new IllegalArgumentException("max-frame must be > 0");
        this.port = port;
        this.bind = (bind == null || bind.trim().isEmpty()) ? "127.0.0.1" : bind.trim();
        this.threads = threads;
        this.maxFrame = maxFrame;
        this.middleware = Collections.unmodifiableList(new ArrayList<>(
                (middleware == null || middleware.isEmpty()) ? MiddlewareCatalog.DEFAULT_STACK : middleware));
    }

    public static ServerConfig defaults() {
        return new ServerConfig(0, "127.0.0.1", 0, FramedJsonTransport.DEFAULT_MAX_FRAME, null);
    }

    public static ServerConfig fromArgs(String... args) {
        Map<String, String> flags = parseArgs(args);
        for (String key : flags.keySet()) {
            if (!FLAGS.contains(key)) throw new IllegalArgumentException("unknown flag --" + key);
        }
        List<String> middleware = null;
        if (flags.containsKey("middleware")) {
            middleware = new ArrayList<>();
            for (String s : flags.get("middleware").split(",")) {
                if (!s.trim().isEmpty()) middleware.add(s.trim());
            }
        }
        return new ServerConfig(
                intFlag(flags, "port", 0),
                flags.get("bind"),
                intFlag(flags, "threads", 0),
                intFlag(flags, "max-frame", FramedJsonTransport.DEFAULT_MAX_FRAME),
                middleware);
    }

    public int port() { return port; }
    public String bind() { return bind; }
    public int threads() { return threads; }
    public int maxFrame() { return maxFrame; }
    public List<String> middleware() { return middleware; }

    private static int intFlag(Map<String, String> flags, String key, int def) {
        String v = flags.get(key);
        if (v == null) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + key + " expects an integer, got: " + v, e);
        }
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new LinkedHashMap<>();
        if (args == null) return out;
        for (String a : args) {
            if (a.startsWith("--") && a.contains("=")) {
                int i = a.indexOf('=');
                out.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            } else {
                throw new IllegalArgumentException("unexpected argument: " + a);
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return "ServerConfig[" + bind + ":" + port + " threads=" + threads + " maxFrame=" + maxFrame
                + " middleware=" + middleware + "]";
    }
}
