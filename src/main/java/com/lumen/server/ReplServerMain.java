package com.lumen.server;

import com.lumen.debug.Debug;

public final class ReplServerMain {

    private ReplServerMain() {}

    public static void main(String[] args) throws Exception {
        Debug.useSysOut();
        ServerConfig config = ServerConfig.fromArgs(args);
        ReplServer server = new ReplServer(config).start();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.close();
            } catch (Exception e) {
                Debug.get().w("ReplServerMain", "shutdown failed: " + e.getMessage());
            }
        }));
        System.out.println("lumen REPL server started on port " + server.port() + " on host " + config.bind());
    }
}
