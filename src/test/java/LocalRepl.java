import com.lumen.client.ReplClient;
import com.lumen.protocol.LocalTransport;
import com.lumen.server.ReplServer;
import com.lumen.server.ServerConfig;

/** A server with one in-memory client connection. */
final class LocalRepl implements AutoCloseable {

    final ReplServer server;
    final ReplClient client;

    LocalRepl() {
        this(ServerConfig.defaults());
    }

    LocalRepl(ServerConfig config) {
        server = new ReplServer(config);
        LocalTransport[] pair = LocalTransport.pair();
        Thread loop = new Thread(() -> server.serve(pair[1]), "local-connection");
        loop.setDaemon(true);
        loop.start();
        client = new ReplClient(pair[0]);
    }

    @Override
    public void close() throws Exception {
        client.close();
        server.close();
    }
}
