package com.hdlcov.instrument.catalog;

import com.google.common.flogger.GoogleLogger;
import com.hdlcov.proto.CatalogProto.ModuleCatalog;
import com.hdlcov.proto.CatalogProto.SubscribeRequest;
import com.hdlcov.proto.CoverageCatalogServiceGrpc;
import io.grpc.Server;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import io.grpc.netty.shaded.io.netty.channel.EventLoopGroup;
import io.grpc.netty.shaded.io.netty.channel.epoll.Epoll;
import io.grpc.netty.shaded.io.netty.channel.epoll.EpollEventLoopGroup;
import io.grpc.netty.shaded.io.netty.channel.epoll.EpollServerDomainSocketChannel;
import io.grpc.netty.shaded.io.netty.channel.unix.DomainSocketAddress;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Streams module catalogs to subscribers.
 *
 * <p>A subscriber first receives the latest catalog of every module published before it
 * connected, then each new one as it is published. Only the latest catalog per module is kept for
 * replay, so the replay set is bounded by the number of distinct modules.
 */
public final class CatalogServer {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private final Set<StreamObserver<ModuleCatalog>> observers =
            Collections.newSetFromMap(new ConcurrentHashMap<>());
    private final Map<String, ModuleCatalog> published = new LinkedHashMap<>();
    private final Path socketPath;

    private Server server;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    private CatalogServer(Path socketPath) {
        this.socketPath = socketPath;
    }

    /** Starts a server on a unix domain socket, replacing any stale socket file. */
    public static CatalogServer forUnixDomainSocket(Path socketPath) throws IOException {
        if (!Epoll.isAvailable()) {
            throw new IOException(
                    "Epoll is required for unix domain sockets", Epoll.unavailabilityCause());
        }
        Files.deleteIfExists(socketPath);
        CatalogServer catalogServer = new CatalogServer(socketPath);
        catalogServer.bossGroup = new EpollEventLoopGroup(1);
        catalogServer.workerGroup = new EpollEventLoopGroup();
        catalogServer.server =
                NettyServerBuilder.forAddress(new DomainSocketAddress(socketPath.toString()))
                        .bossEventLoopGroup(catalogServer.bossGroup)
                        .workerEventLoopGroup(catalogServer.workerGroup)
                        .channelType(EpollServerDomainSocketChannel.class)
                        .addService(catalogServer.new CatalogServiceImpl())
                        .build()
                        .start();
        logger.atInfo().log("Catalog server listening on %s", socketPath);
        return catalogServer;
    }

    /** Starts a server on a TCP port; port 0 picks a free one. */
    public static CatalogServer forPort(int port) throws IOException {
        CatalogServer catalogServer = new CatalogServer(null);
        catalogServer.server =
                NettyServerBuilder.forPort(port)
                        .addService(catalogServer.new CatalogServiceImpl())
                        .build()
                        .start();
        logger.atInfo().log("Catalog server listening on port %d", catalogServer.getPort());
        return catalogServer;
    }

    public int getPort() {
        return server.getPort();
    }

    /** Publishes every module of the catalog to current and future subscribers. */
    public void publish(CoverageCatalog catalog) {
        List<ModuleCatalog> messages = CatalogMessages.toMessages(catalog);
        synchronized (published) {
            for (ModuleCatalog message : messages) {
                published.put(message.getModule(), message);
            }
            for (StreamObserver<ModuleCatalog> observer : observers) {
                for (ModuleCatalog message : messages) {
                    observer.onNext(message);
                }
            }
        }
        logger.atFine().log(
                "Published %d modules to %d subscribers", messages.size(), observers.size());
    }

    /** Number of module catalogs a new subscriber would receive on connecting. */
    public int replayedModuleCount() {
        synchronized (published) {
            return published.size();
        }
    }

    public void stop() {
        synchronized (published) {
            for (StreamObserver<ModuleCatalog> observer : observers) {
                observer.onCompleted();
            }
            observers.clear();
        }
        if (server != null) {
            server.shutdown();
            try {
                server.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        if (socketPath != null) {
            try {
                Files.deleteIfExists(socketPath);
            } catch (IOException e) {
                logger.atWarning().withCause(e).log("Could not remove socket %s", socketPath);
            }
        }
    }

    private final class CatalogServiceImpl
            extends CoverageCatalogServiceGrpc.CoverageCatalogServiceImplBase {
        @Override
        public void subscribe(
                SubscribeRequest request, StreamObserver<ModuleCatalog> responseObserver) {
            if (responseObserver instanceof ServerCallStreamObserver<ModuleCatalog> serverObserver) {
                serverObserver.setOnCancelHandler(() -> observers.remove(responseObserver));
            }
            // Replay and registration under one lock, so no catalog is missed or sent twice
            synchronized (published) {
                for (ModuleCatalog message : published.values()) {
                    responseObserver.onNext(message);
                }
                observers.add(responseObserver);
            }
        }
    }
}
