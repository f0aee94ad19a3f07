package com.hdlcov.instrument.catalog;

import com.hdlcov.proto.CatalogProto.CoverPoint;
import com.hdlcov.proto.CatalogProto.ModuleCatalog;
import com.hdlcov.proto.CatalogProto.SubscribeRequest;
import com.hdlcov.proto.CoverageCatalogServiceGrpc;
import io.grpc.ManagedChannel;
import io.grpc.netty.shaded.io.grpc.netty.NettyChannelBuilder;
import io.grpc.netty.shaded.io.netty.channel.EventLoopGroup;
import io.grpc.netty.shaded.io.netty.channel.epoll.Epoll;
import io.grpc.netty.shaded.io.netty.channel.epoll.EpollDomainSocketChannel;
import io.grpc.netty.shaded.io.netty.channel.epoll.EpollEventLoopGroup;
import io.grpc.netty.shaded.io.netty.channel.unix.DomainSocketAddress;
import io.grpc.stub.StreamObserver;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** Prints the coverage catalogs streamed by a {@link CatalogServer}. */
public final class CatalogClient {

    private static final String DEFAULT_SOCKET_PATH = "/tmp/hdlcov-catalog.sock";
    private static final int DEFAULT_DURATION_SECONDS = 10;

    private CatalogClient() {
        // Utility class
    }

    public static void main(String[] args) throws InterruptedException {
        String socketPath = DEFAULT_SOCKET_PATH;
        int port = -1;
        int durationSeconds = DEFAULT_DURATION_SECONDS;
        for (String arg : args) {
            if (arg.startsWith("--socket=")) {
                socketPath = arg.substring("--socket=".length());
            } else if (arg.startsWith("--port=")) {
                port = parseInt(arg.substring("--port=".length()), port);
            } else if (arg.startsWith("--duration=")) {
                durationSeconds = parseInt(arg.substring("--duration=".length()), durationSeconds);
            } else {
                System.err.println("Unknown option: " + arg);
                return;
            }
        }

        EventLoopGroup group = null;
        ManagedChannel channel;
        if (port >= 0) {
            channel = NettyChannelBuilder.forAddress("localhost", port).usePlaintext().build();
        } else {
            if (!Epoll.isAvailable()) {
                System.err.println("Epoll is not available; unable to connect to catalog socket.");
                return;
            }
            group = new EpollEventLoopGroup();
            channel =
                    NettyChannelBuilder.forAddress(new DomainSocketAddress(socketPath))
                            .channelType(EpollDomainSocketChannel.class)
                            .eventLoopGroup(group)
                            .usePlaintext()
                            .build();
        }

        CountDownLatch latch = new CountDownLatch(1);
        CoverageCatalogServiceGrpc.newStub(channel)
                .subscribe(
                        SubscribeRequest.getDefaultInstance(),
                        new StreamObserver<ModuleCatalog>() {
                            @Override
                            public void onNext(ModuleCatalog value) {
                                System.out.println(format(value));
                            }

                            @Override
                            public void onError(Throwable t) {
                                System.err.println("Catalog stream error: " + t.getMessage());
                                latch.countDown();
                            }

                            @Override
                            public void onCompleted() {
                                latch.countDown();
                            }
                        });

        if (durationSeconds <= 0) {
            latch.await();
        } else {
            latch.await(durationSeconds, TimeUnit.SECONDS);
        }

        channel.shutdownNow();
        channel.awaitTermination(5, TimeUnit.SECONDS);
        if (group != null) {
            group.shutdownGracefully().syncUninterruptibly();
        }
    }

    static String format(ModuleCatalog catalog) {
        StringBuilder sb = new StringBuilder();
        sb.append("module ").append(catalog.getModule()).append(": ")
                .append(catalog.getPointsCount()).append(" points");
        for (CoverPoint point : catalog.getPointsList()) {
            sb.append("\n  ").append(point.getPage());
            if (!point.getHier().isEmpty()) {
                sb.append(' ').append(point.getHier());
            }
            sb.append(' ').append(point.getComment())
                    .append(" @").append(point.getFilename()).append(':').append(point.getLine());
            if (point.getOffset() != 0) {
                sb.append('+').append(point.getOffset());
            }
            if (!point.getLines().isEmpty()) {
                sb.append(" lines=").append(point.getLines());
            }
        }
        return sb.toString();
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            System.err.println("Invalid number: " + value);
            return fallback;
        }
    }
}
