package com.discovery.server;

import com.discovery.config.RegistryConfig;
import com.discovery.exception.RegistryException;
import com.discovery.registry.Registry;
import com.discovery.serializer.SerializerFactory;
import com.discovery.server.handler.RegistrationHandler;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServerOptions;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 基于 vertx 的注册接口服务器
 *
 * @author sakame
 * @version 1.0
 */
@Slf4j
public class VertxHttpServer implements HttpServer {

    private static final long START_TIMEOUT_SECONDS = 10;

    private final Registry registry;

    private final RegistryConfig registryConfig;

    private Vertx vertx;

    private io.vertx.core.http.HttpServer httpServer;

    public VertxHttpServer(Registry registry, RegistryConfig registryConfig) {
        this.registry = registry;
        this.registryConfig = registryConfig;
    }

    @Override
    public void doStart(int port) {
        vertx = Vertx.vertx();

        httpServer = vertx.createHttpServer(new HttpServerOptions().setHost(registryConfig.getServerHost()));
        httpServer.requestHandler(new RegistrationHandler(vertx, registry,
                SerializerFactory.getInstance(registryConfig.getSerializer())));

        try {
            httpServer.listen(port)
                    .toCompletionStage()
                    .toCompletableFuture()
                    .get(START_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.info("Server is now listening port:{}", httpServer.actualPort());
        } catch (ExecutionException | TimeoutException e) {
            doShutdown();
            throw new RegistryException("Failed to start server on port " + port, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            doShutdown();
            throw new RegistryException("Interrupted while starting server on port " + port, e);
        }
    }

    /**
     * @return 实际监听的端口，未启动时为 -1
     */
    public int getPort() {
        return httpServer == null ? -1 : httpServer.actualPort();
    }

    @Override
    public void doShutdown() {
        if (vertx == null) {
            return;
        }
        vertx.close();
        vertx = null;
        httpServer = null;
        log.info("Server closed");
    }
}
