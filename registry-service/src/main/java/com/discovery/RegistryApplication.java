package com.discovery;

import com.discovery.client.HttpRegistryClient;
import com.discovery.client.RegistryClient;
import com.discovery.config.RegistryConfig;
import com.discovery.heartbeat.HeartbeatMonitor;
import com.discovery.notify.DependencyNotifier;
import com.discovery.registry.LocalRegistry;
import com.discovery.registry.Registry;
import com.discovery.server.VertxHttpServer;
import lombok.extern.slf4j.Slf4j;

import java.util.Scanner;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 注册中心启动类，按任意键回车后关闭
 *
 * @author sakame
 * @version 1.0
 */
@Slf4j
public class RegistryApplication {

    private final RegistryConfig registryConfig;

    private final DependencyNotifier notifier;

    private final Registry registry;

    private final HeartbeatMonitor heartbeatMonitor;

    private final VertxHttpServer httpServer;

    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public RegistryApplication(RegistryConfig registryConfig) {
        this.registryConfig = registryConfig;
        RegistryClient client = new HttpRegistryClient(registryConfig);
        this.notifier = new DependencyNotifier(client, registryConfig);
        this.registry = new LocalRegistry(client, notifier);
        this.heartbeatMonitor = new HeartbeatMonitor(registry, client, registryConfig);
        this.httpServer = new VertxHttpServer(registry, registryConfig);
    }

    public static void main(String[] args) {
        RegistryApplication application = new RegistryApplication(RegistryConfig.getRegistryConfig());
        Runtime.getRuntime().addShutdownHook(new Thread(application::stop, "registry-shutdown"));
        application.start();

        System.out.println("Registry service started. Press any key to shutdown.");
        Scanner scanner = new Scanner(System.in);
        if (scanner.hasNextLine()) {
            scanner.nextLine();
        }
        application.stop();
        System.out.println("Shutting down registry service.");
    }

    /**
     * 启动心跳检测和注册接口
     */
    public void start() {
        heartbeatMonitor.start();
        httpServer.doStart(registryConfig.getServerPort());
    }

    /**
     * 依次关闭接口、心跳、推送，重复调用只执行一次
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        httpServer.doShutdown();
        heartbeatMonitor.stop();
        notifier.close();
        registry.destroy();
        log.info("registry service stopped");
    }

    public Registry getRegistry() {
        return registry;
    }

    public int getPort() {
        return httpServer.getPort();
    }
}
