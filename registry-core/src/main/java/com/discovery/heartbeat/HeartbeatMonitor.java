package com.discovery.heartbeat;

import cn.hutool.core.thread.ThreadFactoryBuilder;
import com.discovery.client.RegistryClient;
import com.discovery.config.RegistryConfig;
import com.discovery.constant.HealthStatus;
import com.discovery.constant.RemovalPolicy;
import com.discovery.exception.DeliveryException;
import com.discovery.exception.RegistryException;
import com.discovery.model.Registration;
import com.discovery.registry.Registry;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * 心跳检测
 * <p>
 * 每一轮对所有注册的服务并发检测，等本轮全部结束后再等待固定间隔进入下一轮。
 * 单个服务最多尝试 heartbeatAttempts 次，失败时按 {@link RemovalPolicy} 移除，
 * 之后的尝试成功会重新注册
 *
 * @author sakame
 * @version 1.0
 */
@Slf4j
public class HeartbeatMonitor implements AutoCloseable {

    private final Registry registry;

    private final RegistryClient client;

    private final RegistryConfig registryConfig;

    private final ScheduledExecutorService scheduler;

    private final ExecutorService probeExecutor;

    private final AtomicBoolean started = new AtomicBoolean(false);

    /**
     * 服务地址 => 健康状态
     */
    private final Map<String, HealthStatus> statuses = new ConcurrentHashMap<>();

    public HeartbeatMonitor(Registry registry, RegistryClient client, RegistryConfig registryConfig) {
        this.registry = registry;
        this.client = client;
        this.registryConfig = registryConfig;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(ThreadFactoryBuilder.create()
                .setNamePrefix("registry-heartbeat-")
                .setDaemon(true)
                .build());
        this.probeExecutor = Executors.newCachedThreadPool(ThreadFactoryBuilder.create()
                .setNamePrefix("registry-probe-")
                .setDaemon(true)
                .setUncaughtExceptionHandler((t, e) -> log.error("Uncaught exception in '{}'", t.getName(), e))
                .build());
    }

    /**
     * 启动心跳循环，重复调用只会启动一次
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        scheduler.scheduleWithFixedDelay(this::runWave, 0,
                registryConfig.getHeartbeatIntervalMillis(), TimeUnit.MILLISECONDS);
        log.info("heartbeat started, interval {}ms, attempts {}, policy {}",
                registryConfig.getHeartbeatIntervalMillis(), registryConfig.getHeartbeatAttempts(),
                registryConfig.getRemovalPolicy());
    }

    public boolean isStarted() {
        return started.get();
    }

    /**
     * 停止心跳循环并中断正在进行的检测
     */
    public void stop() {
        scheduler.shutdownNow();
        probeExecutor.shutdownNow();
        log.info("heartbeat stopped");
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * 执行一轮检测，所有服务检测结束后返回
     */
    public void runWave() {
        try {
            List<Registration> registrations = registry.snapshot();
            Set<String> urls = registrations.stream()
                    .map(Registration::getServiceUrl)
                    .collect(Collectors.toSet());
            statuses.keySet().retainAll(urls);

            CompletableFuture<?>[] probes = registrations.stream()
                    .map(registration -> CompletableFuture.runAsync(() -> safeProbe(registration), probeExecutor))
                    .toArray(CompletableFuture[]::new);
            CompletableFuture.allOf(probes).get();
        } catch (RejectedExecutionException e) {
            log.debug("probe executor is closed, skip heartbeat wave");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.error("heartbeat wave failed", e.getCause());
        } catch (RuntimeException e) {
            log.error("heartbeat wave failed", e);
        }
    }

    /**
     * 单个服务的检测，任何异常都不能影响同一轮的其它检测
     *
     * @param registration
     */
    private void safeProbe(Registration registration) {
        try {
            probe(registration);
        } catch (RuntimeException e) {
            log.error("heartbeat check for {} failed unexpectedly", registration.getServiceUrl(), e);
        }
    }

    /**
     * 检测单个服务
     * <p>
     * 只移除和恢复本轮开始时拿到的注册信息对象。检测期间同一地址被重新注册时，
     * 新的注册信息优先，本次检测直接结束，由下一轮检测新的注册信息
     *
     * @param registration
     * @return 最终是否检测通过
     */
    boolean probe(Registration registration) {
        String url = registration.getServiceUrl();
        int attempts = registryConfig.getHeartbeatAttempts();
        boolean eager = registryConfig.getRemovalPolicy() == RemovalPolicy.EAGER;
        boolean removed = false;
        statuses.put(url, HealthStatus.PROBING);

        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (checkOnce(registration, attempt)) {
                log.debug("heartbeat check passed for service {}", registration.getServiceName());
                statuses.put(url, HealthStatus.HEALTHY);
                if (removed) {
                    recover(registration);
                }
                return true;
            }

            if (eager && !removed) {
                if (!registry.unRegisterIfCurrent(registration)) {
                    return superseded(registration);
                }
                removed = true;
            }
            if (attempt < attempts && !sleep(registryConfig.getHeartbeatRetryDelayMillis())) {
                return false;
            }
        }

        if (!removed && !registry.unRegisterIfCurrent(registration)) {
            return superseded(registration);
        }
        statuses.put(url, HealthStatus.UNHEALTHY);
        log.warn("service {} ({}) failed {} heartbeat check(s), removed", registration.getServiceName(), url, attempts);
        return false;
    }

    private boolean superseded(Registration registration) {
        statuses.remove(registration.getServiceUrl(), HealthStatus.PROBING);
        log.info("service url {} was registered again during heartbeat check, skip {}",
                registration.getServiceUrl(), registration.getServiceName());
        return false;
    }

    private boolean checkOnce(Registration registration, int attempt) {
        try {
            if (client.checkHealth(registration.getHeartbeatUrl())) {
                return true;
            }
            log.info("heartbeat check failed for service {}, attempt {}", registration.getServiceName(), attempt);
        } catch (DeliveryException e) {
            log.info("heartbeat check failed for service {}, attempt {}: {}",
                    registration.getServiceName(), attempt, e.getMessage());
        }
        return false;
    }

    private void recover(Registration registration) {
        try {
            if (registry.registerIfAbsent(registration)) {
                log.info("service {} ({}) recovered", registration.getServiceName(), registration.getServiceUrl());
            }
        } catch (RegistryException e) {
            statuses.put(registration.getServiceUrl(), HealthStatus.UNHEALTHY);
            log.warn("fail to register recovered service {}: {}", registration.getServiceUrl(), e.getMessage());
        }
    }

    /**
     * @return 被中断时返回 false
     */
    private boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public HealthStatus getHealthStatus(String serviceUrl) {
        return statuses.get(serviceUrl);
    }

    public Map<String, HealthStatus> getHealthStatuses() {
        return Collections.unmodifiableMap(new HashMap<>(statuses));
    }
}
