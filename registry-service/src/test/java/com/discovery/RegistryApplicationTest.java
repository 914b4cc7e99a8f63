package com.discovery;

import cn.hutool.http.HttpRequest;
import cn.hutool.http.HttpResponse;
import cn.hutool.http.HttpStatus;
import com.discovery.config.RegistryConfig;
import com.discovery.constant.RemovalPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * 启动完整的注册中心服务
 *
 * @author sakame
 * @version 1.0
 */
class RegistryApplicationTest {

    private RegistryApplication application;

    @BeforeEach
    void init() {
        RegistryConfig registryConfig = new RegistryConfig();
        registryConfig.setServerPort(0);
        registryConfig.setHeartbeatIntervalMillis(60_000);
        registryConfig.setShutdownTimeoutMillis(1000);
        application = new RegistryApplication(registryConfig);
        application.start();
    }

    @AfterEach
    void destroy() {
        application.stop();
    }

    @Test
    void registerAndRemoveThroughHttp() {
        String servicesUrl = "http://localhost:" + application.getPort() + "/services";
        String body = "{\"ServiceName\":\"Log\",\"ServiceUrl\":\"http://localhost:4000\","
                + "\"RequiredServices\":[],"
                + "\"ServiceUpdateUrl\":\"http://localhost:4000/services\","
                + "\"HeartbeatUrl\":\"http://localhost:4000/heartbeat\"}";

        try (HttpResponse response = HttpRequest.post(servicesUrl).body(body).timeout(5000).execute()) {
            Assertions.assertEquals(HttpStatus.HTTP_OK, response.getStatus());
        }
        Assertions.assertEquals(1, application.getRegistry().snapshot().size());
        Assertions.assertEquals("Log", application.getRegistry().snapshot().get(0).getServiceName());

        try (HttpResponse response = HttpRequest.delete(servicesUrl).body("http://localhost:4000").timeout(5000).execute()) {
            Assertions.assertEquals(HttpStatus.HTTP_OK, response.getStatus());
        }
        Assertions.assertTrue(application.getRegistry().snapshot().isEmpty());
    }

    @Test
    void stopIsIdempotent() {
        Assertions.assertTrue(application.getPort() > 0);

        application.stop();
        application.stop();

        Assertions.assertEquals(-1, application.getPort());
    }

    @Test
    void bundledConfigIsLoaded() {
        RegistryConfig registryConfig = RegistryConfig.getRegistryConfig();

        Assertions.assertEquals(3000, registryConfig.getServerPort());
        Assertions.assertEquals(RemovalPolicy.EAGER, registryConfig.getRemovalPolicy());
        Assertions.assertEquals(3, registryConfig.getHeartbeatAttempts());
    }
}
