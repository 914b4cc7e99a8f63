package com.discovery.server;

import cn.hutool.http.HttpRequest;
import cn.hutool.http.HttpResponse;
import cn.hutool.http.HttpStatus;
import com.discovery.client.HttpRegistryClient;
import com.discovery.config.RegistryConfig;
import com.discovery.notify.DependencyNotifier;
import com.discovery.registry.LocalRegistry;
import com.discovery.serializer.JsonSerializer;
import com.discovery.support.StubServiceServer;
import com.discovery.support.TestConfigs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

/**
 * 注册接口测试，注册中心和依赖方都走真实 http
 *
 * @author sakame
 * @version 1.0
 */
class RegistrationGatewayTest {

    private static final String PROVIDER_URL = "http://localhost:5000";

    private StubServiceServer stub;

    private DependencyNotifier notifier;

    private LocalRegistry registry;

    private VertxHttpServer server;

    private String servicesUrl;

    @BeforeEach
    void init() throws Exception {
        stub = new StubServiceServer()
                .respond("/services", HttpStatus.HTTP_OK)
                .respond("/broken", HttpStatus.HTTP_INTERNAL_ERROR)
                .start();
        RegistryConfig registryConfig = TestConfigs.fast();
        HttpRegistryClient client = new HttpRegistryClient(new JsonSerializer(), 1000);
        notifier = new DependencyNotifier(client, registryConfig);
        registry = new LocalRegistry(client, notifier);
        server = new VertxHttpServer(registry, registryConfig);
        server.doStart(0);
        servicesUrl = "http://localhost:" + server.getPort() + "/services";
    }

    @AfterEach
    void destroy() throws Exception {
        server.doShutdown();
        notifier.close();
        registry.destroy();
        stub.close();
    }

    @Test
    void registerReturnsOk() {
        Assertions.assertEquals(HttpStatus.HTTP_OK, post(servicesUrl, provider()));

        Assertions.assertEquals(1, registry.snapshot().size());
        Assertions.assertEquals("A", registry.snapshot().get(0).getServiceName());
        Assertions.assertEquals(PROVIDER_URL, registry.snapshot().get(0).getServiceUrl());
    }

    @Test
    void lowerCamelKeysAreAccepted() {
        String body = "{\"serviceName\":\"A\",\"serviceUrl\":\"" + PROVIDER_URL + "\","
                + "\"heartbeatUrl\":\"" + PROVIDER_URL + "/heartbeat\"}";

        Assertions.assertEquals(HttpStatus.HTTP_OK, post(servicesUrl, body));
        Assertions.assertEquals(1, registry.snapshot().size());
    }

    @Test
    void malformedRegistrationIsBadRequest() {
        Assertions.assertEquals(HttpStatus.HTTP_BAD_REQUEST, post(servicesUrl, "{not json"));
        Assertions.assertEquals(HttpStatus.HTTP_BAD_REQUEST, post(servicesUrl, ""));
        Assertions.assertEquals(HttpStatus.HTTP_BAD_REQUEST, post(servicesUrl, "{\"ServiceName\":\"A\"}"));
        Assertions.assertTrue(registry.snapshot().isEmpty());
    }

    @Test
    void failedCatchUpIsBadRequest() {
        Assertions.assertEquals(HttpStatus.HTTP_BAD_REQUEST, post(servicesUrl, consumer(stub.url("/broken"))));

        Assertions.assertTrue(registry.snapshot().isEmpty());
        Assertions.assertEquals(1, stub.received("/broken").size());
    }

    @Test
    void dependentLearnsAboutProviders() throws InterruptedException {
        Assertions.assertEquals(HttpStatus.HTTP_OK, post(servicesUrl, provider()));

        Assertions.assertEquals(HttpStatus.HTTP_OK, post(servicesUrl, consumer(stub.url("/services"))));
        List<String> bodies = stub.received("/services");
        Assertions.assertEquals(1, bodies.size());
        Assertions.assertTrue(bodies.get(0).contains("\"Url\":\"" + PROVIDER_URL + "\""));

        String secondProvider = "{\"ServiceName\":\"A\",\"ServiceUrl\":\"http://localhost:5001\","
                + "\"HeartbeatUrl\":\"http://localhost:5001/heartbeat\"}";
        Assertions.assertEquals(HttpStatus.HTTP_OK, post(servicesUrl, secondProvider));
        bodies = stub.awaitReceived("/services", 2, 2000);
        Assertions.assertEquals(2, bodies.size());
        Assertions.assertTrue(bodies.get(1).contains("\"Url\":\"http://localhost:5001\""));
    }

    @Test
    void deregisterNotifiesDependents() throws InterruptedException {
        post(servicesUrl, provider());
        post(servicesUrl, consumer(stub.url("/services")));

        Assertions.assertEquals(HttpStatus.HTTP_OK, delete(servicesUrl, PROVIDER_URL + "\n"));

        Assertions.assertEquals(1, registry.snapshot().size());
        List<String> bodies = stub.awaitReceived("/services", 2, 2000);
        Assertions.assertEquals(2, bodies.size());
        Assertions.assertTrue(bodies.get(1).contains("\"Removed\":[{\"Name\":\"A\""));
    }

    @Test
    void deregisterUnknownUrlIsOk() {
        Assertions.assertEquals(HttpStatus.HTTP_OK, delete(servicesUrl, "http://localhost:9999"));
    }

    @Test
    void otherMethodsAreNotAllowed() {
        try (HttpResponse put = HttpRequest.put(servicesUrl).body(provider()).execute()) {
            Assertions.assertEquals(HttpStatus.HTTP_BAD_METHOD, put.getStatus());
        }
        try (HttpResponse get = HttpRequest.get(servicesUrl).execute()) {
            Assertions.assertEquals(HttpStatus.HTTP_BAD_METHOD, get.getStatus());
        }
    }

    @Test
    void otherPathsAreNotFound() {
        String otherUrl = "http://localhost:" + server.getPort() + "/other";

        Assertions.assertEquals(HttpStatus.HTTP_NOT_FOUND, post(otherUrl, provider()));
    }

    private static String provider() {
        return "{\"ServiceName\":\"A\",\"ServiceUrl\":\"" + PROVIDER_URL + "\","
                + "\"RequiredServices\":[],"
                + "\"ServiceUpdateUrl\":\"" + PROVIDER_URL + "/services\","
                + "\"HeartbeatUrl\":\"" + PROVIDER_URL + "/heartbeat\"}";
    }

    private static String consumer(String updateUrl) {
        return "{\"ServiceName\":\"Consumer\",\"ServiceUrl\":\"http://localhost:6000\","
                + "\"RequiredServices\":[\"A\"],"
                + "\"ServiceUpdateUrl\":\"" + updateUrl + "\","
                + "\"HeartbeatUrl\":\"http://localhost:6000/heartbeat\"}";
    }

    private static int post(String url, String body) {
        try (HttpResponse response = HttpRequest.post(url).body(body).timeout(5000).execute()) {
            return response.getStatus();
        }
    }

    private static int delete(String url, String body) {
        try (HttpResponse response = HttpRequest.delete(url).body(body).timeout(5000).execute()) {
            return response.getStatus();
        }
    }
}
