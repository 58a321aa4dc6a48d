package io.kubeclient.client.http.vertx;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.configureFor;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.givenThat;
import static com.github.tomakehurst.wiremock.client.WireMock.okForContentType;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.kubeclient.client.KubeApiClient;
import io.kubeclient.client.KubeClientOptions;
import io.kubeclient.client.resources.ResourceEventStream;
import io.kubeclient.model.ConfigMapV1;
import io.kubeclient.model.ResourceEventType;
import io.kubeclient.model.ResourceEventV1;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClientOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Makes sure the Vert.x transport can be plugged into {@link KubeApiClient}.
 */
public class ClientBuilderTest {

    private WireMockServer server;
    private Vertx vertx;
    private KubeApiClient client;

    @BeforeEach
    public void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();
        configureFor("localhost", server.port());

        vertx = Vertx.vertx();
        client = KubeApiClient.create(KubeClientOptions.builder()
                .apiEndpoint("http://localhost:" + server.port())
                .httpClientBuilder(new VertxHttpClientBuilder()
                        .vertx(vertx)
                        .options(new HttpClientOptions().setMaxChunkSize(16)))
                .build());
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
        if (vertx != null) {
            vertx.close();
        }
    }

    @Test
    public void shouldGetResource() {
        givenThat(get(urlEqualTo("/api/v1/namespaces/default/configmaps/settings"))
                .willReturn(okForContentType("application/json",
                        "{\"kind\":\"ConfigMap\",\"apiVersion\":\"v1\",\"metadata\":{\"name\":\"settings\"},"
                                + "\"data\":{\"mode\":\"fast\"}}")));

        Optional<ConfigMapV1> configMap = client.configMapsV1().get("settings").join();

        assertTrue(configMap.isPresent());
        assertEquals("fast", configMap.get().data().get("mode"));
    }

    @Test
    public void shouldWatchResources() {
        givenThat(get(urlEqualTo("/api/v1/namespaces/default/configmaps?watch=true"))
                .willReturn(aResponse().withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"type\":\"ADDED\",\"object\":{\"metadata\":{\"name\":\"a\"}}}\n"
                                + "{\"type\":\"DELETED\",\"object\":{\"metadata\":{\"name\":\"a\"}}}\n")));

        List<ResourceEventV1<ConfigMapV1>> events = new ArrayList<>();
        try (ResourceEventStream<ConfigMapV1> stream = client.configMapsV1().watchAll(null, null)) {
            stream.forEachRemaining(events::add);
            assertFalse(stream.hasNext());
        }

        assertEquals(2, events.size());
        assertEquals(ResourceEventType.ADDED, events.get(0).type());
        assertEquals(ResourceEventType.DELETED, events.get(1).type());
        assertEquals("a", events.get(1).object().metadata().name());
    }
}
