package io.kubeclient.client.resources;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.configureFor;
import static com.github.tomakehurst.wiremock.client.WireMock.delete;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.givenThat;
import static com.github.tomakehurst.wiremock.client.WireMock.okForContentType;
import static com.github.tomakehurst.wiremock.client.WireMock.patch;
import static com.github.tomakehurst.wiremock.client.WireMock.patchRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.put;
import static com.github.tomakehurst.wiremock.client.WireMock.putRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.kubeclient.client.KubeApiClient;
import io.kubeclient.client.KubeClientOptions;
import io.kubeclient.model.ConfigMapListV1;
import io.kubeclient.model.ConfigMapV1;
import io.kubeclient.model.DeploymentListV1;
import io.kubeclient.model.DeploymentSpecV1;
import io.kubeclient.model.DeploymentStrategyType;
import io.kubeclient.model.DeploymentStrategyV1;
import io.kubeclient.model.DeploymentV1;
import io.kubeclient.model.KubeClientException;
import io.kubeclient.model.KubeProtocolException;
import io.kubeclient.model.LabelSelectorV1;
import io.kubeclient.model.ObjectMetaV1;
import io.kubeclient.model.StatusV1;
import io.kubeclient.util.Utils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class KubeResourceClientTest {

    private static final String CONFIG_MAP_PATH = "/api/v1/namespaces/default/configmaps/settings";
    private static final String DEPLOYMENTS_PATH = "/apis/apps/v1/namespaces/apps/deployments";

    private static final String CONFIG_MAP = """
            {
                "kind": "ConfigMap",
                "apiVersion": "v1",
                "metadata": {"name": "settings", "namespace": "default", "resourceVersion": "42"},
                "data": {"mode": "fast"}
            }
            """;

    private static final String NOT_FOUND_STATUS = """
            {
                "kind": "Status",
                "apiVersion": "v1",
                "metadata": {},
                "status": "Failure",
                "message": "configmaps \\"settings\\" not found",
                "reason": "NotFound",
                "details": {"name": "settings", "kind": "configmaps"},
                "code": 404
            }
            """;

    private static final String DEPLOYMENT = """
            {
                "kind": "Deployment",
                "apiVersion": "apps/v1",
                "metadata": {"name": "web", "namespace": "apps"},
                "spec": {"replicas": 5}
            }
            """;

    private WireMockServer server;
    private KubeApiClient client;

    @BeforeEach
    public void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();

        configureFor("localhost", server.port());

        client = KubeApiClient.create(KubeClientOptions.builder()
                .apiEndpoint("http://localhost:" + server.port())
                .addHeader("Authorization", "Bearer test-token")
                .build());
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        CompletionException e = assertThrows(CompletionException.class, future::join);
        return e.getCause();
    }

    @Test
    public void testGetExistingResource() {
        givenThat(get(urlEqualTo(CONFIG_MAP_PATH))
                .willReturn(okForContentType("application/json", CONFIG_MAP)));

        Optional<ConfigMapV1> configMap = client.configMapsV1().get("settings").join();

        assertTrue(configMap.isPresent());
        assertEquals("fast", configMap.get().data().get("mode"));
        assertEquals("42", configMap.get().metadata().resourceVersion());
        verify(getRequestedFor(urlEqualTo(CONFIG_MAP_PATH))
                .withHeader("Authorization", equalTo("Bearer test-token"))
                .withHeader("Accept", equalTo("application/json")));
    }

    @Test
    public void testResourceSurvivesRoundTrip() throws Exception {
        DeploymentV1 deployment = new DeploymentV1(
                ObjectMetaV1.builder().name("web").namespace("apps").labels(Map.of("app", "web")).build(),
                new DeploymentSpecV1(3, new LabelSelectorV1(Map.of("app", "web")),
                        new DeploymentStrategyV1(DeploymentStrategyType.ROLLING_UPDATE), 10, 5, false));
        givenThat(get(urlEqualTo(DEPLOYMENTS_PATH + "/web"))
                .willReturn(okForContentType("application/json", Utils.marshal(deployment))));

        Optional<DeploymentV1> fetched = client.deploymentsV1().get("web", "apps").join();

        assertEquals(Optional.of(deployment), fetched);
    }

    @Test
    public void testGetMissingResourceIsEmpty() {
        givenThat(get(urlEqualTo(CONFIG_MAP_PATH))
                .willReturn(aResponse().withStatus(404)
                        .withHeader("Content-Type", "application/json")
                        .withBody(NOT_FOUND_STATUS)));

        Optional<ConfigMapV1> configMap = client.configMapsV1().get("settings").join();

        assertTrue(configMap.isEmpty());
    }

    @Test
    public void testNotFoundWithoutStatusIsAnError() {
        givenThat(get(urlEqualTo(CONFIG_MAP_PATH))
                .willReturn(aResponse().withStatus(404)
                        .withHeader("Content-Type", "text/plain")
                        .withBody("404 page not found")));

        Throwable failure = failureOf(client.configMapsV1().get("settings"));

        KubeClientException e = assertInstanceOf(KubeClientException.class, failure);
        assertEquals(404, e.getStatusCode());
        assertNull(e.getStatus());
        assertEquals("Failed to retrieve ConfigMap (v1) resource (HTTP status 404).", e.getMessage());
        assertEquals("ConfigMap (v1) resource", e.getResourceTypeDescription());
    }

    @Test
    public void testNotFoundWithOtherReasonIsAnError() {
        givenThat(get(urlEqualTo(CONFIG_MAP_PATH))
                .willReturn(aResponse().withStatus(404)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"kind\":\"Status\",\"status\":\"Failure\",\"reason\":\"notfound\",\"code\":404}")));

        KubeClientException e = assertInstanceOf(KubeClientException.class,
                failureOf(client.configMapsV1().get("settings")));

        assertEquals("notfound", e.getReason());
    }

    @Test
    public void testServerErrorCarriesStatus() {
        givenThat(get(urlEqualTo(CONFIG_MAP_PATH))
                .willReturn(aResponse().withStatus(500)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"kind\":\"Status\",\"status\":\"Failure\",\"reason\":\"InternalError\","
                                + "\"message\":\"etcd unavailable\",\"code\":500}")));

        KubeClientException e = assertInstanceOf(KubeClientException.class,
                failureOf(client.configMapsV1().get("settings")));

        assertEquals(500, e.getStatusCode());
        assertEquals("InternalError", e.getReason());
        assertEquals("etcd unavailable", e.getStatus().message());
    }

    @Test
    public void testInvalidSuccessBodyIsProtocolError() {
        givenThat(get(urlEqualTo(CONFIG_MAP_PATH))
                .willReturn(okForContentType("application/json", "{\"kind\": \"ConfigMap\", ")));

        assertInstanceOf(KubeProtocolException.class, failureOf(client.configMapsV1().get("settings")));
    }

    @Test
    public void testListWithLabelSelector() {
        givenThat(get(urlPathEqualTo(DEPLOYMENTS_PATH))
                .withQueryParam("labelSelector", equalTo("app=web,tier!=cache"))
                .willReturn(okForContentType("application/json", """
                        {
                            "kind": "DeploymentList",
                            "apiVersion": "apps/v1",
                            "metadata": {"resourceVersion": "77"},
                            "items": [
                                {"metadata": {"name": "web"}, "spec": {"replicas": 2}},
                                {"kind": "Deployment", "apiVersion": "apps/v1", "metadata": {"name": "api"}}
                            ]
                        }
                        """)));

        DeploymentListV1 list = client.deploymentsV1().list("app=web,tier!=cache", "apps").join();

        assertEquals(2, list.items().size());
        assertEquals("web", list.items().get(0).metadata().name());
        assertEquals("77", list.metadata().resourceVersion());
    }

    @Test
    public void testListFailureDescribesItemKind() {
        givenThat(get(urlPathEqualTo(DEPLOYMENTS_PATH))
                .willReturn(aResponse().withStatus(403)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"kind\":\"Status\",\"status\":\"Failure\",\"reason\":\"Forbidden\",\"code\":403}")));

        KubeClientException e = assertInstanceOf(KubeClientException.class,
                failureOf(client.deploymentsV1().list(null, "apps")));

        assertEquals("Failed to list Deployment (apps/v1) resources (HTTP status 403).", e.getMessage());
        assertEquals("Forbidden", e.getReason());
    }

    @Test
    public void testListWithForeignItemKindIsRejected() {
        givenThat(get(urlPathEqualTo("/api/v1/namespaces/default/configmaps"))
                .willReturn(okForContentType("application/json", """
                        {"kind": "ConfigMapList", "apiVersion": "v1",
                         "items": [{"kind": "Secret", "apiVersion": "v1", "metadata": {"name": "s"}}]}
                        """)));

        CompletableFuture<ConfigMapListV1> list = client.configMapsV1().list();

        KubeProtocolException e = assertInstanceOf(KubeProtocolException.class, failureOf(list));
        assertTrue(e.getMessage().contains("Secret"), e.getMessage());
    }

    @Test
    public void testTypedPatch() {
        givenThat(patch(urlEqualTo(DEPLOYMENTS_PATH + "/web"))
                .willReturn(okForContentType("application/json", DEPLOYMENT)));

        DeploymentV1 patched = client.deploymentsV1()
                .patch("web", p -> p
                        .field("spec", "replicas").replace(5)
                        .field("metadata", "labels", "tier").add("frontend"), "apps")
                .join();

        assertEquals(5, patched.spec().replicas());
        verify(patchRequestedFor(urlEqualTo(DEPLOYMENTS_PATH + "/web"))
                .withHeader("Content-Type", equalTo("application/json-patch+json"))
                .withRequestBody(equalToJson("""
                        [
                            {"op": "replace", "path": "/spec/replicas", "value": 5},
                            {"op": "add", "path": "/metadata/labels/tier", "value": "frontend"}
                        ]
                        """)));
    }

    @Test
    public void testScale() {
        givenThat(patch(urlEqualTo(DEPLOYMENTS_PATH + "/web"))
                .willReturn(okForContentType("application/json", DEPLOYMENT)));

        client.deploymentsV1().scale("web", 5, "apps").join();

        verify(patchRequestedFor(urlEqualTo(DEPLOYMENTS_PATH + "/web"))
                .withRequestBody(equalToJson("[{\"op\":\"replace\",\"path\":\"/spec/replicas\",\"value\":5}]")));
    }

    @Test
    public void testRawPatch() {
        givenThat(patch(urlEqualTo(CONFIG_MAP_PATH))
                .willReturn(okForContentType("application/json", CONFIG_MAP)));

        client.configMapsV1()
                .patchRaw("settings", p -> p
                        .test("/metadata/resourceVersion", "42")
                        .remove("/data/obsolete")
                        .move("/data/old", "/data/new"), null)
                .join();

        verify(patchRequestedFor(urlEqualTo(CONFIG_MAP_PATH))
                .withHeader("Content-Type", equalTo("application/json-patch+json"))
                .withRequestBody(equalToJson("""
                        [
                            {"op": "test", "path": "/metadata/resourceVersion", "value": "42"},
                            {"op": "remove", "path": "/data/obsolete"},
                            {"op": "move", "from": "/data/old", "path": "/data/new"}
                        ]
                        """)));
    }

    @Test
    public void testMergePatch() {
        givenThat(patch(urlEqualTo(CONFIG_MAP_PATH))
                .willReturn(okForContentType("application/json", CONFIG_MAP)));

        client.configMapsV1().patchMerge("settings", Map.of("data", Map.of("mode", "fast")), null).join();

        verify(patchRequestedFor(urlEqualTo(CONFIG_MAP_PATH))
                .withHeader("Content-Type", equalTo("application/merge-patch+json"))
                .withRequestBody(equalToJson("{\"data\": {\"mode\": \"fast\"}}")));
    }

    @Test
    public void testPatchConflict() {
        givenThat(patch(urlEqualTo(CONFIG_MAP_PATH))
                .willReturn(aResponse().withStatus(422)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"kind\":\"Status\",\"status\":\"Failure\",\"reason\":\"Invalid\",\"code\":422}")));

        KubeClientException e = assertInstanceOf(KubeClientException.class, failureOf(
                client.configMapsV1().patchRaw("settings", p -> p.test("/data/mode", "slow"), null)));

        assertEquals(422, e.getStatusCode());
        assertEquals("Failed to patch ConfigMap (v1) resource (HTTP status 422).", e.getMessage());
    }

    @Test
    public void testCreateUsesMetadataNamespace() {
        givenThat(post(urlEqualTo("/api/v1/namespaces/team-a/configmaps"))
                .willReturn(aResponse().withStatus(201)
                        .withHeader("Content-Type", "application/json")
                        .withBody(CONFIG_MAP)));
        ConfigMapV1 configMap = new ConfigMapV1(
                ObjectMetaV1.builder().name("settings").namespace("team-a").build(), Map.of("mode", "fast"));

        ConfigMapV1 created = client.configMapsV1().create(configMap).join();

        assertEquals("settings", created.metadata().name());
        verify(postRequestedFor(urlEqualTo("/api/v1/namespaces/team-a/configmaps"))
                .withHeader("Content-Type", equalTo("application/json"))
                .withRequestBody(equalToJson("""
                        {"kind": "ConfigMap", "apiVersion": "v1",
                         "metadata": {"name": "settings", "namespace": "team-a"},
                         "data": {"mode": "fast"}}
                        """)));
    }

    @Test
    public void testCreateConflict() {
        givenThat(post(urlEqualTo("/api/v1/namespaces/default/configmaps"))
                .willReturn(aResponse().withStatus(409)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"kind\":\"Status\",\"status\":\"Failure\",\"reason\":\"AlreadyExists\",\"code\":409}")));
        ConfigMapV1 configMap = new ConfigMapV1(ObjectMetaV1.builder().name("settings").build(), Map.of());

        KubeClientException e = assertInstanceOf(KubeClientException.class,
                failureOf(client.configMapsV1().create(configMap)));

        assertEquals("AlreadyExists", e.getReason());
    }

    @Test
    public void testUpdateReplacesByName() {
        givenThat(put(urlEqualTo(CONFIG_MAP_PATH))
                .willReturn(okForContentType("application/json", CONFIG_MAP)));
        ConfigMapV1 configMap = new ConfigMapV1(
                ObjectMetaV1.builder().name("settings").resourceVersion("42").build(), Map.of("mode", "fast"));

        client.configMapsV1().update(configMap).join();

        verify(putRequestedFor(urlEqualTo(CONFIG_MAP_PATH))
                .withRequestBody(equalToJson("""
                        {"kind": "ConfigMap", "apiVersion": "v1",
                         "metadata": {"name": "settings", "resourceVersion": "42"},
                         "data": {"mode": "fast"}}
                        """)));
    }

    @Test
    public void testUpdateWithoutNameIsRejected() {
        ConfigMapV1 configMap = new ConfigMapV1(ObjectMetaV1.builder().build(), Map.of());

        assertThrows(IllegalArgumentException.class, () -> client.configMapsV1().update(configMap));
    }

    @Test
    public void testDeleteReturnsStatus() {
        givenThat(delete(urlEqualTo(CONFIG_MAP_PATH))
                .willReturn(okForContentType("application/json",
                        "{\"kind\":\"Status\",\"apiVersion\":\"v1\",\"status\":\"Success\","
                                + "\"details\":{\"name\":\"settings\",\"kind\":\"configmaps\"}}")));

        StatusV1 status = client.configMapsV1().delete("settings", null).join();

        assertTrue(status.isSuccess());
        assertEquals("settings", status.details().name());
    }

    @Test
    public void testDeleteReturningObjectYieldsSuccess() {
        givenThat(delete(urlEqualTo(CONFIG_MAP_PATH))
                .willReturn(okForContentType("application/json", CONFIG_MAP)));

        StatusV1 status = client.configMapsV1().delete("settings", null).join();

        assertTrue(status.isSuccess());
        assertEquals(StatusV1.KIND, status.kind());
    }

    @Test
    public void testDeleteReturningObjectWithoutKindYieldsSuccess() {
        givenThat(delete(urlEqualTo(CONFIG_MAP_PATH))
                .willReturn(okForContentType("application/json",
                        "{\"metadata\":{\"name\":\"settings\"},\"data\":{\"mode\":\"fast\"}}")));

        StatusV1 status = client.configMapsV1().delete("settings", null).join();

        assertTrue(status.isSuccess());
        assertEquals(StatusV1.KIND, status.kind());
        assertEquals("Deleted ConfigMap (v1) resource.", status.message());
    }

    @Test
    public void testDeleteMissingResourceIsAnError() {
        givenThat(delete(urlEqualTo(CONFIG_MAP_PATH))
                .willReturn(aResponse().withStatus(404)
                        .withHeader("Content-Type", "application/json")
                        .withBody(NOT_FOUND_STATUS)));

        KubeClientException e = assertInstanceOf(KubeClientException.class,
                failureOf(client.configMapsV1().delete("settings", null)));

        assertEquals(StatusV1.REASON_NOT_FOUND, e.getReason());
        assertEquals("Failed to delete ConfigMap (v1) resource (HTTP status 404).", e.getMessage());
    }

    @Test
    public void testConnectionFailure() {
        int port = server.port();
        server.stop();
        KubeApiClient unreachable = KubeApiClient.create(KubeClientOptions.builder()
                .apiEndpoint("http://localhost:" + port)
                .build());

        KubeClientException e = assertInstanceOf(KubeClientException.class,
                failureOf(unreachable.configMapsV1().get("settings")));

        assertEquals(KubeClientException.NO_RESPONSE, e.getStatusCode());
        assertTrue(e.getMessage().startsWith("Failed to retrieve ConfigMap (v1) resource"), e.getMessage());
    }
}
