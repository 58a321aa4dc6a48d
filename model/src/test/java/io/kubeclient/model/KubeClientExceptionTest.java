package io.kubeclient.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.io.IOException;

import org.junit.jupiter.api.Test;

public class KubeClientExceptionTest {

    @Test
    void testExposesStatusDetails() {
        StatusV1 status = StatusV1.failure(409, "AlreadyExists", "configmaps \"a\" already exists");

        KubeClientException e = new KubeClientException("conflict", 409, status, "ConfigMap (v1) resource");

        assertEquals(409, e.getStatusCode());
        assertEquals("AlreadyExists", e.getReason());
        assertSame(status, e.getStatus());
        assertEquals("ConfigMap (v1) resource", e.getResourceTypeDescription());
        assertInstanceOf(KubeException.class, e);
    }

    @Test
    void testTransportFailureHasNoStatus() {
        IOException cause = new IOException("connection refused");

        KubeClientException e = new KubeClientException("failed", "Deployment (apps/v1) resource", cause);

        assertEquals(KubeClientException.NO_RESPONSE, e.getStatusCode());
        assertNull(e.getStatus());
        assertNull(e.getReason());
        assertSame(cause, e.getCause());
    }
}
