/**
 * Pluggable HTTP transport used by the resource client.
 *
 * <p>{@link io.kubeclient.client.http.HttpClient} builds GET, POST, PUT, PATCH and DELETE
 * requests against a base URL and answers with an {@link io.kubeclient.client.http.HttpResponse}
 * whatever the status code. Streamed GET requests expose the body as a
 * {@code Flow.Publisher} of byte chunks, which {@link io.kubeclient.client.http.lines.LineStream}
 * turns into lines.
 *
 * <p>{@link io.kubeclient.client.http.jdk.JdkHttpClientBuilder} is the default transport.
 * A Vert.x transport ships in a separate artifact.
 */
@NullMarked
package io.kubeclient.client.http;

import org.jspecify.annotations.NullMarked;
