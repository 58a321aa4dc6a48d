/**
 * {@link io.kubeclient.client.http.HttpClient} implementation on top of Vert.x core.
 */
@NullMarked
package io.kubeclient.client.http.vertx;

import org.jspecify.annotations.NullMarked;
