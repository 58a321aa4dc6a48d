/**
 * Resource gateway and typed resource clients.
 *
 * <p>{@link io.kubeclient.client.resources.KubeResourceClient} implements fetch, list, create,
 * replace, patch, delete and watch against path templates described by
 * {@link io.kubeclient.client.resources.ResourceRequest}. Failures are mapped to
 * {@link io.kubeclient.model.KubeClientException} from the server's Status document. A fetch of a
 * resource the server reports as {@code NotFound} yields an empty {@code Optional} instead.
 */
@NullMarked
package io.kubeclient.client.resources;

import org.jspecify.annotations.NullMarked;
