/**
 * Data contracts of the Kubernetes-style resource API.
 *
 * <p>Resources and lists are immutable records. The {@link io.kubeclient.model.KubeKindRegistry}
 * maps model types to their declared kind and API version and is only consulted to describe
 * failures. Client-side failures are reported through the unchecked
 * {@link io.kubeclient.model.KubeException} hierarchy:
 * <ul>
 *   <li>{@link io.kubeclient.model.KubeClientException} - the API answered with a non-success status</li>
 *   <li>{@link io.kubeclient.model.KubeProtocolException} - the response could not be understood
 *       (missing content type, unknown charset, malformed JSON)</li>
 *   <li>{@link io.kubeclient.model.KubeStreamException} - a watch stream was aborted by something
 *       other than its consumer</li>
 * </ul>
 */
@NullMarked
package io.kubeclient.model;

import org.jspecify.annotations.NullMarked;
