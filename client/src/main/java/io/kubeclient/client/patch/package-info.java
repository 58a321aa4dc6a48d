/**
 * JSON-Patch (RFC 6902) documents for PATCH requests.
 */
@NullMarked
package io.kubeclient.client.patch;

import org.jspecify.annotations.NullMarked;
