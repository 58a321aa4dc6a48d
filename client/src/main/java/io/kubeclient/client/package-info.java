/**
 * Client entry point and its configuration.
 */
@NullMarked
package io.kubeclient.client;

import org.jspecify.annotations.NullMarked;
