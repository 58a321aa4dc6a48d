/**
 * Line-oriented reading of streamed response bodies.
 *
 * <p>{@link io.kubeclient.client.http.lines.LineDecoder} turns byte chunks into lines whatever
 * the chunking and line-ending convention. {@link io.kubeclient.client.http.lines.LineStream}
 * connects a body publisher to a blocking iterator with bounded read-ahead and cancellation.
 */
@NullMarked
package io.kubeclient.client.http.lines;

import org.jspecify.annotations.NullMarked;
