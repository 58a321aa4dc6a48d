@NullMarked
package io.kubeclient.client.http.jdk;

import org.jspecify.annotations.NullMarked;
