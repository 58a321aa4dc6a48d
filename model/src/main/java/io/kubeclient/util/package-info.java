@NullMarked
package io.kubeclient.util;

import org.jspecify.annotations.NullMarked;
