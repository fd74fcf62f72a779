/**
 * Default {@link io.engagespot.client.http.HttpClient} backed by {@code java.net.http.HttpClient}.
 */
@NullMarked
package io.engagespot.client.http.jdk;

import org.jspecify.annotations.NullMarked;
