/**
 * Client side of task delegation.
 *
 * <p>{@link io.taskrelay.client.TaskObserver} sends a prompt to a remote agent through a
 * {@link io.taskrelay.client.ClientTransport} and polls the resulting task until it reaches a
 * terminal state or asks for more input.
 */
@NullMarked
package io.taskrelay.client;

import org.jspecify.annotations.NullMarked;
