/**
 * Server side of the task delegation core.
 * <p>
 * Bindings (JSON-RPC, gRPC, REST) translate wire requests into calls on
 * {@link io.taskrelay.server.requesthandlers.RequestHandler}, passing a
 * {@link io.taskrelay.server.ServerCallContext} that describes the caller.
 */
@NullMarked
package io.taskrelay.server;

import org.jspecify.annotations.NullMarked;
