/**
 * Task lifecycle: storage, the state machine, atomic task mutations and webhook delivery.
 */
@NullMarked
package io.taskrelay.server.tasks;

import org.jspecify.annotations.NullMarked;
