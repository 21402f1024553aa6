/**
 * Per-task event streams: one main queue per task fanning out to bounded subscriber queues.
 */
@NullMarked
package io.taskrelay.server.events;

import org.jspecify.annotations.NullMarked;
