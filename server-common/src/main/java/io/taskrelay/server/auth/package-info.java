/**
 * Caller identity and task visibility.
 */
@NullMarked
package io.taskrelay.server.auth;

import org.jspecify.annotations.NullMarked;
