/**
 * Configuration sources and the typed server settings read from them.
 */
@NullMarked
package io.taskrelay.server.config;

import org.jspecify.annotations.NullMarked;
