/**
 * Agent card validation, canonicalization and signature verification.
 */
@NullMarked
package io.taskrelay.server.agentcard;

import org.jspecify.annotations.NullMarked;
