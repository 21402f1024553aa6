@NullMarked
package io.taskrelay.server.agentexecution;

import org.jspecify.annotations.NullMarked;
