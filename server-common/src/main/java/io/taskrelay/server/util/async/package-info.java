@NullMarked
package io.taskrelay.server.util.async;

import org.jspecify.annotations.NullMarked;
