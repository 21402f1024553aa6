@NullMarked
package io.taskrelay.server.extensions;

import org.jspecify.annotations.NullMarked;
