@NullMarked
package io.taskrelay.server.version;

import org.jspecify.annotations.NullMarked;
