@NullMarked
package io.taskrelay.server.util;

import org.jspecify.annotations.NullMarked;
