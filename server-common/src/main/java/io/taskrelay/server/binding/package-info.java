@NullMarked
package io.taskrelay.server.binding;

import org.jspecify.annotations.NullMarked;
