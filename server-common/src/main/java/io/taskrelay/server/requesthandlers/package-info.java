@NullMarked
package io.taskrelay.server.requesthandlers;

import org.jspecify.annotations.NullMarked;
