@NullMarked
package io.taskrelay.server.http;

import org.jspecify.annotations.NullMarked;
