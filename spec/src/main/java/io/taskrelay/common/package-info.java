@NullMarked
package io.taskrelay.common;

import org.jspecify.annotations.NullMarked;
