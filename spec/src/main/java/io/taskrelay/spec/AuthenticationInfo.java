package io.taskrelay.spec;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.taskrelay.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Credentials the server presents when calling a client's webhook.
 *
 * @param schemes authentication schemes, e.g. {@code Bearer}
 * @param credentials the credential value sent with the first scheme
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthenticationInfo(List<String> schemes, @Nullable String credentials) {

    public AuthenticationInfo {
        Assert.checkNotNullParam("schemes", schemes);
        schemes = List.copyOf(schemes);
    }
}
