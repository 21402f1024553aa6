package io.taskrelay.spec;

import static io.taskrelay.spec.A2AErrorCodes.EXTENSION_SUPPORT_REQUIRED_ERROR_CODE;

import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;

/**
 * The agent declares an extension as required and the caller did not request it.
 */
public class ExtensionSupportRequiredError extends A2AError {

    public static final String REASON = "EXTENSION_SUPPORT_REQUIRED";

    public ExtensionSupportRequiredError() {
        this("Extension support required");
    }

    public ExtensionSupportRequiredError(String message) {
        this(message, null);
    }

    public ExtensionSupportRequiredError(String message, @Nullable Map<String, Object> details) {
        super(EXTENSION_SUPPORT_REQUIRED_ERROR_CODE, REASON, message, details);
    }

    public static ExtensionSupportRequiredError forExtensions(List<String> missing) {
        return new ExtensionSupportRequiredError(
                "Required extension(s) not requested: " + String.join(", ", missing),
                Map.of("extensions", List.copyOf(missing)));
    }
}
