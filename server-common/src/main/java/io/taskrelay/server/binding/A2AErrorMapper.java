package io.taskrelay.server.binding;

import static io.taskrelay.spec.A2AErrorCodes.CONTENT_TYPE_NOT_SUPPORTED_ERROR_CODE;
import static io.taskrelay.spec.A2AErrorCodes.EXTENDED_AGENT_CARD_NOT_CONFIGURED_ERROR_CODE;
import static io.taskrelay.spec.A2AErrorCodes.EXTENSION_SUPPORT_REQUIRED_ERROR_CODE;
import static io.taskrelay.spec.A2AErrorCodes.INTERNAL_ERROR_CODE;
import static io.taskrelay.spec.A2AErrorCodes.INVALID_AGENT_RESPONSE_ERROR_CODE;
import static io.taskrelay.spec.A2AErrorCodes.INVALID_PARAMS_ERROR_CODE;
import static io.taskrelay.spec.A2AErrorCodes.INVALID_REQUEST_ERROR_CODE;
import static io.taskrelay.spec.A2AErrorCodes.JSON_PARSE_ERROR_CODE;
import static io.taskrelay.spec.A2AErrorCodes.METHOD_NOT_FOUND_ERROR_CODE;
import static io.taskrelay.spec.A2AErrorCodes.PUSH_NOTIFICATION_NOT_SUPPORTED_ERROR_CODE;
import static io.taskrelay.spec.A2AErrorCodes.TASK_NOT_CANCELABLE_ERROR_CODE;
import static io.taskrelay.spec.A2AErrorCodes.TASK_NOT_FOUND_ERROR_CODE;
import static io.taskrelay.spec.A2AErrorCodes.UNSUPPORTED_OPERATION_ERROR_CODE;
import static io.taskrelay.spec.A2AErrorCodes.VERSION_NOT_SUPPORTED_ERROR_CODE;

import java.util.Map;

import io.taskrelay.spec.A2AError;
import io.taskrelay.spec.InternalError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates errors into the codes of each protocol binding.
 * <p>
 * JSON-RPC uses the error's own code; HTTP and gRPC statuses are looked up from it. Any
 * exception that is not an {@link A2AError}, storage failures included, is reported as an
 * {@link InternalError} without exposing its message.
 */
public final class A2AErrorMapper {

    private static final Logger LOGGER = LoggerFactory.getLogger(A2AErrorMapper.class);

    private static final Map<Integer, Integer> HTTP_STATUS = Map.ofEntries(
            Map.entry(TASK_NOT_FOUND_ERROR_CODE, 404),
            Map.entry(TASK_NOT_CANCELABLE_ERROR_CODE, 409),
            Map.entry(PUSH_NOTIFICATION_NOT_SUPPORTED_ERROR_CODE, 501),
            Map.entry(UNSUPPORTED_OPERATION_ERROR_CODE, 501),
            Map.entry(CONTENT_TYPE_NOT_SUPPORTED_ERROR_CODE, 415),
            Map.entry(INVALID_AGENT_RESPONSE_ERROR_CODE, 502),
            Map.entry(EXTENDED_AGENT_CARD_NOT_CONFIGURED_ERROR_CODE, 400),
            Map.entry(EXTENSION_SUPPORT_REQUIRED_ERROR_CODE, 400),
            Map.entry(VERSION_NOT_SUPPORTED_ERROR_CODE, 501),
            Map.entry(INVALID_PARAMS_ERROR_CODE, 422),
            Map.entry(INVALID_REQUEST_ERROR_CODE, 400),
            Map.entry(METHOD_NOT_FOUND_ERROR_CODE, 404),
            Map.entry(JSON_PARSE_ERROR_CODE, 400),
            Map.entry(INTERNAL_ERROR_CODE, 500));

    private static final Map<Integer, String> GRPC_STATUS = Map.ofEntries(
            Map.entry(TASK_NOT_FOUND_ERROR_CODE, "NOT_FOUND"),
            Map.entry(TASK_NOT_CANCELABLE_ERROR_CODE, "FAILED_PRECONDITION"),
            Map.entry(PUSH_NOTIFICATION_NOT_SUPPORTED_ERROR_CODE, "UNIMPLEMENTED"),
            Map.entry(UNSUPPORTED_OPERATION_ERROR_CODE, "UNIMPLEMENTED"),
            Map.entry(CONTENT_TYPE_NOT_SUPPORTED_ERROR_CODE, "INVALID_ARGUMENT"),
            Map.entry(INVALID_AGENT_RESPONSE_ERROR_CODE, "INTERNAL"),
            Map.entry(EXTENDED_AGENT_CARD_NOT_CONFIGURED_ERROR_CODE, "FAILED_PRECONDITION"),
            Map.entry(EXTENSION_SUPPORT_REQUIRED_ERROR_CODE, "FAILED_PRECONDITION"),
            Map.entry(VERSION_NOT_SUPPORTED_ERROR_CODE, "UNIMPLEMENTED"),
            Map.entry(INVALID_PARAMS_ERROR_CODE, "INVALID_ARGUMENT"),
            Map.entry(INVALID_REQUEST_ERROR_CODE, "INVALID_ARGUMENT"),
            Map.entry(METHOD_NOT_FOUND_ERROR_CODE, "UNIMPLEMENTED"),
            Map.entry(JSON_PARSE_ERROR_CODE, "INVALID_ARGUMENT"),
            Map.entry(INTERNAL_ERROR_CODE, "INTERNAL"));

    private A2AErrorMapper() {
    }

    /**
     * Binding independent description of an error.
     *
     * @param jsonRpcCode the JSON-RPC error code
     * @param httpStatus the HTTP status for REST
     * @param grpcStatus the gRPC status code name
     * @param reason stable machine readable reason
     * @param message human readable message
     * @param details structured details, possibly empty
     */
    public record MappedError(int jsonRpcCode, int httpStatus, String grpcStatus, String reason, String message,
                              Map<String, Object> details) {
    }

    public static MappedError map(Throwable throwable) {
        A2AError error = toA2AError(throwable);
        return new MappedError(error.getCode(), httpStatus(error), grpcStatus(error), error.getReason(),
                error.getMessage() == null ? "" : error.getMessage(), error.getDetails());
    }

    public static A2AError toA2AError(Throwable throwable) {
        if (throwable instanceof A2AError a2aError) {
            return a2aError;
        }
        LOGGER.error("Unexpected failure reported as internal error", throwable);
        return new InternalError("Internal error");
    }

    public static int jsonRpcCode(A2AError error) {
        return error.getCode();
    }

    public static int httpStatus(A2AError error) {
        return HTTP_STATUS.getOrDefault(error.getCode(), 500);
    }

    public static String grpcStatus(A2AError error) {
        return GRPC_STATUS.getOrDefault(error.getCode(), "INTERNAL");
    }
}
