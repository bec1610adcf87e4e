package com.customerapi.common.validation;

/**
 * Validates entity identifiers taken from routes and request bodies.
 */
public final class IdentifierValidator {

    private IdentifierValidator() {
        // Utility class - no instantiation
    }

    public static ErrorInfo validate(Integer id) {
        if (id == null || id < 1) {
            return ErrorInfo.badInput("id", "Identifier must be a positive integer");
        }
        return ErrorInfo.ok();
    }

    /**
     * The route identifier must be valid and equal to the one in the body.
     */
    public static ErrorInfo validate(Integer routeId, Integer bodyId) {
        ErrorInfo errorInfo = validate(routeId);
        if (!errorInfo.isOk()) {
            return errorInfo;
        }

        if (bodyId == null) {
            return ErrorInfo.badInput("customerIdentifier", "Identifier in request body is required");
        }

        if (!routeId.equals(bodyId)) {
            return ErrorInfo.badInput("customerIdentifier",
                    String.format("Identifier in route (%d) does not match identifier in body (%d)", routeId, bodyId));
        }

        return ErrorInfo.ok();
    }
}
