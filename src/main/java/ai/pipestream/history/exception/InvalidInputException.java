package ai.pipestream.history.exception;

/**
 * Thrown when request validation fails. Raised before any store mutation.
 */
public class InvalidInputException extends HistoryServiceException {

    public InvalidInputException(String operation, String field, String reason) {
        super("INVALID_INPUT", operation, String.format("Invalid %s: %s", field, reason));
    }

    public static InvalidInputException missingField(String operation, String fieldName) {
        return new InvalidInputException(operation, fieldName, "field is required but missing");
    }

    public static InvalidInputException invalidField(String operation, String fieldName, String value, String reason) {
        return new InvalidInputException(operation, fieldName,
                String.format("value '%s' is invalid: %s", value, reason));
    }
}
