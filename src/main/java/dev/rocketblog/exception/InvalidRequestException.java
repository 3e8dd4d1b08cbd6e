package dev.rocketblog.exception;

import lombok.Getter;

/**
 * A request parameter failed validation. Raised before any statement is built,
 * so no store interaction happens for the request.
 * The message is an i18n key resolved by {@link GlobalExceptionHandler}.
 */
@Getter
public class InvalidRequestException extends RuntimeException {

    private final String field;

    public InvalidRequestException(String field, String messageKey) {
        super(messageKey);
        this.field = field;
    }
}
