package io.surfworks.templar.json;

/**
 * Exception thrown when a JSON function definition cannot be read.
 */
public class TemplateJsonException extends RuntimeException {

    public TemplateJsonException(String message) {
        super(message);
    }

    public TemplateJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
