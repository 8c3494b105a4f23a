package org.cfnrefactor.sam;

import lombok.Getter;

/**
 * Raised when a resource the engine knows how to convert carries contradictory or mistyped input.
 * Unsupported shapes are skipped instead; this exception is only for input that cannot be right.
 */
@Getter
public class TemplateValidationException extends RuntimeException {

    private final String propertyName;
    private final String resourceId;

    public TemplateValidationException(String propertyName, String resourceId, String message) {
        super(message);
        this.propertyName = propertyName;
        this.resourceId = resourceId;
    }

    /**
     * Build the message used for invalid event source input.
     * @param resourceType short type name, e.g. {@code EventSourceMapping}
     */
    public static TemplateValidationException invalidEvent(String resourceType, String propertyName,
                                                           String resourceId, String detail) {
        String message = "Invalid " + resourceType + " property: Event with id [" + propertyName + "] is invalid. "
            + detail + " (resource " + resourceId + ")";
        return new TemplateValidationException(propertyName, resourceId, message);
    }
}
