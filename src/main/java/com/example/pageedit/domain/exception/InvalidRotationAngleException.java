package com.example.pageedit.domain.exception;

/**
 * Raised when a rotation angle is not a non-zero multiple of 90 degrees.
 */
public class InvalidRotationAngleException extends DomainException {

	/**
	 * @param angle rejected angle in degrees
	 */
    public InvalidRotationAngleException(int angle) {
        super("Rotation angle must be a non-zero multiple of 90 degrees: " + angle);
    }
}
