package dk.trustworks.staffing.exceptions;

/**
 * Generic exception for the staffing engine.
 * Thrown when the input snapshot cannot be used for a calculation.
 */
public class StaffingEngineException extends RuntimeException {

    public StaffingEngineException(String message) {
        super(message);
    }

    public StaffingEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
