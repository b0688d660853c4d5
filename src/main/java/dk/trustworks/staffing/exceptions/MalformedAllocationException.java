package dk.trustworks.staffing.exceptions;

/**
 * Exception thrown when an allocation map contains a key that is not an ISO date
 * (yyyy-MM-dd) or a missing percentage.
 */
public class MalformedAllocationException extends StaffingEngineException {

    private final String offendingKey;

    public MalformedAllocationException(String offendingKey, String message) {
        super(message);
        this.offendingKey = offendingKey;
    }

    public MalformedAllocationException(String offendingKey, String message, Throwable cause) {
        super(message, cause);
        this.offendingKey = offendingKey;
    }

    public String getOffendingKey() {
        return offendingKey;
    }
}
