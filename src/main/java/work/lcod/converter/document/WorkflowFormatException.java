package work.lcod.converter.document;

/**
 * Raised when a workflow document is well-formed XML but cannot be turned into a graph safely.
 */
public final class WorkflowFormatException extends RuntimeException {
    public WorkflowFormatException(String message) {
        super(message);
    }
}
