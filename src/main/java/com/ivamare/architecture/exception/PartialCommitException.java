package com.ivamare.architecture.exception;

/**
 * Thrown when flushing a unit of work fails part way.
 *
 * <p>The unit of work is always rolled back before this is raised.
 * {@link #isCompensated()} tells whether repository writes that had already
 * been applied were undone.
 */
public class PartialCommitException extends ArchitectureException {

    /**
     * Flush stage, in the order stages run.
     */
    public enum Stage {
        DELETE,
        UPDATE,
        INSERT
    }

    private final Stage stage;
    private final Object entityKey;
    private final boolean compensated;

    public PartialCommitException(Stage stage, Object entityKey, boolean compensated, Throwable cause) {
        super("Commit failed at " + stage + " stage for " + entityKey
            + (compensated ? " (applied changes compensated)" : " (applied changes NOT compensated)")
            + ": " + cause.getMessage(), cause);
        this.stage = stage;
        this.entityKey = entityKey;
        this.compensated = compensated;
    }

    public Stage getStage() {
        return stage;
    }

    public Object getEntityKey() {
        return entityKey;
    }

    public boolean isCompensated() {
        return compensated;
    }
}
