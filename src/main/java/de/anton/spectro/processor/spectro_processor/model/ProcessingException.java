package de.anton.spectro.processor.spectro_processor.model;

/**
 * Base class of all failures raised while processing an instrument file.
 * The dispatcher records the pipeline stage that was running when the failure occurred.
 */
public class ProcessingException extends Exception {

    private String stage; // Name of the pipeline stage, set once by the dispatcher

    public ProcessingException(String message) {
        super(message);
    }

    public ProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

    /** @return The pipeline stage that raised this exception, or null if raised outside a run. */
    public String getStage() {
        return stage;
    }

    /**
     * Records the stage that raised the exception. Only the first call has an effect,
     * so a nested run (blank file) keeps its own stage.
     */
    public void setStage(String stage) {
        if (this.stage == null) {
            this.stage = stage;
        }
    }

    @Override
    public String getMessage() {
        return stage == null ? super.getMessage() : "[" + stage + "] " + super.getMessage();
    }
}
