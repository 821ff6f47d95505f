package de.anton.spectro.processor.spectro_processor;

import de.anton.spectro.processor.spectro_processor.controller.CommandLineController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main application class. Hands the arguments to the command line controller and exits with its code.
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new CommandLineController().run(args, System.out, System.err);
        } catch (RuntimeException e) {
            // Catch critical errors not mapped to an exit code
            logger.error("Critical error while processing", e);
            System.err.println("Unexpected error: " + e.getClass().getSimpleName() + ": " + e.getMessage());
            exitCode = CommandLineController.EXIT_PROCESSING;
        }
        logger.debug("Exiting with code {}", exitCode);
        System.exit(exitCode);
    }
}
