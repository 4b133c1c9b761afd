package com.dcruver.medi.app;

import com.dcruver.medi.error.MediException;
import com.dcruver.medi.error.StaleIndexException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.command.CommandExceptionResolver;
import org.springframework.shell.command.CommandHandlingResult;
import org.springframework.stereotype.Component;

/**
 * Turns failures raised by commands into one readable line and a non-zero exit code.
 * Exit code 1 is an error; 2 means the note store was updated but the search index is stale.
 */
@Component
@Slf4j
public class ShellErrorResolver implements CommandExceptionResolver {

    static final int EXIT_ERROR = 1;
    static final int EXIT_STALE_INDEX = 2;

    @Override
    public CommandHandlingResult resolve(Exception ex) {
        if (ex instanceof StaleIndexException) {
            log.warn(ex.getMessage(), ex);
            return CommandHandlingResult.of("Warning: " + ex.getMessage() + "\n", EXIT_STALE_INDEX);
        }
        if (ex instanceof MediException || ex instanceof IllegalArgumentException) {
            log.error("Command failed: {}", ex.getMessage(), ex);
            return CommandHandlingResult.of("Error: " + ex.getMessage() + "\n", EXIT_ERROR);
        }
        // anything else is left to Spring Shell's default handling
        return null;
    }
}
