/**
 *
 */
package org.theseed.bng.cli;

/**
 * This exception is thrown when a command's parameters are invalid.
 *
 */
public class ParseFailureException extends Exception {

    /** serialization ID */
    private static final long serialVersionUID = -2715412081657617218L;

    public ParseFailureException(String message) {
        super(message);
    }

    public ParseFailureException(String message, Throwable cause) {
        super(message, cause);
    }

}
