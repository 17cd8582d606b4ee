/**
 *
 */
package org.theseed.bng.cli;

import java.io.IOException;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * This is the base class for command processors.  The subclass declares its options and
 * positional parameters with args4j annotations.  The command is processed in three steps:
 * the defaults are set, the command line is parsed and validated, and then the command is run.
 *
 * The command-line options common to all commands are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 */
public abstract class BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);
    /** TRUE if the command ran without error */
    private boolean succeeded;

    // COMMAND-LINE OPTIONS

    /** help option */
    @Option(name = "-h", aliases = { "--help" }, help = true)
    private boolean help;

    /** debug-message flag */
    @Option(name = "-v", aliases = { "--verbose", "--debug" }, usage = "show more detailed progress messages")
    private boolean debug;

    /**
     * Parse the command line and validate the parameters.
     *
     * @param args	command-line arguments
     *
     * @return TRUE if the command is ready to run, FALSE if it should be skipped
     */
    public boolean parseCommand(String[] args) {
        boolean retVal = false;
        this.help = false;
        this.debug = false;
        this.setDefaults();
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            if (this.help)
                parser.printUsage(System.err);
            else {
                if (this.debug) {
                    ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
                            LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
                    root.setLevel(Level.DEBUG);
                    log.debug("Debug logging enabled.");
                }
                retVal = this.validateParms();
            }
        } catch (CmdLineException | ParseFailureException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
        } catch (IOException e) {
            log.error("Error setting up command: {}", e.toString());
        }
        return retVal;
    }

    /**
     * Run the command.  Errors are logged, and the result can be checked with {@link #isSucceeded()}.
     */
    public void run() {
        this.succeeded = false;
        try {
            long start = System.currentTimeMillis();
            this.runCommand();
            log.info("Command complete in {} ms.", System.currentTimeMillis() - start);
            this.succeeded = true;
        } catch (Exception e) {
            log.error("Command failed.", e);
        }
    }

    /**
     * @return TRUE if the last run completed without error
     */
    public boolean isSucceeded() {
        return this.succeeded;
    }

    /**
     * Set the default values of the command-line options.
     */
    protected abstract void setDefaults();

    /**
     * Validate the command-line options and parameters.
     *
     * @return TRUE if the command should proceed
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract boolean validateParms() throws IOException, ParseFailureException;

    /**
     * Execute the command.
     *
     * @throws Exception
     */
    protected abstract void runCommand() throws Exception;

}
