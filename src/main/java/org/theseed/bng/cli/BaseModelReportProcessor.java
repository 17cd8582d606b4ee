/**
 *
 */
package org.theseed.bng.cli;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is the base class for commands whose output is a single UTF-8 text document built from a
 * loaded spatial model, such as a BNGL file or a species usage report.  The subclass writes the
 * document to a print writer; this class decides where the text goes.  An output file is only
 * created once the model has loaded and the subclass options have been accepted, so a failed
 * validation never leaves an empty BNGL file behind.
 *
 * The positional parameter is the name of the model JSON file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	file to receive the document (the default is the standard output)
 *
 */
public abstract class BaseModelReportProcessor extends BaseModelProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseModelReportProcessor.class);

    // COMMAND-LINE OPTIONS

    /** document output file (if not STDOUT) */
    @Option(name = "-o", aliases = { "--output" }, metaVar = "model.bngl",
            usage = "file to receive the output document (if not STDOUT)")
    private File outFile;

    @Override
    protected void setModelDefaults() {
        this.outFile = null;
        this.setReporterDefaults();
    }

    /**
     * Set the defaults for the document options of the subclass.
     */
    protected abstract void setReporterDefaults();

    @Override
    protected void validateModelParms() throws IOException, ParseFailureException {
        this.validateModelReportParms();
        if (this.outFile == null)
            log.info("Document will be written to the standard output.");
        else
            log.info("Document will be written to {}.", this.outFile);
    }

    /**
     * Check the document options of the subclass.
     *
     * @throws ParseFailureException
     * @throws IOException
     */
    protected abstract void validateModelReportParms() throws IOException, ParseFailureException;

    @Override
    protected final void runCommand() throws Exception {
        boolean toFile = (this.outFile != null);
        OutputStream stream = (toFile ? new FileOutputStream(this.outFile) : System.out);
        PrintWriter writer = new PrintWriter(new OutputStreamWriter(stream, StandardCharsets.UTF_8));
        try {
            this.runReporter(writer);
        } finally {
            writer.flush();
            // The standard output stays open for whoever runs us.
            if (toFile)
                writer.close();
        }
    }

    /**
     * Write the document.
     *
     * @param writer	UTF-8 print writer for the document text
     *
     * @throws Exception
     */
    protected abstract void runReporter(PrintWriter writer) throws Exception;

}
