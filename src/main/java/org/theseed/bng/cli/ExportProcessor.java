/**
 *
 */
package org.theseed.bng.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;

import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.bng.model.BnglNames;

/**
 * This command writes a spatial model as a BNGL file.  The parameter lines produced by the export
 * are wrapped in a parameters block, and the other three sections follow it.
 *
 * The positional parameter is the name of the model JSON file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for the BNGL, if not STDOUT
 *
 * --nfsim		convert the bimolecular rates for NFSim using a reference compartment
 * --volume		volume of the NFSim reference compartment in um^3
 * --area		area of the NFSim reference compartment in um^2
 *
 */
public class ExportProcessor extends BaseModelReportProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ExportProcessor.class);

    // COMMAND-LINE OPTIONS

    /** TRUE to produce rates for NFSim */
    @Option(name = "--nfsim", usage = "if specified, rates will be converted for NFSim")
    private boolean nfsimFlag;

    /** reference compartment volume */
    @Option(name = "--volume", metaVar = "0.125", usage = "reference compartment volume for NFSim rates (um^3)")
    private double volume;

    /** reference compartment area */
    @Option(name = "--area", metaVar = "1.5", usage = "reference compartment area for NFSim rates (um^2)")
    private double area;

    @Override
    protected void setReporterDefaults() {
        this.nfsimFlag = false;
        this.volume = 0.0;
        this.area = 0.0;
    }

    @Override
    protected void validateModelReportParms() throws IOException, ParseFailureException {
        if (this.nfsimFlag) {
            if (this.volume <= 0.0)
                throw new ParseFailureException("A positive reference volume is required for NFSim rates.");
            if (this.area <= 0.0)
                throw new ParseFailureException("A positive reference area is required for NFSim rates.");
            log.info("Rates will be converted for NFSim using volume {} and area {}.", this.volume, this.area);
        }
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        // Each section goes to its own buffer so they can be assembled in BNGL order.
        StringWriter params = new StringWriter();
        StringWriter moleculeTypes = new StringWriter();
        StringWriter compartments = new StringWriter();
        StringWriter reactionRules = new StringWriter();
        String errors;
        try (PrintWriter paramsOut = new PrintWriter(params);
                PrintWriter typesOut = new PrintWriter(moleculeTypes);
                PrintWriter compsOut = new PrintWriter(compartments);
                PrintWriter rulesOut = new PrintWriter(reactionRules)) {
            errors = this.getEngine().exportToBngl(paramsOut, typesOut, compsOut, rulesOut,
                    this.nfsimFlag, this.volume, this.area);
        }
        writer.print("# BNGL exported from " + this.getModelFile().getName() + "\n\n");
        writer.print(BnglNames.BEGIN_PARAMETERS + "\n");
        writer.print(params.toString());
        writer.print(BnglNames.END_PARAMETERS + "\n\n");
        writer.print(moleculeTypes.toString() + "\n");
        writer.print(compartments.toString() + "\n");
        writer.print(reactionRules.toString());
        if (errors.isEmpty())
            log.info("Model exported without errors.");
        else
            log.warn("Model export was incomplete:\n{}", errors);
    }

}
