/**
 *
 */
package org.theseed.bng.cli;

import java.io.IOException;
import java.io.PrintWriter;

import org.kohsuke.args4j.Option;
import org.theseed.bng.BngEngine;
import org.theseed.bng.model.Species;

/**
 * This command reports on the species and reactant classes in use in a spatial model.  The
 * summary line from the engine is written first, and it can be followed by a list of the species.
 *
 * The positional parameter is the name of the model JSON file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report, if not STDOUT
 *
 * --species	list the individual species after the summary
 *
 */
public class StatsProcessor extends BaseModelReportProcessor {

    // COMMAND-LINE OPTIONS

    /** TRUE to list the species */
    @Option(name = "--species", usage = "if specified, the individual species will be listed")
    private boolean listSpecies;

    @Override
    protected void setReporterDefaults() {
        this.listSpecies = false;
    }

    @Override
    protected void validateModelReportParms() throws IOException, ParseFailureException {
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        BngEngine engine = this.getEngine();
        writer.println(engine.getStatsReport());
        if (this.listSpecies) {
            writer.println("id\tspecies\tactive\treactant_class");
            for (Species sp : engine.getAllSpecies().getSpeciesVector()) {
                String active = (sp.wasInstantiated() ? "Y" : "");
                String rClass = (sp.hasValidReactantClassId() ? Integer.toString(sp.getReactantClassId()) : "");
                writer.format("%d\t%s\t%s\t%s%n", sp.getId(), sp.getName(), active, rClass);
            }
        }
    }

}
