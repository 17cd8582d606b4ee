/**
 *
 */
package org.theseed.bng.cli;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

import org.kohsuke.args4j.Argument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.bng.BngEngine;
import org.theseed.bng.model.ModelLoader;
import org.theseed.bng.model.Species;
import org.theseed.bng.registry.RuleContainer;
import org.theseed.bng.registry.SpeciesContainer;

/**
 * This is a base class for commands against spatial models.  The model is loaded, its species are
 * put in a species registry, and the engine is initialized before the subclass validates its own
 * parameters.  Each species is given its reactant class once the rules are registered.
 *
 * The positional parameter is the name of the model JSON file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 */
public abstract class BaseModelProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseModelProcessor.class);
    /** initialized engine for the model */
    private BngEngine engine;
    /** rule registry */
    private RuleContainer rules;

    // COMMAND-LINE OPTIONS

    /** model JSON file */
    @Argument(index = 0, metaVar = "model.json", usage = "JSON file for spatial model",
            required = true)
    private File modelFile;

    @Override
    protected final void setDefaults() {
        this.setModelDefaults();
    }

    /**
     * Set the default options for the subclass.
     */
    protected abstract void setModelDefaults();

    @Override
    protected final boolean validateParms() throws IOException, ParseFailureException {
        if (! this.modelFile.canRead())
            throw new FileNotFoundException("Model file " + this.modelFile + " is not found or unreadable.");
        log.info("Loading model from {}.", this.modelFile);
        ModelLoader loader = new ModelLoader(this.modelFile);
        SpeciesContainer species = new SpeciesContainer();
        for (Species sp : loader.getSpecies())
            species.add(sp);
        this.rules = new RuleContainer(loader.getModel());
        this.engine = new BngEngine(loader.getModel(), this.rules, species);
        this.engine.initialize();
        for (Species sp : species.getSpeciesVector())
            sp.setReactantClassId(this.rules.getReactantClassId(sp.getComplex()));
        log.debug("Reaction classes: {}", this.rules.describeRxnClasses());
        this.validateModelParms();
        return true;
    }

    /**
     * Validate and process the subclass parameters and options.
     *
     * @throws ParseFailureException
     * @throws IOException
     */
    protected abstract void validateModelParms() throws IOException, ParseFailureException;

    /**
     * @return the initialized engine
     */
    protected BngEngine getEngine() {
        return this.engine;
    }

    /**
     * @return the model file name
     */
    protected File getModelFile() {
        return this.modelFile;
    }

}
