/**
 *
 */
package org.theseed.bng;

import java.io.PrintWriter;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.bng.export.BnglExporter;
import org.theseed.bng.model.Complex;
import org.theseed.bng.model.ModelData;
import org.theseed.bng.model.Orientation;
import org.theseed.bng.model.ReactionRule;
import org.theseed.bng.model.Species;
import org.theseed.bng.registry.RuleRegistry;
import org.theseed.bng.registry.SpeciesRegistry;

/**
 * This is the main entry point for a built spatial model.  It registers the model's reaction
 * rules, reports on species usage, creates complexes from species templates, and exports the
 * model as BNGL.
 *
 * The engine must be initialized before anything else is done with it.  After initialization the
 * model and the registries are treated as read-only, except for the species flags maintained by
 * the simulation.
 *
 */
public class BngEngine {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BngEngine.class);
    /** source model */
    private ModelData data;
    /** registry of finalized reaction rules */
    private RuleRegistry allRxns;
    /** registry of species */
    private SpeciesRegistry allSpecies;
    /** TRUE once the rules have been registered */
    private boolean initialized;

    /**
     * Construct an engine for a model.
     *
     * @param data			built model
     * @param allRxns		empty rule registry to receive the model's rules
     * @param allSpecies	species registry
     */
    public BngEngine(ModelData data, RuleRegistry allRxns, SpeciesRegistry allSpecies) {
        this.data = data;
        this.allRxns = allRxns;
        this.allSpecies = allSpecies;
        this.initialized = false;
    }

    /**
     * Register every reaction rule in the model.  This must be called exactly once.
     *
     * @throws IllegalStateException	if the engine is already initialized
     */
    public void initialize() {
        if (this.initialized)
            throw new IllegalStateException("BNG engine initialized twice.");
        for (ReactionRule r : this.data.getRxnRules())
            this.allRxns.addAndFinalize(r);
        this.initialized = true;
        log.info("{} reaction rules registered in {} reaction classes.", this.allRxns.getRules().size(),
                this.allRxns.getNumRxnClasses());
    }

    /**
     * @return TRUE if the engine has been initialized
     */
    public boolean isInitialized() {
        return this.initialized;
    }

    /**
     * Insure the engine has been initialized.
     */
    private void checkInitialized() {
        if (! this.initialized)
            throw new IllegalStateException("BNG engine used before initialization.");
    }

    /**
     * @return a one-line report of active species and reactant classes
     *
     * @throws IllegalStateException	if the engine is not initialized or the species registry contains a null
     */
    public String getStatsReport() {
        this.checkInitialized();
        Set<Integer> activeReactantClasses = new HashSet<Integer>();
        int numActiveSpecies = 0;
        List<Species> speciesVector = this.allSpecies.getSpeciesVector();
        for (Species s : speciesVector) {
            if (s == null)
                throw new IllegalStateException("Null entry found in species registry.");
            if (s.wasInstantiated()) {
                numActiveSpecies++;
                if (s.hasValidReactantClassId())
                    activeReactantClasses.add(s.getReactantClassId());
            }
        }
        String retVal = "[active/total species " + numActiveSpecies + "/" + speciesVector.size()
                + ", rxn classes " + this.allRxns.getNumRxnClasses()
                + ", active/total reactant classes " + activeReactantClasses.size() + "/"
                + this.allRxns.getNumExistingReactantClasses() + "]";
        return retVal;
    }

    /**
     * Create a complex from a species template.  The new complex is an independent copy, so the
     * species is not changed.
     *
     * @param id				ID of the source species
     * @param orientation		orientation of the new complex
     * @param compartmentId		ID of the compartment containing the new complex
     *
     * @return the new complex
     *
     * @throws IllegalArgumentException		if the species ID is invalid
     */
    public Complex createComplexFromSpecies(int id, Orientation orientation, int compartmentId) {
        Species ref = this.allSpecies.get(id);
        Complex retVal = new Complex(ref.getComplex());
        retVal.setOrientation(orientation);
        retVal.setCompartmentId(compartmentId);
        return retVal;
    }

    /**
     * Export the model as BNGL.
     *
     * @param outParameters			output for the parameter lines
     * @param outMoleculeTypes		output for the molecule types section
     * @param outCompartments		output for the compartments section
     * @param outReactionRules		output for the reaction rules section
     * @param ratesForNfsim			TRUE to convert rates for NFSim
     * @param volumeForNfsim		reference compartment volume in um^3 (NFSim only)
     * @param areaForNfsim			reference compartment area in um^2 (NFSim only)
     *
     * @return the error messages for anything that could not be exported, or an empty string
     *
     * @throws IllegalStateException	if the engine is not initialized or the compartment hierarchy is malformed
     * @throws IllegalArgumentException	if NFSim rates are requested and the volume or area is not positive
     */
    public String exportToBngl(PrintWriter outParameters, PrintWriter outMoleculeTypes, PrintWriter outCompartments,
            PrintWriter outReactionRules, boolean ratesForNfsim, double volumeForNfsim, double areaForNfsim) {
        this.checkInitialized();
        BnglExporter exporter = new BnglExporter(this.data, this.allRxns);
        return exporter.exportToBngl(outParameters, outMoleculeTypes, outCompartments, outReactionRules,
                ratesForNfsim, volumeForNfsim, areaForNfsim);
    }

    /**
     * @return the source model
     */
    public ModelData getData() {
        return this.data;
    }

    /**
     * @return the rule registry
     */
    public RuleRegistry getAllRxns() {
        return this.allRxns;
    }

    /**
     * @return the species registry
     */
    public SpeciesRegistry getAllSpecies() {
        return this.allSpecies;
    }

}
