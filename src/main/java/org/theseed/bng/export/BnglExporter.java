/**
 *
 */
package org.theseed.bng.export;

import static org.theseed.bng.model.BnglNames.*;

import java.io.PrintWriter;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.bng.model.Compartment;
import org.theseed.bng.model.ModelData;
import org.theseed.bng.model.MoleculeType;
import org.theseed.bng.registry.RegisteredRule;
import org.theseed.bng.registry.RuleRegistry;

/**
 * This object writes a spatial model as BNGL.  The output is divided into four sections:  the
 * parameters, the molecule types, the compartments and the reaction rules.  The parameters are
 * written by all three of the other section writers, so the writers must run in a fixed order
 * (molecule types, then reaction rules, then compartments) to get reproducible output.
 *
 * None of the methods here modify the model or the rule registry.
 *
 */
public class BnglExporter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BnglExporter.class);
    /** source model */
    private ModelData model;
    /** finalized rules */
    private RuleRegistry rules;

    /**
     * Construct an exporter for a model.
     *
     * @param model		model to export
     * @param rules		rule registry containing the model's finalized rules
     */
    public BnglExporter(ModelData model, RuleRegistry rules) {
        this.model = model;
        this.rules = rules;
    }

    /**
     * Export the whole model.
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
     * @throws IllegalArgumentException	if NFSim rates are requested and the volume or area is not positive
     * @throws IllegalStateException	if the compartment hierarchy is malformed
     */
    public String exportToBngl(PrintWriter outParameters, PrintWriter outMoleculeTypes, PrintWriter outCompartments,
            PrintWriter outReactionRules, boolean ratesForNfsim, double volumeForNfsim, double areaForNfsim) {
        RateConversion conversion = new RateConversion(ratesForNfsim, volumeForNfsim, areaForNfsim);
        conversion.writeGlobalParameters(outParameters);
        this.exportMoleculeTypes(outParameters, outMoleculeTypes);
        String retVal = this.exportReactionRules(outParameters, outReactionRules, conversion);
        retVal += this.exportCompartments(outParameters, outCompartments);
        return retVal;
    }

    /**
     * Write the molecule types section and the diffusion constant parameters.  Reactive surface
     * pseudo-types and species superclasses are not real molecule types and are skipped.
     *
     * @param outParameters			output for the parameter lines
     * @param outMoleculeTypes		output for the molecule types section
     */
    public void exportMoleculeTypes(PrintWriter outParameters, PrintWriter outMoleculeTypes) {
        outMoleculeTypes.print(BEGIN_MOLECULE_TYPES + "\n");
        outParameters.print("\n" + IND + "# diffusion constants\n");
        int count = 0;
        for (MoleculeType mt : this.model.getMoleculeTypes()) {
            if (mt.isReactiveSurface() || isSpeciesSuperclass(mt.getName()))
                continue;
            outMoleculeTypes.print(IND + mt.toBngl() + "\n");
            String prefix = (mt.isSurf() ? MCELL_DIFFUSION_CONSTANT_2D_PREFIX : MCELL_DIFFUSION_CONSTANT_3D_PREFIX);
            outParameters.print(IND + prefix + mt.getName() + " " + BnglFormat.toStr(mt.getDiffusionConstant()) + "\n");
            count++;
        }
        outMoleculeTypes.print(END_MOLECULE_TYPES + "\n");
        log.debug("{} molecule types exported.", count);
    }

    /**
     * Write the reaction rules section and the rate parameters.  Each rule gets a rate parameter
     * named for its position in the registry.  A rule that cannot be expressed in BNGL is still
     * written with its unconverted rate, and an error message is returned for it.
     *
     * @param outParameters			output for the parameter lines
     * @param outReactionRules		output for the reaction rules section
     * @param conversion			rate converter to use
     *
     * @return the error messages for rules that could not be exported, or an empty string
     */
    public String exportReactionRules(PrintWriter outParameters, PrintWriter outReactionRules,
            RateConversion conversion) {
        StringBuilder retVal = new StringBuilder();
        outReactionRules.print(BEGIN_REACTION_RULES + "\n");
        conversion.writeConversionFactors(outParameters);
        outParameters.print("\n" + IND + "# reaction rates\n");
        List<RegisteredRule> ruleList = this.rules.getRules();
        for (RegisteredRule rule : ruleList) {
            String rateParam = RATE_PARAM_PREFIX + rule.getIndex();
            retVal.append(conversion.writeRateParameter(outParameters, rateParam, rule));
            outReactionRules.print(IND + rule.toBngl() + " " + rateParam + "\n");
        }
        outReactionRules.print(END_REACTION_RULES + "\n");
        log.debug("{} reaction rules exported.", ruleList.size());
        return retVal.toString();
    }

    /**
     * Write the compartments section and the compartment size parameters.  Parents are always
     * written before their children.  The default compartment is never written.
     *
     * @param outParameters			output for the parameter lines
     * @param outCompartments		output for the compartments section
     *
     * @return an empty string (compartment export has no recoverable errors)
     */
    public String exportCompartments(PrintWriter outParameters, PrintWriter outCompartments) {
        outCompartments.print(BEGIN_COMPARTMENTS + "\n");
        List<Integer> order = CompartmentOrder.resolve(this.model);
        boolean first = true;
        for (int id : order) {
            Compartment comp = this.model.getCompartment(id);
            if (comp.isDefault())
                continue;
            if (first) {
                outParameters.print("\n" + IND + "# compartment sizes\n");
                first = false;
            }
            String size = BnglFormat.toStr(comp.getVolumeOrArea());
            String volName = PREFIX_VOLUME + comp.getName();
            StringBuilder line = new StringBuilder(IND).append(comp.getName());
            if (comp.is3d()) {
                outParameters.print(IND + volName + " " + size + " # um^3\n");
                line.append(" 3 ").append(volName);
            } else {
                String areaName = PREFIX_AREA + comp.getName();
                outParameters.print(IND + areaName + " " + size + " # um^2\n");
                outParameters.print(IND + volName + " " + areaName + " * " + PARAM_THICKNESS + " # um^3\n");
                line.append(" 2 ").append(areaName).append(" * ").append(PARAM_THICKNESS);
            }
            if (comp.hasParent()) {
                Compartment parent = this.model.getCompartment(comp.getParentId());
                if (! parent.isDefault())
                    line.append(' ').append(parent.getName());
            }
            outCompartments.print(line.append('\n').toString());
        }
        outCompartments.print(END_COMPARTMENTS + "\n");
        return "";
    }

}
