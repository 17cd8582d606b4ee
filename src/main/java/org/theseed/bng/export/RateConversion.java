/**
 *
 */
package org.theseed.bng.export;

import static org.theseed.bng.model.BnglNames.*;

import java.io.PrintWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.bng.model.RxnClass;
import org.theseed.bng.registry.RegisteredRule;

/**
 * This object writes the parameters that convert reaction rates from the spatial simulator's
 * convention to the BNGL convention.
 *
 * Unimolecular rates use the same units in both conventions.  Bimolecular volume rates are in
 * M^-1 s^-1 and are divided by Avogadro's number times a volume in litres.  Bimolecular surface
 * rates are treated the same way, using the area times an assumed membrane thickness as the
 * volume.  When the rates are meant for NFSim, the volumes are those of a reference compartment
 * supplied by the caller; otherwise the volume factor only converts cubic microns to litres.
 *
 * The combined factors are multiplied by scaling parameters that are 1 in BNGL and that the
 * spatial simulator redefines, so the same file gives correct rates in both tools.
 *
 * NFSim rates need a reference compartment of positive volume and area.  A converter built for
 * NFSim with a size of zero or less throws IllegalArgumentException, and the export entry points
 * pass that exception on to their callers.
 *
 */
public class RateConversion {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(RateConversion.class);
    /** TRUE if the rates are to be converted for NFSim */
    private boolean ratesForNfsim;
    /** reference compartment volume for NFSim (um^3) */
    private double volumeHint;
    /** reference compartment area for NFSim (um^2) */
    private double areaHint;

    /**
     * Construct a rate converter.
     *
     * @param ratesForNfsim		TRUE to produce rates for NFSim
     * @param volumeHint		reference compartment volume in um^3 (NFSim only)
     * @param areaHint			reference compartment area in um^2 (NFSim only)
     *
     * @throws IllegalArgumentException		if NFSim rates are requested and a size hint is not positive
     */
    public RateConversion(boolean ratesForNfsim, double volumeHint, double areaHint) {
        if (ratesForNfsim && (volumeHint <= 0.0 || areaHint <= 0.0))
            throw new IllegalArgumentException("Compartment volume and area must be positive for NFSim rates.");
        this.ratesForNfsim = ratesForNfsim;
        this.volumeHint = volumeHint;
        this.areaHint = areaHint;
    }

    /**
     * Write the global conversion parameters:  the membrane thickness and the volume factors
     * for volume and surface reactions.
     *
     * @param params	parameter output
     */
    public void writeGlobalParameters(PrintWriter params) {
        params.print(IND + PARAM_THICKNESS + " " + BnglFormat.toStr(THICKNESS_UM) + " # um, assumed membrane thickness\n");
        if (this.ratesForNfsim) {
            params.print(IND + PARAM_RATE_CONV_VOLUME + " " + BnglFormat.toStr(this.volumeHint)
                    + " * 1e-15 # compartment volume in litres\n");
            params.print(IND + PARAM_RATE_CONV_AREA + " " + BnglFormat.toStr(this.areaHint) + " * " + PARAM_THICKNESS
                    + " * 1e-15 # compartment area converted to volume in litres\n");
        } else {
            params.print(IND + PARAM_RATE_CONV_VOLUME + " 1e-15 # um^3 to litres\n");
            params.print(IND + PARAM_RATE_CONV_AREA + " " + PARAM_THICKNESS + " # um^2 to um^3\n");
        }
    }

    /**
     * Write the combined conversion factors and the scaling parameters for bimolecular rates.
     *
     * @param params	parameter output
     */
    public void writeConversionFactors(PrintWriter params) {
        params.print("\n" + IND + "# parameters to control rates in MCell and BioNetGen\n");
        params.print(IND + PARAM_MCELL2BNG_VOL_CONV + " " + NA_VALUE_STR + " * " + PARAM_RATE_CONV_VOLUME + "\n");
        params.print(IND + PARAM_MCELL2BNG_SURF_CONV + " " + NA_VALUE_STR + " * " + PARAM_RATE_CONV_AREA + "\n");
        params.print(IND + PARAM_VOL_RXN + " 1\n");
        params.print(IND + PARAM_SURF_RXN + " 1\n");
        params.print(IND + MCELL_REDEFINE_PREFIX + PARAM_VOL_RXN + " " + PARAM_MCELL2BNG_VOL_CONV + "\n");
        params.print(IND + MCELL_REDEFINE_PREFIX + PARAM_SURF_RXN + " " + PARAM_MCELL2BNG_SURF_CONV + "\n");
    }

    /**
     * @return the BNGL expression for the converted rate of a rule, or the unconverted rate if
     * 		   the rule's class has no BNGL equivalent
     *
     * @param rule		registered rule of interest
     */
    public String rateExpression(RegisteredRule rule) {
        String retVal = BnglFormat.toStr(rule.getBaseRateConstant());
        switch (rule.getRxnClass()) {
        case VOLUME_BIMOL :
            retVal += " / " + PARAM_MCELL2BNG_VOL_CONV + " * " + PARAM_VOL_RXN;
            break;
        case SURFACE_BIMOL :
            retVal += " / " + PARAM_MCELL2BNG_SURF_CONV + " * " + PARAM_SURF_RXN;
            break;
        default:
            // Unimolecular rates need no conversion.  Unexportable rates are left as-is.
            break;
        }
        return retVal;
    }

    /**
     * Write the rate parameter for a rule.
     *
     * @param params		parameter output
     * @param paramName		name to give the rate parameter
     * @param rule			registered rule whose rate is to be written
     *
     * @return an error message if the rule cannot be expressed in BNGL, else an empty string
     */
    public String writeRateParameter(PrintWriter params, String paramName, RegisteredRule rule) {
        params.print(IND + paramName + " " + this.rateExpression(rule) + "\n");
        String retVal = "";
        RxnClass rxnClass = rule.getRxnClass();
        if (rxnClass == RxnClass.REACTIVE_SURFACE)
            retVal = "Export of reactions with reactive surfaces to BNGL is not supported, error for "
                    + rule.toBngl() + ".\n";
        else if (! rxnClass.isExportable())
            retVal = "Reaction " + rule.toBngl() + " has reactants that cannot be classified, "
                    + "its rate was not converted.\n";
        if (! retVal.isEmpty())
            log.warn("Rate of rule {} exported without conversion.", rule);
        return retVal;
    }

}
