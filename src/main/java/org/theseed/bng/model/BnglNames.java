/**
 *
 */
package org.theseed.bng.model;

import java.util.Set;

/**
 * This class contains the reserved names and keywords used when a spatial model is written
 * out as BNGL.  Parameter names here are shared between the section emitters, so any code
 * that refers to a generated parameter must take its name from this class.
 *
 */
public final class BnglNames {

    /** indentation for lines inside a block */
    public static final String IND = "  ";

    // BLOCK KEYWORDS
    public static final String BEGIN_PARAMETERS = "BEGIN PARAMETERS";
    public static final String END_PARAMETERS = "END PARAMETERS";
    public static final String BEGIN_MOLECULE_TYPES = "BEGIN MOLECULE_TYPES";
    public static final String END_MOLECULE_TYPES = "END MOLECULE_TYPES";
    public static final String BEGIN_REACTION_RULES = "BEGIN REACTION_RULES";
    public static final String END_REACTION_RULES = "END REACTION_RULES";
    public static final String BEGIN_COMPARTMENTS = "BEGIN COMPARTMENTS";
    public static final String END_COMPARTMENTS = "END COMPARTMENTS";

    // RATE CONVERSION PARAMETERS
    /** assumed membrane thickness */
    public static final String PARAM_THICKNESS = "THICKNESS";
    /** volume used to convert volume reaction rates */
    public static final String PARAM_RATE_CONV_VOLUME = "RATE_CONV_VOLUME";
    /** volume used to convert surface reaction rates */
    public static final String PARAM_RATE_CONV_AREA = "RATE_CONV_AREA";
    /** combined conversion factor for bimolecular volume reactions */
    public static final String PARAM_MCELL2BNG_VOL_CONV = "MCELL2BNG_VOL_CONV";
    /** combined conversion factor for bimolecular surface reactions */
    public static final String PARAM_MCELL2BNG_SURF_CONV = "MCELL2BNG_SURF_CONV";
    /** scaling knob for bimolecular volume reactions */
    public static final String PARAM_VOL_RXN = "VOL_RXN";
    /** scaling knob for bimolecular surface reactions */
    public static final String PARAM_SURF_RXN = "SURF_RXN";
    /** prefix that marks a parameter to be redefined by the spatial simulator */
    public static final String MCELL_REDEFINE_PREFIX = "MCELL_REDEFINE_";
    /** Avogadro's number as written into the parameters */
    public static final String NA_VALUE_STR = "6.02214076e23";
    /** assumed membrane thickness in microns */
    public static final double THICKNESS_UM = 0.01;
    /** prefix for reaction rate parameters */
    public static final String RATE_PARAM_PREFIX = "k";

    // MOLECULE AND COMPARTMENT PARAMETERS
    public static final String MCELL_DIFFUSION_CONSTANT_3D_PREFIX = "MCELL_DIFFUSION_CONSTANT_3D_";
    public static final String MCELL_DIFFUSION_CONSTANT_2D_PREFIX = "MCELL_DIFFUSION_CONSTANT_2D_";
    public static final String PREFIX_VOLUME = "vol_";
    public static final String PREFIX_AREA = "area_";

    // RESERVED NAMES
    /** compartment used when no compartment is specified; never exported */
    public static final String DEFAULT_COMPARTMENT_NAME = "default_compartment";
    public static final String ALL_MOLECULES = "ALL_MOLECULES";
    public static final String ALL_VOLUME_MOLECULES = "ALL_VOLUME_MOLECULES";
    public static final String ALL_SURFACE_MOLECULES = "ALL_SURFACE_MOLECULES";
    /** wildcard names that denote classes of species rather than real molecule types */
    private static final Set<String> SPECIES_SUPERCLASSES = Set.of(ALL_MOLECULES, ALL_VOLUME_MOLECULES,
            ALL_SURFACE_MOLECULES);

    private BnglNames() { }

    /**
     * @return TRUE if the specified name is a species superclass wildcard
     *
     * @param name		name to check
     */
    public static boolean isSpeciesSuperclass(String name) {
        return SPECIES_SUPERCLASSES.contains(name);
    }

}
