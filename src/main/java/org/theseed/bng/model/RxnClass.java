/**
 *
 */
package org.theseed.bng.model;

import java.util.List;

/**
 * This enumeration classifies a reaction rule by reactant arity and geometry.  The class of a rule
 * determines how its rate constant is converted when the rule is exported.
 *
 */
public enum RxnClass {
    /** one reactant */
    UNIMOLECULAR,
    /** two reactants, at least one of them in a volume */
    VOLUME_BIMOL,
    /** two reactants, both on a surface */
    SURFACE_BIMOL,
    /** a reactant is a reactive surface class */
    REACTIVE_SURFACE,
    /** anything else */
    OTHER;

    /**
     * Geometry of a single reactant.
     */
    private static enum Geometry {
        VOLUME, SURFACE, REACTIVE_SURFACE, UNKNOWN;
    }

    /**
     * @return TRUE if a rule of this class can be expressed in BNGL
     */
    public boolean isExportable() {
        return this != REACTIVE_SURFACE && this != OTHER;
    }

    /**
     * Classify a reaction rule.
     *
     * @param rule		rule to classify
     * @param model		model containing the rule's molecule types
     *
     * @return the class of the rule
     */
    public static RxnClass classify(ReactionRule rule, ModelData model) {
        final int n = rule.getNumReactants();
        Geometry[] geometries = new Geometry[n];
        for (int i = 0; i < n; i++) {
            geometries[i] = reactantGeometry(rule.getReactantTypeNames(i), model);
            if (geometries[i] == Geometry.REACTIVE_SURFACE)
                return REACTIVE_SURFACE;
        }
        RxnClass retVal;
        if (n == 1)
            retVal = UNIMOLECULAR;
        else if (n != 2 || geometries[0] == Geometry.UNKNOWN || geometries[1] == Geometry.UNKNOWN)
            retVal = OTHER;
        else if (geometries[0] == Geometry.SURFACE && geometries[1] == Geometry.SURFACE)
            retVal = SURFACE_BIMOL;
        else
            retVal = VOLUME_BIMOL;
        return retVal;
    }

    /**
     * Compute the geometry of a reactant.  A complex with any surface molecule is on a surface.
     *
     * @param typeNames		names of the molecule types in the reactant
     * @param model			model containing the molecule types
     *
     * @return the geometry of the reactant
     */
    private static Geometry reactantGeometry(List<String> typeNames, ModelData model) {
        Geometry retVal = (typeNames.isEmpty() ? Geometry.UNKNOWN : Geometry.VOLUME);
        for (String typeName : typeNames) {
            Geometry geo;
            if (typeName.equals(BnglNames.ALL_VOLUME_MOLECULES))
                geo = Geometry.VOLUME;
            else if (typeName.equals(BnglNames.ALL_SURFACE_MOLECULES))
                geo = Geometry.SURFACE;
            else {
                MoleculeType type = model.getMoleculeType(typeName);
                if (type == null)
                    geo = Geometry.UNKNOWN;
                else if (type.isReactiveSurface())
                    geo = Geometry.REACTIVE_SURFACE;
                else if (type.isSurf())
                    geo = Geometry.SURFACE;
                else
                    geo = Geometry.VOLUME;
            }
            if (geo == Geometry.REACTIVE_SURFACE)
                return geo;
            else if (geo == Geometry.UNKNOWN)
                retVal = Geometry.UNKNOWN;
            else if (geo == Geometry.SURFACE && retVal != Geometry.UNKNOWN)
                retVal = Geometry.SURFACE;
        }
        return retVal;
    }

}
