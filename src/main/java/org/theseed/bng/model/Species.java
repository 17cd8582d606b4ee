/**
 *
 */
package org.theseed.bng.model;

/**
 * A species is a canonical complex template.  Each species has a dense ID number assigned by the
 * species registry, a flag that is set once the species has actually been produced, and an
 * optional reactant class ID.
 *
 */
public class Species {

    // FIELDS
    /** ID value for a species not yet in a registry */
    public static final int ID_INVALID = -1;
    /** reactant class ID value when there is no reactant class */
    public static final int REACTANT_CLASS_INVALID = -1;
    /** ID number of this species */
    private int id;
    /** name of this species */
    private String name;
    /** template complex */
    private Complex complex;
    /** TRUE if this species was instantiated at least once */
    private boolean instantiated;
    /** reactant class ID */
    private int reactantClassId;

    /**
     * Construct a new species.
     *
     * @param name		name of the species
     * @param complex	template complex
     */
    public Species(String name, Complex complex) {
        this.id = ID_INVALID;
        this.name = name;
        this.complex = complex;
        this.instantiated = false;
        this.reactantClassId = REACTANT_CLASS_INVALID;
    }

    /**
     * @return the species ID
     */
    public int getId() {
        return this.id;
    }

    /**
     * @param id 	the ID to set
     */
    public void setId(int id) {
        this.id = id;
    }

    /**
     * @return the species name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the template complex
     */
    public Complex getComplex() {
        return this.complex;
    }

    /**
     * @return TRUE if this species was instantiated
     */
    public boolean wasInstantiated() {
        return this.instantiated;
    }

    /**
     * Denote that this species was instantiated.
     */
    public void setInstantiated() {
        this.instantiated = true;
    }

    /**
     * @return TRUE if this species has a valid reactant class
     */
    public boolean hasValidReactantClassId() {
        return this.reactantClassId != REACTANT_CLASS_INVALID;
    }

    /**
     * @return the reactant class ID
     */
    public int getReactantClassId() {
        return this.reactantClassId;
    }

    /**
     * @param reactantClassId 	the reactant class ID to set
     */
    public void setReactantClassId(int reactantClassId) {
        this.reactantClassId = reactantClassId;
    }

    @Override
    public String toString() {
        return "Species " + this.id + "(" + this.name + ")";
    }

}
