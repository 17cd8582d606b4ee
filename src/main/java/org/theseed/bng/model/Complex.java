/**
 *
 */
package org.theseed.bng.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A complex is a set of bound molecules.  Species hold a template complex; the runtime copies
 * of a complex carry their own orientation and compartment, which can be changed without
 * affecting the template.
 *
 */
public class Complex {

    // FIELDS
    /** names of the molecule types in this complex */
    private List<String> moleculeTypes;
    /** orientation of this complex */
    private Orientation orientation;
    /** ID of the containing compartment */
    private int compartmentId;

    /**
     * Construct a complex with no orientation and no compartment.
     *
     * @param moleculeTypes		names of the molecule types in the complex
     */
    public Complex(List<String> moleculeTypes) {
        this.moleculeTypes = new ArrayList<String>(moleculeTypes);
        this.orientation = Orientation.NONE;
        this.compartmentId = Compartment.ID_INVALID;
    }

    /**
     * Construct an independent copy of a complex.
     *
     * @param other		complex to copy
     */
    public Complex(Complex other) {
        this.moleculeTypes = new ArrayList<String>(other.moleculeTypes);
        this.orientation = other.orientation;
        this.compartmentId = other.compartmentId;
    }

    /**
     * @return the names of the molecule types in this complex
     */
    public List<String> getMoleculeTypes() {
        return Collections.unmodifiableList(this.moleculeTypes);
    }

    /**
     * @return the orientation
     */
    public Orientation getOrientation() {
        return this.orientation;
    }

    /**
     * @param orientation 	the new orientation
     */
    public void setOrientation(Orientation orientation) {
        this.orientation = orientation;
    }

    /**
     * @return the compartment ID
     */
    public int getCompartmentId() {
        return this.compartmentId;
    }

    /**
     * @param compartmentId 	the new compartment ID
     */
    public void setCompartmentId(int compartmentId) {
        this.compartmentId = compartmentId;
    }

    @Override
    public String toString() {
        return String.join(".", this.moleculeTypes);
    }

}
