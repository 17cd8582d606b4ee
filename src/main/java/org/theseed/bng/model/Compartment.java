/**
 *
 */
package org.theseed.bng.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * This object represents a spatial compartment.  A 3D compartment is a volume and a 2D compartment
 * is a surface.  Compartments reference each other by ID number, and the parent-child links form
 * a forest.  The ID and the links are assigned when the compartment is added to a {@link ModelData}.
 *
 */
public class Compartment {

    // FIELDS
    /** ID value used when there is no compartment */
    public static final int ID_INVALID = -1;
    /** ID number of this compartment */
    private int id;
    /** name of this compartment */
    private String name;
    /** TRUE for a volume, FALSE for a surface */
    private boolean is3d;
    /** volume (um^3) or area (um^2) */
    private double volumeOrArea;
    /** ID of the parent compartment, or ID_INVALID for a root */
    private int parentId;
    /** IDs of the child compartments, in insertion order */
    private Set<Integer> childIds;

    /**
     * Construct a compartment that is not yet part of a model.
     *
     * @param name			compartment name
     * @param is3d			TRUE for a volume compartment, FALSE for a surface
     * @param volumeOrArea	size of the compartment
     */
    public Compartment(String name, boolean is3d, double volumeOrArea) {
        this.id = ID_INVALID;
        this.name = name;
        this.is3d = is3d;
        this.volumeOrArea = volumeOrArea;
        this.parentId = ID_INVALID;
        this.childIds = new LinkedHashSet<Integer>();
    }

    /**
     * @return the ID number
     */
    public int getId() {
        return this.id;
    }

    /**
     * Specify the ID number.
     *
     * @param id	new ID number
     */
    public void setId(int id) {
        this.id = id;
    }

    /**
     * @return the compartment name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return TRUE if this is a volume compartment
     */
    public boolean is3d() {
        return this.is3d;
    }

    /**
     * @return the volume or area
     */
    public double getVolumeOrArea() {
        return this.volumeOrArea;
    }

    /**
     * @return the parent compartment ID, or ID_INVALID if this is a root
     */
    public int getParentId() {
        return this.parentId;
    }

    /**
     * @return TRUE if this compartment has a parent
     */
    public boolean hasParent() {
        return this.parentId != ID_INVALID;
    }

    /**
     * Specify the parent compartment ID.
     *
     * @param parentId	ID of the parent
     */
    public void setParentId(int parentId) {
        this.parentId = parentId;
    }

    /**
     * @return the IDs of the child compartments
     */
    public Set<Integer> getChildIds() {
        return Collections.unmodifiableSet(this.childIds);
    }

    /**
     * Add a child compartment ID.
     *
     * @param childId	ID of the new child
     */
    public void addChildId(int childId) {
        this.childIds.add(childId);
    }

    /**
     * @return TRUE if this is the default compartment
     */
    public boolean isDefault() {
        return this.name.equals(BnglNames.DEFAULT_COMPARTMENT_NAME);
    }

    @Override
    public String toString() {
        return "Compartment " + this.id + "(" + this.name + ")";
    }

}
