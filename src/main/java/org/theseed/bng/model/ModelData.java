/**
 *
 */
package org.theseed.bng.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * This object holds a built spatial model:  the molecule types, the compartments and the reaction
 * rules, each in the order they were added.  Once the model is built it is treated as read-only;
 * nothing is ever removed.
 *
 */
public class ModelData {

    // FIELDS
    /** molecule types in order */
    private List<MoleculeType> moleculeTypes;
    /** map of names to molecule types */
    private Map<String, MoleculeType> moleculeTypeMap;
    /** compartments, indexed by ID */
    private List<Compartment> compartments;
    /** map of names to compartments */
    private Map<String, Compartment> compartmentMap;
    /** reaction rules in order */
    private List<ReactionRule> rxnRules;

    /**
     * Construct an empty model.
     */
    public ModelData() {
        this.moleculeTypes = new ArrayList<MoleculeType>();
        this.moleculeTypeMap = new HashMap<String, MoleculeType>();
        this.compartments = new ArrayList<Compartment>();
        this.compartmentMap = new HashMap<String, Compartment>();
        this.rxnRules = new ArrayList<ReactionRule>();
    }

    /**
     * Add a molecule type to the model.
     *
     * @param type		molecule type to add
     *
     * @throws IllegalArgumentException		if a type of the same name already exists
     */
    public void addMoleculeType(MoleculeType type) {
        if (this.moleculeTypeMap.containsKey(type.getName()))
            throw new IllegalArgumentException("Duplicate molecule type " + type.getName() + ".");
        this.moleculeTypes.add(type);
        this.moleculeTypeMap.put(type.getName(), type);
    }

    /**
     * Add a root compartment to the model.
     *
     * @param comp		compartment to add
     *
     * @return the ID assigned to the compartment
     */
    public int addCompartment(Compartment comp) {
        return this.addCompartment(comp, Compartment.ID_INVALID);
    }

    /**
     * Add a compartment to the model and connect it to its parent.
     *
     * @param comp			compartment to add
     * @param parentId		ID of the parent compartment, or ID_INVALID for a root
     *
     * @return the ID assigned to the compartment
     *
     * @throws IllegalArgumentException		if the name is a duplicate or the parent is not found
     */
    public int addCompartment(Compartment comp, int parentId) {
        if (this.compartmentMap.containsKey(comp.getName()))
            throw new IllegalArgumentException("Duplicate compartment " + comp.getName() + ".");
        if (parentId != Compartment.ID_INVALID && (parentId < 0 || parentId >= this.compartments.size()))
            throw new IllegalArgumentException("Invalid parent ID " + parentId + " for compartment "
                    + comp.getName() + ".");
        final int retVal = this.compartments.size();
        comp.setId(retVal);
        this.compartments.add(comp);
        this.compartmentMap.put(comp.getName(), comp);
        if (parentId != Compartment.ID_INVALID) {
            comp.setParentId(parentId);
            this.compartments.get(parentId).addChildId(retVal);
        }
        return retVal;
    }

    /**
     * Add a reaction rule to the model.
     *
     * @param rule		rule to add
     */
    public void addRxnRule(ReactionRule rule) {
        this.rxnRules.add(rule);
    }

    /**
     * @return the molecule types, in order
     */
    public List<MoleculeType> getMoleculeTypes() {
        return Collections.unmodifiableList(this.moleculeTypes);
    }

    /**
     * @return the molecule type with the specified name, or NULL if there is none
     *
     * @param name		name of the desired molecule type
     */
    public MoleculeType getMoleculeType(String name) {
        return this.moleculeTypeMap.get(name);
    }

    /**
     * @return the compartments, in ID order
     */
    public List<Compartment> getCompartments() {
        return Collections.unmodifiableList(this.compartments);
    }

    /**
     * @return the compartment with the specified ID
     *
     * @param id	ID of the desired compartment
     *
     * @throws IllegalArgumentException		if the ID is invalid
     */
    public Compartment getCompartment(int id) {
        if (id < 0 || id >= this.compartments.size())
            throw new IllegalArgumentException("Invalid compartment ID " + id + ".");
        return this.compartments.get(id);
    }

    /**
     * @return the compartment with the specified name, or NULL if there is none
     *
     * @param name		name of the desired compartment
     */
    public Compartment findCompartment(String name) {
        return this.compartmentMap.get(name);
    }

    /**
     * @return the number of compartments
     */
    public int getCompartmentCount() {
        return this.compartments.size();
    }

    /**
     * @return the reaction rules, in order
     */
    public List<ReactionRule> getRxnRules() {
        return Collections.unmodifiableList(this.rxnRules);
    }

}
