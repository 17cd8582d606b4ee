/**
 *
 */
package org.theseed.bng.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.theseed.bng.model.Species;

/**
 * This is the standard species registry.  Each species added receives the next ID number, and the
 * species can be found by ID or by name.
 *
 */
public class SpeciesContainer implements SpeciesRegistry {

    // FIELDS
    /** species, indexed by ID */
    private List<Species> species;
    /** map of species names to IDs */
    private Map<String, Integer> nameMap;

    /**
     * Construct an empty species registry.
     */
    public SpeciesContainer() {
        this.species = new ArrayList<Species>();
        this.nameMap = new HashMap<String, Integer>();
    }

    /**
     * Add a species to the registry.
     *
     * @param sp	species to add
     *
     * @return the ID assigned to the species
     *
     * @throws IllegalArgumentException		if a species with the same name is already present
     */
    public int add(Species sp) {
        if (this.nameMap.containsKey(sp.getName()))
            throw new IllegalArgumentException("Duplicate species " + sp.getName() + ".");
        final int retVal = this.species.size();
        sp.setId(retVal);
        this.species.add(sp);
        this.nameMap.put(sp.getName(), retVal);
        return retVal;
    }

    @Override
    public List<Species> getSpeciesVector() {
        return Collections.unmodifiableList(this.species);
    }

    @Override
    public Species get(int id) {
        if (id < 0 || id >= this.species.size())
            throw new IllegalArgumentException("Invalid species ID " + id + ".");
        return this.species.get(id);
    }

    /**
     * @return the ID of the named species, or Species.ID_INVALID if it is not found
     *
     * @param name		name of the desired species
     */
    public int find(String name) {
        return this.nameMap.getOrDefault(name, Species.ID_INVALID);
    }

    /**
     * @return the number of species
     */
    public int size() {
        return this.species.size();
    }

}
