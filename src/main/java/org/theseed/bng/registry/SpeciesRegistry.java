/**
 *
 */
package org.theseed.bng.registry;

import java.util.List;

import org.theseed.bng.model.Species;

/**
 * This interface describes a registry of species.  Species are indexed densely by ID and are
 * never deleted.
 *
 */
public interface SpeciesRegistry {

    /**
     * @return the list of species, indexed by ID
     */
    public List<Species> getSpeciesVector();

    /**
     * @return the species with the specified ID
     *
     * @param id	ID of the desired species
     *
     * @throws IllegalArgumentException		if the ID is invalid
     */
    public Species get(int id);

}
