/**
 *
 */
package org.theseed.bng.export;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.theseed.bng.model.Compartment;
import org.theseed.bng.model.ModelData;

/**
 * This class computes the order in which compartments are written to BNGL.  A compartment can only
 * name a parent that has already been declared, so every parent must precede its descendants.  The
 * compartments are visited depth-first from each root in ID order, and children are visited in the
 * order they were added to their parent, so the output is always the same for the same model.
 *
 */
public final class CompartmentOrder {

    private CompartmentOrder() { }

    /**
     * @return the compartment IDs of a model in parent-first order
     *
     * @param model		model whose compartments are to be ordered
     */
    public static List<Integer> resolve(ModelData model) {
        return resolve(model.getCompartments());
    }

    /**
     * Compute the parent-first order for a list of compartments.  The list must be indexed by
     * compartment ID.
     *
     * @param compartments		list of compartments, indexed by ID
     *
     * @return the compartment IDs in parent-first order
     *
     * @throws IllegalStateException	if the parent-child links are inconsistent or some compartment is unreachable
     */
    public static List<Integer> resolve(List<Compartment> compartments) {
        final int n = compartments.size();
        List<Integer> retVal = new ArrayList<Integer>(n);
        Set<Integer> visited = new HashSet<Integer>(n * 4 / 3 + 1);
        Deque<Integer> stack = new ArrayDeque<Integer>();
        for (Compartment root : compartments) {
            if (root.hasParent())
                continue;
            stack.push(root.getId());
            while (! stack.isEmpty()) {
                int id = stack.pop();
                if (! visited.add(id))
                    continue;
                retVal.add(id);
                Compartment comp = compartments.get(id);
                // Push the children in reverse so they pop in insertion order.
                List<Integer> children = new ArrayList<Integer>(comp.getChildIds());
                for (int i = children.size() - 1; i >= 0; i--) {
                    int childId = children.get(i);
                    if (childId < 0 || childId >= n)
                        throw new IllegalStateException(comp + " has invalid child ID " + childId + ".");
                    if (compartments.get(childId).getParentId() != id)
                        throw new IllegalStateException(compartments.get(childId) + " is listed as a child of "
                                + comp + " but has parent ID " + compartments.get(childId).getParentId() + ".");
                    if (! visited.contains(childId))
                        stack.push(childId);
                }
            }
        }
        if (retVal.size() != visited.size() || retVal.size() != n)
            throw new IllegalStateException("Compartment hierarchy is malformed:  " + retVal.size()
                    + " compartments ordered out of " + n + ".");
        return retVal;
    }

}
