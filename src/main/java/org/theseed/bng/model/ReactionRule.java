/**
 *
 */
package org.theseed.bng.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * This object represents a reaction rule in a spatial model.  The reactant and product patterns are
 * kept as BNGL text; this class does not interpret them beyond extracting the names of the molecule
 * types in each reactant, which is all that is needed to classify the rule for rate conversion.
 *
 */
public class ReactionRule {

    // FIELDS
    /** name of the rule (may be empty) */
    private String name;
    /** base rate constant in the spatial simulator's units */
    private double baseRateConstant;
    /** reactant patterns */
    private List<String> reactants;
    /** product patterns */
    private List<String> products;
    /** characters that end a molecule type name inside a pattern */
    private static final String NAME_DELIMS = "(@',";

    /**
     * Construct a reaction rule.
     *
     * @param name			name of the rule, or NULL if it is unnamed
     * @param rate			base rate constant
     * @param reactants		reactant patterns
     * @param products		product patterns
     */
    public ReactionRule(String name, double rate, List<String> reactants, List<String> products) {
        this.name = StringUtils.defaultString(name);
        this.baseRateConstant = rate;
        this.reactants = new ArrayList<String>(reactants);
        this.products = new ArrayList<String>(products);
    }

    /**
     * @return the name of the rule
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the base rate constant
     */
    public double getBaseRateConstant() {
        return this.baseRateConstant;
    }

    /**
     * @return the reactant patterns
     */
    public List<String> getReactants() {
        return Collections.unmodifiableList(this.reactants);
    }

    /**
     * @return the product patterns
     */
    public List<String> getProducts() {
        return Collections.unmodifiableList(this.products);
    }

    /**
     * @return the number of reactants
     */
    public int getNumReactants() {
        return this.reactants.size();
    }

    /**
     * @return TRUE if this is a unimolecular rule
     */
    public boolean isUnimol() {
        return this.reactants.size() == 1;
    }

    /**
     * @return TRUE if this is a bimolecular rule
     */
    public boolean isBimol() {
        return this.reactants.size() == 2;
    }

    /**
     * @return the names of the molecule types in the specified reactant
     *
     * @param idx	index of the reactant of interest
     */
    public List<String> getReactantTypeNames(int idx) {
        return moleculeTypeNames(this.reactants.get(idx));
    }

    /**
     * Extract the molecule type names from a BNGL complex pattern.  Compartment prefixes
     * and suffixes, components and orientation marks are stripped.
     *
     * @param pattern	pattern to parse
     *
     * @return a list of the molecule type names, in order
     */
    public static List<String> moleculeTypeNames(String pattern) {
        List<String> retVal = new ArrayList<String>();
        String body = pattern.trim();
        // A leading "@comp:" or "@comp::" applies to the whole complex.
        if (body.startsWith("@"))
            body = StringUtils.stripStart(StringUtils.substringAfter(body, ":"), ":");
        for (String molecule : StringUtils.split(body, '.')) {
            String mol = molecule.trim();
            int end = StringUtils.indexOfAny(mol, NAME_DELIMS);
            if (end >= 0)
                mol = mol.substring(0, end);
            if (! mol.isEmpty())
                retVal.add(mol);
        }
        return retVal;
    }

    /**
     * @return the BNGL rendering of this rule, without the rate
     */
    public String toBngl() {
        String left = (this.reactants.isEmpty() ? "0" : String.join(" + ", this.reactants));
        String right = (this.products.isEmpty() ? "0" : String.join(" + ", this.products));
        String retVal = left + " -> " + right;
        if (! this.name.isEmpty())
            retVal = this.name + ": " + retVal;
        return retVal;
    }

    @Override
    public String toString() {
        return this.toBngl();
    }

}
