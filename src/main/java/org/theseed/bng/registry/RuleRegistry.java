/**
 *
 */
package org.theseed.bng.registry;

import java.util.List;

import org.theseed.bng.model.ReactionRule;

/**
 * This interface describes a registry of finalized reaction rules.  Each rule in the source model
 * is added exactly once, before the registry is queried.
 *
 */
public interface RuleRegistry {

    /**
     * Finalize a reaction rule and add it to the registry.
     *
     * @param rule		rule to add
     */
    public void addAndFinalize(ReactionRule rule);

    /**
     * @return the registered rules, in registration order
     */
    public List<RegisteredRule> getRules();

    /**
     * @return the number of reaction classes derived from the rules
     */
    public int getNumRxnClasses();

    /**
     * @return the number of reactant classes that currently exist
     */
    public int getNumExistingReactantClasses();

}
