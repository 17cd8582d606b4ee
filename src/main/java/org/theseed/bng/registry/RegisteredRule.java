/**
 *
 */
package org.theseed.bng.registry;

import org.theseed.bng.model.ReactionRule;
import org.theseed.bng.model.RxnClass;

/**
 * This object is a reaction rule that has been finalized by a rule registry.  It carries the
 * rule's position in the registry and its cached classification.
 *
 */
public class RegisteredRule {

    // FIELDS
    /** position in the registry */
    private int index;
    /** source rule */
    private ReactionRule rule;
    /** classification */
    private RxnClass rxnClass;

    /**
     * Construct a registered rule.
     *
     * @param index			position in the registry
     * @param rule			source reaction rule
     * @param rxnClass		classification of the rule
     */
    public RegisteredRule(int index, ReactionRule rule, RxnClass rxnClass) {
        this.index = index;
        this.rule = rule;
        this.rxnClass = rxnClass;
    }

    /**
     * @return the position of this rule in the registry
     */
    public int getIndex() {
        return this.index;
    }

    /**
     * @return the source rule
     */
    public ReactionRule getRule() {
        return this.rule;
    }

    /**
     * @return the classification of this rule
     */
    public RxnClass getRxnClass() {
        return this.rxnClass;
    }

    /**
     * @return the base rate constant
     */
    public double getBaseRateConstant() {
        return this.rule.getBaseRateConstant();
    }

    /**
     * @return the BNGL rendering of the rule
     */
    public String toBngl() {
        return this.rule.toBngl();
    }

    @Override
    public String toString() {
        return "Rule " + this.index + "(" + this.rule.toBngl() + ")";
    }

}
