/**
 *
 */
package org.theseed.bng.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.bng.model.BnglNames;
import org.theseed.bng.model.Complex;
import org.theseed.bng.model.ModelData;
import org.theseed.bng.model.MoleculeType;
import org.theseed.bng.model.ReactionRule;
import org.theseed.bng.model.RxnClass;
import org.theseed.bng.model.Species;

/**
 * This is the standard rule registry.  Rules are classified against the molecule types of the
 * source model when they are added.  Rules with the same reactant molecule types form a reaction
 * class.  Complexes that can take part in the same set of reaction classes form a reactant class;
 * reactant class IDs are handed out on request as species are created.
 *
 */
public class RuleContainer implements RuleRegistry {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(RuleContainer.class);
    /** source model */
    private ModelData model;
    /** registered rules, in order */
    private List<RegisteredRule> rules;
    /** map of reactant signatures to reaction class IDs */
    private Map<String, Integer> rxnClassMap;
    /** map of molecule type names to the IDs of the reaction classes using them as reactants */
    private Map<String, Set<Integer>> typeRxnClasses;
    /** map of reaction class ID sets to reactant class IDs */
    private Map<Set<Integer>, Integer> reactantClassMap;

    /**
     * Construct an empty rule registry for a model.
     *
     * @param model		model whose rules will be registered
     */
    public RuleContainer(ModelData model) {
        this.model = model;
        this.rules = new ArrayList<RegisteredRule>();
        this.rxnClassMap = new HashMap<String, Integer>();
        this.typeRxnClasses = new HashMap<String, Set<Integer>>();
        this.reactantClassMap = new HashMap<Set<Integer>, Integer>();
    }

    @Override
    public void addAndFinalize(ReactionRule rule) {
        RxnClass rxnClass = RxnClass.classify(rule, this.model);
        RegisteredRule registered = new RegisteredRule(this.rules.size(), rule, rxnClass);
        this.rules.add(registered);
        // Find the reaction class for this rule's reactants.
        String signature = reactantSignature(rule);
        Integer classId = this.rxnClassMap.computeIfAbsent(signature, x -> this.rxnClassMap.size());
        for (int i = 0; i < rule.getNumReactants(); i++) {
            for (String typeName : rule.getReactantTypeNames(i)) {
                Set<Integer> classIds = this.typeRxnClasses.computeIfAbsent(typeName, x -> new TreeSet<Integer>());
                classIds.add(classId);
            }
        }
        log.debug("Registered {} as {} in reaction class {}.", registered, rxnClass, classId);
    }

    /**
     * @return a string that identifies the reactant molecule types of a rule, independent of reactant order
     *
     * @param rule		rule of interest
     */
    private static String reactantSignature(ReactionRule rule) {
        List<String> reactants = new ArrayList<String>(rule.getNumReactants());
        for (int i = 0; i < rule.getNumReactants(); i++)
            reactants.add(String.join(".", rule.getReactantTypeNames(i)));
        Collections.sort(reactants);
        return String.join(" + ", reactants);
    }

    @Override
    public List<RegisteredRule> getRules() {
        return Collections.unmodifiableList(this.rules);
    }

    @Override
    public int getNumRxnClasses() {
        return this.rxnClassMap.size();
    }

    @Override
    public int getNumExistingReactantClasses() {
        return this.reactantClassMap.size();
    }

    /**
     * Compute the reactant class of a complex.  A complex reacts in every reaction class whose
     * reactants use one of its molecule types or a superclass wildcard that covers it.
     *
     * @param complex	complex of interest
     *
     * @return the reactant class ID, or Species.REACTANT_CLASS_INVALID if the complex is not a reactant
     */
    public int getReactantClassId(Complex complex) {
        Set<Integer> classIds = new TreeSet<Integer>();
        boolean surface = false;
        for (String typeName : complex.getMoleculeTypes()) {
            classIds.addAll(this.typeRxnClasses.getOrDefault(typeName, Collections.emptySet()));
            MoleculeType type = this.model.getMoleculeType(typeName);
            if (type != null && type.isSurf())
                surface = true;
        }
        classIds.addAll(this.typeRxnClasses.getOrDefault(BnglNames.ALL_MOLECULES, Collections.emptySet()));
        String wildcard = (surface ? BnglNames.ALL_SURFACE_MOLECULES : BnglNames.ALL_VOLUME_MOLECULES);
        classIds.addAll(this.typeRxnClasses.getOrDefault(wildcard, Collections.emptySet()));
        int retVal;
        if (classIds.isEmpty())
            retVal = Species.REACTANT_CLASS_INVALID;
        else
            retVal = this.reactantClassMap.computeIfAbsent(classIds, x -> this.reactantClassMap.size());
        return retVal;
    }

    /**
     * @return a string listing the reaction classes, for debugging
     */
    public String describeRxnClasses() {
        return this.rxnClassMap.entrySet().stream().sorted(Map.Entry.comparingByValue())
                .map(x -> x.getValue() + ": " + x.getKey()).collect(Collectors.joining(", "));
    }

}
