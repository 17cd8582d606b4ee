/**
 *
 */
package org.theseed.bng.registry;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.theseed.bng.model.BnglNames;
import org.theseed.bng.model.Complex;
import org.theseed.bng.model.ModelData;
import org.theseed.bng.model.MoleculeType;
import org.theseed.bng.model.ReactionRule;
import org.theseed.bng.model.RxnClass;
import org.theseed.bng.model.Species;

/**
 * Tests for the rule and species registries.
 *
 */
public class RegistryTest {

    @Test
    public void testRuleContainer() {
        ModelData model = new ModelData();
        model.addMoleculeType(new MoleculeType("A", MoleculeType.Kind.VOLUME, 1e-6));
        model.addMoleculeType(new MoleculeType("B", MoleculeType.Kind.VOLUME, 1e-6));
        model.addMoleculeType(new MoleculeType("M", MoleculeType.Kind.SURFACE, 1e-8));
        model.addMoleculeType(new MoleculeType("Z", MoleculeType.Kind.VOLUME, 1e-6));
        RuleContainer rules = new RuleContainer(model);
        rules.addAndFinalize(new ReactionRule("r0", 1e6, List.of("A(x)", "B"), List.of("A(x!1).B")));
        // Same reactants in the other order give the same reaction class.
        rules.addAndFinalize(new ReactionRule("r1", 2e6, List.of("B", "A(x~P)"), Collections.emptyList()));
        rules.addAndFinalize(new ReactionRule("r2", 0.1, List.of("A"), List.of("B")));
        rules.addAndFinalize(new ReactionRule("r3", 1e5, List.of("M", BnglNames.ALL_SURFACE_MOLECULES),
                Collections.emptyList()));
        List<RegisteredRule> registered = rules.getRules();
        assertThat(registered.size(), equalTo(4));
        for (int i = 0; i < registered.size(); i++) {
            assertThat(registered.get(i).getIndex(), equalTo(i));
            assertThat(registered.get(i).getRule().getName(), equalTo("r" + i));
        }
        assertThat(registered.get(0).getRxnClass(), equalTo(RxnClass.VOLUME_BIMOL));
        assertThat(registered.get(2).getRxnClass(), equalTo(RxnClass.UNIMOLECULAR));
        assertThat(registered.get(3).getRxnClass(), equalTo(RxnClass.SURFACE_BIMOL));
        assertThat(registered.get(1).getBaseRateConstant(), equalTo(2e6));
        assertThat(rules.getNumRxnClasses(), equalTo(3));
        assertThat(rules.describeRxnClasses(), equalTo("0: A + B, 1: A, 2: ALL_SURFACE_MOLECULES + M"));
        // Now the reactant classes.
        assertThat(rules.getNumExistingReactantClasses(), equalTo(0));
        int aClass = rules.getReactantClassId(new Complex(List.of("A")));
        int abClass = rules.getReactantClassId(new Complex(List.of("A", "B")));
        int bClass = rules.getReactantClassId(new Complex(List.of("B")));
        int mClass = rules.getReactantClassId(new Complex(List.of("M")));
        assertThat(aClass, equalTo(0));
        assertThat(abClass, equalTo(aClass));
        assertThat(bClass, equalTo(1));
        assertThat(mClass, equalTo(2));
        // A surface complex picks up the surface wildcard.
        assertThat(rules.getReactantClassId(new Complex(List.of("B", "M"))), equalTo(3));
        assertThat(rules.getReactantClassId(new Complex(List.of("Z"))), equalTo(Species.REACTANT_CLASS_INVALID));
        assertThat(rules.getNumExistingReactantClasses(), equalTo(4));
    }

    @Test
    public void testSpeciesContainer() {
        SpeciesContainer species = new SpeciesContainer();
        assertThat(species.size(), equalTo(0));
        int a = species.add(new Species("A", new Complex(List.of("A"))));
        int b = species.add(new Species("B", new Complex(List.of("B"))));
        assertThat(a, equalTo(0));
        assertThat(b, equalTo(1));
        assertThat(species.get(b).getId(), equalTo(b));
        assertThat(species.get(b).getName(), equalTo("B"));
        assertThat(species.find("A"), equalTo(a));
        assertThat(species.find("Q"), equalTo(Species.ID_INVALID));
        assertThat(species.getSpeciesVector().size(), equalTo(2));
        assertThrows(IllegalArgumentException.class, () -> species.get(2));
        assertThrows(IllegalArgumentException.class, () -> species.add(new Species("A", new Complex(List.of("A")))));
        assertThrows(UnsupportedOperationException.class, () -> species.getSpeciesVector().add(null));
    }

}
