/**
 *
 */
package org.theseed.bng.model;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for reaction rule parsing and classification.
 *
 */
public class ReactionRuleTest {

    @Test
    public void testTypeNames() {
        assertThat(ReactionRule.moleculeTypeNames("A"), contains("A"));
        assertThat(ReactionRule.moleculeTypeNames("A(b~0,c!1).B(a!1)@CP"), contains("A", "B"));
        assertThat(ReactionRule.moleculeTypeNames("@PM:R(l!1).L(r!1)"), contains("R", "L"));
        assertThat(ReactionRule.moleculeTypeNames("@CP::A(b)"), contains("A"));
        assertThat(ReactionRule.moleculeTypeNames("@CP::A(b!1).B(a!1)"), contains("A", "B"));
        assertThat(ReactionRule.moleculeTypeNames("S'"), contains("S"));
        assertThat(ReactionRule.moleculeTypeNames(" T, "), contains("T"));
        assertThat(ReactionRule.moleculeTypeNames(""), empty());
    }

    @Test
    public void testRendering() {
        ReactionRule rule = new ReactionRule("bind", 1e6, List.of("A(b)", "B(a)"), List.of("A(b!1).B(a!1)"));
        assertThat(rule.toBngl(), equalTo("bind: A(b) + B(a) -> A(b!1).B(a!1)"));
        assertThat(rule.isBimol(), equalTo(true));
        assertThat(rule.getReactantTypeNames(1), contains("B"));
        assertThat(rule.getReactants(), contains("A(b)", "B(a)"));
        assertThat(rule.getProducts(), contains("A(b!1).B(a!1)"));
        rule = new ReactionRule(null, 0.1, List.of("C"), Collections.emptyList());
        assertThat(rule.getName(), equalTo(""));
        assertThat(rule.toBngl(), equalTo("C -> 0"));
        assertThat(rule.isUnimol(), equalTo(true));
        assertThat(rule.getProducts(), empty());
    }

    @Test
    public void testClassify() {
        ModelData model = new ModelData();
        model.addMoleculeType(new MoleculeType("V", MoleculeType.Kind.VOLUME, 1e-6));
        model.addMoleculeType(new MoleculeType("W", MoleculeType.Kind.VOLUME, 1e-6));
        model.addMoleculeType(new MoleculeType("S", MoleculeType.Kind.SURFACE, 1e-8));
        model.addMoleculeType(new MoleculeType("T", MoleculeType.Kind.SURFACE, 1e-8));
        model.addMoleculeType(new MoleculeType("rs", MoleculeType.Kind.REACTIVE_SURFACE, 0.0));
        assertThat(classify(model, "V"), equalTo(RxnClass.UNIMOLECULAR));
        assertThat(classify(model, "S"), equalTo(RxnClass.UNIMOLECULAR));
        assertThat(classify(model, "V", "W"), equalTo(RxnClass.VOLUME_BIMOL));
        assertThat(classify(model, "@CP::V(x)", "W"), equalTo(RxnClass.VOLUME_BIMOL));
        assertThat(classify(model, "@PM::S", "@PM:T"), equalTo(RxnClass.SURFACE_BIMOL));
        assertThat(classify(model, "V", "S"), equalTo(RxnClass.VOLUME_BIMOL));
        assertThat(classify(model, "S", "T"), equalTo(RxnClass.SURFACE_BIMOL));
        // A complex with one surface molecule is on the surface.
        assertThat(classify(model, "V.S", "T"), equalTo(RxnClass.SURFACE_BIMOL));
        assertThat(classify(model, "V", "rs"), equalTo(RxnClass.REACTIVE_SURFACE));
        assertThat(classify(model, "rs"), equalTo(RxnClass.REACTIVE_SURFACE));
        assertThat(classify(model, "V", "Q"), equalTo(RxnClass.OTHER));
        assertThat(classify(model, "V", "W", "S"), equalTo(RxnClass.OTHER));
        assertThat(classify(model), equalTo(RxnClass.OTHER));
        assertThat(classify(model, "V", BnglNames.ALL_VOLUME_MOLECULES), equalTo(RxnClass.VOLUME_BIMOL));
        assertThat(classify(model, "S", BnglNames.ALL_SURFACE_MOLECULES), equalTo(RxnClass.SURFACE_BIMOL));
        assertThat(classify(model, "V", BnglNames.ALL_MOLECULES), equalTo(RxnClass.OTHER));
        assertThat(RxnClass.VOLUME_BIMOL.isExportable(), equalTo(true));
        assertThat(RxnClass.REACTIVE_SURFACE.isExportable(), equalTo(false));
        assertThat(RxnClass.OTHER.isExportable(), equalTo(false));
    }

    /**
     * @return the class of a rule with the specified reactants
     *
     * @param model			model containing the molecule types
     * @param reactants		reactant patterns
     */
    private static RxnClass classify(ModelData model, String... reactants) {
        ReactionRule rule = new ReactionRule("r", 1.0, List.of(reactants), Collections.emptyList());
        return RxnClass.classify(rule, model);
    }

}
