/**
 *
 */
package org.theseed.bng.export;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.theseed.bng.model.Compartment;
import org.theseed.bng.model.ModelData;
import org.theseed.bng.model.MoleculeType;
import org.theseed.bng.model.ReactionRule;
import org.theseed.bng.registry.RuleContainer;

/**
 * Tests for BNGL export of models.
 *
 */
public class BnglExporterTest {

    /**
     * This object holds the four outputs of an export.
     */
    private static class Output {
        private StringWriter params = new StringWriter();
        private StringWriter moleculeTypes = new StringWriter();
        private StringWriter compartments = new StringWriter();
        private StringWriter reactionRules = new StringWriter();
        private String errors;

        /**
         * Export a model into this object.
         *
         * @param model		model to export
         * @param nfsim		TRUE for NFSim rates
         * @param volume	reference volume
         * @param area		reference area
         */
        private Output(ModelData model, boolean nfsim, double volume, double area) {
            RuleContainer rules = new RuleContainer(model);
            for (ReactionRule rule : model.getRxnRules())
                rules.addAndFinalize(rule);
            BnglExporter exporter = new BnglExporter(model, rules);
            try (PrintWriter p = new PrintWriter(this.params); PrintWriter m = new PrintWriter(this.moleculeTypes);
                    PrintWriter c = new PrintWriter(this.compartments); PrintWriter r = new PrintWriter(this.reactionRules)) {
                this.errors = exporter.exportToBngl(p, m, c, r, nfsim, volume, area);
            }
        }

        /**
         * @return the lines of an output, with the indentation removed
         *
         * @param writer	output to split
         */
        private static List<String> lines(StringWriter writer) {
            return Arrays.stream(writer.toString().split("\n")).map(x -> x.trim()).collect(Collectors.toList());
        }

        /**
         * @return the value expression of the named parameter, or NULL if it is not found
         *
         * @param name	parameter name
         */
        private String param(String name) {
            String retVal = null;
            for (String line : lines(this.params)) {
                if (line.startsWith(name + " ")) {
                    retVal = line.substring(name.length() + 1);
                    int hash = retVal.indexOf(" #");
                    if (hash >= 0)
                        retVal = retVal.substring(0, hash);
                }
            }
            return retVal;
        }
    }

    /**
     * @return a model with no molecule types, no rules, and only the default compartment
     */
    private static ModelData emptyModel() {
        ModelData retVal = new ModelData();
        retVal.addCompartment(new Compartment("default_compartment", true, 1.0));
        return retVal;
    }

    /**
     * @return a model with volume types V and W, surface types S and T, and a reactive surface RS
     */
    private static ModelData typedModel() {
        ModelData retVal = new ModelData();
        retVal.addMoleculeType(new MoleculeType("V", MoleculeType.Kind.VOLUME, 1e-6));
        retVal.addMoleculeType(new MoleculeType("W", MoleculeType.Kind.VOLUME, 2e-6));
        retVal.addMoleculeType(new MoleculeType("S", MoleculeType.Kind.SURFACE, 1e-8));
        retVal.addMoleculeType(new MoleculeType("T", MoleculeType.Kind.SURFACE, 3e-8));
        retVal.addMoleculeType(new MoleculeType("RS", MoleculeType.Kind.REACTIVE_SURFACE, 0.0));
        return retVal;
    }

    /**
     * @return a simple rule with the specified rate and reactants
     */
    private static ReactionRule rule(double rate, String... reactants) {
        return new ReactionRule(null, rate, List.of(reactants), Collections.emptyList());
    }

    @Test
    public void testEmptyModel() {
        Output out = new Output(emptyModel(), false, 0.0, 0.0);
        assertThat(out.errors, equalTo(""));
        assertThat(out.moleculeTypes.toString(), equalTo("BEGIN MOLECULE_TYPES\nEND MOLECULE_TYPES\n"));
        assertThat(out.compartments.toString(), equalTo("BEGIN COMPARTMENTS\nEND COMPARTMENTS\n"));
        assertThat(out.reactionRules.toString(), equalTo("BEGIN REACTION_RULES\nEND REACTION_RULES\n"));
        assertThat(out.params.toString(), not(containsString("default_compartment")));
        assertThat(out.param("THICKNESS"), equalTo("0.01"));
        assertThat(out.param("RATE_CONV_VOLUME"), equalTo("1e-15"));
        assertThat(out.param("RATE_CONV_AREA"), equalTo("THICKNESS"));
        assertThat(out.param("MCELL2BNG_VOL_CONV"), equalTo("6.02214076e23 * RATE_CONV_VOLUME"));
        assertThat(out.param("MCELL2BNG_SURF_CONV"), equalTo("6.02214076e23 * RATE_CONV_AREA"));
        assertThat(out.param("VOL_RXN"), equalTo("1"));
        assertThat(out.param("SURF_RXN"), equalTo("1"));
        assertThat(out.param("MCELL_REDEFINE_VOL_RXN"), equalTo("MCELL2BNG_VOL_CONV"));
        assertThat(out.param("MCELL_REDEFINE_SURF_RXN"), equalTo("MCELL2BNG_SURF_CONV"));
    }

    @Test
    public void testNfsimParameters() {
        Output out = new Output(emptyModel(), true, 0.125, 1.5);
        assertThat(out.param("RATE_CONV_VOLUME"), equalTo("0.125 * 1e-15"));
        assertThat(out.param("RATE_CONV_AREA"), equalTo("1.5 * THICKNESS * 1e-15"));
        assertThrows(IllegalArgumentException.class, () -> new Output(emptyModel(), true, 0.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new Output(emptyModel(), true, 1.0, -1.0));
    }

    @Test
    public void testUnimolecular() {
        ModelData model = typedModel();
        model.addRxnRule(rule(0.25, "V"));
        Output out = new Output(model, false, 0.0, 0.0);
        assertThat(out.param("k0"), equalTo("0.25"));
        assertThat(out.errors, equalTo(""));
        assertThat(Output.lines(out.reactionRules), contains("BEGIN REACTION_RULES", "V -> 0 k0", "END REACTION_RULES"));
    }

    @Test
    public void testVolumeBimolecular() {
        ModelData model = typedModel();
        model.addRxnRule(rule(1e8, "V", "W"));
        model.addRxnRule(rule(2e6, "V", "S"));
        Output out = new Output(model, false, 0.0, 0.0);
        assertThat(out.param("k0"), equalTo("100000000 / MCELL2BNG_VOL_CONV * VOL_RXN"));
        assertThat(out.param("k1"), equalTo("2000000 / MCELL2BNG_VOL_CONV * VOL_RXN"));
        assertThat(out.errors, equalTo(""));
    }

    @Test
    public void testSurfaceBimolecular() {
        ModelData model = typedModel();
        model.addRxnRule(rule(3.5e5, "S", "T"));
        Output out = new Output(model, true, 1.0, 2.0);
        assertThat(out.param("k0"), equalTo("350000 / MCELL2BNG_SURF_CONV * SURF_RXN"));
        assertThat(out.errors, equalTo(""));
    }

    @Test
    public void testReactiveSurface() {
        ModelData model = typedModel();
        model.addRxnRule(rule(10.0, "V"));
        model.addRxnRule(new ReactionRule("clamp", 1e4, List.of("V", "RS"), List.of("RS")));
        model.addRxnRule(rule(1e7, "V", "W"));
        model.addRxnRule(rule(5e6, "V", "UNKNOWN"));
        Output out = new Output(model, false, 0.0, 0.0);
        assertThat(out.errors, containsString("clamp: V + RS -> RS"));
        assertThat(out.errors, containsString("V + UNKNOWN -> 0"));
        // Every rule is still written, bound to its own parameter.
        assertThat(Output.lines(out.reactionRules), contains("BEGIN REACTION_RULES", "V -> 0 k0",
                "clamp: V + RS -> RS k1", "V + W -> 0 k2", "V + UNKNOWN -> 0 k3", "END REACTION_RULES"));
        assertThat(out.param("k0"), equalTo("10"));
        assertThat(out.param("k1"), equalTo("10000"));
        assertThat(out.param("k2"), equalTo("10000000 / MCELL2BNG_VOL_CONV * VOL_RXN"));
        assertThat(out.param("k3"), equalTo("5000000"));
    }

    @Test
    public void testMoleculeTypes() {
        ModelData model = typedModel();
        model.addMoleculeType(new MoleculeType("ALL_MOLECULES", MoleculeType.Kind.VOLUME, 0.0));
        model.addMoleculeType(new MoleculeType("ALL_SURFACE_MOLECULES", MoleculeType.Kind.SURFACE, 0.0));
        Output out = new Output(model, false, 0.0, 0.0);
        assertThat(Output.lines(out.moleculeTypes), contains("BEGIN MOLECULE_TYPES", "V()", "W()", "S()", "T()",
                "END MOLECULE_TYPES"));
        assertThat(out.param("MCELL_DIFFUSION_CONSTANT_3D_V"), equalTo("1e-6"));
        assertThat(out.param("MCELL_DIFFUSION_CONSTANT_3D_W"), equalTo("2e-6"));
        assertThat(out.param("MCELL_DIFFUSION_CONSTANT_2D_S"), equalTo("1e-8"));
        assertThat(out.param("MCELL_DIFFUSION_CONSTANT_2D_T"), equalTo("3e-8"));
        assertThat(out.params.toString(), not(containsString("_RS")));
        assertThat(out.params.toString(), not(containsString("ALL_")));
        // Diffusion constants precede the rate parameters.
        String params = out.params.toString();
        assertThat(params.indexOf("MCELL_DIFFUSION_CONSTANT_3D_V"), lessThan(params.indexOf("MCELL2BNG_VOL_CONV")));
    }

    @Test
    public void testCompartments() {
        ModelData model = new ModelData();
        // Put the default compartment in the middle to be sure it is skipped wherever it is.
        int a = model.addCompartment(new Compartment("A", true, 8.0));
        int def = model.addCompartment(new Compartment("default_compartment", true, 1000.0));
        int b = model.addCompartment(new Compartment("B", false, 6.0), a);
        model.addCompartment(new Compartment("C", true, 1.0), b);
        model.addCompartment(new Compartment("D", true, 2.0), def);
        Output out = new Output(model, false, 0.0, 0.0);
        assertThat(Output.lines(out.compartments), contains("BEGIN COMPARTMENTS", "A 3 vol_A",
                "B 2 area_B * THICKNESS A", "C 3 vol_C B", "D 3 vol_D", "END COMPARTMENTS"));
        assertThat(out.param("vol_A"), equalTo("8"));
        assertThat(out.param("area_B"), equalTo("6"));
        assertThat(out.param("vol_B"), equalTo("area_B * THICKNESS"));
        assertThat(out.param("vol_C"), equalTo("1"));
        assertThat(out.params.toString(), not(containsString("default_compartment")));
        assertThat(out.compartments.toString(), not(containsString("default_compartment")));
        assertThat(out.errors, equalTo(""));
    }

}
