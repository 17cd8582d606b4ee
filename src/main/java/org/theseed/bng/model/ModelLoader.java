/**
 *
 */
package org.theseed.bng.model;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonException;
import com.github.cliftonlabs.json_simple.JsonKey;
import com.github.cliftonlabs.json_simple.JsonObject;
import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * This object loads a spatial model from a JSON file.  The file contains a single object with four
 * arrays:  "molecule_types", "compartments", "reaction_rules" and "species".  Compartment parents
 * are specified by name, and a parent must be listed before its children.  The species are not
 * part of the model proper; they are returned separately so the caller can put them in a registry.
 *
 */
public class ModelLoader {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ModelLoader.class);
    /** model loaded */
    private ModelData model;
    /** species loaded */
    private List<Species> species;
    /** name of the source, for error messages */
    private String sourceName;

    private static enum TypeKeys implements JsonKey {
        NAME(""), TYPE("volume"), DIFFUSION_CONSTANT(0.0);

        private final Object m_value;

        private TypeKeys(final Object value) {
            this.m_value = value;
        }

        @Override
        public String getKey() {
            return this.name().toLowerCase();
        }

        @Override
        public Object getValue() {
            return this.m_value;
        }

    }

    private static enum CompartmentKeys implements JsonKey {
        NAME(""), IS_3D(true), SIZE(1.0), PARENT("");

        private final Object m_value;

        private CompartmentKeys(final Object value) {
            this.m_value = value;
        }

        @Override
        public String getKey() {
            return this.name().toLowerCase();
        }

        @Override
        public Object getValue() {
            return this.m_value;
        }

    }

    private static enum ItemKeys implements JsonKey {
        NAME(""), RATE(0.0), INSTANTIATED(false);

        private final Object m_value;

        private ItemKeys(final Object value) {
            this.m_value = value;
        }

        @Override
        public String getKey() {
            return this.name().toLowerCase();
        }

        @Override
        public Object getValue() {
            return this.m_value;
        }

    }

    /**
     * Load a model from a JSON file.
     *
     * @param inFile	file containing the model JSON
     *
     * @throws IOException
     */
    public ModelLoader(File inFile) throws IOException {
        try (FileReader reader = new FileReader(inFile, StandardCharsets.UTF_8)) {
            this.load(reader, inFile.toString());
        }
    }

    /**
     * Load a model from a JSON stream.
     *
     * @param reader		reader for the model JSON
     * @param sourceName	name of the source, for error messages
     *
     * @throws IOException
     */
    public ModelLoader(Reader reader, String sourceName) throws IOException {
        this.load(reader, sourceName);
    }

    /**
     * Parse the model JSON and build the model and species list.
     *
     * @param reader		reader for the model JSON
     * @param sourceName	name of the source, for error messages
     *
     * @throws IOException
     */
    private void load(Reader reader, String sourceName) throws IOException {
        this.sourceName = sourceName;
        this.model = new ModelData();
        this.species = new ArrayList<Species>();
        try {
            JsonObject modelObject = (JsonObject) Jsoner.deserialize(reader);
            if (modelObject == null)
                throw new IllegalArgumentException("Model is null.");
            for (JsonObject typeObject : objects(modelObject, "molecule_types"))
                this.model.addMoleculeType(this.parseMoleculeType(typeObject));
            for (JsonObject compObject : objects(modelObject, "compartments"))
                this.addCompartment(compObject);
            for (JsonObject ruleObject : objects(modelObject, "reaction_rules")) {
                checkNulls(ruleObject, ItemKeys.values());
                ReactionRule rule = new ReactionRule(ruleObject.getStringOrDefault(ItemKeys.NAME),
                        ruleObject.getDoubleOrDefault(ItemKeys.RATE), strings(ruleObject, "reactants"),
                        strings(ruleObject, "products"));
                this.model.addRxnRule(rule);
            }
            for (JsonObject spObject : objects(modelObject, "species")) {
                checkNulls(spObject, ItemKeys.values());
                List<String> molecules = strings(spObject, "molecules");
                String name = spObject.getStringOrDefault(ItemKeys.NAME);
                if (StringUtils.isBlank(name))
                    name = String.join(".", molecules);
                Species sp = new Species(name, new Complex(molecules));
                if (spObject.getBooleanOrDefault(ItemKeys.INSTANTIATED))
                    sp.setInstantiated();
                this.species.add(sp);
            }
        } catch (JsonException e) {
            throw new IOException("JSON error in " + sourceName + ":" + e.toString());
        } catch (ClassCastException | IllegalArgumentException e) {
            throw new IOException("Invalid model in " + sourceName + ": " + e.getMessage());
        }
        log.info("{} molecule types, {} compartments, {} reaction rules and {} species loaded from {}.",
                this.model.getMoleculeTypes().size(), this.model.getCompartmentCount(),
                this.model.getRxnRules().size(), this.species.size(), sourceName);
    }

    /**
     * @return a molecule type built from a JSON object
     *
     * @param typeObject	JSON object describing the molecule type
     */
    private MoleculeType parseMoleculeType(JsonObject typeObject) {
        checkNulls(typeObject, TypeKeys.values());
        String name = typeObject.getStringOrDefault(TypeKeys.NAME);
        if (StringUtils.isBlank(name))
            throw new IllegalArgumentException("Molecule type has no name.");
        MoleculeType.Kind kind = MoleculeType.Kind.valueOf(typeObject.getStringOrDefault(TypeKeys.TYPE).toUpperCase());
        List<MoleculeType.ComponentType> components = new ArrayList<MoleculeType.ComponentType>();
        for (JsonObject compObject : objects(typeObject, "components")) {
            checkNulls(compObject, TypeKeys.NAME);
            components.add(new MoleculeType.ComponentType(compObject.getStringOrDefault(TypeKeys.NAME),
                    strings(compObject, "states")));
        }
        return new MoleculeType(name, kind, typeObject.getDoubleOrDefault(TypeKeys.DIFFUSION_CONSTANT), components);
    }

    /**
     * Add a compartment from a JSON object to the model.
     *
     * @param compObject	JSON object describing the compartment
     */
    private void addCompartment(JsonObject compObject) {
        checkNulls(compObject, CompartmentKeys.values());
        String name = compObject.getStringOrDefault(CompartmentKeys.NAME);
        Compartment comp = new Compartment(name, compObject.getBooleanOrDefault(CompartmentKeys.IS_3D),
                compObject.getDoubleOrDefault(CompartmentKeys.SIZE));
        String parentName = compObject.getStringOrDefault(CompartmentKeys.PARENT);
        int parentId = Compartment.ID_INVALID;
        if (! StringUtils.isBlank(parentName)) {
            Compartment parent = this.model.findCompartment(parentName);
            if (parent == null)
                throw new IllegalArgumentException("Parent " + parentName + " of compartment " + name
                        + " is not defined before it.");
            parentId = parent.getId();
        }
        this.model.addCompartment(comp, parentId);
    }

    /**
     * Verify that none of the specified keys has an explicit null value.  A missing key takes its
     * default, but a null would otherwise come back from the typed getters.
     *
     * @param object	JSON object to check
     * @param keys		keys to check
     *
     * @throws IllegalArgumentException		if one of the keys has a null value
     */
    private static void checkNulls(JsonObject object, JsonKey... keys) {
        for (JsonKey key : keys) {
            if (object.containsKey(key.getKey()) && object.get(key.getKey()) == null)
                throw new IllegalArgumentException("Null value for \"" + key.getKey() + "\".");
        }
    }

    /**
     * @return the objects in a JSON array member, or an empty list if the member is missing
     *
     * @param parent	parent JSON object
     * @param key		name of the array member
     */
    private static List<JsonObject> objects(JsonObject parent, String key) {
        JsonArray array = (JsonArray) parent.get(key);
        List<JsonObject> retVal;
        if (array == null)
            retVal = Collections.emptyList();
        else {
            retVal = new ArrayList<JsonObject>(array.size());
            for (int i = 0; i < array.size(); i++) {
                JsonObject item = (JsonObject) array.get(i);
                if (item == null)
                    throw new IllegalArgumentException("Null entry in \"" + key + "\".");
                retVal.add(item);
            }
        }
        return retVal;
    }

    /**
     * @return the strings in a JSON array member, or an empty list if the member is missing
     *
     * @param parent	parent JSON object
     * @param key		name of the array member
     */
    private static List<String> strings(JsonObject parent, String key) {
        JsonArray array = (JsonArray) parent.get(key);
        List<String> retVal;
        if (array == null)
            retVal = Collections.emptyList();
        else {
            retVal = new ArrayList<String>(array.size());
            for (int i = 0; i < array.size(); i++) {
                String item = (String) array.get(i);
                if (item == null)
                    throw new IllegalArgumentException("Null entry in \"" + key + "\".");
                retVal.add(item);
            }
        }
        return retVal;
    }

    /**
     * @return the model
     */
    public ModelData getModel() {
        return this.model;
    }

    /**
     * @return the species, in file order
     */
    public List<Species> getSpecies() {
        return this.species;
    }

    /**
     * @return the name of the model source
     */
    public String getSourceName() {
        return this.sourceName;
    }

}
