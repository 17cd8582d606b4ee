/**
 *
 */
package org.theseed.bng.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * This object represents an elementary molecule type in a spatial model.  A molecule type has a
 * name, a diffusion constant, a kind that tells us where it lives (in a volume, on a surface, or
 * whether it is a reactive surface pseudo-type), and a list of component types.  The internal
 * bond structure of molecules is not modeled here; the components are only kept so the type can
 * be declared in BNGL.
 *
 */
public class MoleculeType {

    // FIELDS
    /** name of the molecule type */
    private String name;
    /** diffusion constant in um^2/s */
    private double diffusionConstant;
    /** kind of molecule type */
    private Kind kind;
    /** component types */
    private List<ComponentType> components;

    /**
     * This enumeration describes where a molecule type lives.
     */
    public static enum Kind {
        /** diffuses in a 3D compartment */
        VOLUME,
        /** diffuses on a 2D surface */
        SURFACE,
        /** pseudo-type for a surface class with catalytic effects */
        REACTIVE_SURFACE;
    }

    /**
     * This is a simple object that describes a component of a molecule type and its allowed states.
     */
    public static class ComponentType {

        /** name of the component */
        private String name;
        /** allowed states (may be empty) */
        private List<String> states;

        /**
         * Construct a component type.
         *
         * @param name		component name
         * @param states	list of allowed states
         */
        public ComponentType(String name, List<String> states) {
            this.name = name;
            this.states = List.copyOf(states);
        }

        /**
         * @return the component name
         */
        public String getName() {
            return this.name;
        }

        /**
         * @return the allowed states
         */
        public List<String> getStates() {
            return this.states;
        }

        @Override
        public String toString() {
            StringBuilder retVal = new StringBuilder(this.name);
            for (String state : this.states)
                retVal.append('~').append(state);
            return retVal.toString();
        }

    }

    /**
     * Construct a molecule type with no components.
     *
     * @param name		name of the type
     * @param kind		kind of type
     * @param diff		diffusion constant
     */
    public MoleculeType(String name, Kind kind, double diff) {
        this(name, kind, diff, Collections.emptyList());
    }

    /**
     * Construct a molecule type.
     *
     * @param name			name of the type
     * @param kind			kind of type
     * @param diff			diffusion constant
     * @param components	list of component types
     */
    public MoleculeType(String name, Kind kind, double diff, List<ComponentType> components) {
        this.name = name;
        this.kind = kind;
        this.diffusionConstant = diff;
        this.components = new ArrayList<ComponentType>(components);
    }

    /**
     * @return the name of this molecule type
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the diffusion constant
     */
    public double getDiffusionConstant() {
        return this.diffusionConstant;
    }

    /**
     * @return the kind of molecule type
     */
    public Kind getKind() {
        return this.kind;
    }

    /**
     * @return TRUE if this molecule type lives in a volume
     */
    public boolean isVol() {
        return this.kind == Kind.VOLUME;
    }

    /**
     * @return TRUE if this molecule type lives on a surface
     */
    public boolean isSurf() {
        return this.kind == Kind.SURFACE;
    }

    /**
     * @return TRUE if this is a reactive surface pseudo-type
     */
    public boolean isReactiveSurface() {
        return this.kind == Kind.REACTIVE_SURFACE;
    }

    /**
     * @return the component types
     */
    public List<ComponentType> getComponents() {
        return Collections.unmodifiableList(this.components);
    }

    /**
     * @return the BNGL declaration of this molecule type
     */
    public String toBngl() {
        String comps = this.components.stream().map(x -> x.toString()).collect(Collectors.joining(","));
        return this.name + "(" + comps + ")";
    }

    @Override
    public String toString() {
        return this.toBngl();
    }

}
