package com.ttennebkram.pdpatch.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Registry of well-known object classes and their inlet/outlet counts.
 * A null count means the class takes a variable number depending on its
 * creation arguments.
 */
public class ObjectRegistry {

    private static final Logger LOGGER = Logger.getLogger(ObjectRegistry.class.getName());

    /**
     * Information about a registered object class.
     */
    public static class ObjectRegistration {
        public final String className;
        public final String category;
        public final Integer inlets;
        public final Integer outlets;

        public ObjectRegistration(String className, String category, Integer inlets, Integer outlets) {
            this.className = className;
            this.category = category;
            this.inlets = inlets;
            this.outlets = outlets;
        }
    }

    private static final List<ObjectRegistration> registeredObjects = new ArrayList<>();
    private static final Map<String, ObjectRegistration> objectsByName = new HashMap<>();
    private static boolean initialized = false;

    /**
     * Fill the registry with the built-in table.
     * Safe to call multiple times - only initializes once.
     */
    public static synchronized void initialize() {
        if (initialized) return;
        initialized = true;

        String category = "Audio Sources";
        add(category, 2, 1, "osc~", "phasor~", "tabosc4~");
        add(category, 0, 1, "noise~");

        category = "Audio Math";
        add(category, 2, 1, "+~", "-~", "*~", "/~");
        add(category, 3, 1, "clip~");
        add(category, 1, 1, "wrap~", "abs~", "sqrt~");

        category = "Audio Filters";
        add(category, 2, 1, "lop~", "hip~");
        add(category, 3, 1, "bp~");
        add(category, 3, 2, "vcf~");

        category = "Audio I/O";
        add(category, 2, 0, "dac~");
        add(category, 0, 2, "adc~");
        add(category, 2, 1, "line~");
        add(category, 3, 1, "vline~");
        add(category, 1, 1, "env~");
        add(category, 2, 2, "threshold~");

        category = "Audio Delay";
        add(category, 1, 0, "delwrite~");
        add(category, 2, 1, "delread~");
        add(category, 1, 1, "delread4~", "vd~");

        category = "Audio Tables";
        add(category, 1, 1, "tabread~", "tabread4~");
        add(category, 2, 0, "tabwrite~");
        add(category, 1, 0, "tabsend~");
        add(category, 0, 1, "tabreceive~");

        category = "Control Math";
        add(category, 2, 1, "+", "-", "*", "/", "mod", "div", "pow", "min", "max", "random");
        add(category, 1, 1, "abs", "sqrt");
        add(category, 2, 1, "==", "!=", ">", "<", ">=", "<=", "&&", "||");

        category = "Control Routing";
        add(category, 1, null, "trigger", "t", "unpack");
        add(category, null, 1, "pack", "list");
        add(category, null, null, "route", "select", "sel", "pipe");
        add(category, 2, 1, "spigot");
        add(category, 2, 2, "swap", "moses");

        category = "Control Time";
        add(category, 2, 1, "delay", "metro", "timer", "line");

        category = "Control Data";
        add(category, 2, 1, "float", "f", "int", "i", "symbol");
        add(category, 1, 1, "value", "v");

        category = "Control I/O";
        add(category, null, 0, "send", "s");
        add(category, 0, 1, "receive", "r", "catch~", "receive~", "r~");
        add(category, 1, 0, "throw~", "send~", "s~");

        category = "Misc";
        add(category, 1, 1, "bang", "change", "tabread");
        add(category, 0, 1, "loadbang", "inlet", "inlet~");
        add(category, 1, 0, "print", "outlet", "outlet~");
        add(category, 2, 2, "stripnote");
        add(category, 3, 2, "makenote");
        add(category, 2, 0, "tabwrite");

        category = "MIDI";
        add(category, 0, 3, "notein", "ctlin");
        add(category, 3, 0, "noteout", "ctlout");
        add(category, 0, 2, "bendin", "midiin");
        add(category, 2, 0, "bendout");
        add(category, 1, 0, "midiout");

        LOGGER.fine(() -> "ObjectRegistry: Registered " + registeredObjects.size() + " object classes");
    }

    private static void add(String category, Integer inlets, Integer outlets, String... classNames) {
        for (String name : classNames) {
            register(new ObjectRegistration(name, category, inlets, outlets));
        }
    }

    /**
     * Register an object class, replacing any earlier entry of the same name.
     * Used for externals whose arity the caller knows.
     */
    public static synchronized void register(ObjectRegistration registration) {
        initialize();
        ObjectRegistration previous = objectsByName.put(registration.className, registration);
        if (previous != null) {
            registeredObjects.remove(previous);
        }
        registeredObjects.add(registration);
    }

    /**
     * Look up a class by name.
     * @return the registration, or null for an unknown class
     */
    public static synchronized ObjectRegistration lookup(String className) {
        initialize();
        return objectsByName.get(className);
    }

    /**
     * Get all registered classes.
     */
    public static synchronized List<ObjectRegistration> getAllObjects() {
        initialize();
        return Collections.unmodifiableList(new ArrayList<>(registeredObjects));
    }

    /** Check if a class name is an inlet or inlet~ boundary object. */
    public static boolean isBoundaryInlet(String className) {
        return "inlet".equals(className) || "inlet~".equals(className);
    }

    /** Check if a class name is an outlet or outlet~ boundary object. */
    public static boolean isBoundaryOutlet(String className) {
        return "outlet".equals(className) || "outlet~".equals(className);
    }
}
