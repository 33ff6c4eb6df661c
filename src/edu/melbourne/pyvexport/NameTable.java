/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps Ivy names to mypyvy identifiers. Ivy names carry module paths
 * ({@code a.b}), indices ({@code a[0]}) and sort or formal qualifiers
 * ({@code fml:x}); mypyvy allows none of these characters.
 * <p>
 * The mapping is not injective ({@code a[b]} and {@code a_B_b_B_} meet), so
 * every global name of a run is registered here and a second source name
 * with the same image is rejected.
 */
public class NameTable {

    public static final String DOT_REPLACEMENT = "_";
    public static final String BRACE_REPLACEMENT = "_B_";
    public static final String COLON_REPLACEMENT = "_c_";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Map<String, String> sources = new HashMap<>(); //mypyvy name -> Ivy name

    public static String translateName(String name) {
        if (name == null || name.isEmpty()) {
            throw new InvalidNameException("cannot translate empty name to mypyvy", name);
        }
        String res = name.replace(".", DOT_REPLACEMENT);
        res = res.replace("[", BRACE_REPLACEMENT);
        res = res.replace("]", BRACE_REPLACEMENT);
        res = res.replace(":", COLON_REPLACEMENT);
        if (!IDENTIFIER.matcher(res).matches()) {
            throw new InvalidNameException("cannot translate " + name + " to a mypyvy identifier", name);
        }
        return res;
    }

    /**
     * Translates a global name and records it. Registering the same source
     * name again is allowed.
     */
    public String register(String name) {
        String res = translateName(name);
        String prev = sources.get(res);
        if (prev == null) {
            sources.put(res, name);
        } else if (!prev.equals(name)) {
            throw new NameCollisionException(prev + " and " + name + " both translate to " + res, name);
        }
        return res;
    }

    /**
     * A table for the names one declaration binds. It starts with the global
     * names; registrations in it do not reach this table.
     */
    public NameTable scope() {
        NameTable res = new NameTable();
        res.sources.putAll(sources);
        return res;
    }

    /**
     * Translates a bound name and records it. Unlike {@link #register} the
     * image must be new, even for the same source name.
     */
    public String bind(String name) {
        String res = translateName(name);
        String prev = sources.get(res);
        if (prev != null) {
            throw new NameCollisionException(prev + " and " + name + " both bind " + res, name);
        }
        sources.put(res, name);
        return res;
    }

    public boolean isRegistered(String pyvName) {
        return sources.containsKey(pyvName);
    }

    /**
     * The source name registered for {@code pyvName}, or null.
     */
    public String sourceOf(String pyvName) {
        return sources.get(pyvName);
    }
}
