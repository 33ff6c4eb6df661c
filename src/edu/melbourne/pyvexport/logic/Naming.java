/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.logic;

/**
 * Name conventions the Ivy elaborator uses to tag symbols of transition
 * relations.
 */
public class Naming {

    public static final String NEW_PREFIX = "new_"; //post-state copy of a state symbol
    public static final String SKOLEM_PREFIX = "__"; //implicitly existentially quantified
    public static final String FORMAL_PREFIX = "fml:"; //formal parameter of an action
    public static final String TEMPORARY_PREFIX = "__m_"; //intermediate relation abbreviating a subformula

    private Naming() {
    }

    public static boolean isNew(String name) {
        return name.startsWith(NEW_PREFIX) && name.length() > NEW_PREFIX.length();
    }

    public static String newOf(String name) {
        if (!isNew(name)) {
            throw new IllegalArgumentException(name + " is not a post-state name");
        }
        return name.substring(NEW_PREFIX.length());
    }

    public static String toNew(String name) {
        return NEW_PREFIX + name;
    }

    public static boolean isSkolem(String name) {
        return name.startsWith(SKOLEM_PREFIX) || name.startsWith(FORMAL_PREFIX);
    }

    public static boolean isTemporary(String name) {
        return name.startsWith(TEMPORARY_PREFIX);
    }
}
