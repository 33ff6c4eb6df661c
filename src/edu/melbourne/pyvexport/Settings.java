/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Options of a translation run. Read from {@code pyvexport.properties} on
 * the class path; a system property with the same key wins.
 */
public class Settings {

    public static final String RESOURCE = "pyvexport.properties";

    public static final String VERBOSE = "pyvexport.verbose";
    public static final String OUTPUT_DIR = "pyvexport.outputDir";
    public static final String SOLVER_TIMEOUT_MS = "pyvexport.solverTimeoutMs";
    public static final String CHECK_EQUIVALENCE = "pyvexport.checkEquivalence";
    public static final String SIMPLIFY = "pyvexport.simplify";

    private boolean verbose = false;
    private File outputDir = new File(".");
    private int solverTimeoutMs = 0; //0 means no limit
    private boolean checkEquivalence = true;
    private boolean simplify = true;

    public Settings() {
    }

    /**
     * Defaults, overridden by the class path resource and then by system
     * properties.
     */
    public static Settings load() {
        Properties props = new Properties();
        InputStream in = Settings.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in != null) {
            try {
                props.load(in);
            } catch (IOException ex) {
                throw new IllegalStateException("cannot read " + RESOURCE, ex);
            } finally {
                try {
                    in.close();
                } catch (IOException ex) {
                    throw new IllegalStateException("cannot close " + RESOURCE, ex);
                }
            }
        }
        return fromProperties(props);
    }

    public static Settings fromProperties(Properties props) {
        Settings s = new Settings();
        s.verbose = Boolean.parseBoolean(lookup(props, VERBOSE, "false"));
        s.outputDir = new File(lookup(props, OUTPUT_DIR, "."));
        String timeout = lookup(props, SOLVER_TIMEOUT_MS, "0");
        try {
            s.solverTimeoutMs = Integer.parseInt(timeout.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(SOLVER_TIMEOUT_MS + " is not a number: " + timeout, ex);
        }
        if (s.solverTimeoutMs < 0) {
            throw new IllegalArgumentException(SOLVER_TIMEOUT_MS + " must not be negative: " + timeout);
        }
        s.checkEquivalence = Boolean.parseBoolean(lookup(props, CHECK_EQUIVALENCE, "true"));
        s.simplify = Boolean.parseBoolean(lookup(props, SIMPLIFY, "true"));
        return s;
    }

    private static String lookup(Properties props, String key, String def) {
        String v = System.getProperty(key);
        if (v != null) {
            return v;
        }
        return props.getProperty(key, def);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public Settings setVerbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    public File getOutputDir() {
        return outputDir;
    }

    public Settings setOutputDir(File outputDir) {
        this.outputDir = outputDir;
        return this;
    }

    public int getSolverTimeoutMs() {
        return solverTimeoutMs;
    }

    public Settings setSolverTimeoutMs(int solverTimeoutMs) {
        this.solverTimeoutMs = solverTimeoutMs;
        return this;
    }

    public boolean isCheckEquivalence() {
        return checkEquivalence;
    }

    public Settings setCheckEquivalence(boolean checkEquivalence) {
        this.checkEquivalence = checkEquivalence;
        return this;
    }

    public boolean isSimplify() {
        return simplify;
    }

    public Settings setSimplify(boolean simplify) {
        this.simplify = simplify;
        return this;
    }

    @Override
    public String toString() {
        return "{verbose=" + verbose + ", outputDir=" + outputDir + ", solverTimeoutMs=" + solverTimeoutMs
                + ", checkEquivalence=" + checkEquivalence + ", simplify=" + simplify + "}";
    }
}
