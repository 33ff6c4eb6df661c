/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

import edu.melbourne.pyvexport.logic.SourceModule;
import edu.melbourne.pyvexport.mypyvy.Program;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PropertyConfigurator;

/**
 * Exports the current isolate as a mypyvy program.
 */
public class PyvExport {

    private static final Logger logger = Logger.getLogger(PyvExport.class);

    public static final String EXTENSION = ".pyv";

    private PyvExport() {
    }

    public static void configureLogger(String propertiesFile) {
        PropertyConfigurator.configure(propertiesFile);
    }

    /**
     * Runs the whole translation. Any {@link TranslationException} is logged
     * and rethrown; nothing is written in that case.
     */
    public static Program translate(SourceModule module, Settings settings) {
        if (settings.isVerbose()) {
            Logger.getLogger("edu.melbourne.pyvexport").setLevel(Level.DEBUG);
        }
        logger.info("The translation performs simplification via SMT. It might take on the order of minutes!");
        try (ExportContext context = new ExportContext(module, settings)) {
            ProgramAssembler prog = new ProgramAssembler(context);
            prog.translateSignature();
            prog.addAxiomsAndProps();
            prog.addConjectures();
            prog.addInitializers();
            prog.addPublicActions();
            prog.addIntermediatesAndHavocAction();
            return prog.toProgram();
        } catch (TranslationException ex) {
            logger.error("translation of " + module.getName() + " failed: " + ex.getMessage());
            throw ex;
        }
    }

    /**
     * Translates {@code module} and writes it to {@code <module name>.pyv} in
     * the output directory.
     *
     * @return the file written
     */
    public static File checkIsolate(SourceModule module, Settings settings) throws IOException {
        Program prog = translate(module, settings);
        File dir = settings.getOutputDir();
        if (!dir.isDirectory() && !dir.mkdirs()) {
            throw new IOException("cannot create output directory " + dir);
        }
        File out = new File(dir, module.getName() + EXTENSION);
        try (Writer w = new OutputStreamWriter(new FileOutputStream(out), StandardCharsets.UTF_8)) {
            w.write(prog.toString());
        }
        logger.info("output written to " + out.getPath());
        return out;
    }
}
