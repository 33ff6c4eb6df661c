/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

import edu.melbourne.pyvexport.logic.Formula;
import edu.melbourne.pyvexport.logic.Sort;
import edu.melbourne.pyvexport.logic.Symbol;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.*;

public class PyvExportTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void writesProgramNamedAfterIsolate() throws IOException {
        File dir = new File(tmp.getRoot(), "out");
        File out = PyvExport.checkIsolate(ProgramAssemblerTest.graph(), ProgramAssemblerTest.exact().setOutputDir(dir));
        assertEquals(new File(dir, "graph.pyv"), out);
        String text = new String(Files.readAllBytes(out.toPath()), StandardCharsets.UTF_8);
        assertEquals(ProgramAssemblerTest.GRAPH_PYV, text);
    }

    @Test
    public void simplifiedProgramKeepsStructure() throws IOException {
        Settings settings = new Settings().setOutputDir(tmp.getRoot());
        File out = PyvExport.checkIsolate(ProgramAssemblerTest.graph(), settings);
        String text = new String(Files.readAllBytes(out.toPath()), StandardCharsets.UTF_8);
        assertTrue(text, text.startsWith("sort Node\nsort color\n"));
        assertTrue(text, text.contains("transition add_edge(fml_c_x: Node, fml_c_y: Node)\n  modifies edge\n"));
        assertTrue(text, text.contains("transition _havoc_intermediaries()\n"));
        assertTrue(text, text.endsWith("invariant [inv_B_0_B_] forall X:Node. !edge(X, X)\n"));
    }

    @Test
    public void nothingIsWrittenOnFailure() throws IOException {
        Sort node = Sort.uninterpreted("Node");
        Symbol owner = new Symbol("owner", Sort.relation(node));
        Symbol edge = new Symbol("edge", Sort.relation(node, node));
        Formula.Var x = Formula.var("X", node);
        // declares edge as modified but leaves it alone
        Formula copy = Formula.forall(Arrays.asList(x), Formula.iff(Formula.app(owner.toNew(), x), Formula.app(owner, x)));
        ModuleFixture module = new ModuleFixture("broken").sort(node).symbol(owner).symbol(edge)
                .action("a", ModuleFixture.action(copy, owner, edge), true);
        try {
            PyvExport.checkIsolate(module, new Settings().setOutputDir(tmp.getRoot()));
            fail("expected ModifiesMismatchException");
        } catch (ModifiesMismatchException ex) {
            assertNotNull(ex.getTerm());
        }
        assertFalse(new File(tmp.getRoot(), "broken.pyv").exists());
    }

    @Test
    public void verboseRunsTheSameTranslation() {
        assertEquals(ProgramAssemblerTest.GRAPH_PYV,
                PyvExport.translate(ProgramAssemblerTest.graph(), ProgramAssemblerTest.exact().setVerbose(true)).toString());
    }
}
