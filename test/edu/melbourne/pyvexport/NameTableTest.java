/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

import org.junit.Test;

import static org.junit.Assert.*;

public class NameTableTest {

    @Test
    public void replacesIvyPunctuation() {
        assertEquals("mod_cst_B_0_B_", NameTable.translateName("mod.cst[0]"));
        assertEquals("fml_c_x", NameTable.translateName("fml:x"));
        assertEquals("__m_r", NameTable.translateName("__m_r"));
        assertEquals("edge", NameTable.translateName("edge"));
    }

    @Test(expected = InvalidNameException.class)
    public void rejectsEmptyName() {
        NameTable.translateName("");
    }

    @Test
    public void rejectsCharactersWithoutReplacement() {
        try {
            NameTable.translateName("a-b");
            fail("expected InvalidNameException");
        } catch (InvalidNameException ex) {
            assertEquals("a-b", ex.getTerm());
        }
    }

    @Test(expected = InvalidNameException.class)
    public void rejectsLeadingDigit() {
        NameTable.translateName("0x");
    }

    @Test
    public void registeringTwiceIsAllowed() {
        NameTable names = new NameTable();
        assertEquals("a_b", names.register("a.b"));
        assertEquals("a_b", names.register("a.b"));
        assertTrue(names.isRegistered("a_b"));
        assertEquals("a.b", names.sourceOf("a_b"));
        assertFalse(names.isRegistered("a.b"));
        assertNull(names.sourceOf("c"));
    }

    @Test
    public void detectsCollisions() {
        NameTable names = new NameTable();
        names.register("a[b]");
        try {
            names.register("a_B_b_B_");
            fail("expected NameCollisionException");
        } catch (NameCollisionException ex) {
            assertTrue(ex.getMessage().contains("a_B_b_B_"));
        }
    }
}
