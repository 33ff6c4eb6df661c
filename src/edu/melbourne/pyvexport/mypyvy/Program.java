/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.mypyvy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 *
 * A mypyvy program: declarations in the order they are printed.
 */
public class Program {

    private final List<Decl> decls;

    public Program(List<Decl> decls) {
        this.decls = Collections.unmodifiableList(new ArrayList<>(decls));
    }

    public List<Decl> getDecls() {
        return decls;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Decl d : decls) {
            sb.append(d).append("\n");
        }
        return sb.toString();
    }
}
