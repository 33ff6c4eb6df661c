/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

import edu.melbourne.pyvexport.logic.Symbol;
import edu.melbourne.pyvexport.mypyvy.Decl;
import java.util.Collections;
import java.util.Set;

/**
 * A translated action or initializer together with the second-order
 * witnesses it uses, which the program has to declare and havoc.
 */
public class ActionTranslation<D extends Decl> {

    private final D decl;
    private final Set<Symbol> secondOrderWitnesses;

    public ActionTranslation(D decl, Set<Symbol> secondOrderWitnesses) {
        this.decl = decl;
        this.secondOrderWitnesses = Collections.unmodifiableSet(secondOrderWitnesses);
    }

    public D getDecl() {
        return decl;
    }

    public Set<Symbol> getSecondOrderWitnesses() {
        return secondOrderWitnesses;
    }
}
