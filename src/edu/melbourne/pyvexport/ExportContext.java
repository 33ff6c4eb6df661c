/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

import edu.melbourne.pyvexport.logic.Formula;
import edu.melbourne.pyvexport.logic.LabeledFormula;
import edu.melbourne.pyvexport.logic.Sort;
import edu.melbourne.pyvexport.logic.SourceModule;
import edu.melbourne.pyvexport.logic.Symbol;
import edu.melbourne.pyvexport.smt.FormulaToZ3;
import edu.melbourne.pyvexport.smt.MacroEliminator;
import edu.melbourne.pyvexport.smt.SmtSession;
import edu.melbourne.pyvexport.smt.Z3ToFormula;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Everything a translation run shares: the module, the settings, the Z3
 * session and the tables derived once from the signature. Built at the start
 * of a run and closed at the end.
 */
public class ExportContext implements AutoCloseable {

    private final SourceModule module;
    private final Settings settings;
    private final SmtSession session;
    private final FormulaToZ3 compiler;
    private final MacroEliminator eliminator;
    private final NameTable names = new NameTable();

    private final Map<String, Sort> solverSorts = new LinkedHashMap<>();
    private final Map<String, Symbol> signature = new LinkedHashMap<>();
    private final Set<String> immutable = new HashSet<>();
    private final Map<String, Symbol> mutable = new TreeMap<>(); //by mypyvy name

    public ExportContext(SourceModule module, Settings settings) {
        this.module = module;
        this.settings = settings;
        this.session = new SmtSession(settings.getSolverTimeoutMs());
        this.compiler = new FormulaToZ3(session.getContext());
        this.eliminator = new MacroEliminator(session, compiler, settings.isCheckEquivalence(), settings.isSimplify());
        try {
            init();
        } catch (RuntimeException ex) {
            session.close();
            throw ex;
        }
    }

    private void init() {
        solverSorts.put(compiler.sortName(Sort.BOOL), Sort.BOOL);
        for (Sort s : module.getSorts().values()) {
            if (s instanceof Sort.UninterpretedSort || s instanceof Sort.EnumeratedSort) {
                solverSorts.put(compiler.sortName(s), s);
            }
            if (s instanceof Sort.EnumeratedSort) {
                for (String v : ((Sort.EnumeratedSort) s).getValues()) {
                    signature.put(v, new Symbol(v, s));
                }
            }
        }
        for (Map.Entry<String, Symbol> e : module.getSymbols().entrySet()) {
            if (!e.getKey().equals(e.getValue().getName())) {
                throw new IllegalArgumentException("symbol name mismatch: " + e.getKey() + " != " + e.getValue().getName());
            }
            signature.put(e.getKey(), e.getValue());
        }
        // symbols fixed by axioms or by properties assumed in this isolate
        for (Formula ax : module.getAxioms()) {
            immutable.addAll(LogicToPyv.globalsInFormula(ax));
        }
        for (LabeledFormula prop : module.getLabeledProps()) {
            if (prop.isAssumed()) {
                immutable.addAll(LogicToPyv.globalsInFormula(prop.getFormula()));
            }
        }
        for (Symbol sym : module.getSymbols().values()) {
            if (isEnumValue(sym)) {
                immutable.add(sym.getName());
            } else if (!immutable.contains(sym.getName())) {
                mutable.put(NameTable.translateName(sym.getName()), sym);
            }
        }
    }

    private static boolean isEnumValue(Symbol sym) {
        return sym.getSort() instanceof Sort.EnumeratedSort
                && ((Sort.EnumeratedSort) sym.getSort()).getValues().contains(sym.getName());
    }

    public SourceModule getModule() {
        return module;
    }

    public Settings getSettings() {
        return settings;
    }

    public SmtSession getSession() {
        return session;
    }

    public FormulaToZ3 getCompiler() {
        return compiler;
    }

    public MacroEliminator getEliminator() {
        return eliminator;
    }

    public NameTable getNames() {
        return names;
    }

    public boolean isMutable(Symbol sym) {
        return !immutable.contains(sym.getName());
    }

    /**
     * mypyvy names of the mutable signature symbols.
     */
    public Set<String> getMutableNames() {
        return Collections.unmodifiableSet(mutable.keySet());
    }

    /**
     * The mutable signature symbol with the given mypyvy name, or null.
     */
    public Symbol mutableSymbol(String pyvName) {
        return mutable.get(pyvName);
    }

    /**
     * Back-translation for formulas over {@code f}'s symbols, the signature
     * and the enumeration values.
     */
    public Z3ToFormula backTranslation(Formula f) {
        Map<String, Symbol> syms = new LinkedHashMap<>(signature);
        for (Symbol s : f.symbols()) {
            syms.put(s.getName(), s);
        }
        return new Z3ToFormula(solverSorts, syms);
    }

    @Override
    public void close() {
        session.close();
    }
}
