/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

import edu.melbourne.pyvexport.logic.Action;
import edu.melbourne.pyvexport.logic.Formula;
import edu.melbourne.pyvexport.logic.LabeledFormula;
import edu.melbourne.pyvexport.logic.Sort;
import edu.melbourne.pyvexport.logic.SourceModule;
import edu.melbourne.pyvexport.logic.Symbol;
import edu.melbourne.pyvexport.mypyvy.Decl;
import edu.melbourne.pyvexport.mypyvy.Program;
import edu.melbourne.pyvexport.mypyvy.PyvExpr;
import edu.melbourne.pyvexport.mypyvy.PyvSort;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Collects the declarations of the mypyvy program and puts them in the order
 * mypyvy needs: sorts, constants, relations, functions, axioms, intermediate
 * relations and functions, the havoc action, the initializer, the actions and
 * the invariants.
 */
public class ProgramAssembler {

    public static final String HAVOC_ACTION = "_havoc_intermediaries";

    private final ExportContext context;

    private final List<Decl> sorts = new ArrayList<>();
    private final List<Decl> constants = new ArrayList<>();
    private final List<Decl> relations = new ArrayList<>();
    private final List<Decl> functions = new ArrayList<>();
    private final List<Decl> axioms = new ArrayList<>();
    private final List<Decl> intermediate = new ArrayList<>();
    private final List<Decl> havocAction = new ArrayList<>();
    private final List<Decl> initializers = new ArrayList<>();
    private final List<Decl> actions = new ArrayList<>();
    private final List<Decl> invariants = new ArrayList<>();

    private final Set<String> constantNames = new HashSet<>();
    // second-order witnesses seen by the initializer and the actions
    private final Set<Symbol> secondOrderWitnesses = new TreeSet<>();

    public ProgramAssembler(ExportContext context) {
        this.context = context;
    }

    private void addConstantIfNotExists(Decl cst) {
        if (constantNames.add(cst.getName())) {
            constants.add(cst);
        }
    }

    void addSort(Sort sort) {
        if (sort instanceof Sort.UninterpretedSort) {
            sorts.add(new Decl.SortDecl(context.getNames().register(sort.getName())));
        } else if (sort instanceof Sort.EnumeratedSort) {
            String name = context.getNames().register(sort.getName());
            sorts.add(new Decl.SortDecl(name));
            PyvSort pyvSort = LogicToPyv.translateSort(sort);
            List<PyvExpr> individuals = new ArrayList<>();
            for (String v : ((Sort.EnumeratedSort) sort).getValues()) {
                String value = context.getNames().register(v);
                addConstantIfNotExists(new Decl.ConstantDecl(value, pyvSort, false));
                individuals.add(PyvExpr.id(value));
            }
            if (individuals.size() >= 2) {
                axioms.add(new Decl.AxiomDecl(name + "_distinct", PyvExpr.distinct(individuals)));
            }
        } else if (sort != Sort.BOOL) {
            throw new UnsupportedSortException("sort " + sort + " not supported", sort);
        }
    }

    public void translateSignature() {
        SourceModule module = context.getModule();
        for (Sort s : module.getSorts().values()) {
            addSort(s);
        }
        for (Map.Entry<String, Symbol> e : module.getSymbols().entrySet()) {
            Symbol sym = e.getValue();
            Decl decl = LogicToPyv.translateSymbolDecl(sym, context.isMutable(sym));
            context.getNames().register(sym.getName());
            switch (sym.getKind()) {
                case INDIVIDUAL:
                    addConstantIfNotExists(decl);
                    break;
                case RELATION:
                    relations.add(decl);
                    break;
                default:
                    functions.add(decl);
                    break;
            }
        }
    }

    public void addAxiomsAndProps() {
        SourceModule module = context.getModule();
        for (Formula ax : module.getAxioms()) {
            axioms.add(new Decl.AxiomDecl(null, LogicToPyv.translate(ax)));
        }
        // properties proved elsewhere are axioms here
        for (LabeledFormula prop : module.getLabeledProps()) {
            if (prop.isAssumed()) {
                axioms.add(new Decl.AxiomDecl(label(prop), LogicToPyv.translate(prop.getFormula())));
            }
        }
    }

    public void addConjectures() {
        for (LabeledFormula conj : context.getModule().getLabeledConjs()) {
            invariants.add(new Decl.InvariantDecl(label(conj), LogicToPyv.translate(conj.getFormula()), false, false));
        }
    }

    private static String label(LabeledFormula f) {
        return f.getLabel() == null ? null : NameTable.translateName(f.getLabel());
    }

    public void addInitializers() {
        ActionTranslation<Decl.InitDecl> init = new InitializerSequencer(context)
                .translateInitializers(context.getModule().getInitializers());
        secondOrderWitnesses.addAll(init.getSecondOrderWitnesses());
        initializers.add(init.getDecl());
    }

    public void addPublicActions() {
        SourceModule module = context.getModule();
        TransitionBuilder builder = new TransitionBuilder(context);
        for (Map.Entry<String, Action> e : module.getActions().entrySet()) {
            if (!module.getPublicActions().contains(e.getKey())) {
                continue;
            }
            ActionTranslation<Decl.DefinitionDecl> act = builder.translateAction(e.getKey(), e.getValue());
            secondOrderWitnesses.addAll(act.getSecondOrderWitnesses());
            actions.add(act.getDecl());
        }
    }

    /**
     * Declares the second-order witnesses as mutable relations and functions
     * and adds an action that sets all of them arbitrarily.
     */
    public void addIntermediatesAndHavocAction() {
        if (secondOrderWitnesses.isEmpty()) {
            return;
        }
        List<String> modified = new ArrayList<>();
        List<PyvExpr> clauses = new ArrayList<>();
        Set<String> declared = new HashSet<>();
        for (Symbol w : secondOrderWitnesses) {
            if (!declared.add(w.getName())) {
                throw new NameCollisionException("existential " + w.getName() + " is used with two sorts", w);
            }
            intermediate.add(LogicToPyv.translateSymbolDecl(w, true));
            modified.add(context.getNames().register(w.getName()));
            clauses.add(LogicToPyv.havocClause(w));
        }
        havocAction.add(new Decl.DefinitionDecl(context.getNames().register(HAVOC_ACTION),
                new ArrayList<>(), modified, PyvExpr.and(clauses)));
    }

    public Set<Symbol> getSecondOrderWitnesses() {
        return secondOrderWitnesses;
    }

    public Program toProgram() {
        List<Decl> decls = new ArrayList<>();
        decls.addAll(sorts);
        decls.addAll(constants);
        decls.addAll(relations);
        decls.addAll(functions);
        decls.addAll(axioms);
        decls.addAll(intermediate);
        decls.addAll(havocAction);
        decls.addAll(initializers);
        decls.addAll(actions);
        decls.addAll(invariants);
        return new Program(decls);
    }
}
