package edu.isi.cfgtrace;

import java.util.Vector;

/**
 * Runs a {@link DerivationSearch} and turns its success path into the
 * human-readable derivation and the edges for tree building. A failed search
 * yields nothing at all, never a partial derivation.
 */
public class DerivationTracer {

    private final int budget;

    public DerivationTracer() {
	this(DerivationSearch.DEFAULT_BUDGET);
    }

    /** @param budget explored-state cap per trace; <= 0 for none */
    public DerivationTracer(int budget) {
	this.budget = budget;
    }

    /**
     * @return the derivation, or null if <code>target</code> is not derivable
     * @throws IncompleteGrammarException if the grammar cannot be sealed
     * @throws BudgetExceededException if the search gave up before an answer
     */
    public Derivation trace(CFGRuleSet grammar, String target, SearchStrategy strategy)
	throws IncompleteGrammarException, BudgetExceededException {
	boolean debug = false;
	DerivationSearch search = new DerivationSearch(grammar, budget);
	SearchOutcome o = search.search(target, strategy);
	if (debug) Debug.debug(debug, strategy+" \""+target+"\": "+o);
	switch (o.getStatus()) {
	case BUDGET_EXCEEDED:
	    throw new BudgetExceededException(search.giveUpMessage(target, o));
	case NOT_DERIVABLE:
	    return null;
	default:
	    break;
	}

	// replay the path, recording each form and each edge
	VariableSymbol start = grammar.getStartState();
	SententialForm form = new SententialForm(start);
	Vector<DerivationStep> steps = new Vector<DerivationStep>();
	Vector<ExpansionEdge> edges = new Vector<ExpansionEdge>();
	steps.add(new DerivationStep(form.snapshot(), null, -1));
	for (Expansion e : o.getPath()) {
	    CFGRule r = e.getRule();
	    edges.add(new ExpansionEdge(e.getPosition(), r.getLHS(), r.getRHS()));
	    form.substitute(e.getPosition(), r);
	    steps.add(new DerivationStep(form.snapshot(), r, e.getPosition()));
	}
	return new Derivation(target, strategy, start, steps, edges);
    }
}
