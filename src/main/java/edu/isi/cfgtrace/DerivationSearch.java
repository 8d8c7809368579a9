package edu.isi.cfgtrace;

import java.util.Date;
import java.util.List;
import java.util.Vector;

import gnu.trove.set.hash.THashSet;

/**
 * Depth-first backtracking search for a derivation of a target string.
 * <p>
 * At each step the strategy picks one variable occurrence of the current
 * sentential form, and that variable's productions are tried in declaration
 * order; the first one leading to the target wins. A (form, matched length)
 * pair seen before anywhere in the same search is pruned, whether it was a
 * cycle back to an ancestor or a state that already failed, and the visited set
 * is never cleared between siblings. The result is therefore fully determined
 * by the grammar's production order and the scan direction.
 * <p>
 * Sound pruning on top of that: the leading terminals of a form must match a
 * prefix of the target, its trailing terminals a suffix, and the least number
 * of terminals the rest can yield must fit the unmatched input.
 * <p>
 * A search gives up, rather than answering, once it has explored its budget of
 * states or a path reaches {@link #MAX_DEPTH} substitutions.
 * <p>
 * One instance may serve many searches, also concurrently; each call owns its
 * own form and visited set.
 */
public class DerivationSearch {

    /** explored-state cap used unless another is given */
    public static final int DEFAULT_BUDGET = 1000000;

    /**
     * Longest substitution path tried, whatever the budget. Forms that keep
     * growing without repeating (nullable variables piling up) reach it quickly.
     */
    public static final int MAX_DEPTH = 5000;

    private final CFGRuleSet grammar;
    // <= 0 means unlimited
    private final int budget;

    public DerivationSearch(CFGRuleSet grammar) throws IncompleteGrammarException {
	this(grammar, DEFAULT_BUDGET);
    }

    public DerivationSearch(CFGRuleSet grammar, int budget) throws IncompleteGrammarException {
	grammar.seal();
	this.grammar = grammar;
	this.budget = budget;
    }

    public CFGRuleSet getGrammar() { return grammar; }

    /** membership only */
    public boolean derives(String target, SearchStrategy strategy) throws BudgetExceededException {
	SearchOutcome o = search(target, strategy);
	if (o.getStatus() == SearchOutcome.Status.BUDGET_EXCEEDED)
	    throw new BudgetExceededException(giveUpMessage(target, o));
	return o.isDerivable();
    }

    // why a BUDGET_EXCEEDED search stopped
    String giveUpMessage(String target, SearchOutcome o) {
	String msg = "Gave up on \""+target+"\" after "+o.getStatesExplored()+" states";
	if (budget > 0 && o.getStatesExplored() >= budget)
	    return msg+" (budget "+budget+")";
	return msg+" (a path reached "+MAX_DEPTH+" substitutions)";
    }

    /** search from the bare start symbol */
    public SearchOutcome search(String target, SearchStrategy strategy) {
	Vector<Symbol> start = new Vector<Symbol>();
	start.add(grammar.getStartState());
	return search(start, target, strategy);
    }

    /**
     * Look for a derivation of <code>target</code> from <code>form</code>.
     *
     * @param form starting sentential form; declared variables and terminals only
     * @param target string of terminal characters, possibly empty
     * @param strategy which variable occurrence to expand at each step
     * @return the outcome, with the substitution path if derivable
     */
    public SearchOutcome search(List<? extends Symbol> form, String target, SearchStrategy strategy) {
	boolean debug = false;
	for (Symbol s : form) {
	    if (!SymbolClassifier.isVariable(grammar, s) && !SymbolClassifier.isTerminal(grammar, s))
		throw new IllegalArgumentException("Form symbol "+s+" is not a variable or terminal of this grammar");
	}
	int foreign = SymbolClassifier.firstForeignChar(grammar, target);
	if (foreign >= 0) {
	    if (debug) Debug.debug(debug, "'"+target.charAt(foreign)+"' at "+foreign+" is not a terminal; not searching");
	    return new SearchOutcome(SearchOutcome.Status.NOT_DERIVABLE, null, 0);
	}
	Date startTime = new Date();
	Run run = new Run(new SententialForm(form), target, strategy);
	boolean found = derive(run);
	Debug.dbtime(2, startTime, strategy.getLabel()+" search for \""+target+"\" ("+run.explored+" states)");
	if (found)
	    return new SearchOutcome(SearchOutcome.Status.DERIVABLE, run.path, run.explored);
	if (run.aborted)
	    return new SearchOutcome(SearchOutcome.Status.BUDGET_EXCEEDED, null, run.explored);
	return new SearchOutcome(SearchOutcome.Status.NOT_DERIVABLE, null, run.explored);
    }

    // everything private to one search call
    private static class Run {
	final SententialForm form;
	final String target;
	final SearchStrategy strategy;
	final THashSet<SearchState> visited = new THashSet<SearchState>();
	final Vector<Expansion> path = new Vector<Expansion>();
	int explored = 0;
	boolean aborted = false;

	Run(SententialForm form, String target, SearchStrategy strategy) {
	    this.form = form;
	    this.target = target;
	    this.strategy = strategy;
	}
    }

    // results of visiting a form, other than the position to expand next
    private static final int MATCHED = -2;
    private static final int DEAD = -1;

    // one variable occurrence being expanded: its position, the next of its
    // rules to try, and the rule currently substituted there, if any
    private static class Frame {
	final int pos;
	int next = 0;
	CFGRule applied = null;

	Frame(int pos) {
	    this.pos = pos;
	}
    }

    // explicit-stack walk, so the depth of a derivation is bounded by
    // MAX_DEPTH and not by the thread's stack
    private boolean derive(Run run) {
	SententialForm f = run.form;
	int pos = visit(run);
	if (pos == MATCHED)
	    return true;
	if (pos == DEAD)
	    return false;
	Vector<Frame> stack = new Vector<Frame>();
	stack.add(new Frame(pos));
	while (!stack.isEmpty()) {
	    Frame top = stack.lastElement();
	    if (top.applied != null) {
		run.path.remove(run.path.size()-1);
		f.undo(top.pos, top.applied);
		top.applied = null;
		if (run.aborted)
		    return false;
	    }
	    List<CFGRule> rules = grammar.getRules((VariableSymbol)f.get(top.pos));
	    if (top.next >= rules.size()) {
		stack.remove(stack.size()-1);
		continue;
	    }
	    CFGRule r = rules.get(top.next++);
	    f.substitute(top.pos, r);
	    run.path.add(new Expansion(top.pos, r));
	    top.applied = r;
	    int child = visit(run);
	    if (child == MATCHED)
		return true;
	    if (child != DEAD)
		stack.add(new Frame(child));
	}
	return false;
    }

    // check the current form: MATCHED, DEAD, or the position to expand next
    private int visit(Run run) {
	boolean debug = false;
	SententialForm f = run.form;
	String target = run.target;
	int depth = run.path.size();

	int matched = f.leadingTerminals();
	if (matched > target.length())
	    return DEAD;
	for (int i = 0; i < matched; i++) {
	    if (((TerminalSymbol)f.get(i)).getValue() != target.charAt(i))
		return DEAD;
	}

	if (depth >= MAX_DEPTH) {
	    if (debug) Debug.debug(debug, "giving up at depth "+depth);
	    run.aborted = true;
	    return DEAD;
	}
	if (!run.visited.add(new SearchState(f.getKey(), matched))) {
	    if (debug) Debug.debug(debug, depth, "seen "+f+" before");
	    return DEAD;
	}
	if (budget > 0 && run.explored >= budget) {
	    run.aborted = true;
	    return DEAD;
	}
	run.explored++;
	if (debug) Debug.debug(debug, depth, "at "+f);

	int pos = run.strategy.pickPosition(f);
	// no variables: all terminals, and the prefix check above covered each of them
	if (pos < 0)
	    return matched == target.length() ? MATCHED : DEAD;
	if (!fits(f, matched, target))
	    return DEAD;
	return pos;
    }

    // can the unmatched part of f still produce the unmatched part of target?
    private boolean fits(SententialForm f, int matched, String target) {
	int remaining = target.length()-matched;
	long need = 0;
	for (int i = matched; i < f.size(); i++) {
	    Symbol s = f.get(i);
	    if (s.isTerminal())
		need++;
	    else {
		int y = grammar.getMinYield((VariableSymbol)s);
		if (y == CFGRuleSet.INFINITE_YIELD)
		    return false;
		need += y;
	    }
	    if (need > remaining)
		return false;
	}
	// trailing terminals against the target's suffix. need <= remaining keeps them clear of the prefix
	int j = target.length()-1;
	for (int i = f.size()-1; i >= matched && f.get(i).isTerminal(); i--, j--) {
	    if (((TerminalSymbol)f.get(i)).getValue() != target.charAt(j))
		return false;
	}
	return true;
    }
}
