package edu.isi.cfgtrace;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.Vector;

import gnu.trove.map.hash.TObjectIntHashMap;

/**
 * A context-free grammar: variables, terminals, productions indexed by head, and
 * a start variable. Built up one call at a time by a loader; every call either
 * succeeds or throws and leaves the grammar exactly as it was. Once
 * {@link #seal()} succeeds the grammar is read-only and may be shared by
 * concurrent derivation queries.
 */
public class CFGRuleSet {

    /** minimum yield of a variable that derives no terminal string */
    public static final int INFINITE_YIELD = Integer.MAX_VALUE;

    private HashSet<VariableSymbol> states;
    private HashMap<Character, TerminalSymbol> terminals;
    // head -> productions, in declaration order. the order is the search priority
    private LinkedHashMap<VariableSymbol, ArrayList<CFGRule>> rulesByLHS;
    private ArrayList<CFGRule> rules;
    private VariableSymbol startState;
    private int nextRuleIndex;

    private volatile boolean sealed = false;
    // filled by seal() before sealed is set, so readers check sealed first
    private TObjectIntHashMap<VariableSymbol> minYield = null;

    public CFGRuleSet() {
	states = new HashSet<VariableSymbol>();
	terminals = new HashMap<Character, TerminalSymbol>();
	rulesByLHS = new LinkedHashMap<VariableSymbol, ArrayList<CFGRule>>();
	rules = new ArrayList<CFGRule>();
	startState = null;
	nextRuleIndex = 0;
    }

    // accessors

    public VariableSymbol getStartState() { return startState; }
    public Set<VariableSymbol> getVariables() { return Collections.unmodifiableSet(states); }
    public Collection<TerminalSymbol> getTerminals() { return Collections.unmodifiableCollection(terminals.values()); }
    public List<CFGRule> getRules() { return Collections.unmodifiableList(rules); }
    public int getNumRules() { return rules.size(); }
    public int getNumStates() { return states.size(); }
    public int getNumTerminals() { return terminals.size(); }
    public boolean isSealed() { return sealed; }

    /** productions of <code>lhs</code> in declaration order; empty if it has none */
    public List<CFGRule> getRules(VariableSymbol lhs) {
	ArrayList<CFGRule> l = rulesByLHS.get(lhs);
	if (l == null)
	    return Collections.emptyList();
	return Collections.unmodifiableList(l);
    }

    /** the declared terminal for character c, or null */
    public TerminalSymbol getTerminal(char c) {
	return terminals.get(c);
    }

    // mutators. each one validates completely before touching anything

    private void checkOpen() throws GrammarException {
	if (sealed)
	    throw new GrammarException("Grammar is sealed; no further changes allowed");
    }

    public VariableSymbol addVariable(String name) throws GrammarException {
	checkOpen();
	VariableSymbol v = SymbolFactory.getVariable(name);
	states.add(v);
	return v;
    }

    public TerminalSymbol addTerminal(String value) throws GrammarException {
	checkOpen();
	TerminalSymbol t = SymbolFactory.getTerminal(value);
	terminals.put(t.getValue(), t);
	return t;
    }

    /**
     * Add a production from its textual pieces.
     *
     * @param head the variable being rewritten
     * @param body tokens of the right-hand side: variables, terminals, or the
     *        single token "epsilon"
     */
    public CFGRule addProduction(String head, List<String> body) throws GrammarException {
	checkOpen();
	VariableSymbol lhs = SymbolFactory.getVariable(head);
	if (!states.contains(lhs))
	    throw new UnknownHeadException("Production head "+head+" is not a declared variable");
	Vector<Symbol> rhs = new Vector<Symbol>();
	for (String tok : body)
	    rhs.add(SymbolClassifier.classify(this, tok));
	return addProduction(lhs, rhs);
    }

    public CFGRule addProduction(VariableSymbol head, List<? extends Symbol> body) throws GrammarException {
	boolean debug = false;
	checkOpen();
	if (head == null || !states.contains(head))
	    throw new UnknownHeadException("Production head "+head+" is not a declared variable");
	if (body == null || body.isEmpty())
	    throw new InvalidSymbolException("Empty body for "+head+"; write "+SymbolFactory.EPSILON_TOKEN+" for the empty string");
	Vector<Symbol> rhs = new Vector<Symbol>(body.size());
	for (Symbol s : body) {
	    if (s == null)
		throw new InvalidSymbolException("Null symbol in body of "+head);
	    if (s.isEpsilon()) {
		if (body.size() > 1)
		    throw new InvalidSymbolException(SymbolFactory.EPSILON_TOKEN+" may not be mixed with other symbols in a body of "+head);
	    }
	    else if (!SymbolClassifier.isVariable(this, s) && !SymbolClassifier.isTerminal(this, s))
		throw new UnknownBodySymbolException("Symbol "+s+" in body of "+head+" is not declared");
	    rhs.add(s);
	}
	CFGRule r = new CFGRule(head, rhs, nextRuleIndex++);
	if (!rulesByLHS.containsKey(head))
	    rulesByLHS.put(head, new ArrayList<CFGRule>());
	rulesByLHS.get(head).add(r);
	rules.add(r);
	if (debug) Debug.debug(debug, "Added rule "+r+" with index "+r.getIndex());
	return r;
    }

    public VariableSymbol setStart(String name) throws GrammarException {
	checkOpen();
	VariableSymbol v = SymbolFactory.getVariable(name);
	if (!states.contains(v))
	    throw new UnknownHeadException("Start symbol "+name+" is not a declared variable");
	if (startState != null)
	    throw new GrammarException("Start symbol already set to "+startState);
	startState = v;
	return v;
    }

    /** true iff variables, terminals and productions are non-empty and the start is set */
    public boolean isComplete() {
	return !states.isEmpty() && !terminals.isEmpty() && !rules.isEmpty() && startState != null;
    }

    /**
     * Freeze the grammar. Idempotent.
     *
     * @throws IncompleteGrammarException if {@link #isComplete()} is false
     */
    public synchronized void seal() throws IncompleteGrammarException {
	if (sealed)
	    return;
	if (!isComplete()) {
	    StringBuilder missing = new StringBuilder();
	    if (states.isEmpty()) missing.append(" variables");
	    if (terminals.isEmpty()) missing.append(" terminals");
	    if (rules.isEmpty()) missing.append(" productions");
	    if (startState == null) missing.append(" start");
	    throw new IncompleteGrammarException("Incomplete grammar: missing"+missing);
	}
	minYield = computeMinYield();
	sealed = true;
    }

    // least number of terminals each variable can derive. fixpoint over the rules;
    // variables that never bottom out keep INFINITE_YIELD
    private TObjectIntHashMap<VariableSymbol> computeMinYield() {
	boolean debug = false;
	TObjectIntHashMap<VariableSymbol> y = new TObjectIntHashMap<VariableSymbol>();
	for (VariableSymbol v : states)
	    y.put(v, INFINITE_YIELD);
	boolean changed = true;
	while (changed) {
	    changed = false;
	    for (CFGRule r : rules) {
		long sum = 0;
		for (Symbol s : r.getSubstitution()) {
		    if (s.isTerminal())
			sum++;
		    else {
			int v = y.get(s);
			if (v == INFINITE_YIELD) {
			    sum = INFINITE_YIELD;
			    break;
			}
			sum += v;
		    }
		}
		if (sum < y.get(r.getLHS())) {
		    y.put(r.getLHS(), (int)Math.min(sum, INFINITE_YIELD-1));
		    changed = true;
		}
	    }
	}
	if (debug) Debug.debug(debug, "Minimum yields: "+y);
	return y;
    }

    /**
     * Fewest terminals any derivation from <code>v</code> produces, or
     * {@link #INFINITE_YIELD}. Only available once sealed.
     */
    public int getMinYield(VariableSymbol v) {
	if (!sealed)
	    throw new IllegalStateException("Grammar not sealed");
	if (!minYield.containsKey(v))
	    return INFINITE_YIELD;
	return minYield.get(v);
    }

    // sectioned text form, readable by GrammarReader
    public String toString() {
	StringBuilder sb = new StringBuilder();
	sb.append(GrammarReader.VARIABLES).append('\n');
	for (String s : sorted(states))
	    sb.append(s).append('\n');
	sb.append(GrammarReader.TERMINALS).append('\n');
	for (String s : sorted(terminals.values()))
	    sb.append(s).append('\n');
	sb.append(GrammarReader.PRODUCTIONS).append('\n');
	for (VariableSymbol head : rulesByLHS.keySet()) {
	    StringBuilder line = new StringBuilder(head.toString()).append(" ->");
	    boolean first = true;
	    for (CFGRule r : rulesByLHS.get(head)) {
		if (!first)
		    line.append(" |");
		first = false;
		for (Symbol s : r.getRHS())
		    line.append(' ').append(s);
	    }
	    sb.append(line).append('\n');
	}
	sb.append(GrammarReader.START).append('\n');
	if (startState != null)
	    sb.append(startState).append('\n');
	return sb.toString();
    }

    private static TreeSet<String> sorted(Collection<? extends Symbol> syms) {
	TreeSet<String> ret = new TreeSet<String>();
	for (Symbol s : syms)
	    ret.add(s.toString());
	return ret;
    }
}
