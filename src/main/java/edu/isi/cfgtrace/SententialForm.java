package edu.isi.cfgtrace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Vector;

/**
 * The string of symbols a derivation has reached so far. It only ever changes by
 * replacing one variable occurrence with a production's substitution, and every
 * such change can be undone exactly. Never holds the epsilon marker.
 */
public class SententialForm {

    private ArrayList<Symbol> syms;

    public SententialForm(Symbol start) {
	syms = new ArrayList<Symbol>();
	syms.add(start);
    }

    public SententialForm(List<? extends Symbol> form) {
	syms = new ArrayList<Symbol>(form);
    }

    public int size() { return syms.size(); }
    public Symbol get(int i) { return syms.get(i); }
    public boolean isEmpty() { return syms.isEmpty(); }

    public int firstVariable() {
	for (int i = 0; i < syms.size(); i++)
	    if (syms.get(i).isVariable())
		return i;
	return -1;
    }

    public int lastVariable() {
	for (int i = syms.size()-1; i >= 0; i--)
	    if (syms.get(i).isVariable())
		return i;
	return -1;
    }

    // count of terminals before the first variable (or all of them)
    public int leadingTerminals() {
	int i = 0;
	while (i < syms.size() && syms.get(i).isTerminal())
	    i++;
	return i;
    }

    /** replace the variable at pos with the rule's substitution */
    public void substitute(int pos, CFGRule r) {
	if (syms.get(pos) != r.getLHS())
	    throw new IllegalArgumentException("Symbol at "+pos+" is "+syms.get(pos)+", not "+r.getLHS());
	syms.remove(pos);
	syms.addAll(pos, r.getSubstitution());
    }

    /** reverse substitute(pos, r) */
    public void undo(int pos, CFGRule r) {
	int n = r.getSubstitution().size();
	for (int i = 0; i < n; i++)
	    syms.remove(pos);
	syms.add(pos, r.getLHS());
    }

    // every symbol is one character, so the plain concatenation is an unambiguous key
    public String getKey() {
	StringBuilder sb = new StringBuilder(syms.size());
	for (Symbol s : syms)
	    sb.append(s);
	return sb.toString();
    }

    public List<Symbol> snapshot() {
	return Collections.unmodifiableList(new Vector<Symbol>(syms));
    }

    // symbols separated by single spaces; empty form is the empty string
    public String toString() {
	return render(syms);
    }

    static String render(List<? extends Symbol> form) {
	StringBuilder sb = new StringBuilder();
	for (Symbol s : form) {
	    if (sb.length() > 0)
		sb.append(' ');
	    sb.append(s);
	}
	return sb.toString();
    }
}
