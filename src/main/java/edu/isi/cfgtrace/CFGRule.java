package edu.isi.cfgtrace;

import java.util.Collections;
import java.util.List;
import java.util.Vector;

// CFG Rule. VariableSymbol lhs, Vector of Symbols rhs, index in declaration order.
// an epsilon rule has the single-symbol rhs [epsilon]
public class CFGRule {

    private final VariableSymbol lhs;
    private final List<Symbol> rhs;
    // position among all rules of the rule set; rules of one lhs are tried in this order
    private final int index;

    CFGRule(VariableSymbol lhs, Vector<Symbol> rhs, int index) {
	this.lhs = lhs;
	this.rhs = Collections.unmodifiableList(rhs);
	this.index = index;
    }

    public VariableSymbol getLHS() { return lhs; }
    public List<Symbol> getRHS() { return rhs; }
    public int getIndex() { return index; }

    public boolean isEpsilonRule() {
	return rhs.size() == 1 && rhs.get(0).isEpsilon();
    }

    // what replaces the lhs in a sentential form: the rhs, or nothing for epsilon
    public List<Symbol> getSubstitution() {
	if (isEpsilonRule())
	    return Collections.emptyList();
	return rhs;
    }

    // rules are equal if lhs and rhs are the same; index is bookkeeping
    public boolean equals(Object o) {
	if (!(o instanceof CFGRule))
	    return false;
	CFGRule r = (CFGRule)o;
	return lhs.equals(r.lhs) && rhs.equals(r.rhs);
    }

    public int hashCode() {
	return 31*lhs.hashCode()+rhs.hashCode();
    }

    public String toString() {
	StringBuilder sb = new StringBuilder(lhs.toString()).append(" ->");
	for (Symbol s : rhs)
	    sb.append(' ').append(s);
	return sb.toString();
    }
}
