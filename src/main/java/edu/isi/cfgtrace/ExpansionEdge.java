package edu.isi.cfgtrace;

import java.util.Collections;
import java.util.List;
import java.util.Vector;

// parent variable -> the children one substitution gave it, plus where in the
// sentential form the parent stood. an epsilon substitution has the child [epsilon]
public final class ExpansionEdge {
    private final int position;
    private final VariableSymbol parent;
    private final List<Symbol> children;

    public ExpansionEdge(int position, VariableSymbol parent, List<? extends Symbol> children) {
	this.position = position;
	this.parent = parent;
	this.children = Collections.unmodifiableList(new Vector<Symbol>(children));
    }

    public int getPosition() { return position; }
    public VariableSymbol getParent() { return parent; }
    public List<Symbol> getChildren() { return children; }

    public boolean equals(Object o) {
	if (!(o instanceof ExpansionEdge))
	    return false;
	ExpansionEdge e = (ExpansionEdge)o;
	return position == e.position && parent.equals(e.parent) && children.equals(e.children);
    }

    public int hashCode() {
	return (parent.hashCode()*31+children.hashCode())*31+position;
    }

    public String toString() {
	return parent+" -> "+SententialForm.render(children)+" @"+position;
    }
}
