package edu.isi.cfgtrace;

import java.util.Collections;
import java.util.List;
import java.util.Vector;

/** One node of a {@link ParseTree}. Children belong to exactly one parent. */
public class ParseTreeNode {

    // position in the owning tree's node arena, in creation order
    private final int id;
    private final Symbol label;
    private final Vector<ParseTreeNode> children;

    ParseTreeNode(int id, Symbol label) {
	this.id = id;
	this.label = label;
	this.children = new Vector<ParseTreeNode>();
    }

    public int getId() { return id; }
    public Symbol getLabel() { return label; }
    public List<ParseTreeNode> getChildren() { return Collections.unmodifiableList(children); }
    public boolean isLeaf() { return children.isEmpty(); }

    void addChild(ParseTreeNode n) {
	children.add(n);
    }

    // leaf symbols left to right; epsilon leaves contribute nothing
    public String toYield() {
	if (isLeaf())
	    return label.isTerminal() ? label.toString() : "";
	StringBuilder sb = new StringBuilder();
	for (ParseTreeNode c : children)
	    sb.append(c.toYield());
	return sb.toString();
    }

    // S(a S(epsilon) b)
    public String toString() {
	StringBuilder ret = new StringBuilder(label.toString());
	if (!children.isEmpty()) {
	    ret.append("("+children.get(0).toString());
	    for (int i = 1; i < children.size(); i++) {
		ret.append(" "+children.get(i).toString());
	    }
	    ret.append(")");
	}
	return ret.toString();
    }
}
