package edu.isi.cfgtrace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A rooted ordered tree of grammar symbols. The tree owns all of its nodes in an
 * arena indexed by node id, which renderers can use as stable node names.
 */
public class ParseTree {
    private final ArrayList<ParseTreeNode> nodes = new ArrayList<ParseTreeNode>();
    private final ParseTreeNode root;

    ParseTree(VariableSymbol start) {
	root = newNode(start);
    }

    ParseTreeNode newNode(Symbol label) {
	ParseTreeNode n = new ParseTreeNode(nodes.size(), label);
	nodes.add(n);
	return n;
    }

    public ParseTreeNode getRoot() { return root; }
    public int getNumNodes() { return nodes.size(); }
    public ParseTreeNode getNode(int id) { return nodes.get(id); }
    /** every node, in creation order */
    public List<ParseTreeNode> getNodes() { return Collections.unmodifiableList(nodes); }

    /** leaf nodes left to right, epsilon leaves included */
    public List<ParseTreeNode> getLeaves() {
	ArrayList<ParseTreeNode> ret = new ArrayList<ParseTreeNode>();
	collectLeaves(root, ret);
	return ret;
    }
    private static void collectLeaves(ParseTreeNode n, List<ParseTreeNode> acc) {
	if (n.isLeaf()) {
	    acc.add(n);
	    return;
	}
	for (ParseTreeNode c : n.getChildren())
	    collectLeaves(c, acc);
    }

    public int getDepth() {
	return depth(root);
    }
    private static int depth(ParseTreeNode n) {
	int d = 0;
	for (ParseTreeNode c : n.getChildren())
	    d = Math.max(d, depth(c));
	return d+1;
    }

    public String toYield() { return root.toYield(); }

    public String toString() { return root.toString(); }
}
