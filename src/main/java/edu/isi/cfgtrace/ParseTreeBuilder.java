package edu.isi.cfgtrace;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a parse tree from the expansion edges of a trace. The builder keeps the
 * frontier of the tree, one node per symbol of the current sentential form;
 * each edge names the frontier position of the variable it expands, so the
 * children always go under exactly the occurrence the derivation rewrote,
 * whichever strategy produced it.
 */
public class ParseTreeBuilder {

    /**
     * @param edges expansion edges in derivation order
     * @param start the start variable, which becomes the root
     * @throws InconsistentEdgesException if an edge does not match a pending
     *         variable occurrence
     */
    public ParseTree build(List<ExpansionEdge> edges, VariableSymbol start) throws InconsistentEdgesException {
	boolean debug = false;
	if (start == null)
	    throw new InconsistentEdgesException("No start symbol");
	ParseTree tree = new ParseTree(start);
	ArrayList<ParseTreeNode> frontier = new ArrayList<ParseTreeNode>();
	frontier.add(tree.getRoot());
	int edgeNum = 0;
	for (ExpansionEdge e : edges) {
	    edgeNum++;
	    int pos = e.getPosition();
	    if (pos < 0 || pos >= frontier.size())
		throw new InconsistentEdgesException("Edge "+edgeNum+" ("+e+") points outside a frontier of "+frontier.size()+" symbols");
	    ParseTreeNode parent = frontier.get(pos);
	    if (!parent.getLabel().equals(e.getParent()))
		throw new InconsistentEdgesException("Edge "+edgeNum+" ("+e+") expects "+e.getParent()+" but frontier has "+parent.getLabel());
	    List<Symbol> kids = e.getChildren();
	    if (kids.isEmpty())
		throw new InconsistentEdgesException("Edge "+edgeNum+" ("+e+") has no children");
	    ArrayList<ParseTreeNode> pending = new ArrayList<ParseTreeNode>();
	    for (Symbol s : kids) {
		if (s.isEpsilon() && kids.size() > 1)
		    throw new InconsistentEdgesException("Edge "+edgeNum+" ("+e+") mixes epsilon with other symbols");
		ParseTreeNode n = tree.newNode(s);
		parent.addChild(n);
		if (!s.isEpsilon())
		    pending.add(n);
	    }
	    frontier.remove(pos);
	    frontier.addAll(pos, pending);
	    if (debug) Debug.debug(debug, "after edge "+edgeNum+": "+tree);
	}
	return tree;
    }
}
