package edu.isi.cfgtrace;

import java.util.List;

// graphviz dot text for parse trees and derivation chains. turning dot into
// pictures is left to graphviz itself
public class DotWriter {

    public static String treeToDot(ParseTree tree) {
	StringBuilder sb = new StringBuilder();
	sb.append("digraph ParseTree {\n");
	sb.append("  rankdir=TB;\n");
	for (ParseTreeNode n : tree.getNodes()) {
	    sb.append("  node").append(n.getId()).append(" [label=\"").append(label(n.getLabel())).append("\", ");
	    if (n.getLabel().isVariable())
		sb.append("shape=circle, style=filled, fillcolor=lightblue");
	    else
		sb.append("shape=box, style=filled, fillcolor=lightgrey");
	    sb.append("];\n");
	}
	for (ParseTreeNode n : tree.getNodes()) {
	    for (ParseTreeNode c : n.getChildren())
		sb.append("  node").append(n.getId()).append(" -> node").append(c.getId()).append(";\n");
	}
	sb.append("}\n");
	return sb.toString();
    }

    public static String derivationToDot(Derivation d) {
	List<DerivationStep> steps = d.getSteps();
	StringBuilder sb = new StringBuilder();
	sb.append("digraph ").append(d.getStrategy().getLabel()).append("Derivation {\n");
	sb.append("  rankdir=TB;\n");
	for (int i = 0; i < steps.size(); i++) {
	    String form = steps.get(i).toString();
	    sb.append("  step").append(i).append(" [label=\"").append(escape(form.length() == 0 ? "ε" : form)).append("\", shape=box");
	    if (i == 0)
		sb.append(", style=filled, fillcolor=lightblue");
	    else if (i == steps.size()-1)
		sb.append(", style=filled, fillcolor=lightgreen");
	    sb.append("];\n");
	    if (i > 0)
		sb.append("  step").append(i-1).append(" -> step").append(i).append(" [label=\"Step ").append(i).append("\"];\n");
	}
	sb.append("}\n");
	return sb.toString();
    }

    private static String label(Symbol s) {
	if (s.isEpsilon())
	    return "ε";
	return escape(s.toString());
    }

    private static String escape(String s) {
	return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
