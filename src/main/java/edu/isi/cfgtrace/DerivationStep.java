package edu.isi.cfgtrace;

import java.util.List;

/**
 * Immutable snapshot of a sentential form within a derivation, with the
 * substitution that produced it. The first step of a derivation is the bare
 * start symbol and has no expanded variable.
 */
public final class DerivationStep {
    private final List<Symbol> form;
    private final CFGRule rule;
    private final int position;

    DerivationStep(List<Symbol> form, CFGRule rule, int position) {
	this.form = form;
	this.rule = rule;
	this.position = position;
    }

    public List<Symbol> getForm() { return form; }
    /** the variable whose expansion produced this form, or null for the first step */
    public VariableSymbol getExpanded() { return rule == null ? null : rule.getLHS(); }
    public CFGRule getRule() { return rule; }
    /** where in the previous form the expansion happened; -1 for the first step */
    public int getPosition() { return position; }

    public String getYield() {
	StringBuilder sb = new StringBuilder();
	for (Symbol s : form)
	    if (s.isTerminal())
		sb.append(s);
	return sb.toString();
    }

    public boolean equals(Object o) {
	if (!(o instanceof DerivationStep))
	    return false;
	DerivationStep d = (DerivationStep)o;
	return position == d.position && form.equals(d.form)
	    && (rule == null ? d.rule == null : rule.equals(d.rule));
    }

    public int hashCode() {
	return form.hashCode()*31+position;
    }

    // "a S b"; the empty form is ""
    public String toString() {
	return SententialForm.render(form);
    }
}
