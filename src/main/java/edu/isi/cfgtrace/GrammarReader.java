package edu.isi.cfgtrace;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the sectioned grammar format:
 * <pre>
 * VARIABLES
 * S
 * TERMINALS
 * a
 * b
 * PRODUCTIONS
 * S -&gt; a S b | epsilon
 * START
 * S
 * </pre>
 * One symbol per line in VARIABLES, TERMINALS and START; one head per line in
 * PRODUCTIONS, alternatives separated by <code>|</code>, symbols by whitespace.
 * An empty alternative means epsilon. Lines starting with <code>#</code> and
 * blank lines are ignored. The first bad line aborts the read, so a grammar is
 * only ever returned whole, and sealed.
 */
public class GrammarReader {

    public static final String VARIABLES = "VARIABLES";
    public static final String TERMINALS = "TERMINALS";
    public static final String PRODUCTIONS = "PRODUCTIONS";
    public static final String START = "START";

    private enum Section { NONE, VARIABLES, TERMINALS, PRODUCTIONS, START }

    // empty spaces or comments
    private static Pattern commentPat = Pattern.compile("\\s*(#.*)?");
    // head, arrow, alternatives
    private static Pattern sidesPat = Pattern.compile("\\s*(\\S+)\\s*->(.*)");
    private static Pattern altSplitPat = Pattern.compile("\\|");
    private static Pattern spacePat = Pattern.compile("\\s+");

    public static CFGRuleSet read(String filename, String encoding)
	throws FileNotFoundException, IOException, DataFormatException, IncompleteGrammarException {
	try (BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(filename), encoding))) {
	    return read(br);
	}
    }

    public static CFGRuleSet read(BufferedReader br) throws IOException, DataFormatException, IncompleteGrammarException {
	boolean debug = false;
	Date readTime = new Date();
	CFGRuleSet rs = new CFGRuleSet();
	Section section = Section.NONE;
	String line;
	int lineno = 0;
	while ((line = br.readLine()) != null) {
	    lineno++;
	    if (commentPat.matcher(line).matches()) {
		if (debug) Debug.debug(debug, "Ignoring comment/whitespace: "+line);
		continue;
	    }
	    String text = line.trim();
	    Section header = header(text);
	    if (header != null) {
		section = header;
		continue;
	    }
	    try {
		switch (section) {
		case VARIABLES:
		    rs.addVariable(text);
		    break;
		case TERMINALS:
		    rs.addTerminal(text);
		    break;
		case PRODUCTIONS:
		    readProductions(rs, text);
		    break;
		case START:
		    rs.setStart(text);
		    break;
		default:
		    throw new DataFormatException("\""+text+"\" appears before any section header");
		}
	    }
	    catch (GrammarException e) {
		throw new DataFormatException("Line "+lineno+": "+e.getMessage(), e);
	    }
	    catch (DataFormatException e) {
		throw new DataFormatException("Line "+lineno+": "+e.getMessage(), e);
	    }
	}
	rs.seal();
	Debug.dbtime(1, readTime, "read grammar of "+rs.getNumRules()+" productions");
	return rs;
    }

    private static Section header(String text) {
	if (text.equals(VARIABLES))
	    return Section.VARIABLES;
	if (text.equals(TERMINALS))
	    return Section.TERMINALS;
	if (text.equals(PRODUCTIONS))
	    return Section.PRODUCTIONS;
	if (text.equals(START))
	    return Section.START;
	return null;
    }

    // one line of alternatives for a head. the whole line is checked before any rule is added
    private static void readProductions(CFGRuleSet rs, String text) throws GrammarException, DataFormatException {
	boolean debug = false;
	Matcher sidesMatch = sidesPat.matcher(text);
	if (!sidesMatch.matches() || sidesMatch.group(2).contains("->"))
	    throw new DataFormatException("Incorrect production format: "+text);
	String head = sidesMatch.group(1);
	ArrayList<List<String>> bodies = new ArrayList<List<String>>();
	for (String alt : altSplitPat.split(sidesMatch.group(2), -1)) {
	    String trimmed = alt.trim();
	    ArrayList<String> toks = new ArrayList<String>();
	    if (trimmed.length() == 0)
		toks.add(SymbolFactory.EPSILON_TOKEN);
	    else {
		for (String t : spacePat.split(trimmed))
		    toks.add(t);
	    }
	    bodies.add(toks);
	}
	// validate every alternative first so a bad line adds nothing
	VariableSymbol lhs = SymbolFactory.getVariable(head);
	if (!rs.getVariables().contains(lhs))
	    throw new UnknownHeadException("Production head "+head+" is not a declared variable");
	for (List<String> toks : bodies) {
	    for (String t : toks)
		SymbolClassifier.classify(rs, t);
	    if (toks.size() > 1 && toks.contains(SymbolFactory.EPSILON_TOKEN))
		throw new InvalidSymbolException(SymbolFactory.EPSILON_TOKEN+" may not be mixed with other symbols in "+text);
	}
	for (List<String> toks : bodies) {
	    CFGRule r = rs.addProduction(head, toks);
	    if (debug) Debug.debug(debug, "Made rule "+r);
	}
    }
}
