package edu.isi.cfgtrace;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.Date;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line options, etc.
public class CFGTrace {
    // version number. change this when updating cfgtrace!
    static final String VERSION = "1.0";

    // exit statuses
    static final int OK = 0;
    static final int BAD_CONFIG = 1;
    static final int ABORTED = 2;

    // create a summary of a grammar and add it to a buffer
    private static void getGrammarCheck(StringBuilder buffer, String name, CFGRuleSet rs) {
	buffer.append("CFG info for "+name+":\n");
	buffer.append("\t"+rs.getNumStates()+" variables\n");
	buffer.append("\t"+rs.getNumTerminals()+" terminals\n");
	buffer.append("\t"+rs.getNumRules()+" productions\n");
	buffer.append("\tstart symbol "+rs.getStartState()+"\n");
    }

    // everything having to do with the JSAP parameters and config exceptions based on this.
    // Sets the jsap object
    private static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

	// HELP OPTION
	Switch helpsw = new Switch("help",
		'h',
		"help",
	"print this help message");
	jsap.registerParameter(helpsw);

	// format of the input (and output data) - assumed utf-8 but can be changed here
	FlaggedOption encodingopt = new FlaggedOption("encoding",
		StringStringParser.getParser(),
		"utf-8",
		true,
		'e',
		"encoding",
		"encoding of input and output files, if other than utf-8. Use the same "+
	"naming you would use if specifying this charset in a java program");
	jsap.registerParameter(encodingopt);

	// OPTIONS REGARDING THE SEARCH

	Switch leftsw = new Switch("left",
		'l',
		"left",
	"leftmost derivation: always expand the first remaining variable. This is the default");
	jsap.registerParameter(leftsw);

	Switch rightsw = new Switch("right",
		'r',
		"right",
	"rightmost derivation: always expand the last remaining variable");
	jsap.registerParameter(rightsw);

	FlaggedOption budgetopt = new FlaggedOption("budget",
		IntegerStringParser.getParser(),
		""+DerivationSearch.DEFAULT_BUDGET,
		true,
		'b',
		"budget",
		"give up on a string after exploring this many search states. 0 or less means no limit; "+
		"a search still gives up once a derivation reaches "+DerivationSearch.MAX_DEPTH+" steps");
	jsap.registerParameter(budgetopt);

	// OPTIONS REGARDING THE OUTPUT

	Switch treesw = new Switch("tree",
		't',
		"tree",
	"print the parse tree of each derivable string");
	jsap.registerParameter(treesw);

	Switch dotsw = new Switch("dot",
		'd',
		"dot",
	"print graphviz dot text for the parse tree and the derivation of each derivable string");
	jsap.registerParameter(dotsw);

	Switch csw = new Switch("check",
		'c',
		"check",
	"print the number of variables, terminals and productions, then the grammar itself");
	jsap.registerParameter(csw);

	// how long things take, if at least this level
	FlaggedOption timeopt = new FlaggedOption("time",
		IntegerStringParser.getParser(),
		null,
		false,
		JSAP.NO_SHORTFLAG,
		"time",
	"report timing to stderr: 1 for grammar reading, 2 for each search as well");
	jsap.registerParameter(timeopt);

	// output file - if specified, whatever is written is written here. otherwise to stdout
	FlaggedOption outfileopt =
	    new FlaggedOption("outfile",
		    FileStringParser.getParser(),
		    null,
		    false,
		    'o',
		    "outputfile",
		    "file to write derivations, trees, and summaries. If absent, writing is done "+
	    "to stdout");
	jsap.registerParameter(outfileopt);

	UnflaggedOption grammaropt = new UnflaggedOption("grammar",
		FileStringParser.getParser(),
		null,
		true,
		false,
		"grammar file in VARIABLES/TERMINALS/PRODUCTIONS/START format. The special name '-' "+
	"(no quote) reads the grammar from STDIN");
	jsap.registerParameter(grammaropt);

	UnflaggedOption stringsopt = new UnflaggedOption("strings",
		StringStringParser.getParser(),
		null,
		false,
		true,
	"strings to derive. Pass \"\" for the empty string");
	jsap.registerParameter(stringsopt);

	JSAPResult config = jsap.parse(argv);
	if (!config.success() || config.getBoolean("help"))
	    return config;

	// make sure both left and right aren't set
	if (config.getBoolean("left") && config.getBoolean("right"))
	    throw new ConfigureException("Can't ask for both leftmost and rightmost derivation (-l and -r)!");

	// there has to be something to do
	String[] strings = config.getStringArray("strings");
	if ((strings == null || strings.length == 0) && !config.getBoolean("check"))
	    throw new ConfigureException("No strings to derive and no -c; nothing to do");

	if ((config.getBoolean("tree") || config.getBoolean("dot")) && (strings == null || strings.length == 0))
	    throw new ConfigureException("-t and -d need at least one string to derive");

	return config;
    }

    /** run with the given arguments, writing results to out unless -o says otherwise */
    static int run(String argv[], Writer out) throws IOException {
	boolean debug = false;
	JSAP jsap = new JSAP();
	JSAPResult config = null;

	// 1) Set up all parameters. Die on bad combinations.
	try {
	    config = processParameters(jsap, argv);
	}
	catch (JSAPException e) {
	    Debug.prettyDebug("cfgtrace options improperly configured: "+e.getMessage());
	    Debug.prettyDebug("Try 'cfgtrace -h' for a detailed help message");
	    return BAD_CONFIG;
	}
	catch (ConfigureException e) {
	    Debug.prettyDebug("cfgtrace options improperly configured: "+e.getMessage());
	    Debug.prettyDebug("Try 'cfgtrace -h' for a detailed help message");
	    return BAD_CONFIG;
	}

	if (config.getBoolean("help")) {
	    Debug.prettyDebug("Usage: cfgtrace ");
	    Debug.prettyDebug("             "+jsap.getUsage());
	    Debug.prettyDebug("");
	    Debug.prettyDebug(jsap.getHelp());
	    return OK;
	}

	if (!config.success()) {
	    for (java.util.Iterator errs = config.getErrorMessageIterator();
	    errs.hasNext();) {
		Debug.prettyDebug("Error: " + errs.next());
	    }
	    Debug.prettyDebug("Usage: cfgtrace ");
	    Debug.prettyDebug("             "+jsap.getUsage());
	    return BAD_CONFIG;
	}

	String encoding = config.getString("encoding");
	Debug.setEncoding(encoding);
	if (config.contains("time"))
	    Debug.setDbLevel(config.getInt("time"));
	SearchStrategy strategy = config.getBoolean("right") ? SearchStrategy.RIGHTMOST : SearchStrategy.LEFTMOST;
	int budget = config.getInt("budget");
	File grammarFile = config.getFile("grammar");
	File outfile = config.getFile("outfile");
	String[] strings = config.getStringArray("strings");

	// 2) Read the grammar
	CFGRuleSet rs = null;
	try {
	    if (grammarFile.getName().equals("-")) {
		if (debug) Debug.debug(debug, "Reading grammar from stdin");
		rs = GrammarReader.read(new BufferedReader(new InputStreamReader(System.in, encoding)));
	    }
	    else {
		if (debug) Debug.debug(debug, "Reading grammar from "+grammarFile.getName());
		rs = GrammarReader.read(grammarFile.getPath(), encoding);
	    }
	}
	catch (FileNotFoundException e) {
	    Debug.prettyDebug("Grammar file "+grammarFile+" not found");
	    return BAD_CONFIG;
	}
	catch (DataFormatException e) {
	    Debug.prettyDebug("Bad grammar in "+grammarFile+": "+e.getMessage());
	    return BAD_CONFIG;
	}
	catch (IncompleteGrammarException e) {
	    Debug.prettyDebug("Bad grammar in "+grammarFile+": "+e.getMessage());
	    return BAD_CONFIG;
	}

	// 3) Do the work, writing as we go
	Writer w = out;
	if (outfile != null)
	    w = new OutputStreamWriter(new FileOutputStream(outfile), encoding);
	try {
	    return process(rs, grammarFile.getName(), strings, strategy, budget, config, w);
	}
	finally {
	    if (outfile != null)
		w.close();
	    else
		w.flush();
	}
    }

    private static int process(CFGRuleSet rs, String name, String[] strings, SearchStrategy strategy, int budget,
	    JSAPResult config, Writer w) throws IOException {
	int status = OK;
	if (config.getBoolean("check")) {
	    StringBuilder sb = new StringBuilder();
	    getGrammarCheck(sb, name, rs);
	    w.write(sb.toString());
	    w.write(rs.toString());
	}
	if (strings == null)
	    return status;
	DerivationTracer tracer = new DerivationTracer(budget);
	for (String target : strings) {
	    Derivation d = null;
	    try {
		d = tracer.trace(rs, target, strategy);
	    }
	    catch (IncompleteGrammarException e) {
		// the reader only hands out sealed grammars
		throw new IllegalStateException(e);
	    }
	    catch (BudgetExceededException e) {
		w.write("Could not decide '"+target+"': "+e.getMessage()+"\n");
		status = ABORTED;
		continue;
	    }
	    if (d == null) {
		w.write("String '"+target+"' is not in the language of this grammar.\n");
		continue;
	    }
	    w.write(strategy.getLabel()+" derivation of '"+target+"':\n");
	    w.write(d.toString());
	    if (config.getBoolean("tree") || config.getBoolean("dot")) {
		ParseTree tree = null;
		try {
		    tree = d.getParseTree();
		}
		catch (InconsistentEdgesException e) {
		    // bug in the tracer; report it and go on with the next string
		    Debug.prettyDebug("Internal error building tree for '"+target+"': "+e.getMessage());
		    continue;
		}
		if (config.getBoolean("tree"))
		    w.write("Parse tree: "+tree+"\n");
		if (config.getBoolean("dot")) {
		    w.write(DotWriter.treeToDot(tree));
		    w.write(DotWriter.derivationToDot(d));
		}
	    }
	}
	return status;
    }

    public static void main(String argv[]) throws Exception {
	Debug.prettyDebug("This is cfgtrace, version "+VERSION);
	Date startTime = new Date();
	OutputStreamWriter out = new OutputStreamWriter(System.out, "utf-8");
	int status = run(argv, out);
	Debug.dbtime(1, startTime, "total");
	System.exit(status);
    }
}
