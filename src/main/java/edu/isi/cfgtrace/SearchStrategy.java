package edu.isi.cfgtrace;

// which variable occurrence of a sentential form gets expanded next.
// this is the only thing that differs between leftmost and rightmost search
public enum SearchStrategy { LEFTMOST("left"), RIGHTMOST("right");
    private final String shortName;
    SearchStrategy(String shortName) {
	this.shortName = shortName;
    }
    public String getShortName() { return shortName; }

    private static final String list;
    public static final String getList() { return list;}
    static {
	StringBuilder sb = new StringBuilder();
	for (SearchStrategy x: SearchStrategy.values()) {
	    sb.append(x.shortName+" ");
	}
	list = sb.toString().trim();
    }
    public static SearchStrategy get(String s) throws ConfigureException {
	for (SearchStrategy x : SearchStrategy.values()) {
	    if (x.shortName.equals(s) || x.toString().equals(s))
		return x;
	}
	throw new ConfigureException("Invalid strategy ("+s+"); valid values are "+list);
    }

    /** position to expand in f, or -1 if f holds no variable */
    public int pickPosition(SententialForm f) {
	if (this == LEFTMOST)
	    return f.firstVariable();
	return f.lastVariable();
    }

    // "Leftmost", "Rightmost"
    public String getLabel() {
	return Character.toUpperCase(shortName.charAt(0))+shortName.substring(1)+"most";
    }
}
