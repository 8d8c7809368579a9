package edu.isi.cfgtrace;

// a (form, matched input length) pair. only used to recognize repeats
final class SearchState {
    private final String key;
    private final int matched;

    SearchState(String key, int matched) {
	this.key = key;
	this.matched = matched;
    }

    public int hashCode() {
	return 31*key.hashCode()+matched;
    }

    public boolean equals(Object o) {
	if (!(o instanceof SearchState))
	    return false;
	SearchState s = (SearchState)o;
	return matched == s.matched && key.equals(s.key);
    }

    public String toString() { return key+":"+matched; }
}
