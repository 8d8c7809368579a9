package edu.isi.cfgtrace;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.util.Date;
// diagnostics to stderr. results never go through here; the cli writes those itself
public class Debug {

    static String encoding = "utf-8";
    public static void setEncoding(String s) {
	encoding = s;
	initializeStream();
    }

    private static OutputStreamWriter w=null;
    private static synchronized void initializeStream() {
	try {
	    w = new OutputStreamWriter(System.err, encoding);
	}
	catch (UnsupportedEncodingException e) {
	    System.err.println("Warning: encoding "+encoding+" not supported; using default");
	    w = new OutputStreamWriter(System.err);
	}
    }

    private static synchronized void write(String s) {
	if (w == null)
	    initializeStream();
	try {
	    w.write(s);
	    w.flush();
	}
	catch (IOException e) {
	    System.err.println("IOException while trying to print "+s);
	}
    }

    // stuff we always print to stderr
    public static void prettyDebug(String s) {
	write(s+"\n");
    }

    // true debugging stuff. caller is tagged as class:method
    public static void debug(boolean d, String s)  {
	if (d)
	    debug(0, caller(), s);
    }
    public static void debug(boolean d, int i, String s) {
	if (d)
	    debug(i, caller(), s);
    }
    private static void debug(int i, String caller, String s) {
	StringBuilder sb = new StringBuilder();
	for (int x = 0; x < i; x++)
	    sb.append(' ');
	sb.append(caller).append(" : ").append(s).append('\n');
	write(sb.toString());
    }
    private static String caller() {
	StackTraceElement e = new Throwable().getStackTrace()[2];
	return e.getClassName()+":"+e.getMethodName();
    }

    private static int dblevel=0;
    public static void setDbLevel(int i) {
	dblevel = i;
    }

    // print time debug info if the global level is at least needlevel
    public static void dbtime(int needlevel, Date pta, String msg) {
	if (dblevel < needlevel)
	    return;
	long x = new Date().getTime() - pta.getTime();
	write(msg+": "+x+" ms\n");
    }
}
