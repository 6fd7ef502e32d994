package edu.isi.wfst;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;

// logging for the library. everything goes to stderr through a single writer
public class Debug {

	static String encoding = "utf-8";
	public static void setEncoding(String s) {
		encoding = s;
		initializeStream();
	}

	private static OutputStreamWriter w=null;
	private static void initializeStream() {
		try {
			w = new OutputStreamWriter(System.err, encoding);
		}
		catch (UnsupportedEncodingException e) {
			System.err.println("Warning: encoding "+encoding+" not supported; using default");
			w = new OutputStreamWriter(System.err);
		}
	}

	// stuff we always print to stderr
	public static void prettyDebug(String s) {
		if (w == null)
			initializeStream();
		try {
			w.write(s+"\n");
			w.flush();
		}
		catch (IOException e) {
			System.err.println("IOException while trying to print "+s);
		}
	}
	// true debugging stuff. caller is found from the stack
	public static void debug(boolean d, String s)  {
		if (!d)
			return;
		StackTraceElement caller = new Throwable().getStackTrace()[1];
		debug(0, caller.getClassName()+":"+caller.getMethodName(), s);
	}
	public static void debug(boolean d, int i, String s) {
		if (!d)
			return;
		StackTraceElement caller = new Throwable().getStackTrace()[1];
		debug(i, caller.getClassName()+":"+caller.getMethodName(), s);
	}
	private static void debug(int i, String caller, String s) {
		if (w == null)
			initializeStream();
		try {
			for (int x = 0; x < i; x++)
				w.write(" ");
			w.write(caller+" : "+s+"\n");
			w.flush();
		}
		catch (IOException e) {
			System.err.println("IOException while trying to print "+s);
		}
	}
	private static int dblevel=0;
	public static void setDbLevel(int i) {
		dblevel = i;
	}
	public static int getDbLevel() {
		return dblevel;
	}

	// print elapsed time since start (ms from System.currentTimeMillis) if the global level is high enough
	public static void dbtime(int needlevel, long start, String msg) {
		if (dblevel < needlevel)
			return;
		if (w == null)
			initializeStream();
		long x = System.currentTimeMillis() - start;
		try {
			w.write(msg+": "+x+" ms\n");
			w.flush();
		}
		catch (IOException e) {
			System.err.println("IOException while trying to print "+msg);
		}
	}

}
