package edu.isi.remora;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.util.Date;
// diagnostics. everything goes to stderr; nothing here ever stops the process
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

	// number of errors reported since startup (or the last reset)
	private static int errors = 0;
	public static int getErrorCount() { return errors; }
	public static void resetErrorCount() { errors = 0; }

	// stuff we always print to stderr
	public static void prettyDebug(String s) {
		write(s);
	}

	// library-level failure that doesn't stop anything. the caller is expected to
	// check the returned value (usually a NOWEIGHT)
	public static void error(String s) {
		errors++;
		write("Error: "+caller(new Throwable().getStackTrace())+" : "+s);
	}

	// true debugging stuff
	public static void debug(boolean d, String s)  {
		if (d)
			debug(0, caller(new Throwable().getStackTrace()), s);
	}
	public static void debug(boolean d, int i, String s) {
		if (d)
			debug(i, caller(new Throwable().getStackTrace()), s);
	}
	private static void debug(int i, String caller, String s) {
		StringBuffer sb = new StringBuffer();
		for (int x = 0; x < i; x++)
			sb.append(' ');
		sb.append(caller+" : "+s);
		write(sb.toString());
	}

	private static String caller(StackTraceElement[] trace) {
		if (trace.length < 2)
			return "?";
		String cls = trace[1].getClassName();
		return cls.substring(cls.lastIndexOf('.')+1)+":"+trace[1].getMethodName();
	}

	private static synchronized void write(String s) {
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

	private static int dblevel=0;
	public static void setDbLevel(int i) {
		dblevel = i;
	}
	// print elapsed time since start if the global level is at least needlevel
	public static void dbtime(int needlevel, Date start, String msg) {
		if (dblevel < needlevel)
			return;
		long x = new Date().getTime() - start.getTime();
		write(msg+": "+x+" ms");
	}
}
