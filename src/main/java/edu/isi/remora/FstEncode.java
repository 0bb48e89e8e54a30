package edu.isi.remora;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Date;
import java.util.Iterator;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line: encodes transducer labels and/or weights, or decodes them again
//   fstencode in.fst codex [out.fst]
public class FstEncode {
	// version number. change this when updating remora!
	static final String VERSION = "1.0";
	static final String NAME = "fstencode";

	// everything having to do with the JSAP parameters
	private static void registerParameters(JSAP jsap) throws JSAPException {

		Switch helpsw = new Switch("help",
				'h',
				"help",
				"print this help message");
		jsap.registerParameter(helpsw);

		// WHAT TO ENCODE
		Switch labelsw = new Switch("encode_labels",
				JSAP.NO_SHORTFLAG,
				"encode_labels",
				"encode output labels along with input labels");
		jsap.registerParameter(labelsw);

		Switch weightsw = new Switch("encode_weights",
				JSAP.NO_SHORTFLAG,
				"encode_weights",
				"encode weights");
		jsap.registerParameter(weightsw);

		Switch reusesw = new Switch("encode_reuse",
				JSAP.NO_SHORTFLAG,
				"encode_reuse",
				"extend the existing codex instead of starting a new one. The codex must have been "+
				"built with the same --encode_labels/--encode_weights settings. Ignored with --decode");
		jsap.registerParameter(reusesw);

		Switch decodesw = new Switch("decode",
				JSAP.NO_SHORTFLAG,
				"decode",
				"decode labels and/or weights using the codex; encoding flags are taken from the codex");
		jsap.registerParameter(decodesw);

		// WEIGHT TEXT FORMAT
		FlaggedOption sepopt = new FlaggedOption("weight_separator",
				StringStringParser.getParser(),
				String.valueOf(CompositeWeightConfig.DEFAULT_SEPARATOR),
				true,
				JSAP.NO_SHORTFLAG,
				"weight_separator",
				"character separating the elements of composite weights");
		jsap.registerParameter(sepopt);

		FlaggedOption parenopt = new FlaggedOption("weight_parentheses",
				StringStringParser.getParser(),
				JSAP.NO_DEFAULT,
				false,
				JSAP.NO_SHORTFLAG,
				"weight_parentheses",
				"two characters, open and close, wrapped around composite weights so they "+
				"can nest. Absent means no parentheses");
		jsap.registerParameter(parenopt);

		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				JSAP.NO_DEFAULT,
				false,
				JSAP.NO_SHORTFLAG,
				"time",
				"print timing information to stderr for steps at or below level <time>");
		jsap.registerParameter(timeopt);

		UnflaggedOption argsopt = new UnflaggedOption("files",
				StringStringParser.getParser(),
				JSAP.NO_DEFAULT,
				false,
				true,
				"in.fst codex [out.fst]. in.fst may be '-' to read from STDIN; without out.fst "+
				"the result is written to STDOUT");
		jsap.registerParameter(argsopt);
	}

	private static void usage(JSAP jsap) {
		Debug.prettyDebug("Encodes transducer labels and/or weights.");
		Debug.prettyDebug("");
		Debug.prettyDebug("  Usage: "+NAME+" in.fst codex [out.fst]");
		Debug.prettyDebug("             "+jsap.getUsage());
	}

	// returns the process exit status
	public static int run(String[] argv, InputStream stdin, OutputStream stdout) {
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		CompositeWeightConfig weightConfig = null;
		String[] files = null;
		try {
			registerParameters(jsap);
			config = jsap.parse(argv);
		}
		catch (JSAPException e) {
			System.err.println(NAME+" options improperly configured: "+e.getMessage());
			return 1;
		}

		if (config.getBoolean("help")) {
			Debug.prettyDebug("This is "+NAME+", version "+VERSION);
			usage(jsap);
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			return 0;
		}

		if (!config.success()) {
			for (Iterator<?> errs = config.getErrorMessageIterator(); errs.hasNext();)
				Debug.prettyDebug("Error: "+errs.next());
			usage(jsap);
			return 1;
		}

		files = config.contains("files") ? config.getStringArray("files") : new String[0];
		if (files.length < 2 || files.length > 3) {
			usage(jsap);
			return 1;
		}

		try {
			weightConfig = CompositeWeightConfig.parse(config.getString("weight_separator"),
					config.getString("weight_parentheses"));
		}
		catch (ConfigureException e) {
			System.err.println(NAME+" options improperly configured: "+e.getMessage());
			System.err.println("Try '"+NAME+" -h' for a detailed help message");
			return 1;
		}
		if (config.contains("time"))
			Debug.setDbLevel(config.getInt("time"));

		String inName = files[0];
		File codex = new File(files[1]);
		String outName = files.length > 2 ? files[2] : null;

		try {
			Date readTime = new Date();
			VectorFst<? extends Weight> fst = readFst(inName, stdin, weightConfig);
			Debug.dbtime(1, readTime, "read transducer");

			Date codeTime = new Date();
			if (config.getBoolean("decode"))
				Encoder.decode(fst, codex);
			else
				Encoder.encode(fst,
						EncodeMapper.getFlags(config.getBoolean("encode_labels"), config.getBoolean("encode_weights")),
						config.getBoolean("encode_reuse"),
						codex);
			Debug.dbtime(1, codeTime, config.getBoolean("decode") ? "decode" : "encode");

			Date writeTime = new Date();
			writeFst(fst, outName, stdout);
			Debug.dbtime(1, writeTime, "write transducer");
		}
		catch (ConfigureException e) {
			System.err.println(NAME+" options improperly configured: "+e.getMessage());
			return 1;
		}
		catch (FileNotFoundException e) {
			System.err.println("File not found: "+e.getMessage());
			return 1;
		}
		catch (DataFormatException e) {
			System.err.println("Syntax error while reading transducer or codex: "+e.getMessage());
			return 1;
		}
		catch (UnusualConditionException e) {
			System.err.println("Couldn't decode: "+e.getMessage());
			return 1;
		}
		catch (IOException e) {
			System.err.println("Problem processing transducer or codex: "+e.getMessage());
			return 1;
		}
		return 0;
	}

	private static VectorFst<? extends Weight> readFst(String name, InputStream stdin, CompositeWeightConfig config)
	throws IOException, DataFormatException {
		if (name.equals("-"))
			return VectorFst.read(new BufferedInputStream(stdin), config);
		InputStream is = new BufferedInputStream(new FileInputStream(name));
		try {
			return VectorFst.read(is, config);
		}
		finally {
			is.close();
		}
	}

	private static void writeFst(VectorFst<? extends Weight> fst, String name, OutputStream stdout) throws IOException {
		if (name == null) {
			fst.write(stdout);
			stdout.flush();
			return;
		}
		OutputStream os = new BufferedOutputStream(new FileOutputStream(name));
		try {
			fst.write(os);
		}
		finally {
			os.close();
		}
	}

	public static void main(String argv[]) {
		System.exit(run(argv, System.in, System.out));
	}
}
