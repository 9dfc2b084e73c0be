package gpusync.exec;

import java.util.ArrayList;
import java.util.List;

import gpusync.analysis.ThreadSyncException;
import gpusync.hir.PrintTools;
import gpusync.hir.Program;
import gpusync.hir.StorageScope;
import gpusync.hir.Tools;
import gpusync.transforms.ThreadSyncPass;
import gpusync.transforms.TransformPass;

/**
 * <b> ThreadSyncDriver </b> implements the command line parser and runs the
 * thread synchronization pass once per requested storage scope, in the order
 * the scopes are given.
 */
public class ThreadSyncDriver
{
	/** Verbosity levels the passes print at. */
	public static final int MAX_VERBOSITY = 4;

	protected CommandLineOptionSet options;

	public ThreadSyncDriver() {
		options = new CommandLineOptionSet();
		options.add(options.UTILITY, "verbosity", "0", "N",
				"Degree of status messages (0-" + MAX_VERBOSITY + ") that you wish to see (default is 0)");
		options.add("help", "Print this message");
		options.add("usage", "Print this message");
		options.add(options.UTILITY, "printIR",
				"Print the program after the passes ran");
		options.add(options.TRANSFORM, "syncScopes", "shared", "LIST",
				"Comma-separated storage scopes (global, shared, warp, local, with an optional .tag) "
				+ "whose barriers are inserted, in the given order (default is shared)");
		options.add(options.TRANSFORM, "disableThreadSync",
				"Do not insert any barrier");
	}

	public String getOptionValue(String name) {
		return options.getValue(name);
	}

	public void setOptionValue(String name, String value) {
		options.setValue(name, value);
	}

	/**
	 * Parses command line options of the form {@code -name} or
	 * {@code -name=value} and checks their values.
	 *
	 * @throws IllegalArgumentException if an option is unknown or has a
	 *         malformed value.
	 */
	public void parseCommandLine(String[] args) {
		for( String arg : args ) {
			if( !arg.startsWith("-") || arg.length() == 1 ) {
				throw new IllegalArgumentException("unrecognized argument " + arg);
			}
			int eq = arg.indexOf('=');
			String name = (eq == -1) ? arg.substring(1) : arg.substring(1, eq);
			if( !options.contains(name) ) {
				throw new IllegalArgumentException("unrecognized option -" + name);
			}
			if( eq == -1 ) {
				if( options.hasArgument(name) ) {
					throw new IllegalArgumentException("option -" + name + " needs a value");
				}
				options.setValue(name);
			} else {
				if( !options.hasArgument(name) ) {
					throw new IllegalArgumentException("option -" + name + " takes no value");
				}
				options.setValue(name, arg.substring(eq + 1));
			}
		}
		String value = getOptionValue("verbosity");
		int verbosity;
		try {
			verbosity = Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("wrong argument (" + value
					+ ") for verbosity option; argument should be an integer constant.", e);
		}
		if( verbosity < 0 || verbosity > MAX_VERBOSITY ) {
			throw new IllegalArgumentException("wrong argument (" + value
					+ ") for verbosity option; argument should be between 0 and " + MAX_VERBOSITY + ".");
		}
		PrintTools.setVerbosity(verbosity);
		getSyncScopes();
	}

	/**
	 * Returns the storage scopes named by the syncScopes option.
	 *
	 * @throws IllegalArgumentException if a scope name is unknown or empty.
	 */
	public List<StorageScope> getSyncScopes() {
		List<StorageScope> ret = new ArrayList<StorageScope>();
		String value = getOptionValue("syncScopes");
		for( String name : value.split(",") ) {
			if( name.trim().isEmpty() ) {
				throw new IllegalArgumentException("empty storage scope in syncScopes=" + value);
			}
			ret.add(StorageScope.parse(name));
		}
		return ret;
	}

	/**
	 * Prints the list of options that the driver accepts.
	 */
	public void printUsage() {
		String usage = "\ngpusync.exec.ThreadSyncDriver [option]...\n";
		usage += options.getUsage();
		System.err.println(usage);
	}

	/**
	 * Runs the thread synchronization pass for every requested storage scope.
	 */
	public void runPasses(Program program) {
		if( getOptionValue("disableThreadSync") != null ) {
			PrintTools.println("[ThreadSyncDriver] thread synchronization is disabled", 1);
			return;
		}
		for( StorageScope scope : getSyncScopes() ) {
			TransformPass.run(new ThreadSyncPass(program, scope));
		}
	}

	/**
	 * Runs this driver on the program with args as the command line. Errors
	 * are reported and terminate the process.
	 *
	 * @param args The command line options.
	 * @param program The program to rewrite in place.
	 */
	public void run(String[] args, Program program) {
		try {
			parseCommandLine(args);
		} catch (IllegalArgumentException e) {
			printUsage();
			Tools.exit("[ERROR in commandline input parsing] " + e.getMessage());
		}
		if( getOptionValue("help") != null || getOptionValue("usage") != null ) {
			printUsage();
			Tools.exit(0);
		}
		try {
			runPasses(program);
		} catch (ThreadSyncException e) {
			PrintTools.println("Caught error message: " + e + "\n", 1);
			Tools.exit("[ERROR in ThreadSync] " + e.getKind() + ": " + e.getMessage());
		}
		if( getOptionValue("printIR") != null ) {
			PrintTools.printlnStatus("[ThreadSyncDriver]", "Printing...", 1);
			System.out.print(program);
		}
	}
}
