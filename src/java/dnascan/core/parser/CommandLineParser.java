package dnascan.core.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.apache.commons.lang3.StringUtils;

/**
 * Command line parser for flag / value pairs
 * Every flag takes exactly one value; boolean flags take true or false. List flags take a comma separated value.
 */
public final class CommandLineParser {

	/**
	 * Value types a flag can take
	 */
	private enum ArgType {
		STRING("String"),
		STRING_LIST("comma separated list"),
		INT("int"),
		DOUBLE("double"),
		BOOLEAN("boolean");

		private final String label;

		private ArgType(String typeLabel) {
			label = typeLabel;
		}

		@Override
		public String toString() {
			return label;
		}
	}

	private boolean isParsed;
	private List<String> programDescription;
	private Map<String, ArgType> argTypes;
	private Map<String, String> argDescriptions;
	private Map<String, Object> argDefaults;
	private Set<String> requiredArgs;
	private Map<String, String> commandLineValues;

	public CommandLineParser() {
		isParsed = false;
		programDescription = new ArrayList<String>();
		argTypes = new HashMap<String, ArgType>();
		argDescriptions = new HashMap<String, String>();
		argDefaults = new HashMap<String, Object>();
		requiredArgs = new HashSet<String>();
		commandLineValues = new HashMap<String, String>();
	}

	/**
	 * Sets program description to be printed as part of help menu
	 * @param description The program description
	 */
	public void setProgramDescription(String description) {
		programDescription.add(description);
	}

	private void addArg(String flag, ArgType type, String description, boolean required, Object def) {
		if(argTypes.containsKey(flag)) {
			throw new IllegalArgumentException("Flag " + flag + " has already been used.");
		}
		if(argDescriptions.containsValue(description)) {
			throw new IllegalArgumentException("Description " + description + " has already been used.");
		}
		argTypes.put(flag, type);
		argDescriptions.put(flag, description);
		if(required) {
			requiredArgs.add(flag);
		}
		if(def != null) {
			argDefaults.put(flag, def);
		}
	}

	/**
	 * Adds new string argument
	 * @param flag the command line flag for the argument
	 * @param description the description of the argument
	 * @param required whether parameter is required
	 */
	public void addStringArg(String flag, String description, boolean required) {
		addArg(flag, ArgType.STRING, description, required, null);
	}

	/**
	 * Adds new string argument with a default
	 * @param flag the command line flag for the argument
	 * @param description the description of the argument
	 * @param required whether parameter is required
	 * @param def default value
	 */
	public void addStringArg(String flag, String description, boolean required, String def) {
		addArg(flag, ArgType.STRING, description, required, def);
	}

	/**
	 * Adds new comma separated list argument
	 * @param flag the command line flag for the argument
	 * @param description the description of the argument
	 * @param required whether parameter is required
	 */
	public void addStringListArg(String flag, String description, boolean required) {
		addArg(flag, ArgType.STRING_LIST, description, required, null);
	}

	/**
	 * Adds new int argument with a default
	 * @param flag the command line flag for the argument
	 * @param description the description of the argument
	 * @param required whether parameter is required
	 * @param def default value
	 */
	public void addIntArg(String flag, String description, boolean required, int def) {
		addArg(flag, ArgType.INT, description, required, Integer.valueOf(def));
	}

	/**
	 * Adds new double argument with a default
	 * @param flag the command line flag for the argument
	 * @param description the description of the argument
	 * @param required whether parameter is required
	 * @param def default value
	 */
	public void addDoubleArg(String flag, String description, boolean required, double def) {
		addArg(flag, ArgType.DOUBLE, description, required, Double.valueOf(def));
	}

	/**
	 * Adds new boolean argument with a default
	 * @param flag the command line flag for the argument
	 * @param description the description of the argument
	 * @param required whether parameter is required
	 * @param def default value
	 */
	public void addBooleanArg(String flag, String description, boolean required, boolean def) {
		addArg(flag, ArgType.BOOLEAN, description, required, Boolean.valueOf(def));
	}

	/**
	 * Parse command arguments
	 * @param args the command line arguments passed to a main program
	 * @throws IllegalArgumentException if a flag is unknown, repeated, missing its value, or a required flag is absent. The message includes the help menu.
	 */
	public void parse(String[] args) {
		isParsed = false;
		commandLineValues.clear();
		int i = 0;
		while(i < args.length) {
			// A flag shouldn't be the last item
			if(args.length == i + 1) {
				throw invalid("flag " + args[i] + " has no value");
			}
			if(!argTypes.containsKey(args[i])) {
				throw invalid("unknown flag " + args[i]);
			}
			if(commandLineValues.containsKey(args[i])) {
				throw invalid("flag " + args[i] + " given twice");
			}
			if(argTypes.containsKey(args[i + 1])) {
				throw invalid("flag " + args[i] + " has no value");
			}
			commandLineValues.put(args[i], args[i + 1]);
			i += 2;
		}
		for(String req : requiredArgs) {
			if(!commandLineValues.containsKey(req)) {
				throw invalid("argument " + req + " is required");
			}
		}
		isParsed = true;
	}

	private IllegalArgumentException invalid(String problem) {
		return new IllegalArgumentException("Invalid command line: " + problem + "\n" + getHelpMessage());
	}

	/**
	 * Whether a flag was given on the command line
	 * @param flag The flag
	 * @return True iff the flag was given
	 */
	public boolean hasValue(String flag) {
		checkParsed();
		return commandLineValues.containsKey(flag);
	}

	private String rawValue(String flag, ArgType type) {
		checkParsed();
		if(argTypes.get(flag) != type) {
			throw new IllegalArgumentException("Trying to get " + type + " value for non-" + type + " parameter " + flag);
		}
		return commandLineValues.get(flag);
	}

	private void checkParsed() {
		if(!isParsed) {
			throw new IllegalStateException("Cannot get parameter value without first calling method parse()");
		}
	}

	/**
	 * Get value of String parameter specified by flag
	 * @param flag The command line flag for the argument
	 * @return String specified on command line, else the default, else null
	 */
	public String getStringArg(String flag) {
		String value = rawValue(flag, ArgType.STRING);
		if(value == null) {
			return (String) argDefaults.get(flag);
		}
		return value;
	}

	/**
	 * Get value of comma separated list parameter specified by flag
	 * @param flag The command line flag for the argument
	 * @return Trimmed non-empty items, or an empty list if the parameter was not specified
	 */
	public List<String> getStringListArg(String flag) {
		String value = rawValue(flag, ArgType.STRING_LIST);
		if(value == null) {
			return Collections.emptyList();
		}
		List<String> rtrn = new ArrayList<String>();
		for(String item : Arrays.asList(StringUtils.split(value, ','))) {
			if(StringUtils.isNotBlank(item)) {
				rtrn.add(item.trim());
			}
		}
		return rtrn;
	}

	/**
	 * Get value of int parameter specified by flag
	 * @param flag The command line flag for the argument
	 * @return Integer specified on command line or the default
	 */
	public int getIntArg(String flag) {
		String value = rawValue(flag, ArgType.INT);
		if(value == null) {
			return ((Integer) argDefaults.get(flag)).intValue();
		}
		try {
			return Integer.parseInt(value);
		} catch(NumberFormatException e) {
			throw invalid("value " + value + " of " + flag + " is not an integer");
		}
	}

	/**
	 * Get value of double parameter specified by flag
	 * @param flag The command line flag for the argument
	 * @return Double specified on command line or the default
	 */
	public double getDoubleArg(String flag) {
		String value = rawValue(flag, ArgType.DOUBLE);
		if(value == null) {
			return ((Double) argDefaults.get(flag)).doubleValue();
		}
		try {
			return Double.parseDouble(value);
		} catch(NumberFormatException e) {
			throw invalid("value " + value + " of " + flag + " is not a number");
		}
	}

	/**
	 * Get value of boolean parameter specified by flag
	 * @param flag The command line flag for the argument
	 * @return Boolean specified on command line or the default
	 */
	public boolean getBooleanArg(String flag) {
		String value = rawValue(flag, ArgType.BOOLEAN);
		if(value == null) {
			return ((Boolean) argDefaults.get(flag)).booleanValue();
		}
		return Boolean.parseBoolean(value);
	}

	/**
	 * Program description plus argument flags and descriptions, sorted by flag
	 * @return The help message
	 */
	public String getHelpMessage() {
		StringBuilder sb = new StringBuilder();
		sb.append("\n");
		for(String s : programDescription) {
			sb.append(s).append("\n\n");
		}
		TreeSet<String> lines = new TreeSet<String>();
		for(String key : argTypes.keySet()) {
			String msg = key + " <" + argTypes.get(key) + ">\t" + argDescriptions.get(key);
			if(requiredArgs.contains(key)) {
				msg += " (required)";
			} else {
				msg += " (default=" + argDefaults.get(key) + ")";
			}
			lines.add(msg);
		}
		for(String s : lines) {
			sb.append(s).append("\n");
		}
		return sb.toString();
	}

}
