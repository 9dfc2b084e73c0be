package gpusync.exec;

import java.util.Map;
import java.util.TreeMap;

import gpusync.hir.PrintTools;

/**
* Class for registering and managing information of options.
*/
public class CommandLineOptionSet {

    public final int UTILITY = 1;
    public final int ANALYSIS = 2;
    public final int TRANSFORM = 3;
    private final String[] type_name = {"UTILITY", "ANALYSIS", "TRANSFORM"};

    private class OptionRecord {

        public int option_type;
        public String value;
        // example argument shown in the usage; null for a switch
        public String arg;
        public String usage;
        // value taken when the option is turned on without a value
        private String value_on;

        public OptionRecord(int type, String value, String arg, String usage) {
            this.option_type = type;
            this.value = value;
            this.arg = arg;
            this.usage = usage;
            this.value_on = null;
        }
    }

    /** Storage for the entire set of options. */
    private TreeMap<String, OptionRecord> name_to_record;

    /** Default constructor */
    public CommandLineOptionSet() {
        name_to_record = new TreeMap<String, OptionRecord>();
    }

    /**
    * Registers a new UTILITY switch with the given usage information.
    * @param name the name of the option.
    * @param usage the usage of the option.
    */
    public void add(String name, String usage) {
        name_to_record.put(name, new OptionRecord(UTILITY, null, null, usage));
    }

    /**
    * Registers a new switch with the given type and usage information.
    * @param type the category to which the option belongs.
    * @param name the name of the option.
    * @param usage the usage of the option.
    */
    public void add(int type, String name, String usage) {
        name_to_record.put(name, new OptionRecord(type, null, null, usage));
    }

    /**
    * Registers a new option with the given type, default value, argument,
    * and usage.
    * @param type the category to which the option belongs.
    * @param name the name of the option.
    * @param value the default value of the option.
    * @param arg the argument allowed for the option.
    * @param usage the usage of the option.
    */
    public void add(int type,
                    String name, String value, String arg, String usage) {
        name_to_record.put(name, new OptionRecord(type, value, arg, usage));
    }

    /**
    * Registers a new option with the given type, default value, turn-on
    * value, argument, and usage.
    * @param type the category to which the option belongs.
    * @param name the name of the option.
    * @param value the default value of the option.
    * @param value_on the value taken when the option is turned on without a
    *                 value
    * @param arg the argument allowed for the option.
    * @param usage the usage of the option.
    */
    public void add(int type, String name,
                    String value, String value_on, String arg, String usage) {
        OptionRecord record = new OptionRecord(type, value, arg, usage);
        record.value_on = value_on;
        name_to_record.put(name, record);
    }

    /**
    * Checks if the option set contains an option with the specified name.
    * @param name the name to be searched for.
    * @return true if such an option exists.
    */
    public boolean contains(String name) {
        return name_to_record.containsKey(name);
    }

    /**
    * Checks if the option takes an argument.
    */
    public boolean hasArgument(String name) {
        OptionRecord record = name_to_record.get(name);
        return record != null && record.arg != null;
    }

    /**
    * Returns the usage information for the entire option set.
    */
    public String getUsage() {
        StringBuilder sb = new StringBuilder(2000);
        String sep = PrintTools.line_sep;
        for (int j = UTILITY; j <= TRANSFORM; j++) {
            for (int i = 0; i < 80; i++) sb.append("-");
            sb.append(sep).append(type_name[j-1]).append(sep);
            for (int i = 0; i < 80; i++) sb.append("-");
            sb.append(sep).append(getUsage(j));
        }
        return sb.toString();
    }

    /**
    * Returns the usage information for the specified option type.
    */
    public String getUsage(int type) {
        StringBuilder sb = new StringBuilder(500);
        String sep = PrintTools.line_sep;
        for (Map.Entry<String, OptionRecord> stringOptionRecordEntry :
                name_to_record.entrySet()) {
            OptionRecord record = stringOptionRecordEntry.getValue();
            if (record.option_type == type) {
                sb.append("-").append(stringOptionRecordEntry.getKey());
                if (record.arg != null) {
                    sb.append("=").append(record.arg);
                }
                sb.append(sep).append("    ").append(record.usage);
                sb.append(sep).append(sep);
            }
        }
        return sb.toString();
    }

    /**
    * Returns the value of the specified option name.
    */
    public String getValue(String name) {
        OptionRecord record = name_to_record.get(name);
        if (record == null) {
            return null;
        } else {
            return record.value;
        }
    }

    /**
    * Sets a new value for the specified option name.
    */
    public void setValue(String name, String value) {
        OptionRecord record = name_to_record.get(name);
        if (record != null) {
            record.value = value;
        }
    }

    /**
    * Turns on the specified option with its turn-on value, or "1" if it has
    * none. This is the case where the user names the option without a value.
    */
    public void setValue(String name) {
        OptionRecord record = name_to_record.get(name);
        if (record != null) {
            if (record.value_on == null) {
                record.value = "1";
            } else {
                record.value = record.value_on;
            }
        }
    }

    /**
    * Returns the type of the specified option name.
    */
    public int getType(String name) {
        OptionRecord record = name_to_record.get(name);
        if (record == null) {
            return 0;
        } else {
            return record.option_type;
        }
    }
}
