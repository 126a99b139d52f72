package broad.core.util;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import umms.core.exception.ConfigurationException;

/**
 * Minimal unix style command line parsing: "-key value" pairs and bare "-flag" switches.
 * Every accessor reports problems as a {@link ConfigurationException} carrying the usage text.
 */
public class CLUtil {

	public static ArgumentMap getParameters(String [] args, String usage) {
		ArgumentMap argMap = new ArgumentMap(args.length, usage);
		for(int i = 0; i < args.length; i++) {
			if(args[i].startsWith("-") && args[i].length() > 1) {
				String key = args[i].substring(1);
				String val = "";
				if(i + 1 < args.length && !isKey(args[i + 1])) {
					val = args[i + 1];
					i++;
				}
				argMap.put(key, val);
			} else { //ONLY for backwards compatibility, before we implemented unix type parameter passing.
				String[] arg = args[i].split("=");
				if(arg.length != 2){
					throw new ConfigurationException("Could not interpret argument " + args[i] + "\n" + usage);
				}
				argMap.put(arg[0],arg[1]);
			}
		}
		return argMap;
	}

	// negative numbers are values, not keys
	private static boolean isKey(String arg) {
		return arg.startsWith("-") && arg.length() > 1 && !Character.isDigit(arg.charAt(1)) && arg.charAt(1) != '.';
	}

	public static class ArgumentMap extends HashMap<String, List<String>> {
		private static final long serialVersionUID = 2312363L;
		private String usage;
		private String output;

		public ArgumentMap(int size, String usage) {
			super(size);
			this.usage = usage;
		}

		public String get(String key) {
			List<String> result = super.get(key);
			return result == null ||  result.size() == 0 ? "" : result.get(0);
		}

		public String get(String key, String defaultValue) {
			return super.containsKey(key) ? get(key) : defaultValue;
		}

		public void put(String key, String value) {
			if (key.toLowerCase().equals("out")) {
				this.output = value;
			} else {
				List<String> values = super.get(key);
				if(values == null) {
					values = new ArrayList<String>();
					super.put(key, values);
				}
				values.add(value);
			}
		}

		public String getOutput() {
			if(output == null || output.isEmpty()) {
				throw new ConfigurationException("Must provide an \"out\"\n" + usage);
			}
			return output;
		}

		public String getMandatory(String key) {
			List<String> parameter = super.get(key);
			if(parameter == null || parameter.size() == 0 || parameter.get(0).isEmpty()) {
				throw new ConfigurationException("Argument "+key+" is mandatory\n"+usage);
			}
			return parameter.get(0);
		}

		/**
		 * @return comma separated values of key, empty if the key is absent
		 */
		public List<String> getList(String key) {
			List<String> rtrn = new ArrayList<String>();
			for (String value : getAll(key)) {
				for (String token : StringUtils.split(value, ',')) {
					if (!StringUtils.isBlank(token)) {
						rtrn.add(token.trim());
					}
				}
			}
			return rtrn;
		}

		public List<String> getAll(String key) {
			return super.get(key) == null ? new ArrayList<String>() : super.get(key);
		}

		/**
		 * @param key - the key whose value is presumably an integer
		 * @return An integer representing the value.
		 * @throws ConfigurationException - if the value is missing or could not be converted to an integer.
		 */
		public int getInteger(String key) {
			String val = getMandatory(key);
			try {
				return Integer.parseInt(val);
			} catch (NumberFormatException e) {
				throw new ConfigurationException("Argument " + key + " must be an integer, got " + val + "\n" + usage);
			}
		}

		public int getInteger(String key, int defaultValue) {
			return isPresent(key) ? getInteger(key) : defaultValue;
		}

		public long getLong(String key) {
			String val = getMandatory(key);
			try {
				return Long.parseLong(val);
			} catch (NumberFormatException e) {
				throw new ConfigurationException("Argument " + key + " must be an integer, got " + val + "\n" + usage);
			}
		}

		public double getDouble(String key) {
			String val = getMandatory(key);
			try {
				return Double.parseDouble(val);
			} catch (NumberFormatException e) {
				throw new ConfigurationException("Argument " + key + " must be a number, got " + val + "\n" + usage);
			}
		}

		public double getDouble(String key, double defaultValue) {
			return isPresent(key) ? getDouble(key) : defaultValue;
		}

		public boolean isPresent(String key) {
			return super.get(key) != null && super.get(key).size() > 0;
		}
	}
}
