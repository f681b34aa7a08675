package umms.core.util;

import java.io.BufferedWriter;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Command line parsing in the -key value style. Keys given more than once keep every value.
 */
public class CLUtil {

	public CLUtil() {
		super();
	}

	public static ArgumentMap getParameters(String [] args, String usage, String defaultTask) {
		ArgumentMap argMap = new ArgumentMap(args.length, usage, defaultTask);
		for(int i = 0; i < args.length; i++) {
			if(args[i].startsWith("-") && args[i].length() > 1) {
				String key = args[i].substring(1);
				String val = "";
				if(i + 1 < args.length && !looksLikeKey(args[i + 1])) {
					val = args[i + 1];
					i++;
				}
				argMap.put(key, val);
			} else {
				String[] arg = args[i].split("=");
				if(arg.length != 2){
					throw new IllegalArgumentException("Cannot interpret argument " + args[i] + "\n" + usage);
				}
				argMap.put(arg[0],arg[1]);
			}
		}
		return argMap;
	}

	public static ArgumentMap getParameters(String [] args, String usage) {
		return getParameters(args, usage, null);
	}

	/*
	 * Negative numbers are values, not keys.
	 */
	private static boolean looksLikeKey(String arg) {
		return arg.startsWith("-") && arg.length() > 1 && !Character.isDigit(arg.charAt(1));
	}

	public static class ArgumentMap extends HashMap<String, List<String>> {
		private static final long serialVersionUID = 2312363L;
		private String usage;
		private String defaultTask;
		private String task;
		private String input;
		private String output;

		public ArgumentMap(int size, String usage, String defaultTask) {
			super(size);
			this.usage = usage;
			this.defaultTask = defaultTask;
		}

		public String get(String key) {
			List<String> result = super.get(key);
			return result == null ||  result.size() == 0 ? "" : result.get(0);
		}

		public String get(String key, String defaultValue) {
			return super.containsKey(key) ? get(key) : defaultValue;
		}

		public void put(String key, String value) {
			if(key.toLowerCase().equals("task")) {
				this.task = value;
			} else if (key.toLowerCase().equals("in")) {
				this.input = value;
			} else if (key.toLowerCase().equals("out")) {
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

		public String getTask() {
			if(task == null && defaultTask == null) {
				throw new IllegalArgumentException("Missing task\n"+ usage);
			}
			return task == null ? defaultTask : task;
		}

		public String getInput() {
			if(input == null) {
				throw new IllegalArgumentException("Must provide \"in\"\n" + usage);
			}
			return input;
		}

		public boolean hasInputFile() {
			return input != null;
		}

		public boolean isOutputSet() {
			return output != null;
		}

		/**
		 * @return writer on the -out file, or on stdout when no output was given
		 * @throws IOException
		 */
		public BufferedWriter getOutputWriter() throws IOException {
			if(output != null) {
				return new BufferedWriter(new OutputStreamWriter(new FileOutputStream(output), StandardCharsets.UTF_8));
			}
			return new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
		}

		public List<String> getAll(String key) {
			return super.get(key) == null ? new ArrayList<String>() : super.get(key);
		}

		/**
		 *
		 * @param key - the key whose value is presumably an integer
		 * @return An integer representing the value.
		 * @throws IllegalArgumentException - if the value could not be converted to an integer.
		 */
		public int getInteger(String key) {
			String val = getMandatory(key);
			try {
				return Integer.parseInt(val);
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Argument " + key + " must be an integer, got \"" + val + "\"\n" + usage, e);
			}
		}

		public int getInteger(String key, int defaultValue) {
			return isPresent(key) ? getInteger(key) : defaultValue;
		}

		public String getMandatory(String key)  throws IllegalArgumentException{
			List<String> parameter = super.get(key);
			if(parameter == null || parameter.size() == 0 || parameter.get(0).length() == 0) {
				throw new IllegalArgumentException("Argument "+key+" is mandatory\n"+usage);
			}
			return parameter.get(0);
		}

		public boolean isPresent(String key) {
			return super.get(key) != null && super.get(key).size() > 0;
		}
	}
}
