package umms.core.readers;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.apache.log4j.Logger;

import umms.core.annotation.Location;

/**
 * Reads the locations to annotate, one per line, either as chr:start-end or as the
 * first three columns of a BED-like line. Blank lines, # comments and track/browser
 * lines are skipped.
 */
public class LocationFileReader {

	static Logger logger = Logger.getLogger(LocationFileReader.class.getName());

	public static List<Location> load(File file) throws IOException {
		LineIterator itr = FileUtils.lineIterator(file, StandardCharsets.UTF_8.name());
		try {
			List<Location> locations = load(itr, file.getName());
			logger.info("Read " + locations.size() + " locations from " + file.getName());
			return locations;
		} finally {
			itr.close();
		}
	}

	public static List<Location> load(Reader reader, String source) {
		return load(new LineIterator(reader), source);
	}

	private static List<Location> load(LineIterator itr, String source) {
		List<Location> rtrn = new ArrayList<Location>();
		int lineNumber = 0;
		while (itr.hasNext()) {
			String line = itr.next().trim();
			lineNumber++;
			if (line.length() == 0 || line.startsWith("#") || line.startsWith("track") || line.startsWith("browser")) {
				continue;
			}
			try {
				rtrn.add(parseLine(line));
			} catch (IllegalArgumentException e) {
				throw new IllegalArgumentException(source + " line " + lineNumber + ": " + e.getMessage(), e);
			}
		}
		return rtrn;
	}

	static Location parseLine(String line) {
		String[] tokens = line.split("\\s+");
		if (tokens.length >= 3 && tokens[0].indexOf(':') < 0) {
			try {
				return new Location(tokens[0], Integer.parseInt(tokens[1].replace(",", "")),
						Integer.parseInt(tokens[2].replace(",", "")));
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Bad coordinates in \"" + line + "\"", e);
			}
		}
		return Location.parse(tokens[0]);
	}
}
