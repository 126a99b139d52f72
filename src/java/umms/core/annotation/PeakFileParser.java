package umms.core.annotation;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import umms.core.exception.ParseException;
import umms.core.feature.GenomeWindow;
import umms.core.feature.PeakWindow;

/**
 * Reads called peaks and turns each into a window centered on its summit.
 * <p>
 * Two whitespace delimited layouts are accepted. The full layout (narrowPeak style) takes
 * chromosome, start and end from columns 1-3 and the summit offset from column 10. If any data
 * line does not fit it, the whole file is read again with only the first three columns and
 * every summit offset set to 0.
 */
public class PeakFileParser {
	static Logger logger = Logger.getLogger(PeakFileParser.class.getName());
	public static final String whitespaceDelimiter = "\\s+";

	static final int CHR_COLUMN = 0;
	static final int START_COLUMN = 1;
	static final int END_COLUMN = 2;
	static final int SUMMIT_COLUMN = 9;

	private final int width;

	public PeakFileParser(int width) {
		GenomeWindow.checkWidth(width);
		this.width = width;
	}

	/**
	 * @return peak windows in file order
	 * @throws ParseException if the file fits neither layout
	 */
	public List<PeakWindow> load(File file) throws IOException, ParseException {
		logger.info("Loading peaks from file " + file.getName() + "...");
		List<DataLine> lines = readDataLines(file);

		ParseResult<List<PeakWindow>> result = parse(lines, true);
		if (!result.isSuccess()) {
			logger.info("Peak file does not have summit offsets (" + result.getError() + ", line " + result.getLineNumber() + "), reading chromosome, start and end only");
			result = parse(lines, false);
		}
		if (!result.isSuccess()) {
			throw new ParseException("Peak file " + file + " could not be parsed: " + result.getError(), result.getLineNumber());
		}
		logger.info("Loaded " + result.getValue().size() + " peaks.");
		int misplaced = countSummitsOutsidePeak(result.getValue());
		if (misplaced > 0) {
			logger.warn(misplaced + " peaks have their summit outside [start, end]; their windows are still centered on the summit");
		}
		return result.getValue();
	}

	static int countSummitsOutsidePeak(List<PeakWindow> peaks) {
		int rtrn = 0;
		for (PeakWindow p : peaks) {
			if (p.getSummit() < p.getPeakStart() || p.getSummit() > p.getPeakEnd()) {
				rtrn++;
			}
		}
		return rtrn;
	}

	/**
	 * @param withSummit true to require the summit column, false to use columns 1-3 only
	 */
	ParseResult<List<PeakWindow>> parse(List<DataLine> lines, boolean withSummit) {
		int minColumns = withSummit ? SUMMIT_COLUMN + 1 : END_COLUMN + 1;
		List<PeakWindow> peaks = new ArrayList<PeakWindow>(lines.size());
		for (DataLine line : lines) {
			String[] tokens = line.text.trim().split(whitespaceDelimiter);
			if (tokens.length < minColumns) {
				return ParseResult.failure("expected at least " + minColumns + " columns, found " + tokens.length, line.number);
			}
			try {
				int start = Integer.parseInt(tokens[START_COLUMN]);
				int end = Integer.parseInt(tokens[END_COLUMN]);
				int summit = withSummit ? Integer.parseInt(tokens[SUMMIT_COLUMN]) : 0;
				peaks.add(new PeakWindow(tokens[CHR_COLUMN], start, end, summit, width));
			} catch (NumberFormatException e) {
				return ParseResult.failure("non integer coordinate: " + e.getMessage(), line.number);
			}
		}
		return ParseResult.success(peaks);
	}

	static List<DataLine> readDataLines(File file) throws IOException {
		BufferedReader reader = new BufferedReader(new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8));
		List<DataLine> rtrn = new ArrayList<DataLine>();
		try {
			String nextLine;
			int i = 0;
			while ((nextLine = reader.readLine()) != null) {
				i++;
				if (looksLikeData(nextLine)) {
					rtrn.add(new DataLine(i, nextLine));
				}
			}
		} finally {
			reader.close();
		}
		return rtrn;
	}

	private static boolean looksLikeData(String nextLine) {
		return nextLine.trim().length() > 0 && ! nextLine.startsWith("#") && !nextLine.startsWith("track") && !nextLine.startsWith("browser");
	}

	static final class DataLine {
		final int number;
		final String text;

		DataLine(int number, String text) {
			this.number = number;
			this.text = text;
		}
	}

	public int getWidth() {
		return width;
	}
}
