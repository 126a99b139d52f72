package umms.core.writers;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.Collection;

import org.apache.log4j.Logger;

import umms.core.feature.Window;

/**
 * Writes windows as headerless three column, tab delimited files: chromosome, start, end.
 */
public class WindowWriter {

	static Logger logger = Logger.getLogger(WindowWriter.class.getName());

	public static void write(Collection<? extends Window> windows, File output) throws IOException {
		BufferedWriter bw = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(output), StandardCharsets.UTF_8));
		try {
			for (Window w : windows) {
				bw.write(w.toShortBED());
				bw.newLine();
			}
		} finally {
			bw.close();
		}
		logger.info("Wrote " + windows.size() + " windows to " + output);
	}
}
