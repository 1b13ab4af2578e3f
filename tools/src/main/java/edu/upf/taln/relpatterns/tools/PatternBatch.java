package edu.upf.taln.relpatterns.tools;

import com.google.common.base.Stopwatch;
import edu.upf.taln.relpatterns.core.io.PatternFormatException;
import edu.upf.taln.relpatterns.core.io.PatternReader;
import edu.upf.taln.relpatterns.core.io.PatternWriter;
import edu.upf.taln.relpatterns.core.patterns.AliasClassificationException;
import edu.upf.taln.relpatterns.core.patterns.CaptureClassifier;
import edu.upf.taln.relpatterns.core.patterns.DependencyPattern;
import edu.upf.taln.relpatterns.core.patterns.ExtractorPattern;
import edu.upf.taln.relpatterns.core.validation.PatternCheck;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.util.Iterator;

/**
 * Reads, classifies and checks patterns one line at a time, printing a verdict line for each of them in input
 * order: "&lt;verdict&gt;: &lt;pattern&gt;".
 * Processing stops at the first line that cannot be read or classified; the exception is propagated and no
 * further lines are processed.
 */
public class PatternBatch
{
	private final PatternReader reader = new PatternReader();
	private final PatternWriter writer = new PatternWriter();
	private final PatternCheck check;
	private final boolean skip_blank_lines;
	private final static Logger log = LogManager.getLogger();

	public PatternBatch(PatternCheck check, boolean skip_blank_lines)
	{
		this.check = check;
		this.skip_blank_lines = skip_blank_lines;
	}

	/**
	 * @return number of patterns processed
	 */
	public int run(Iterator<String> lines, PrintStream out) throws PatternFormatException, AliasClassificationException
	{
		log.info("Checking " + check + " of patterns");
		Stopwatch timer = Stopwatch.createStarted();
		int num_patterns = 0;
		int num_positive = 0;

		while (lines.hasNext())
		{
			final String line = lines.next();
			if (skip_blank_lines && StringUtils.isBlank(line))
				continue;

			final ExtractorPattern pattern = process(line);
			final boolean positive = check.test(pattern);
			out.println(check.verdict(pattern) + ": " + writer.write(pattern));
			++num_patterns;
			if (positive)
				++num_positive;
		}
		out.flush();

		log.info(num_positive + " out of " + num_patterns + " patterns passed the " + check + " check in " + timer.stop());
		return num_patterns;
	}

	public ExtractorPattern process(String line) throws PatternFormatException, AliasClassificationException
	{
		final DependencyPattern raw = reader.read(line);
		return CaptureClassifier.classify(raw);
	}
}
