package edu.upf.taln.relpatterns.tools;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import edu.upf.taln.relpatterns.common.CMLCheckers;
import edu.upf.taln.relpatterns.common.FileUtils;
import edu.upf.taln.relpatterns.common.PatternProperties;
import edu.upf.taln.relpatterns.core.validation.PatternCheck;
import org.apache.commons.io.LineIterator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line tool reporting the validity, or the symmetry, of extractor patterns.
 * Patterns are read from the main arguments (one pattern per argument), from an input file, or from standard
 * input, and one verdict line per pattern is written to standard output.
 */
public class Driver
{
	private final static Logger log = LogManager.getLogger();

	@Parameters(commandDescription = "Check validity or symmetry of extractor patterns")
	static class CheckCommand
	{
		@Parameter(description = "Patterns to check, one per argument. If none given, patterns are read from the input file or from standard input")
		List<String> patterns = new ArrayList<>();
		@Parameter(names = {"-i", "-input"}, description = "Path to a file with one pattern per line", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		Path input = null;
		@Parameter(names = {"-p", "-properties"}, description = "Path to properties file", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		Path properties = null;
		@Parameter(names = {"-m", "-mode"}, description = "Check to run on each pattern: validity or symmetry", arity = 1,
				converter = CMLCheckers.PatternCheckConverter.class, validateWith = CMLCheckers.PatternCheckValidator.class)
		PatternCheck mode = null;
		@Parameter(names = {"-e", "-encoding"}, description = "Charset of the input", arity = 1,
				validateWith = CMLCheckers.CharsetValidator.class)
		String encoding = null;
		@Parameter(names = {"-h", "-help"}, help = true, description = "Print usage")
		boolean help = false;
	}

	public static void main(String[] args) throws Exception
	{
		CheckCommand command = new CheckCommand();
		JCommander jc = JCommander.newBuilder()
				.addObject(command)
				.programName("relpatterns")
				.build();
		jc.parse(args);

		if (command.help)
		{
			jc.usage();
			return;
		}

		try
		{
			run(command, System.out);
		}
		catch (Exception e)
		{
			log.error("Pattern check aborted: " + e.getMessage());
			throw e;
		}
	}

	static int run(CheckCommand command, PrintStream out) throws Exception
	{
		final PatternProperties properties = command.properties != null ?
				new PatternProperties(command.properties) : new PatternProperties();
		final PatternCheck check = command.mode != null ? command.mode : properties.getMode();
		final Charset encoding = command.encoding != null ? Charset.forName(command.encoding) : properties.getEncoding();
		final PatternBatch batch = new PatternBatch(check, properties.skipBlankLines());

		if (!command.patterns.isEmpty())
			return batch.run(command.patterns.iterator(), out);

		final LineIterator lines = command.input != null ?
				FileUtils.iterateLines(command.input, encoding) :
				FileUtils.iterateLines(System.in, encoding);
		try
		{
			return batch.run(lines, out);
		}
		finally
		{
			if (command.input != null)
				lines.close();
		}
	}
}
