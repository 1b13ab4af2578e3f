package edu.upf.taln.relpatterns.common;

import edu.upf.taln.relpatterns.core.validation.PatternCheck;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Settings of the pattern batch tools. Defaults are read from config.properties in the classpath, and can be
 * overridden with a properties file.
 */
public class PatternProperties
{
	public static final String resource = "config.properties";
	public static final String encoding_key = "rp.input.encoding";
	public static final String skip_blank_lines_key = "rp.input.skip_blank_lines";
	public static final String mode_key = "rp.output.mode";

	private Charset encoding = StandardCharsets.UTF_8;
	private boolean skipBlankLines = true;
	private PatternCheck mode = PatternCheck.Validity;

	private final static Logger log = LogManager.getLogger();

	public PatternProperties()
	{
		Properties prop = new Properties();
		try (InputStream input = PatternProperties.class.getClassLoader().getResourceAsStream(resource))
		{
			if (input == null)
			{
				log.warn("Unable to find " + resource + ", using default settings");
				return;
			}
			prop.load(input);
		}
		catch (IOException e)
		{
			throw new RuntimeException("Failed to load " + resource, e);
		}

		load(prop);
	}

	public PatternProperties(Path file) throws IOException
	{
		this();
		Properties prop = new Properties();
		try (InputStream input = Files.newInputStream(file))
		{
			prop.load(input);
		}
		load(prop);
	}

	// Only keys present in prop override current values
	private void load(Properties prop)
	{
		final String encoding_value = prop.getProperty(encoding_key);
		if (encoding_value != null)
			encoding = Charset.forName(encoding_value.trim());

		final String skip_value = prop.getProperty(skip_blank_lines_key);
		if (skip_value != null)
			skipBlankLines = Boolean.parseBoolean(skip_value.trim());

		final String mode_value = prop.getProperty(mode_key);
		if (mode_value != null)
		{
			final PatternCheck check = CMLCheckers.parsePatternCheck(mode_value.trim());
			if (check == null)
				throw new RuntimeException(mode_value + " is not a valid value for " + mode_key);
			mode = check;
		}
	}

	public Charset getEncoding()
	{
		return encoding;
	}

	public boolean skipBlankLines()
	{
		return skipBlankLines;
	}

	public PatternCheck getMode()
	{
		return mode;
	}
}
