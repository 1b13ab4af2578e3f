package edu.upf.taln.relpatterns.common;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Enums;
import edu.upf.taln.relpatterns.core.validation.PatternCheck;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class CMLCheckers
{
	public static class PathConverter implements IStringConverter<Path>
	{
		@Override
		public Path convert(String value)
		{
			return Paths.get(value);
		}
	}

	public static class PathToExistingFile implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value);
			if (!Files.exists(path) || !Files.isRegularFile(path))
			{
				throw new ParameterException("Cannot open file " + name + " = " + value);
			}
		}
	}

	// Accepts both "symmetry" and "Symmetry"
	public static class PatternCheckConverter implements IStringConverter<PatternCheck>
	{
		@Override
		public PatternCheck convert(String value)
		{
			return parsePatternCheck(value);
		}
	}

	public static class PatternCheckValidator implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			if (parsePatternCheck(value) == null)
				throw new ParameterException("Parameter " + name + " has invalid value " + value);
		}
	}

	public static class CharsetValidator implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			try
			{
				Charset.forName(value);
			}
			catch (Exception e)
			{
				throw new ParameterException("Unsupported charset " + name + " = " + value);
			}
		}
	}

	public static PatternCheck parsePatternCheck(String value)
	{
		return Enums.getIfPresent(PatternCheck.class, StringUtils.capitalize(StringUtils.lowerCase(value))).orNull();
	}
}
