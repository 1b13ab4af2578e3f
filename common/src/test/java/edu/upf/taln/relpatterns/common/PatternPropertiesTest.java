package edu.upf.taln.relpatterns.common;

import edu.upf.taln.relpatterns.core.validation.PatternCheck;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class PatternPropertiesTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testDefaults()
	{
		PatternProperties properties = new PatternProperties();
		Assert.assertEquals(StandardCharsets.UTF_8, properties.getEncoding());
		Assert.assertTrue(properties.skipBlankLines());
		Assert.assertEquals(PatternCheck.Validity, properties.getMode());
	}

	@Test
	public void testOverrides() throws Exception
	{
		Path file = folder.newFile("override.properties").toPath();
		Files.write(file, List.of(PatternProperties.mode_key + "=symmetry",
				PatternProperties.skip_blank_lines_key + "=false"));

		PatternProperties properties = new PatternProperties(file);
		Assert.assertEquals(PatternCheck.Symmetry, properties.getMode());
		Assert.assertFalse(properties.skipBlankLines());
		// keys missing from the file keep their defaults
		Assert.assertEquals(StandardCharsets.UTF_8, properties.getEncoding());
	}

	@Test(expected = RuntimeException.class)
	public void testInvalidMode() throws Exception
	{
		Path file = folder.newFile("invalid.properties").toPath();
		Files.write(file, List.of(PatternProperties.mode_key + "=coverage"));
		new PatternProperties(file);
	}
}
