package edu.upf.taln.relpatterns.tools;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import edu.upf.taln.relpatterns.core.validation.PatternCheck;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class DriverTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
	private final PrintStream out = new PrintStream(bytes, true);

	private Driver.CheckCommand parse(String... args)
	{
		Driver.CheckCommand command = new Driver.CheckCommand();
		JCommander.newBuilder().addObject(command).build().parse(args);
		return command;
	}

	@Test
	public void testPatternsFromArguments() throws Exception
	{
		Driver.CheckCommand command = parse("{arg1} >nsubj> {rel} <dobj< {arg2}", "{arg1} >conj_and> {rel}");
		Assert.assertEquals(2, command.patterns.size());
		Assert.assertEquals(2, Driver.run(command, out));
		Assert.assertEquals("valid: {arg1} >nsubj> {rel} <dobj< {arg2}" + System.lineSeparator() +
				"invalid: {arg1} >conj_and> {rel}" + System.lineSeparator(), bytes.toString());
	}

	@Test
	public void testPatternsFromFile() throws Exception
	{
		Path input = folder.newFile("patterns.txt").toPath();
		Files.write(input, List.of("{arg1} >prep> {rel} <prep< {arg2}", "", "{arg1} >nsubj> {rel} <dobj< {arg2}"));

		Driver.CheckCommand command = parse("-i", input.toString(), "-m", "symmetry");
		Assert.assertEquals(PatternCheck.Symmetry, command.mode);
		Assert.assertEquals(2, Driver.run(command, out));
		Assert.assertEquals("symmetric: {arg1} >prep> {rel} <prep< {arg2}" + System.lineSeparator() +
				"asymmetric: {arg1} >nsubj> {rel} <dobj< {arg2}" + System.lineSeparator(), bytes.toString());
	}

	@Test
	public void testModeFromProperties() throws Exception
	{
		Path properties = folder.newFile("tools.properties").toPath();
		Files.write(properties, List.of("rp.output.mode=symmetry"));

		Driver.CheckCommand command = parse("-p", properties.toString(), "{arg1} <nsubj< {rel} >nsubj> {arg2}");
		Driver.run(command, out);
		Assert.assertEquals("symmetric: {arg1} <nsubj< {rel} >nsubj> {arg2}" + System.lineSeparator(),
				bytes.toString());
	}

	@Test(expected = ParameterException.class)
	public void testInvalidMode()
	{
		parse("-m", "coverage", "{arg1}");
	}
}
