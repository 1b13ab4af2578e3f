package edu.upf.taln.relpatterns.core.io;

import edu.upf.taln.relpatterns.core.matchers.AttributeNodeMatcher;
import edu.upf.taln.relpatterns.core.matchers.CaptureNodeMatcher;
import edu.upf.taln.relpatterns.core.matchers.ConjunctiveNodeMatcher;
import edu.upf.taln.relpatterns.core.matchers.DisjunctiveEdgeMatcher;
import edu.upf.taln.relpatterns.core.matchers.EdgeNodeMatcher;
import edu.upf.taln.relpatterns.core.matchers.LabelEdgeMatcher;
import edu.upf.taln.relpatterns.core.matchers.Matcher;
import edu.upf.taln.relpatterns.core.matchers.TrivialNodeMatcher;
import edu.upf.taln.relpatterns.core.patterns.DependencyPattern;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class PatternReaderTest
{
	private final PatternReader reader = new PatternReader();
	private final PatternWriter writer = new PatternWriter();

	@Test
	public void testReadSimplePattern() throws Exception
	{
		DependencyPattern pattern = reader.read("{arg1} >nsubj> {rel} <dobj< {arg2}");
		List<Matcher> expected = List.of(
				new CaptureNodeMatcher("arg1"),
				LabelEdgeMatcher.down("nsubj"),
				new CaptureNodeMatcher("rel"),
				LabelEdgeMatcher.up("dobj"),
				new CaptureNodeMatcher("arg2"));
		Assert.assertEquals(expected, pattern.getMatchers());
	}

	@Test
	public void testReadConstraints() throws Exception
	{
		DependencyPattern pattern = reader.read("{rel:postag=VBD:<nn<} >prep_of|!prep_in> text=of:regex=^o.* >> *");
		List<Matcher> matchers = pattern.getMatchers();

		Assert.assertEquals(new CaptureNodeMatcher("rel", new ConjunctiveNodeMatcher(List.of(
				AttributeNodeMatcher.postag("VBD"), new EdgeNodeMatcher(LabelEdgeMatcher.up("nn"))))), matchers.get(0));
		Assert.assertEquals(Matcher.Kind.EdgeDisjunction, matchers.get(1).getKind());
		DisjunctiveEdgeMatcher disjunction = (DisjunctiveEdgeMatcher) matchers.get(1);
		Assert.assertFalse(disjunction.getMatchers().get(0).isNegated());
		Assert.assertTrue(disjunction.getMatchers().get(1).isNegated());
		Assert.assertEquals("prep_in", disjunction.getMatchers().get(1).getLabel());
		Assert.assertEquals(new ConjunctiveNodeMatcher(List.of(AttributeNodeMatcher.text("of"), AttributeNodeMatcher.regex("^o.*"))), matchers.get(2));
		Assert.assertEquals(Matcher.Kind.WildcardEdge, matchers.get(3).getKind());
		Assert.assertEquals(TrivialNodeMatcher.get(), matchers.get(4));
	}

	@Test
	public void testRoundTrip() throws Exception
	{
		List<String> lines = List.of(
				"{arg1} >nsubj> {rel} <dobj< {arg2}",
				"{arg1} <nsubj< {rel:postag=VBD} >dobj> {arg2}",
				"{arg1:<nn<} <prep_of< {rel:text=member} >nsubj|nsubjpass> {slot0} >> {arg2}",
				"{arg1} >!nn> * <amod< {rel:regex=^be.*:postag=VB} >prep> {arg2}",
				"{arg1}");
		for (String line : lines)
			Assert.assertEquals(line, writer.write(reader.read(line)));

		Assert.assertEquals(String.join("\n", lines), writer.write(reader.read(lines)));
	}

	@Test
	public void testWhitespaceIsNormalized() throws Exception
	{
		Assert.assertEquals("{arg1} >nsubj> {rel}", writer.write(reader.read("  {arg1}\t>nsubj>   {rel} ")));
	}

	@Test
	public void testMalformedPatterns()
	{
		assertMalformed("");
		assertMalformed("   ");
		assertMalformed("{arg1} >nsubj>");
		assertMalformed("{arg1} {rel} {arg2}");
		assertMalformed(">nsubj> {rel} >dobj>");
		assertMalformed("{arg1 >nsubj> {rel}");
		assertMalformed("{} >nsubj> {rel}");
		assertMalformed("{arg1} >nsubj< {rel}");
		assertMalformed("{arg1} >nsubj||dobj> {rel}");
		assertMalformed("{arg1} >!> {rel}");
		assertMalformed("{arg1} >nsubj> lemma=be");
		assertMalformed("{arg1} >nsubj> postag");
		assertMalformed("{arg1} >nsubj> {rel:*:postag=VB}");
		assertMalformed("{arg1} >nsubj> {rel:regex=(}");
		assertMalformed("{arg1} >nsubj> postag=NN:");
		assertMalformed("{arg1} >nsubj> {rel:}");
		assertMalformed("{arg1:} >nsubj> {rel}");
	}

	@Test
	public void testErrorCarriesOffendingToken()
	{
		try
		{
			reader.read("{arg1} >nsubj> pos=NN");
			Assert.fail("Expected a format exception");
		}
		catch (PatternFormatException e)
		{
			Assert.assertEquals("pos=NN", e.getText());
		}
	}

	@Test
	public void testEmptyCaptureConstraints()
	{
		try
		{
			reader.read("{arg1} >nsubj> {rel:}");
			Assert.fail("Expected a format exception");
		}
		catch (PatternFormatException e)
		{
			Assert.assertEquals("{rel:}", e.getText());
		}
	}

	@Test
	public void testEdgeConstraintNodesRoundTrip() throws Exception
	{
		for (String line : List.of("{arg1} >nsubj> postag=NN:<nn< >dobj> {arg2}", "{arg1} >nsubj> <nn<:>amod> >dobj> {arg2}"))
			Assert.assertEquals(line, writer.write(reader.read(line)));
	}

	private void assertMalformed(String line)
	{
		try
		{
			reader.read(line);
			Assert.fail("Pattern should not be readable: " + line);
		}
		catch (PatternFormatException e)
		{
			// expected
		}
	}
}
