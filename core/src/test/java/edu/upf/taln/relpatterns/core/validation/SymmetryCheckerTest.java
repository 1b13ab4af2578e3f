package edu.upf.taln.relpatterns.core.validation;

import edu.upf.taln.relpatterns.core.io.PatternReader;
import edu.upf.taln.relpatterns.core.patterns.CaptureClassifier;
import edu.upf.taln.relpatterns.core.patterns.DependencyPattern;
import edu.upf.taln.relpatterns.core.patterns.ExtractorPattern;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class SymmetryCheckerTest
{
	private final PatternReader reader = new PatternReader();

	private boolean symmetric(String line) throws Exception
	{
		ExtractorPattern pattern = CaptureClassifier.classify(reader.read(line));
		return SymmetryChecker.isSymmetric(pattern);
	}

	@Test
	public void testSymmetricPatterns() throws Exception
	{
		Assert.assertTrue(symmetric("{arg1} >prep> {rel} <prep< {arg2}"));
		Assert.assertTrue(symmetric("{arg1} <nsubj< {rel} >nsubj> {arg2}"));
		Assert.assertTrue(symmetric("{arg1} >prep> {rel} >x> * <x< {rel} <prep< {arg2}"));
		Assert.assertTrue(symmetric("{arg1} >prep> {slot0} <prep< {arg2}"));
		Assert.assertTrue(symmetric("{arg1} >nn|amod> {rel} <nn|amod< {arg2}"));
		Assert.assertTrue(symmetric("{arg1} >> {rel} << {arg2}"));
		Assert.assertTrue(symmetric("{arg1}"));
		Assert.assertTrue(symmetric("{rel}"));
	}

	@Test
	public void testArgumentNamesDoNotMatter() throws Exception
	{
		Assert.assertTrue(symmetric("{arg2} >prep> {rel} <prep< {arg1}"));
		Assert.assertTrue(symmetric("{arg1:postag=NN} >prep> {rel} <prep< {arg2:postag=NNP}"));
	}

	@Test
	public void testEdgesMustBeFlips() throws Exception
	{
		Assert.assertFalse(symmetric("{arg1} >nsubj> {rel} <dobj< {arg2}"));
		Assert.assertFalse(symmetric("{arg1} >prep> {rel} >prep> {arg2}"));
		Assert.assertFalse(symmetric("{arg1} >prep> {rel} <!prep< {arg2}"));
		Assert.assertFalse(symmetric("{arg1} >prep> {rel} >conj> {rel} <prep< {arg2}"));
		Assert.assertFalse(symmetric("{arg1} >> {rel} >> {arg2}"));
	}

	@Test
	public void testOtherNodesMustBeEqual() throws Exception
	{
		Assert.assertFalse(symmetric("{arg1} >prep> {rel1} >x> * <x< {rel2} <prep< {arg2}"));
		Assert.assertFalse(symmetric("{arg1} >prep> {rel} >x> * <x< {rel:postag=NN} <prep< {arg2}"));
		Assert.assertFalse(symmetric("{arg1} >prep> {slot0} >x> * <x< {slot1} <prep< {arg2}"));
		// a relation does not stand in for an argument
		Assert.assertFalse(symmetric("{arg1} >prep> {rel} <prep< {rel}"));
	}

	@Test
	public void testEmptyPattern() throws Exception
	{
		Assert.assertTrue(CaptureClassifier.classify(new DependencyPattern(List.of())).isSymmetric());
	}
}
