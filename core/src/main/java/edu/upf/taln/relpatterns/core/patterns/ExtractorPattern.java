package edu.upf.taln.relpatterns.core.patterns;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import edu.upf.taln.relpatterns.core.matchers.ExtractionPartMatcher;
import edu.upf.taln.relpatterns.core.matchers.Matcher;
import edu.upf.taln.relpatterns.core.validation.SymmetryChecker;
import edu.upf.taln.relpatterns.core.validation.ValidityChecker;

import java.util.List;

/**
 * A dependency pattern intended for the extraction of binary relations, where every capture has been typed as
 * an argument, relation or slot. Instances are created with {@link CaptureClassifier}.
 */
public final class ExtractorPattern extends DependencyPattern
{
	ExtractorPattern(List<? extends Matcher> matchers)
	{
		super(matchers);
		Preconditions.checkArgument(matchers.stream().noneMatch(m -> m.getKind() == Matcher.Kind.Capture),
				"Untyped capture in %s", matchers);
	}

	public static ExtractorPattern of(DependencyPattern pattern) throws AliasClassificationException
	{
		return CaptureClassifier.classify(pattern);
	}

	public List<ExtractionPartMatcher> getCaptures()
	{
		return getNodeMatchers().stream()
				.filter(m -> m.getKind() == Matcher.Kind.ExtractionPart)
				.map(m -> (ExtractionPartMatcher) m)
				.collect(ImmutableList.toImmutableList());
	}

	public List<ExtractionPartMatcher> getArguments()
	{
		return getCaptures().stream()
				.filter(ExtractionPartMatcher::isArgument)
				.collect(ImmutableList.toImmutableList());
	}

	public boolean isValid()
	{
		return ValidityChecker.isValid(this);
	}

	public boolean isSymmetric()
	{
		return SymmetryChecker.isSymmetric(this);
	}
}
