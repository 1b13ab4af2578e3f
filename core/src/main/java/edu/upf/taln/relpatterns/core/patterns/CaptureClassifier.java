package edu.upf.taln.relpatterns.core.patterns;

import edu.upf.taln.relpatterns.core.matchers.CaptureNodeMatcher;
import edu.upf.taln.relpatterns.core.matchers.ExtractionPartMatcher;
import edu.upf.taln.relpatterns.core.matchers.ExtractionPartMatcher.Role;
import edu.upf.taln.relpatterns.core.matchers.Matcher;

import java.util.ArrayList;
import java.util.List;

/**
 * Lifts the generic captures of a pattern to typed extraction parts according to their aliases:
 * "arg*" captures are arguments, "rel*" captures relations and "slo*" captures slots.
 */
public class CaptureClassifier
{
	public static ExtractorPattern classify(DependencyPattern pattern) throws AliasClassificationException
	{
		if (pattern instanceof ExtractorPattern)
			return (ExtractorPattern) pattern;

		final List<Matcher> classified = new ArrayList<>(pattern.size());
		for (Matcher m : pattern.getMatchers())
			classified.add(classify(m));

		return new ExtractorPattern(classified);
	}

	public static Matcher classify(Matcher m) throws AliasClassificationException
	{
		switch (m.getKind())
		{
			case Capture:
			{
				final CaptureNodeMatcher capture = (CaptureNodeMatcher) m;
				final Role role = Role.fromAlias(capture.getAlias())
						.orElseThrow(() -> new AliasClassificationException(capture.getAlias()));
				return new ExtractionPartMatcher(role, capture.getAlias(), capture.getMatcher());
			}
			case ExtractionPart: // already classified
			default:
				return m;
		}
	}
}
