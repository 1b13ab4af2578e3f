package edu.upf.taln.relpatterns.core.validation;

import com.google.common.collect.Lists;
import edu.upf.taln.relpatterns.core.matchers.EdgeMatcher;
import edu.upf.taln.relpatterns.core.matchers.ExtractionPartMatcher;
import edu.upf.taln.relpatterns.core.matchers.Matcher;
import edu.upf.taln.relpatterns.core.patterns.ExtractorPattern;

import java.util.List;

/**
 * Determines if a pattern reads the same when reversed, such as
 * <pre>{arg1} >prep> {rel} &lt;prep&lt; {arg2}</pre>
 * Extractions of symmetric patterns can be mirrored by swapping their arguments.
 */
public class SymmetryChecker
{
	public static boolean isSymmetric(ExtractorPattern pattern)
	{
		final List<Matcher> matchers = pattern.getMatchers();
		return compare(matchers, Lists.reverse(matchers));
	}

	private static boolean compare(List<Matcher> m1, List<Matcher> m2)
	{
		if (m1.isEmpty() && m2.isEmpty())
			return true;
		if (m1.isEmpty() || m2.isEmpty())
			return false;

		final Matcher head1 = m1.get(0);
		final Matcher head2 = m2.get(0);
		final List<Matcher> tail1 = m1.subList(1, m1.size());
		final List<Matcher> tail2 = m2.subList(1, m2.size());

		// arguments need not be equal, they are expected to be the two opposite ends
		if (isArgument(head1) && isArgument(head2))
			return compare(tail1, tail2);
		// edges must be opposites of each other
		if (head1.getKind().isEdge() && head2.getKind().isEdge())
			return head1.equals(((EdgeMatcher) head2).flip()) && compare(tail1, tail2);
		// anything else must be equal
		return head1.equals(head2) && compare(tail1, tail2);
	}

	private static boolean isArgument(Matcher m)
	{
		return m.getKind() == Matcher.Kind.ExtractionPart && ((ExtractionPartMatcher) m).isArgument();
	}
}
