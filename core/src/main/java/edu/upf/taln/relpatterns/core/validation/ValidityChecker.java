package edu.upf.taln.relpatterns.core.validation;

import edu.upf.taln.relpatterns.core.matchers.EdgeNodeMatcher;
import edu.upf.taln.relpatterns.core.matchers.ExtractionPartMatcher;
import edu.upf.taln.relpatterns.core.matchers.LabelEdgeMatcher;
import edu.upf.taln.relpatterns.core.matchers.Matcher;
import edu.upf.taln.relpatterns.core.matchers.NodeMatcher;
import edu.upf.taln.relpatterns.core.patterns.DependencyPattern;
import edu.upf.taln.relpatterns.core.patterns.ExtractorPattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.IntStream;

/**
 * Heuristics deciding whether an extractor pattern is worth using. They discard dependency shapes that tend to
 * produce noisy or redundant extractions: ambiguous dep edges, compounded prepositions, coordination, and slots
 * left unconstrained at the ends of the pattern or next to noun compounds.
 */
public class ValidityChecker
{
	/**
	 * Rules are evaluated in declaration order, the first one that applies makes the pattern invalid.
	 */
	public enum Rule
	{
		DepEdge("dep edge", p -> existsEdge(p, e -> e.getLabel().equals("dep"))),
		MultiplePreps("multiple preps", p -> p.getEdgeMatchers().size() == 2 && countEdges(p, e -> e.getLabel().contains("prep")) > 1),
		ConjAnd("conj_and", p -> existsEdge(p, e -> e.getLabel().equals("conj_and"))),
		ConjOr("conj_or", p -> existsEdge(p, e -> e.getLabel().equals("conj_or"))),
		Conj("alt conj", p -> existsEdge(p, e -> e.getLabel().startsWith("conj"))),
		SlotAtEnd("ends with slot", ValidityChecker::slotAtEnd),
		SlotBordersNN("slot borders nn", ValidityChecker::slotBordersNN);

		private final String description;
		private final Predicate<ExtractorPattern> test;

		Rule(String description, Predicate<ExtractorPattern> test)
		{
			this.description = description;
			this.test = test;
		}

		public String getDescription() { return description; }

		public boolean appliesTo(ExtractorPattern pattern)
		{
			return test.test(pattern);
		}
	}

	private final static Logger log = LogManager.getLogger();

	public static boolean isValid(ExtractorPattern pattern)
	{
		return !findViolation(pattern).isPresent();
	}

	/**
	 * @return the first rule making the pattern invalid, if any
	 */
	public static Optional<Rule> findViolation(ExtractorPattern pattern)
	{
		final Optional<Rule> violation = Arrays.stream(Rule.values())
				.filter(r -> r.appliesTo(pattern))
				.findFirst();
		violation.ifPresent(r -> log.debug("invalid: " + r.getDescription() + ": " + pattern));
		return violation;
	}

	private static boolean existsEdge(DependencyPattern p, Predicate<LabelEdgeMatcher> pred)
	{
		return p.getBaseEdgeLabels().stream().anyMatch(pred);
	}

	private static long countEdges(DependencyPattern p, Predicate<LabelEdgeMatcher> pred)
	{
		return p.getBaseEdgeLabels().stream().filter(pred).count();
	}

	private static boolean isSlot(NodeMatcher m)
	{
		return m.getKind() == Matcher.Kind.ExtractionPart && ((ExtractionPartMatcher) m).isSlot();
	}

	// Checks if any of the node matchers composing m requires an nn edge
	private static boolean isNN(NodeMatcher m)
	{
		return m.getBaseNodeMatchers().stream()
				.filter(b -> b.getKind() == Matcher.Kind.EdgeConstraint)
				.flatMap(b -> ((EdgeNodeMatcher) b).getEdge().getBaseEdgeMatchers().stream())
				.filter(e -> e.getKind() == Matcher.Kind.LabelEdge)
				.anyMatch(e -> ((LabelEdgeMatcher) e).getLabel().equals("nn"));
	}

	private static boolean slotAtEnd(ExtractorPattern p)
	{
		final List<NodeMatcher> nodes = p.getNodeMatchers();
		return !nodes.isEmpty() && (isSlot(nodes.get(0)) || isSlot(nodes.get(nodes.size() - 1)));
	}

	// Neighbours are looked up in the sequence of node matchers
	private static boolean slotBordersNN(ExtractorPattern p)
	{
		final List<NodeMatcher> nodes = p.getNodeMatchers();
		return IntStream.range(0, nodes.size())
				.filter(i -> isSlot(nodes.get(i)))
				.anyMatch(i -> (i > 0 && isNN(nodes.get(i - 1))) || (i < nodes.size() - 1 && isNN(nodes.get(i + 1))));
	}
}
