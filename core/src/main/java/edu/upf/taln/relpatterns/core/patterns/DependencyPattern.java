package edu.upf.taln.relpatterns.core.patterns;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import edu.upf.taln.relpatterns.core.matchers.Direction;
import edu.upf.taln.relpatterns.core.matchers.EdgeMatcher;
import edu.upf.taln.relpatterns.core.matchers.LabelEdgeMatcher;
import edu.upf.taln.relpatterns.core.matchers.Matcher;
import edu.upf.taln.relpatterns.core.matchers.NodeMatcher;

import java.util.List;
import java.util.stream.IntStream;

import static java.util.stream.Collectors.joining;

/**
 * A path-shaped template over a dependency graph: a sequence of matchers alternating node matchers and edge
 * matchers, starting and ending with a node matcher.
 * Immutable class.
 */
public class DependencyPattern
{
	public static final String SEPARATOR = " ";
	private final ImmutableList<Matcher> matchers;

	public DependencyPattern(List<? extends Matcher> matchers)
	{
		Preconditions.checkArgument(matchers.isEmpty() || matchers.size() % 2 == 1,
				"Pattern must have an odd number of matchers: %s", matchers);
		IntStream.range(0, matchers.size()).forEach(i ->
		{
			final Matcher m = Preconditions.checkNotNull(matchers.get(i));
			final boolean node_expected = i % 2 == 0;
			Preconditions.checkArgument(node_expected == m.getKind().isNode(),
					"Expected %s matcher at position %s, found %s", node_expected ? "node" : "edge", i, m);
			if (node_expected)
				Preconditions.checkArgument(!rendersAsEdge(m),
						"Node matcher at position %s would be written as an edge: %s", i, m);
		});

		this.matchers = ImmutableList.copyOf(matchers);
	}

	// Text starting and ending with the same direction symbol is read back as an edge, e.g. "<nn<" or "<nn<:<amod<"
	private static boolean rendersAsEdge(Matcher m)
	{
		final String text = m.serialize();
		if (text.length() < 2)
			return false;
		final char first = text.charAt(0);
		return (first == Direction.Up.getSymbol() || first == Direction.Down.getSymbol()) && first == text.charAt(text.length() - 1);
	}

	public List<Matcher> getMatchers() { return matchers; }
	public int size() { return matchers.size(); }
	public boolean isEmpty() { return matchers.isEmpty(); }

	// i-th edge matcher sits between i-th and i+1-th node matchers
	public List<EdgeMatcher> getEdgeMatchers()
	{
		return IntStream.range(0, matchers.size())
				.filter(i -> i % 2 == 1)
				.mapToObj(i -> (EdgeMatcher) matchers.get(i))
				.collect(ImmutableList.toImmutableList());
	}

	public List<NodeMatcher> getNodeMatchers()
	{
		return IntStream.range(0, matchers.size())
				.filter(i -> i % 2 == 0)
				.mapToObj(i -> (NodeMatcher) matchers.get(i))
				.collect(ImmutableList.toImmutableList());
	}

	public List<EdgeMatcher> getBaseEdgeMatchers()
	{
		return getEdgeMatchers().stream()
				.flatMap(e -> e.getBaseEdgeMatchers().stream())
				.collect(ImmutableList.toImmutableList());
	}

	/**
	 * Base edge matchers carrying a label. Edge matchers without a label, e.g. wildcards, are left out.
	 */
	public List<LabelEdgeMatcher> getBaseEdgeLabels()
	{
		return getBaseEdgeMatchers().stream()
				.filter(e -> e.getKind() == Matcher.Kind.LabelEdge)
				.map(e -> (LabelEdgeMatcher) e)
				.collect(ImmutableList.toImmutableList());
	}

	public String serialize()
	{
		return matchers.stream()
				.map(Matcher::serialize)
				.collect(joining(SEPARATOR));
	}

	@Override
	public String toString()
	{
		return serialize();
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		return matchers.equals(((DependencyPattern) o).matchers);
	}

	@Override
	public int hashCode()
	{
		return matchers.hashCode();
	}
}
