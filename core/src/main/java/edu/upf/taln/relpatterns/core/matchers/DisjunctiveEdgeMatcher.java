package edu.upf.taln.relpatterns.core.matchers;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

import static java.util.stream.Collectors.joining;

/**
 * Matches an edge accepted by any of a set of label matchers sharing the same direction, e.g. >nsubj|nsubjpass>
 */
public final class DisjunctiveEdgeMatcher extends EdgeMatcher
{
	public static final String SEPARATOR = "|";
	private final ImmutableList<LabelEdgeMatcher> matchers;

	public DisjunctiveEdgeMatcher(List<LabelEdgeMatcher> matchers)
	{
		Preconditions.checkArgument(matchers.size() > 1, "A disjunction needs at least two matchers: %s", matchers);
		final Direction direction = matchers.get(0).getDirection();
		Preconditions.checkArgument(matchers.stream().allMatch(m -> m.getDirection() == direction),
				"Alternatives in a disjunction must share direction: %s", matchers);
		this.matchers = ImmutableList.copyOf(matchers);
	}

	public List<LabelEdgeMatcher> getMatchers() { return matchers; }
	public Direction getDirection() { return matchers.get(0).getDirection(); }

	@Override
	public DisjunctiveEdgeMatcher flip()
	{
		return new DisjunctiveEdgeMatcher(matchers.stream()
				.map(LabelEdgeMatcher::flip)
				.collect(ImmutableList.toImmutableList()));
	}

	@Override
	public List<EdgeMatcher> getBaseEdgeMatchers()
	{
		return ImmutableList.copyOf(matchers);
	}

	@Override
	public Kind getKind() { return Kind.EdgeDisjunction; }

	@Override
	public String serialize()
	{
		final char symbol = getDirection().getSymbol();
		return symbol + matchers.stream()
				.map(LabelEdgeMatcher::serializeLabel)
				.collect(joining(SEPARATOR)) + symbol;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		return matchers.equals(((DisjunctiveEdgeMatcher) o).matchers);
	}

	@Override
	public int hashCode()
	{
		return matchers.hashCode();
	}
}
