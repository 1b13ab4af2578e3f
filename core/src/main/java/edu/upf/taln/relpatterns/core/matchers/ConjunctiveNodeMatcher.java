package edu.upf.taln.relpatterns.core.matchers;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

import static java.util.stream.Collectors.joining;

/**
 * A node matcher requiring all of its components to hold
 */
public final class ConjunctiveNodeMatcher extends NodeMatcher
{
	public static final String SEPARATOR = ":";
	private final ImmutableList<NodeMatcher> matchers;

	public ConjunctiveNodeMatcher(List<? extends NodeMatcher> matchers)
	{
		Preconditions.checkArgument(matchers.size() > 1, "A conjunction needs at least two matchers: %s", matchers);
		Preconditions.checkArgument(matchers.stream().noneMatch(m -> m.getKind() == Kind.Capture || m.getKind() == Kind.ExtractionPart),
				"Captures cannot be part of a conjunction: %s", matchers);
		this.matchers = ImmutableList.copyOf(matchers);
	}

	public List<NodeMatcher> getMatchers() { return matchers; }

	@Override
	public List<NodeMatcher> getBaseNodeMatchers()
	{
		return matchers.stream()
				.flatMap(m -> m.getBaseNodeMatchers().stream())
				.collect(ImmutableList.toImmutableList());
	}

	@Override
	public Kind getKind() { return Kind.Conjunction; }

	@Override
	public String serialize()
	{
		return matchers.stream()
				.map(Matcher::serialize)
				.collect(joining(SEPARATOR));
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		return matchers.equals(((ConjunctiveNodeMatcher) o).matchers);
	}

	@Override
	public int hashCode()
	{
		return matchers.hashCode();
	}
}
