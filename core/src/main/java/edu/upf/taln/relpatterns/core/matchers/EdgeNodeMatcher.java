package edu.upf.taln.relpatterns.core.matchers;

import com.google.common.base.Preconditions;

/**
 * Requires a node to have an incident edge accepted by an edge matcher, e.g. a noun carrying an nn modifier.
 * The edge is a property of the node and is not part of the path described by the pattern.
 */
public final class EdgeNodeMatcher extends NodeMatcher
{
	private final EdgeMatcher edge;

	public EdgeNodeMatcher(EdgeMatcher edge)
	{
		this.edge = Preconditions.checkNotNull(edge);
	}

	public EdgeMatcher getEdge() { return edge; }

	@Override
	public Kind getKind() { return Kind.EdgeConstraint; }

	@Override
	public String serialize()
	{
		return edge.serialize();
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		return edge.equals(((EdgeNodeMatcher) o).edge);
	}

	@Override
	public int hashCode()
	{
		return 31 * edge.hashCode() + 7;
	}
}
