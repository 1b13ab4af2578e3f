package edu.upf.taln.relpatterns.core.matchers;

import com.google.common.base.Preconditions;

/**
 * Matches an edge with any label in a given direction
 */
public final class WildcardEdgeMatcher extends EdgeMatcher
{
	private final Direction direction;

	public WildcardEdgeMatcher(Direction direction)
	{
		this.direction = Preconditions.checkNotNull(direction);
	}

	public Direction getDirection() { return direction; }

	@Override
	public WildcardEdgeMatcher flip()
	{
		return new WildcardEdgeMatcher(direction.flip());
	}

	@Override
	public Kind getKind() { return Kind.WildcardEdge; }

	@Override
	public String serialize()
	{
		return "" + direction.getSymbol() + direction.getSymbol();
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		return direction == ((WildcardEdgeMatcher) o).direction;
	}

	@Override
	public int hashCode()
	{
		return direction.hashCode();
	}
}
