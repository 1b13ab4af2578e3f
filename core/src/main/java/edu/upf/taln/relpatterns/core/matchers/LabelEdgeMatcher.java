package edu.upf.taln.relpatterns.core.matchers;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;

import java.util.Objects;

/**
 * Matches an edge by its exact dependency label, traversed in a given direction. A negated matcher accepts
 * any edge but those with the label.
 */
public final class LabelEdgeMatcher extends EdgeMatcher
{
	public static final char NEGATION = '!';
	private static final String forbidden_label_chars = "{}:<>|!= \t";

	private final String label;
	private final Direction direction;
	private final boolean negated;

	public LabelEdgeMatcher(String label, Direction direction)
	{
		this(label, direction, false);
	}

	public LabelEdgeMatcher(String label, Direction direction, boolean negated)
	{
		Preconditions.checkArgument(StringUtils.isNotEmpty(label), "Empty edge label");
		Preconditions.checkArgument(StringUtils.containsNone(label, forbidden_label_chars), "Invalid edge label %s", label);
		this.label = label;
		this.direction = Preconditions.checkNotNull(direction);
		this.negated = negated;
	}

	public static LabelEdgeMatcher down(String label) { return new LabelEdgeMatcher(label, Direction.Down); }
	public static LabelEdgeMatcher up(String label) { return new LabelEdgeMatcher(label, Direction.Up); }

	public String getLabel() { return label; }
	public Direction getDirection() { return direction; }
	public boolean isNegated() { return negated; }

	@Override
	public LabelEdgeMatcher flip()
	{
		return new LabelEdgeMatcher(label, direction.flip(), negated);
	}

	@Override
	public Kind getKind() { return Kind.LabelEdge; }

	// Label with its negation mark, as written between direction symbols
	String serializeLabel()
	{
		return negated ? NEGATION + label : label;
	}

	@Override
	public String serialize()
	{
		return direction.getSymbol() + serializeLabel() + direction.getSymbol();
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		LabelEdgeMatcher that = (LabelEdgeMatcher) o;
		return negated == that.negated && direction == that.direction && label.equals(that.label);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(label, direction, negated);
	}
}
