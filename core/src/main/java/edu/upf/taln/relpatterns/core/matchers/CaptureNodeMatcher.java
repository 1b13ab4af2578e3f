package edu.upf.taln.relpatterns.core.matchers;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Objects;

/**
 * A node matcher that tags the matched node with an alias so that it can be extracted.
 * An inner matcher further constrains which nodes qualify.
 */
public class CaptureNodeMatcher extends NodeMatcher
{
	public static final char OPEN = '{';
	public static final char CLOSE = '}';
	public static final String SEPARATOR = ":";
	private static final String forbidden_alias_chars = "{}:<>|= \t";

	private final String alias;
	private final NodeMatcher matcher;

	public CaptureNodeMatcher(String alias)
	{
		this(alias, TrivialNodeMatcher.get());
	}

	public CaptureNodeMatcher(String alias, NodeMatcher matcher)
	{
		Preconditions.checkArgument(StringUtils.isNotEmpty(alias), "Empty capture alias");
		Preconditions.checkArgument(StringUtils.containsNone(alias, forbidden_alias_chars), "Invalid capture alias %s", alias);
		Preconditions.checkNotNull(matcher);
		Preconditions.checkArgument(matcher.getKind() != Kind.Capture && matcher.getKind() != Kind.ExtractionPart,
				"Nested capture in %s", alias);

		this.alias = alias;
		this.matcher = matcher;
	}

	public String getAlias() { return alias; }
	public NodeMatcher getMatcher() { return matcher; }

	@Override
	public List<NodeMatcher> getBaseNodeMatchers()
	{
		return matcher.getBaseNodeMatchers();
	}

	@Override
	public Kind getKind() { return Kind.Capture; }

	@Override
	public String serialize()
	{
		if (matcher.getKind() == Kind.Trivial)
			return OPEN + alias + CLOSE;
		return OPEN + alias + SEPARATOR + matcher.serialize() + CLOSE;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		CaptureNodeMatcher that = (CaptureNodeMatcher) o;
		return alias.equals(that.alias) && matcher.equals(that.matcher);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(alias, matcher);
	}
}
