package edu.upf.taln.relpatterns.core.matchers;

/**
 * Matches any node
 */
public final class TrivialNodeMatcher extends NodeMatcher
{
	public static final String SYMBOL = "*";
	private static final TrivialNodeMatcher instance = new TrivialNodeMatcher();

	private TrivialNodeMatcher() {}

	public static TrivialNodeMatcher get() { return instance; }

	@Override
	public Kind getKind() { return Kind.Trivial; }

	@Override
	public String serialize() { return SYMBOL; }

	@Override
	public boolean equals(Object o)
	{
		return o instanceof TrivialNodeMatcher;
	}

	@Override
	public int hashCode()
	{
		return SYMBOL.hashCode();
	}
}
