package edu.upf.taln.relpatterns.core.matchers;

import java.util.List;

public abstract class EdgeMatcher extends Matcher
{
	EdgeMatcher() {}

	/**
	 * @return the matcher for the same edge traversed in the opposite direction
	 */
	public abstract EdgeMatcher flip();

	// Edge matchers with composite wrapping removed
	public List<EdgeMatcher> getBaseEdgeMatchers()
	{
		return List.of(this);
	}
}
