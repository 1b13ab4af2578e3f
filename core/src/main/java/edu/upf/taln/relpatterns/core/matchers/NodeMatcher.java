package edu.upf.taln.relpatterns.core.matchers;

import java.util.List;

public abstract class NodeMatcher extends Matcher
{
	NodeMatcher() {}

	/**
	 * Node matchers composing this one. Simple matchers return themselves, composite ones their flattened
	 * components.
	 */
	public List<NodeMatcher> getBaseNodeMatchers()
	{
		return List.of(this);
	}
}
