package edu.upf.taln.relpatterns.core.matchers;

/**
 * Base class of the elements of a dependency pattern: node matchers and edge matchers.
 * The hierarchy is closed: all subclasses live in this package. Matchers are immutable values with structural
 * equality, and their string form is the textual pattern syntax.
 */
public abstract class Matcher
{
	public enum Kind
	{
		Trivial, Attribute, Conjunction, EdgeConstraint, Capture, ExtractionPart, // node matchers
		LabelEdge, WildcardEdge, EdgeDisjunction; // edge matchers

		public boolean isEdge()
		{
			return this == LabelEdge || this == WildcardEdge || this == EdgeDisjunction;
		}

		public boolean isNode() { return !isEdge(); }
	}

	Matcher() {}

	public abstract Kind getKind();

	/**
	 * @return the textual form of this matcher, as read by a pattern reader
	 */
	public abstract String serialize();

	@Override
	public String toString()
	{
		return serialize();
	}
}
