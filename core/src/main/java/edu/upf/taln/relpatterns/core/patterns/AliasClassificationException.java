package edu.upf.taln.relpatterns.core.patterns;

/**
 * Thrown when a capture alias does not tell which part of an extraction the capture stands for
 */
public class AliasClassificationException extends Exception
{
	private final String alias;

	public AliasClassificationException(String alias)
	{
		super("Unknown capture alias: " + alias);
		this.alias = alias;
	}

	public String getAlias() { return alias; }
}
