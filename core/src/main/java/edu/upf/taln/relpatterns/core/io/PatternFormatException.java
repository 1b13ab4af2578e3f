package edu.upf.taln.relpatterns.core.io;

/**
 * Thrown when the textual form of a pattern cannot be read
 */
public class PatternFormatException extends Exception
{
	private final String text;

	public PatternFormatException(String message, String text)
	{
		super(message + ": " + text);
		this.text = text;
	}

	public PatternFormatException(String message, String text, Throwable cause)
	{
		super(message + ": " + text, cause);
		this.text = text;
	}

	// Offending text
	public String getText() { return text; }
}
