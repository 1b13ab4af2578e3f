package edu.upf.taln.relpatterns.core.matchers;

/**
 * Direction in which a dependency edge is traversed. Down goes from governor to dependent, Up from dependent
 * to governor.
 */
public enum Direction
{
	Up('<'), Down('>');

	private final char symbol;

	Direction(char symbol)
	{
		this.symbol = symbol;
	}

	public char getSymbol() { return symbol; }

	public Direction flip()
	{
		return this == Up ? Down : Up;
	}

	public static Direction fromSymbol(char c)
	{
		switch (c)
		{
			case '<':
				return Up;
			case '>':
				return Down;
			default:
				throw new IllegalArgumentException("Not a direction symbol: " + c);
		}
	}
}
