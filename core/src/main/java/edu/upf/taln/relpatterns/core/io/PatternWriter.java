package edu.upf.taln.relpatterns.core.io;

import edu.upf.taln.relpatterns.core.patterns.DependencyPattern;

import java.util.Collection;

import static java.util.stream.Collectors.joining;

/**
 * Writes patterns in the one-pattern-per-line format read by {@link PatternReader}.
 * Output can always be read back: patterns do not accept node matchers whose text looks like an edge.
 */
public class PatternWriter
{
	public String write(DependencyPattern pattern)
	{
		return pattern.serialize();
	}

	public String write(Collection<? extends DependencyPattern> patterns)
	{
		return patterns.stream()
				.map(this::write)
				.collect(joining("\n"));
	}
}
