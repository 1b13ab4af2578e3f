package edu.upf.taln.relpatterns.core.io;

import edu.upf.taln.relpatterns.core.matchers.AttributeNodeMatcher;
import edu.upf.taln.relpatterns.core.matchers.AttributeNodeMatcher.Attribute;
import edu.upf.taln.relpatterns.core.matchers.CaptureNodeMatcher;
import edu.upf.taln.relpatterns.core.matchers.ConjunctiveNodeMatcher;
import edu.upf.taln.relpatterns.core.matchers.DisjunctiveEdgeMatcher;
import edu.upf.taln.relpatterns.core.matchers.Direction;
import edu.upf.taln.relpatterns.core.matchers.EdgeMatcher;
import edu.upf.taln.relpatterns.core.matchers.EdgeNodeMatcher;
import edu.upf.taln.relpatterns.core.matchers.LabelEdgeMatcher;
import edu.upf.taln.relpatterns.core.matchers.Matcher;
import edu.upf.taln.relpatterns.core.matchers.NodeMatcher;
import edu.upf.taln.relpatterns.core.matchers.TrivialNodeMatcher;
import edu.upf.taln.relpatterns.core.matchers.WildcardEdgeMatcher;
import edu.upf.taln.relpatterns.core.patterns.DependencyPattern;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads dependency patterns from their textual form, one pattern per line, e.g.
 * <pre>{arg1} &lt;nsubj&lt; {rel:postag=VBD} >dobj> {arg2}</pre>
 * Tokens are separated by whitespace and alternate node and edge matchers.
 * <ul>
 *     <li>Nodes: <code>*</code>, constraints such as <code>postag=NN</code>, <code>text=of</code>,
 *     <code>regex=^be.*</code> or <code>&lt;nn&lt;</code> joined with ':', or captures <code>{alias}</code>
 *     and <code>{alias:constraints}</code>.</li>
 *     <li>Edges: <code>>label></code> goes down from governor to dependent, <code>&lt;label&lt;</code> goes
 *     up. Labels can be negated with '!' and combined with '|'. <code>>></code> and <code>&lt;&lt;</code>
 *     match any label.</li>
 * </ul>
 */
public class PatternReader
{
	public DependencyPattern read(String line) throws PatternFormatException
	{
		if (StringUtils.isBlank(line))
			throw new PatternFormatException("Empty pattern", String.valueOf(line));

		final String[] tokens = StringUtils.split(line.trim());
		if (tokens.length % 2 == 0)
			throw new PatternFormatException("Pattern must start and end with a node", line);

		final List<Matcher> matchers = new ArrayList<>(tokens.length);
		for (int i = 0; i < tokens.length; ++i)
		{
			if (i % 2 == 0)
				matchers.add(readNode(tokens[i]));
			else
				matchers.add(readEdge(tokens[i]));
		}

		return new DependencyPattern(matchers);
	}

	public List<DependencyPattern> read(List<String> lines) throws PatternFormatException
	{
		final List<DependencyPattern> patterns = new ArrayList<>(lines.size());
		for (String line : lines)
			patterns.add(read(line));
		return patterns;
	}

	public NodeMatcher readNode(String token) throws PatternFormatException
	{
		if (isEdge(token))
			throw new PatternFormatException("Expected a node but found an edge", token);

		if (token.charAt(0) == CaptureNodeMatcher.OPEN)
			return readCapture(token);
		return readConstraints(token);
	}

	public EdgeMatcher readEdge(String token) throws PatternFormatException
	{
		if (!isEdge(token))
			throw new PatternFormatException("Expected an edge but found", token);

		final Direction direction = Direction.fromSymbol(token.charAt(0));
		final String body = token.substring(1, token.length() - 1);
		if (body.isEmpty())
			return new WildcardEdgeMatcher(direction);

		final String[] labels = StringUtils.splitPreserveAllTokens(body, DisjunctiveEdgeMatcher.SEPARATOR);
		final List<LabelEdgeMatcher> alternatives = new ArrayList<>(labels.length);
		for (String label : labels)
		{
			final boolean negated = label.length() > 1 && label.charAt(0) == LabelEdgeMatcher.NEGATION;
			final String l = negated ? label.substring(1) : label;
			try
			{
				alternatives.add(new LabelEdgeMatcher(l, direction, negated));
			}
			catch (IllegalArgumentException e)
			{
				throw new PatternFormatException("Invalid edge label '" + label + "'", token, e);
			}
		}

		return alternatives.size() == 1 ? alternatives.get(0) : new DisjunctiveEdgeMatcher(alternatives);
	}

	private NodeMatcher readCapture(String token) throws PatternFormatException
	{
		if (token.length() < 2 || token.charAt(token.length() - 1) != CaptureNodeMatcher.CLOSE)
			throw new PatternFormatException("Unbalanced braces in capture", token);

		final String body = token.substring(1, token.length() - 1);
		final String alias = StringUtils.substringBefore(body, CaptureNodeMatcher.SEPARATOR);
		if (body.contains(CaptureNodeMatcher.SEPARATOR) && StringUtils.substringAfter(body, CaptureNodeMatcher.SEPARATOR).isEmpty())
			throw new PatternFormatException("Empty node constraint in capture", token);
		final NodeMatcher inner = body.contains(CaptureNodeMatcher.SEPARATOR) ?
				readConstraints(StringUtils.substringAfter(body, CaptureNodeMatcher.SEPARATOR)) :
				TrivialNodeMatcher.get();
		try
		{
			return new CaptureNodeMatcher(alias, inner);
		}
		catch (IllegalArgumentException e)
		{
			throw new PatternFormatException("Invalid capture", token, e);
		}
	}

	private NodeMatcher readConstraints(String text) throws PatternFormatException
	{
		if (text.isEmpty())
			throw new PatternFormatException("Empty node constraint", text);
		if (text.equals(TrivialNodeMatcher.SYMBOL))
			return TrivialNodeMatcher.get();

		final String[] parts = StringUtils.splitPreserveAllTokens(text, ConjunctiveNodeMatcher.SEPARATOR);
		final List<NodeMatcher> constraints = new ArrayList<>(parts.length);
		for (String part : parts)
			constraints.add(readConstraint(part));

		return constraints.size() == 1 ? constraints.get(0) : new ConjunctiveNodeMatcher(constraints);
	}

	private NodeMatcher readConstraint(String text) throws PatternFormatException
	{
		if (text.isEmpty())
			throw new PatternFormatException("Empty node constraint", text);
		if (text.equals(TrivialNodeMatcher.SYMBOL))
			throw new PatternFormatException("'" + TrivialNodeMatcher.SYMBOL + "' cannot be combined with other constraints", text);
		if (text.indexOf(CaptureNodeMatcher.OPEN) >= 0 || text.indexOf(CaptureNodeMatcher.CLOSE) >= 0)
			throw new PatternFormatException("Unexpected brace in node constraint", text);
		if (isEdge(text))
			return new EdgeNodeMatcher(readEdge(text));

		final int separator = text.indexOf(AttributeNodeMatcher.SEPARATOR);
		if (separator < 0)
			throw new PatternFormatException("Node constraint must be of the form attribute=value", text);

		final String key = text.substring(0, separator);
		final String value = text.substring(separator + 1);
		final Attribute attribute = Attribute.fromKey(key)
				.orElseThrow(() -> new PatternFormatException("Unknown node attribute '" + key + "'", text));
		try
		{
			return new AttributeNodeMatcher(attribute, value);
		}
		catch (IllegalArgumentException e)
		{
			throw new PatternFormatException("Invalid value for attribute '" + key + "'", text, e);
		}
	}

	private static boolean isEdge(String token)
	{
		if (token.length() < 2)
			return false;
		final char first = token.charAt(0);
		final char last = token.charAt(token.length() - 1);
		return (first == '<' || first == '>') && first == last;
	}
}
