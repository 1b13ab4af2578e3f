package edu.upf.taln.relpatterns.core.matchers;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Constrains a node attribute, e.g. postag=VBD or text=of
 */
public final class AttributeNodeMatcher extends NodeMatcher
{
	public enum Attribute
	{
		Postag("postag"), Text("text"), Regex("regex");

		private final String key;

		Attribute(String key)
		{
			this.key = key;
		}

		public String getKey() { return key; }

		public static Optional<Attribute> fromKey(String key)
		{
			return Arrays.stream(values())
					.filter(a -> a.key.equals(key))
					.findFirst();
		}
	}

	public static final char SEPARATOR = '=';
	private final Attribute attribute;
	private final String value;

	public AttributeNodeMatcher(Attribute attribute, String value)
	{
		Preconditions.checkNotNull(attribute);
		Preconditions.checkArgument(StringUtils.isNotBlank(value), "Empty value for attribute %s", attribute);
		if (attribute == Attribute.Regex)
			Pattern.compile(value); // throws PatternSyntaxException on malformed expressions

		this.attribute = attribute;
		this.value = value;
	}

	public static AttributeNodeMatcher postag(String postag) { return new AttributeNodeMatcher(Attribute.Postag, postag); }
	public static AttributeNodeMatcher text(String text) { return new AttributeNodeMatcher(Attribute.Text, text); }
	public static AttributeNodeMatcher regex(String regex) { return new AttributeNodeMatcher(Attribute.Regex, regex); }

	public Attribute getAttribute() { return attribute; }
	public String getValue() { return value; }

	@Override
	public Kind getKind() { return Kind.Attribute; }

	@Override
	public String serialize()
	{
		return attribute.getKey() + SEPARATOR + value;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		AttributeNodeMatcher that = (AttributeNodeMatcher) o;
		return attribute == that.attribute && value.equals(that.value);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(attribute, value);
	}
}
