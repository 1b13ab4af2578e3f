package edu.upf.taln.relpatterns.core.matchers;

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A capture typed with the part of the extraction it stands for: one of the two arguments, the relation or an
 * auxiliary slot. The role is fixed when the matcher is created.
 */
public final class ExtractionPartMatcher extends CaptureNodeMatcher
{
	public enum Role
	{
		Argument("arg"), Relation("rel"), Slot("slo");

		private final String prefix;

		Role(String prefix)
		{
			this.prefix = prefix;
		}

		public String getPrefix() { return prefix; }

		/**
		 * Role of a capture according to the first three characters of its alias
		 */
		public static Optional<Role> fromAlias(String alias)
		{
			final String prefix = StringUtils.left(alias, 3);
			return Arrays.stream(values())
					.filter(r -> r.prefix.equals(prefix))
					.findFirst();
		}
	}

	private final Role role;

	public ExtractionPartMatcher(Role role, String alias, NodeMatcher matcher)
	{
		super(alias, matcher);
		this.role = Objects.requireNonNull(role);
	}

	public static ExtractionPartMatcher argument(String alias) { return new ExtractionPartMatcher(Role.Argument, alias, TrivialNodeMatcher.get()); }
	public static ExtractionPartMatcher relation(String alias) { return new ExtractionPartMatcher(Role.Relation, alias, TrivialNodeMatcher.get()); }
	public static ExtractionPartMatcher slot(String alias) { return new ExtractionPartMatcher(Role.Slot, alias, TrivialNodeMatcher.get()); }

	public Role getRole() { return role; }
	public boolean isArgument() { return role == Role.Argument; }
	public boolean isRelation() { return role == Role.Relation; }
	public boolean isSlot() { return role == Role.Slot; }

	public ExtractionPartMatcher withMatcher(NodeMatcher matcher)
	{
		return new ExtractionPartMatcher(role, getAlias(), matcher);
	}

	@Override
	public Kind getKind() { return Kind.ExtractionPart; }

	@Override
	public boolean equals(Object o)
	{
		return super.equals(o) && role == ((ExtractionPartMatcher) o).role;
	}

	@Override
	public int hashCode()
	{
		return 31 * super.hashCode() + role.hashCode();
	}
}
