package edu.upf.taln.relpatterns.core.validation;

import edu.upf.taln.relpatterns.core.patterns.ExtractorPattern;

import java.util.function.Predicate;

/**
 * Queries that can be run on extractor patterns, with the verdicts they report
 */
public enum PatternCheck
{
	Validity("valid", "invalid", ValidityChecker::isValid),
	Symmetry("symmetric", "asymmetric", SymmetryChecker::isSymmetric);

	private final String positive;
	private final String negative;
	private final Predicate<ExtractorPattern> check;

	PatternCheck(String positive, String negative, Predicate<ExtractorPattern> check)
	{
		this.positive = positive;
		this.negative = negative;
		this.check = check;
	}

	public boolean test(ExtractorPattern pattern)
	{
		return check.test(pattern);
	}

	public String verdict(ExtractorPattern pattern)
	{
		return test(pattern) ? positive : negative;
	}
}
