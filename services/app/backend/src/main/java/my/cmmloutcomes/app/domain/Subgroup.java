package my.cmmloutcomes.app.domain;

public enum Subgroup {
	OVERALL,
	RAS_MUTANT,
	NON_RAS_MUTANT
}
