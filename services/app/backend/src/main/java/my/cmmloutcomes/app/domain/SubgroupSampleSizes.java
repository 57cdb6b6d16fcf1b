package my.cmmloutcomes.app.domain;

public record SubgroupSampleSizes(Integer rasMutant, Integer nonRasMutant) {
	private static final SubgroupSampleSizes UNKNOWN = new SubgroupSampleSizes(null, null);

	public static SubgroupSampleSizes unknown() {
		return UNKNOWN;
	}

	public Integer forSubgroup(Subgroup subgroup) {
		return switch (subgroup) {
			case RAS_MUTANT -> rasMutant;
			case NON_RAS_MUTANT -> nonRasMutant;
			case OVERALL -> null;
		};
	}
}
