package my.cmmloutcomes.app.domain;

public record StudyAttribution(
		String studyType,
		String keyFindings,
		String patientPopulation,
		String treatmentDetails,
		String dataLocation
) {
	private static final StudyAttribution NONE = new StudyAttribution(null, null, null, null, null);

	public static StudyAttribution none() {
		return NONE;
	}
}
