package my.cmmloutcomes.app.domain;

/**
 * A normalized literature record as delivered by retrieval. Only {@code identifier} is required;
 * {@code drugHint} records the search context the document was found under and is not authoritative.
 */
public record DocumentRecord(
		String identifier,
		String title,
		String abstractText,
		String fullText,
		String citation,
		String drugHint,
		String url,
		Integer publicationYear
) {
	public DocumentRecord {
		if (identifier == null || identifier.isBlank()) {
			throw new IllegalArgumentException("Document identifier is required");
		}
		identifier = identifier.trim();
	}

	public DocumentRecord(String identifier, String title, String abstractText, String citation, String drugHint) {
		this(identifier, title, abstractText, null, citation, drugHint, null, null);
	}

	public boolean hasFullText() {
		return fullText != null && !fullText.isBlank();
	}

	public String content() {
		if (hasFullText()) {
			return fullText;
		}
		StringBuilder content = new StringBuilder();
		if (title != null && !title.isBlank()) {
			content.append("Title: ").append(title.trim());
		}
		if (abstractText != null && !abstractText.isBlank()) {
			if (!content.isEmpty()) {
				content.append("\n\n");
			}
			content.append("Abstract: ").append(abstractText.trim());
		}
		return content.toString();
	}
}
