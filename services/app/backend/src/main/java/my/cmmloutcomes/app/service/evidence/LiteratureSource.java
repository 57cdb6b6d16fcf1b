package my.cmmloutcomes.app.service.evidence;

import my.cmmloutcomes.app.domain.DocumentRecord;

import java.util.List;

/**
 * Retrieval collaborator. Results may repeat documents across queries.
 */
public interface LiteratureSource {
	List<DocumentRecord> search(String query);
}
