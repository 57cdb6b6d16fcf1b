package my.cmmloutcomes.app.service;

import my.cmmloutcomes.app.config.AppProperties;
import my.cmmloutcomes.app.service.aggregation.AggregationEngine;
import my.cmmloutcomes.app.service.aggregation.AggregationResult;
import my.cmmloutcomes.app.service.aggregation.DrugSubgroupSummary;
import my.cmmloutcomes.app.service.aggregation.Selector;
import my.cmmloutcomes.app.service.evidence.EvidenceStore;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read side for report generation: aggregates whatever the evidence store currently holds.
 */
@Service
public class EvidenceSummaryService {
	private final EvidenceStore evidenceStore;
	private final AggregationEngine aggregationEngine;
	private final Map<String, List<String>> combinedGroups;

	public EvidenceSummaryService(EvidenceStore evidenceStore,
								  AggregationEngine aggregationEngine,
								  AppProperties properties) {
		this.evidenceStore = evidenceStore;
		this.aggregationEngine = aggregationEngine;
		AppProperties.Aggregation aggregation = properties.aggregation();
		this.combinedGroups = aggregation == null || aggregation.combinedGroups() == null
				? Map.of()
				: aggregation.combinedGroups();
	}

	public AggregationResult aggregate(Selector selector) {
		return aggregationEngine.aggregate(evidenceStore.records(), selector);
	}

	public List<DrugSubgroupSummary> summarizeStoredDrugs() {
		return summarize(evidenceStore.drugs());
	}

	public List<DrugSubgroupSummary> summarize(Collection<String> drugs) {
		return aggregationEngine.summarize(evidenceStore.records(), drugs, combinedGroups);
	}
}
