package com.metabolite.classification.kegg;

import com.metabolite.classification.core.model.KeggRecord;
import com.metabolite.classification.core.model.LookupResult;

import java.util.Set;

/**
 * Outcome of the two KEGG requests for one compound, kept separately.
 *
 * @param keggId   the compound id both requests were issued for
 * @param detail   result of {@code /get/cpd:<id>}
 * @param pathways result of {@code /link/pathway/cpd:<id>}
 */
public record KeggCompoundInfo(
        String keggId,
        LookupResult<KeggDetail> detail,
        LookupResult<Set<String>> pathways
) {

    public boolean isComplete() {
        return detail.isFound() && pathways.isFound();
    }

    /**
     * Message of the first failed request, in request order.
     */
    public String failureMessage() {
        if (!detail.isFound()) {
            return detail.message();
        }
        if (!pathways.isFound()) {
            return pathways.message();
        }
        return null;
    }

    /**
     * Builds the KEGG side of the record.
     *
     * @param keepPartial when false, a failure of either request discards both results;
     *                    when true, data from the succeeding request is kept and the status
     *                    still reports the failure
     */
    public KeggRecord toRecord(boolean keepPartial) {
        if (isComplete()) {
            KeggDetail d = detail.value();
            return KeggRecord.found(keggId, d.type(), pathways.value(), d.description());
        }
        if (!keepPartial || (!detail.isFound() && !pathways.isFound())) {
            return KeggRecord.error(failureMessage());
        }
        KeggDetail d = detail.value();
        KeggRecord failed = KeggRecord.error(failureMessage());
        return new KeggRecord(
                keggId,
                d != null ? d.type() : null,
                pathways.value(),
                d != null ? d.description() : null,
                failed.status());
    }
}
