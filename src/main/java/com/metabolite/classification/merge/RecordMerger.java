package com.metabolite.classification.merge;

import com.metabolite.classification.classification.Classifier;
import com.metabolite.classification.core.model.HmdbRecord;
import com.metabolite.classification.core.model.KeggRecord;
import com.metabolite.classification.core.model.MergedRecord;
import com.metabolite.classification.core.model.MetaboliteType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines the HMDB and KEGG records of one metabolite and attaches the final type.
 * KEGG fields are laid over HMDB fields; the two sources never share a column.
 */
public class RecordMerger {
    private static final Logger log = LoggerFactory.getLogger(RecordMerger.class);

    private final Classifier classifier;

    public RecordMerger() {
        this(new Classifier());
    }

    public RecordMerger(Classifier classifier) {
        this.classifier = classifier;
    }

    /**
     * @param hmdb may be null when HMDB was never queried for the name
     * @param kegg may be null when KEGG was never queried for the name
     */
    public MergedRecord merge(String metaboliteName, HmdbRecord hmdb, KeggRecord kegg) {
        HmdbRecord h = hmdb != null ? hmdb : HmdbRecord.absent();
        KeggRecord k = kegg != null ? kegg : KeggRecord.absent();

        MetaboliteType finalType = classifier.classify(k.type(), h.superClass());
        log.debug("merge.classified metabolite='{}' keggType={} superClass='{}' finalType={}",
                metaboliteName, k.type(), h.superClass(), finalType);
        return new MergedRecord(metaboliteName, h, k, finalType);
    }
}
