package com.gdin.inspection.perspective.stance;

import com.gdin.inspection.perspective.models.Document;
import com.gdin.inspection.perspective.models.Query;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class LabeledStancePartitionerTest {

    @Test
    public void testUsesGoldLabels() {
        List<Document> docs = List.of(
                Document.of("858", "a"), Document.of("205", "b"), Document.of("1138", "c"),
                Document.of("364", "d"), Document.of("5", "e"), Document.of("6", "f"));
        LabeledStancePartitioner partitioner = new LabeledStancePartitioner(
                List.of("205", "Doc 364", "6"), List.of("1138", "858", "6"));

        StancePartition p = partitioner.partition(Query.of("q", "query"), docs);

        assertEquals(List.of("205", "364"), p.getProIds());
        assertEquals(List.of("858", "1138"), p.getConIds());
        // 5 无标注，6 两边都有
        assertEquals(List.of("5", "6"), p.getExcludedIds());
    }

    @Test
    public void testDocumentIdsThatLookLikeDocPrefixes() {
        List<Document> docs = List.of(Document.of("doc1", "a"), Document.of("doc_2", "b"), Document.of("Doc 7", "c"));
        LabeledStancePartitioner partitioner = new LabeledStancePartitioner(
                List.of("doc1", "7"), List.of("Doc 2"));

        StancePartition p = partitioner.partition(Query.of("q", "query"), docs);

        assertEquals(List.of("doc1", "Doc 7"), p.getProIds());
        assertEquals(List.of("doc_2"), p.getConIds());
        assertEquals(List.of(), p.getExcludedIds());
    }
}
