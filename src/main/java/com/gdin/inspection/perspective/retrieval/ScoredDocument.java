package com.gdin.inspection.perspective.retrieval;

import lombok.Value;

@Value
public class ScoredDocument {
    String documentId;
    double score;
}
