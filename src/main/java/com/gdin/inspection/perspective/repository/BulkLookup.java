package com.gdin.inspection.perspective.repository;

import com.gdin.inspection.perspective.models.Document;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class BulkLookup {
    // 按请求顺序
    Map<String, Document> found;
    List<String> missingIds;

    public boolean hasMissing() {
        return !missingIds.isEmpty();
    }
}
