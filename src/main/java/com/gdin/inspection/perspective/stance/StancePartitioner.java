package com.gdin.inspection.perspective.stance;

import com.gdin.inspection.perspective.models.Document;
import com.gdin.inspection.perspective.models.Query;

import java.util.List;

/**
 * 把检索到的文档划分为 PRO / CON 两个证据池。
 * 无法可靠判断立场的文档放进 excludedIds，而不是猜一个立场。
 */
public interface StancePartitioner {

    StancePartition partition(Query query, List<Document> documents);
}
