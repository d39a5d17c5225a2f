package com.gdin.inspection.perspective.stance;

import com.gdin.inspection.perspective.models.Document;
import com.gdin.inspection.perspective.models.Query;
import com.gdin.inspection.perspective.util.DocumentIdResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 使用输入记录自带的立场标注（favor_ids / against_ids）。两边都出现的 id 排除。
 * 标注 id 与文档 id 的写法可以不同（"Doc 7" 对 "7"），由 {@link DocumentIdResolver} 对应。
 */
@Slf4j
public class LabeledStancePartitioner implements StancePartitioner {

    private final List<String> favorIds;
    private final List<String> againstIds;

    public LabeledStancePartitioner(Collection<String> favorIds, Collection<String> againstIds) {
        this.favorIds = nonNull(favorIds);
        this.againstIds = nonNull(againstIds);
    }

    @Override
    public StancePartition partition(Query query, List<Document> documents) {
        List<String> pro = new ArrayList<>();
        List<String> con = new ArrayList<>();
        List<String> excluded = new ArrayList<>();
        if (documents != null) {
            DocumentIdResolver resolver = new DocumentIdResolver(documents.stream().map(Document::getId).toList());
            Set<String> favor = resolveAll(resolver, favorIds);
            Set<String> against = resolveAll(resolver, againstIds);
            for (Document doc : documents) {
                boolean f = favor.contains(doc.getId());
                boolean a = against.contains(doc.getId());
                if (f && !a) pro.add(doc.getId());
                else if (a && !f) con.add(doc.getId());
                else excluded.add(doc.getId());
            }
        }
        log.info("[{}] labeled stance partition: pro={}, con={}, excluded={}", query.getId(), pro, con, excluded);
        return new StancePartition(List.copyOf(pro), List.copyOf(con), List.copyOf(excluded));
    }

    private static List<String> nonNull(Collection<String> ids) {
        return ids == null ? List.of() : ids.stream().filter(Objects::nonNull).toList();
    }

    // 不在检索结果里的标注 id 直接忽略
    private static Set<String> resolveAll(DocumentIdResolver resolver, List<String> labeled) {
        Set<String> out = new HashSet<>();
        for (String id : labeled) {
            String resolved = resolver.resolve(id);
            if (resolved != null) out.add(resolved);
        }
        return out;
    }
}
