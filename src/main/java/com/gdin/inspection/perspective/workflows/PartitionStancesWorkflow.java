package com.gdin.inspection.perspective.workflows;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.perspective.exception.InsufficientEvidenceException;
import com.gdin.inspection.perspective.models.Document;
import com.gdin.inspection.perspective.models.Polarity;
import com.gdin.inspection.perspective.models.Query;
import com.gdin.inspection.perspective.stance.LabeledStancePartitioner;
import com.gdin.inspection.perspective.stance.StancePartition;
import com.gdin.inspection.perspective.stance.StancePartitioner;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * workflow: partition_stances
 *
 * 输入：
 * - query
 * - retrieved_documents
 * - favor_ids / against_ids（可选，有标注时不调用大模型）
 *
 * 输出：
 * - stance_partition
 */
@Slf4j
@Service
public class PartitionStancesWorkflow {

    @Resource
    private StancePartitioner stancePartitioner;

    public StancePartition run(Query query, List<Document> retrieved, List<String> favorIds, List<String> againstIds) {
        StancePartitioner partitioner = stancePartitioner;
        if (CollectionUtil.isNotEmpty(favorIds) || CollectionUtil.isNotEmpty(againstIds)) {
            partitioner = new LabeledStancePartitioner(favorIds, againstIds);
        }

        StancePartition partition = partitioner.partition(query, retrieved);
        Set<Polarity> empty = partition.emptyPolarities();
        if (!empty.isEmpty()) {
            throw new InsufficientEvidenceException(query.getId(), empty);
        }
        return partition;
    }
}
