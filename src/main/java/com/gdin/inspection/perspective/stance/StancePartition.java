package com.gdin.inspection.perspective.stance;

import com.gdin.inspection.perspective.models.Polarity;
import lombok.Value;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 立场划分结果。三个列表两两不相交，均保持检索顺序。
 */
@Value
public class StancePartition {
    List<String> proIds;
    List<String> conIds;
    // NEUTRAL / 无法解析 / 冲突的文档
    List<String> excludedIds;

    public List<String> pool(Polarity polarity) {
        return polarity == Polarity.PRO ? proIds : conIds;
    }

    public Set<Polarity> emptyPolarities() {
        Set<Polarity> empty = EnumSet.noneOf(Polarity.class);
        if (proIds.isEmpty()) empty.add(Polarity.PRO);
        if (conIds.isEmpty()) empty.add(Polarity.CON);
        return empty;
    }
}
