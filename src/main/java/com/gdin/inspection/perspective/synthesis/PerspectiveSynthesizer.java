package com.gdin.inspection.perspective.synthesis;

import com.gdin.inspection.perspective.models.Claim;
import com.gdin.inspection.perspective.models.Document;
import com.gdin.inspection.perspective.models.Polarity;
import com.gdin.inspection.perspective.models.Query;

import java.util.List;

public interface PerspectiveSynthesizer {

    /**
     * 把一个立场的证据池合成为一条 claim。
     * <p>
     * 每条视角的支撑文档都来自 pool，且由聚类结果决定，不从生成文本中解析。
     *
     * @param pool     该立场的文档，按检索顺序
     * @param polarity 立场
     * @param hints    定向重新生成要求，首次合成传 {@link SynthesisHints#NONE}
     * @throws com.gdin.inspection.perspective.exception.SynthesisExhaustedException 重新生成次数用尽或生成服务持续失败
     */
    Claim synthesize(Query query, List<Document> pool, Polarity polarity, SynthesisHints hints);
}
