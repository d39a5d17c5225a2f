package com.gdin.inspection.perspective.io;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.gdin.inspection.perspective.util.IOUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * 读取输入记录，兼容：
 * <ul>
 *   <li>单个 JSON 对象或 JSON 数组</li>
 *   <li>docs 为 {id: text}，或 [{"id":..., "content"|"text":...}]</li>
 *   <li>id 为数字或字符串；缺省 id 按 query_&lt;下标&gt; 补齐</li>
 *   <li>数组形式的 docs 中同一 id 重复出现时正文必须相同</li>
 * </ul>
 */
@Slf4j
public class QueryRecordReader {

    public List<QueryRecord> read(InputStream is) throws IOException {
        JsonNode root = IOUtil.readTree(is);
        List<QueryRecord> records = new ArrayList<>();
        if (root == null || root.isMissingNode() || root.isNull()) return records;

        if (root.isArray()) {
            for (int i = 0; i < root.size(); i++) records.add(toRecord(root.get(i), i));
        } else if (root.isObject()) {
            records.add(toRecord(root, 0));
        } else {
            throw new IOException("expected a JSON object or array, got " + root.getNodeType());
        }
        log.info("read {} query record(s)", records.size());
        return records;
    }

    private QueryRecord toRecord(JsonNode node, int index) throws IOException {
        if (node == null || !node.isObject()) {
            throw new IOException("record " + index + " is not a JSON object");
        }
        String id = text(node.get("id"));
        if (StrUtil.isBlank(id)) id = "query_" + index;

        String query = text(node.get("query"));
        if (StrUtil.isBlank(query)) {
            throw new IOException("record " + id + " has no query text");
        }

        return QueryRecord.builder()
                .id(id)
                .query(query)
                .docs(readDocs(node.get("docs"), id))
                .favorIds(readIds(node.get("favor_ids")))
                .againstIds(readIds(node.get("against_ids")))
                .build();
    }

    private Map<String, String> readDocs(JsonNode docs, String recordId) throws IOException {
        Map<String, String> out = new LinkedHashMap<>();
        if (docs == null || docs.isNull()) return out;
        if (docs.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = docs.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                out.put(e.getKey(), StrUtil.nullToEmpty(text(e.getValue())));
            }
        } else if (docs.isArray()) {
            for (JsonNode doc : docs) {
                String docId = text(doc.get("id"));
                if (StrUtil.isBlank(docId)) {
                    log.warn("record {}: document without id skipped", recordId);
                    continue;
                }
                String content = StrUtil.nullToEmpty(text(doc.has("content") ? doc.get("content") : doc.get("text")));
                String previous = out.putIfAbsent(docId, content);
                if (previous != null && !previous.equals(content)) {
                    throw new IOException("record " + recordId + ": document " + docId + " appears twice with different text");
                }
            }
        } else {
            throw new IOException("record " + recordId + ": docs must be an object or an array");
        }
        return out;
    }

    private static List<String> readIds(JsonNode ids) {
        if (ids == null || !ids.isArray()) return null;
        List<String> out = new ArrayList<>(ids.size());
        for (JsonNode id : ids) {
            String s = text(id);
            if (StrUtil.isNotBlank(s)) out.add(s);
        }
        return out;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
