package com.gdin.inspection.perspective.synthesis.prompts;

public final class StancePrompts {

    private StancePrompts() {}

    public static final String STANCE_CLASSIFICATION_PROMPT = """
---Stance Classification---

You are given a contested query and a list of documents. For every document decide whether it argues
FOR the query (PRO), AGAINST the query (CON), or neither (NEUTRAL).

---Rules---

1. Judge each document on its own content only.
2. Use NEUTRAL for documents that are off-topic, purely factual without a position, or mixed.
3. Use the document ids exactly as they appear after "Doc".
4. Return one JSON object and nothing else. Keys are document ids, values are "PRO", "CON" or "NEUTRAL".

---Example output---

{"205": "PRO", "1138": "CON", "77": "NEUTRAL"}

---Query---

{query}

---Documents---

{documents}

---Output---
""";
}
