package com.gdin.inspection.perspective.synthesis.prompts;

import com.gdin.inspection.perspective.models.Polarity;

public final class PerspectivePrompts {

    private PerspectivePrompts() {}

    public static final String PERSPECTIVE_PROMPT = """
---Perspective Summary---

Summarize the shared argument of the documents below as ONE sentence that takes the {stance} side of the query.

---Rules---

1. Write exactly one sentence of at most 25 words.
2. Do not copy sentences from the documents; summarize the key point in your own words.
3. Only state what the documents support. Do not add outside facts.
4. Do not mention document ids.
{avoid}
---Query---

{query}

---Documents---

{documents}

---Perspective---
""";

    /**
     * 重新生成时追加：避免与同一 claim 下已有视角重复
     */
    public static final String AVOID_SECTION = """
5. The sentence must make a point that is clearly different from these existing perspectives:
{siblings}
""";

    public static final String CLAIM_PROMPT = """
---Claim Summary---

Write a short claim (at most 10 words) that answers the query from the {stance} side and summarizes all
of the perspectives below.

---Rules---

1. Output the claim only, as a single sentence.
2. The claim must be more general than any single perspective. Do not repeat a perspective verbatim.
{feedback}
---Query---

{query}

---Perspectives---

{perspectives}

---Claim---
""";

    public static final String CLAIM_FEEDBACK_SECTION = """
3. Your previous answer "{previous}" copied a perspective. Write a more general claim.
""";

    public static String stanceName(Polarity polarity) {
        return polarity == Polarity.PRO ? "supporting (PRO)" : "opposing (CON)";
    }
}
