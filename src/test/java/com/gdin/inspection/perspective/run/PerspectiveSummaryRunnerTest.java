package com.gdin.inspection.perspective.run;

import com.gdin.inspection.perspective.ScriptedTextGenerator;
import com.gdin.inspection.perspective.exception.DocumentConflictException;
import com.gdin.inspection.perspective.exception.InsufficientEvidenceException;
import com.gdin.inspection.perspective.io.QueryRecord;
import com.gdin.inspection.perspective.io.ResultRecord;
import com.gdin.inspection.perspective.models.*;
import jakarta.annotation.Resource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 整条流水线：检索 -> 立场划分 -> 正反合成 -> 校验组装。
 * 共享文档库在测试之间共享，往里装数据的用例使用不同的文档 id。
 */
@SpringBootTest
@ActiveProfiles("test")
public class PerspectiveSummaryRunnerTest {

    @TestConfiguration
    static class ScriptedGeneratorConfig {
        @Bean
        @Primary
        public ScriptedTextGenerator scriptedTextGenerator() {
            return new ScriptedTextGenerator();
        }
    }

    @Resource
    private PerspectiveSummaryRunner runner;

    @Resource
    private ScriptedTextGenerator generator;

    @BeforeEach
    public void setUp() {
        generator.reset();
    }

    private static Map<String, String> docs(String... idAndText) {
        Map<String, String> docs = new LinkedHashMap<>();
        for (int i = 0; i < idAndText.length; i += 2) docs.put(idAndText[i], idAndText[i + 1]);
        return docs;
    }

    private static QueryRequest request(String id, String text, Map<String, String> docs) {
        return QueryRequest.builder().query(Query.of(id, text)).documents(docs).build();
    }

    private static Set<String> cited(Claim claim) {
        return claim.citedDocIds();
    }

    @Test
    public void testSurrealistMemes() {
        generator.label("205", "PRO").label("364", "PRO")
                .label("1138", "CON").label("858", "CON")
                .label("77", "NEUTRAL");

        QueryOutcome outcome = runner.run(request("Entertainment_0", "Are surrealist memes good for internet culture?", docs(
                "205", "Surrealist memes spark creativity and invite viewers to imagine absurd new worlds.",
                "364", "Young audiences share surrealist memes as a playful form of digital art.",
                "1138", "Surrealist memes often confuse older users and spread misinformation online.",
                "858", "Critics say absurd meme humor erodes attention spans and meaningful discussion.",
                "77", "The weather in Paris was mild this spring.")));

        assertTrue(outcome.isSuccess(), () -> String.valueOf(outcome.getError()));
        Result result = outcome.getResult();
        assertEquals("Entertainment_0", result.getQueryId());
        assertEquals(Polarity.PRO, result.getClaimPro().getPolarity());
        assertEquals(Polarity.CON, result.getClaimCon().getPolarity());
        assertEquals("Yes, overall this is worthwhile.", result.getClaimPro().getText());

        assertTrue(Set.of("205", "364").containsAll(cited(result.getClaimPro())));
        assertTrue(Set.of("1138", "858").containsAll(cited(result.getClaimCon())));
        assertFalse(cited(result.getClaimPro()).contains("77"));
        for (Claim claim : List.of(result.getClaimPro(), result.getClaimCon())) {
            assertFalse(claim.getPerspectives().isEmpty());
            claim.getPerspectives().forEach(p -> assertFalse(p.getSupportingDocIds().isEmpty()));
        }
        assertEquals(1, generator.getStanceCalls());

        ResultRecord record = outcome.toRecord();
        assertNull(record.getError());
        assertEquals("Entertainment_0", record.getQueryId());
    }

    @Test
    public void testEmptyConPoolFailsWithoutPartialResult() {
        generator.label("501", "PRO").label("502", "PRO");

        QueryOutcome outcome = runner.run(request("q-empty-con", "Is remote work productive?", docs(
                "501", "Remote workers report fewer interruptions and deeper focus.",
                "502", "Companies see productivity gains after adopting remote schedules.")));

        assertFalse(outcome.isSuccess());
        assertNull(outcome.getResult());
        InsufficientEvidenceException e = assertInstanceOf(InsufficientEvidenceException.class, outcome.getError());
        assertEquals(Set.of(Polarity.CON), e.getEmptyPolarities());
        // 立场划分失败后不再调用合成
        assertEquals(0, generator.getPerspectiveCalls());
        assertNotNull(outcome.toRecord().getError());
    }

    @Test
    public void testBatchFailureIsIsolatedAndOrderPreserved() {
        generator.label("601", "PRO").label("602", "CON")
                .label("611", "NEUTRAL").label("612", "NEUTRAL")
                .label("621", "PRO").label("622", "CON");

        List<QueryOutcome> outcomes = runner.runAll(List.of(
                request("q-a", "Should cities ban cars downtown?", docs(
                        "601", "Car free streets make downtown safer for walking families.",
                        "602", "Shop owners fear losing customers who arrive by car.")),
                request("q-b", "Is pineapple acceptable on pizza?", docs(
                        "611", "Pizza was first sold in Naples.",
                        "612", "Pineapples grow in tropical climates.")),
                request("q-c", "Should homework be abolished?", docs(
                        "621", "Homework stress harms sleep for many teenagers.",
                        "622", "Practice at home reinforces lessons taught in class."))));

        assertEquals(List.of("q-a", "q-b", "q-c"), outcomes.stream().map(QueryOutcome::getQueryId).toList());
        assertTrue(outcomes.get(0).isSuccess(), () -> String.valueOf(outcomes.get(0).getError()));
        assertFalse(outcomes.get(1).isSuccess());
        assertInstanceOf(InsufficientEvidenceException.class, outcomes.get(1).getError());
        assertTrue(outcomes.get(2).isSuccess(), () -> String.valueOf(outcomes.get(2).getError()));
        assertEquals(Set.of("621"), cited(outcomes.get(2).getResult().getClaimPro()));
    }

    @Test
    public void testSameQueryTextUnderTwoIdsIsNotMerged() {
        generator.label("701", "PRO").label("702", "CON");
        Map<String, String> docs = docs(
                "701", "School uniforms reduce peer pressure about clothing.",
                "702", "Uniform policies limit student self expression.");

        List<QueryOutcome> outcomes = runner.runAll(List.of(
                request("dup-1", "Should schools require uniforms?", docs),
                request("dup-2", "Should schools require uniforms?", docs)));

        assertEquals(2, outcomes.size());
        assertEquals("dup-1", outcomes.get(0).getResult().getQueryId());
        assertEquals("dup-2", outcomes.get(1).getResult().getQueryId());
    }

    @Test
    public void testGoldLabelsSkipStanceModel() {
        QueryRecord record = QueryRecord.builder()
                .id("q-gold")
                .query("Should voting be mandatory?")
                .docs(docs(
                        "801", "Mandatory voting raises turnout across every social group.",
                        "802", "Forcing citizens to vote infringes on personal freedom."))
                .favorIds(List.of("Doc 801"))
                .againstIds(List.of("802"))
                .build();

        List<QueryOutcome> outcomes = runner.runRecords(List.of(record));

        assertTrue(outcomes.get(0).isSuccess(), () -> String.valueOf(outcomes.get(0).getError()));
        assertEquals(0, generator.getStanceCalls());
        assertEquals(Set.of("801"), cited(outcomes.get(0).getResult().getClaimPro()));
        assertEquals(Set.of("802"), cited(outcomes.get(0).getResult().getClaimCon()));
    }

    @Test
    public void testRequestsReusingDocumentIdsStayApart() {
        generator.label("1", "PRO").label("2", "CON");

        List<QueryOutcome> outcomes = runner.runAll(List.of(
                request("q-solar", "Should homes install solar panels?", docs(
                        "1", "Solar panels cut household electricity bills dramatically.",
                        "2", "Solar farms occupy farmland needed for crops.")),
                request("q-library", "Are public libraries worth funding?", docs(
                        "1", "Public libraries offer free access to books and internet.",
                        "2", "Library budgets divert funds from schools and roads."))));

        assertTrue(outcomes.get(0).isSuccess(), () -> String.valueOf(outcomes.get(0).getError()));
        assertTrue(outcomes.get(1).isSuccess(), () -> String.valueOf(outcomes.get(1).getError()));
        String solarPro = outcomes.get(0).getResult().getClaimPro().getPerspectives().get(0).getText();
        String libraryPro = outcomes.get(1).getResult().getClaimPro().getPerspectives().get(0).getText();
        assertTrue(solarPro.contains("Solar panels"), solarPro);
        assertTrue(libraryPro.contains("Public libraries"), libraryPro);

        // 每个查询的 prompt 只包含自己的文档
        for (String prompt : generator.getPrompts()) {
            assertFalse(prompt.contains("Solar") && prompt.contains("Public libraries"));
        }
    }

    @Test
    public void testRequestWithoutDocumentsSearchesLoadedCorpus() {
        runner.loadCorpus(List.of(
                Document.of("901", "Daylight saving time gives families longer summer evenings outdoors."),
                Document.of("902", "Changing clocks twice a year disrupts sleep and raises accident rates.")));
        generator.label("901", "PRO").label("902", "CON");

        QueryOutcome outcome = runner.run(request("q-dst", "Should daylight saving time be kept?", null));

        assertTrue(outcome.isSuccess(), () -> String.valueOf(outcome.getError()));
        assertEquals(Set.of("901"), cited(outcome.getResult().getClaimPro()));
        assertEquals(Set.of("902"), cited(outcome.getResult().getClaimCon()));
    }

    @Test
    public void testLoadCorpusRejectsConflictingText() {
        runner.loadCorpus(List.of(Document.of("951", "Original text about tides.")));
        runner.loadCorpus(List.of(Document.of("951", "Original text about tides.")));

        DocumentConflictException e = assertThrows(DocumentConflictException.class,
                () -> runner.loadCorpus(List.of(Document.of("951", "A different text about moons."))));
        assertEquals("951", e.getDocumentId());
    }
}
