package com.gdin.inspection.perspective.validation;

import com.gdin.inspection.perspective.config.properties.PerspectiveProperties;
import com.gdin.inspection.perspective.doc.tokenizer.EnglishTokenizer;
import com.gdin.inspection.perspective.models.Claim;
import com.gdin.inspection.perspective.models.Perspective;
import com.gdin.inspection.perspective.models.Polarity;
import com.gdin.inspection.perspective.models.Result;
import com.gdin.inspection.perspective.similarity.LexicalSimilarityScorer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class GroundingValidatorTest {

    private static final Set<String> RETRIEVED = Set.of("205", "364", "1138", "858", "77");

    private final GroundingValidator validator = new GroundingValidator(
            new LexicalSimilarityScorer(new EnglishTokenizer()), 0.75, new PerspectiveProperties().getValidation());

    private static Perspective perspective(String text, String... ids) {
        return Perspective.builder().text(text).supportingDocIds(List.of(ids)).build();
    }

    private static Claim pro(Perspective... perspectives) {
        return Claim.builder().text("Surrealist memes enrich online culture.").polarity(Polarity.PRO)
                .perspectives(List.of(perspectives)).build();
    }

    private static Claim con(Perspective... perspectives) {
        return Claim.builder().text("Surrealist memes harm online discourse.").polarity(Polarity.CON)
                .perspectives(List.of(perspectives)).build();
    }

    private static Result result(Claim pro, Claim con) {
        return Result.builder().queryId("Entertainment_0").claimPro(pro).claimCon(con).build();
    }

    private final Claim validPro = pro(
            perspective("Absurd imagery sparks creativity among young internet users.", "205"),
            perspective("Sharing odd pictures builds playful digital communities.", "364"));
    private final Claim validCon = con(
            perspective("Older audiences find the jokes confusing and alienating.", "1138", "858"));

    @Test
    public void testValidResultPasses() {
        ValidationOutcome outcome = validator.validate(result(validPro, validCon), RETRIEVED);
        assertTrue(outcome.isValid());
        assertSame(validPro, outcome.getResult().getClaimPro());
        assertTrue(outcome.getRejections().isEmpty());
    }

    @Test
    public void testMissingClaimIsMalformed() {
        ValidationOutcome outcome = validator.validate(result(validPro, null), RETRIEVED);
        assertFalse(outcome.isValid());
        assertNull(outcome.getResult());
        RejectionReason r = outcome.getRejections().get(0);
        assertEquals(RejectionType.MALFORMED_CLAIM_COUNT, r.getType());
        assertEquals(Polarity.CON, r.getPolarity());
        assertEquals(Set.of(Polarity.CON), outcome.rejectedPolarities());
    }

    @Test
    public void testWrongPolarityIsMalformed() {
        Claim swapped = validCon.toBuilder().polarity(Polarity.PRO).build();
        ValidationOutcome outcome = validator.validate(result(validPro, swapped), RETRIEVED);
        assertEquals(RejectionType.MALFORMED_CLAIM_COUNT, outcome.getRejections().get(0).getType());
    }

    @Test
    public void testClaimWithoutPerspectivesIsMalformed() {
        Claim empty = Claim.builder().text("Nothing to say.").polarity(Polarity.CON).build();
        ValidationOutcome outcome = validator.validate(result(validPro, empty), RETRIEVED);
        assertEquals(RejectionType.MALFORMED_CLAIM_COUNT, outcome.getRejections().get(0).getType());
    }

    @Test
    public void testPerspectiveWithoutEvidenceIsUngrounded() {
        Claim con = con(perspective("Older audiences find the jokes confusing and alienating."));
        ValidationOutcome outcome = validator.validate(result(validPro, con), RETRIEVED);

        RejectionReason r = outcome.getRejections().get(0);
        assertEquals(RejectionType.UNGROUNDED_PERSPECTIVE, r.getType());
        assertEquals(Polarity.CON, r.getPolarity());
        assertEquals(List.of(0), r.getPerspectiveIndexes());
    }

    @Test
    public void testCitingUnretrievedDocumentIsUngrounded() {
        Claim con = con(
                perspective("Older audiences find the jokes confusing and alienating.", "1138"),
                perspective("Critics link meme humor to shrinking attention spans.", "858", "9999"));
        ValidationOutcome outcome = validator.validate(result(validPro, con), RETRIEVED);

        RejectionReason r = outcome.getRejections().get(0);
        assertEquals(RejectionType.UNGROUNDED_PERSPECTIVE, r.getType());
        assertEquals(List.of(1), r.getPerspectiveIndexes());
        assertEquals(List.of("9999"), r.getDocIds());
    }

    @Test
    public void testDocumentCitedUnderBothClaimsIsRejected() {
        Claim con = con(perspective("Older audiences find the jokes confusing and alienating.", "1138", "205"));
        ValidationOutcome outcome = validator.validate(result(validPro, con), RETRIEVED);

        assertFalse(outcome.isValid());
        List<RejectionReason> cross = outcome.getRejections().stream()
                .filter(r -> r.getType() == RejectionType.CROSS_POLARITY_CITATION).toList();
        assertEquals(2, cross.size());
        assertEquals(List.of("205"), cross.get(0).getDocIds());
        assertEquals(List.of(0), cross.get(0).getPerspectiveIndexes());
    }

    @Test
    public void testNearDuplicatePerspectivesAreRejected() {
        Claim pro = pro(
                perspective("Absurd imagery sparks creativity among young internet users.", "205"),
                perspective("Absurd imagery sparks creativity among young internet users!", "364"));
        ValidationOutcome outcome = validator.validate(result(pro, validCon), RETRIEVED);

        RejectionReason r = outcome.getRejections().get(0);
        assertEquals(RejectionType.DUPLICATE_PERSPECTIVE, r.getType());
        assertEquals(Polarity.PRO, r.getPolarity());
        assertEquals(List.of(0, 1), r.getPerspectiveIndexes());
    }

    @Test
    public void testLengthProblemsAreWarningsOnly() {
        Claim pro = Claim.builder()
                .text("Surrealist memes are on balance a genuinely good and healthy thing for the culture of the internet")
                .polarity(Polarity.PRO)
                .perspectives(List.of(perspective("Creative.", "205")))
                .build();
        ValidationOutcome outcome = validator.validate(result(pro, validCon), RETRIEVED);

        assertTrue(outcome.isValid());
        assertEquals(2, outcome.getWarnings().size());
    }

    @Test
    public void testValidateClaimChecksSingleBranch() {
        assertTrue(validator.validateClaim(validPro, Polarity.PRO, RETRIEVED).isEmpty());
        assertEquals(RejectionType.MALFORMED_CLAIM_COUNT,
                validator.validateClaim(validPro, Polarity.CON, RETRIEVED).get(0).getType());
    }

    @Test
    public void testValidatorDoesNotModifyInput() {
        Result input = result(validPro, con(perspective("Confusing.", "9999")));
        validator.validate(input, RETRIEVED);
        assertEquals(List.of("9999"), input.getClaimCon().getPerspectives().get(0).getSupportingDocIds());
    }
}
