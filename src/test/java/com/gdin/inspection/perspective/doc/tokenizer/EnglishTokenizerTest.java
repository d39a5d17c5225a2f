package com.gdin.inspection.perspective.doc.tokenizer;

import com.gdin.inspection.perspective.pojo.Token;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EnglishTokenizerTest {

    private final EnglishTokenizer tokenizer = new EnglishTokenizer();

    @Test
    public void testStemsAndDropsStopWords() {
        assertEquals(List.of("dog", "bark", "loudli", "night"), tokenizer.terms("The dogs are barking loudly at night."));
    }

    @Test
    public void testInflectionsShareTerm() {
        assertEquals(tokenizer.terms("market"), tokenizer.terms("Markets"));
        assertEquals(tokenizer.terms("uniform"), tokenizer.terms("uniforms"));
    }

    @Test
    public void testPossessiveAndSingleCharacters() {
        assertEquals(List.of("student", "grade"), tokenizer.terms("The student's grade: B"));
    }

    @Test
    public void testPositionsKeepGapsOfRemovedWords() {
        List<Token> tokens = tokenizer.parse("Cats and dogs");
        assertEquals(2, tokens.size());
        assertEquals(0, tokens.get(0).getPosition());
        assertEquals(2, tokens.get(1).getPosition());
    }

    @Test
    public void testBlankText() {
        assertTrue(tokenizer.parse(null).isEmpty());
        assertTrue(tokenizer.parse("   ").isEmpty());
    }

    @Test
    public void testSharedAcrossThreads() throws Exception {
        List<String> expected = tokenizer.terms("Surrealist memes spark creativity.");
        Thread[] threads = new Thread[4];
        List<Throwable> errors = new java.util.concurrent.CopyOnWriteArrayList<>();
        for (int t = 0; t < threads.length; t++) {
            threads[t] = new Thread(() -> {
                try {
                    for (int i = 0; i < 200; i++) assertEquals(expected, tokenizer.terms("Surrealist memes spark creativity."));
                } catch (Throwable e) {
                    errors.add(e);
                }
            });
            threads[t].start();
        }
        for (Thread thread : threads) thread.join();
        assertTrue(errors.isEmpty(), () -> errors.get(0).toString());
    }
}
