package com.gdin.inspection.perspective.util;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ResponseUtilTest {

    @Test
    public void testRemoveThink() {
        assertEquals("answer", ResponseUtil.removeThink("<think>\nreasoning\n</think>answer"));
        assertNull(ResponseUtil.removeThink(null));
    }

    @Test
    public void testFirstSentence() {
        assertEquals("Memes spark creativity.",
                ResponseUtil.firstSentence("<think>x</think>Perspective: \"Memes spark creativity.\" They also amuse."));
        assertEquals("Cars should go", ResponseUtil.firstSentence("**Claim 1: Cars should go**\nmore text"));
        assertEquals("", ResponseUtil.firstSentence("   "));
        assertEquals("", ResponseUtil.firstSentence(null));
    }

    @Test
    public void testJsonResponse() {
        JSONObject json = ResponseUtil.getJSONResponse("<think>{\"no\": 1}</think>Here you go: {\"205\": \"PRO\"} done");
        assertEquals("PRO", json.getString("205"));
        assertFalse(json.containsKey("no"));

        JSONObject wrapped = ResponseUtil.getJSONResponse("\"1\": \"CON\"");
        assertEquals("CON", wrapped.getString("1"));

        assertTrue(ResponseUtil.getJSONResponse("").isEmpty());
        assertThrows(JSONException.class, () -> ResponseUtil.getJSONResponse("} oops {"));
    }
}
