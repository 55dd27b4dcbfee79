package io.agentbus.handler.responder;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class KeywordResponderTest {

    private final KeywordResponder responder = new KeywordResponder();

    @Test
    void classifiesByKeyword() {
        assertEquals(ResponseCategory.WEATHER, responder.classify("What's the weather?"));
        assertEquals(ResponseCategory.WEATHER, responder.classify("Will it RAIN tomorrow"));
        assertEquals(ResponseCategory.DATA_ANALYSIS, responder.classify("tell me about data analysis"));
        assertEquals(ResponseCategory.CODING, responder.classify("review my python code"));
        assertEquals(ResponseCategory.SYSTEM_STATUS, responder.classify("system status"));
        assertEquals(ResponseCategory.GENERAL, responder.classify("hello there"));
    }

    @Test
    void earlierCategoryWinsWhenSeveralMatch() {
        assertEquals(ResponseCategory.WEATHER, responder.classify("weather data api"));
        assertEquals(ResponseCategory.DATA_ANALYSIS, responder.classify("chart the system health"));
    }

    @Test
    void stripsOneLeadingCommandPrefix() {
        assertEquals(ResponseCategory.SYSTEM_STATUS, responder.classify("  /status"));
        assertEquals(ResponseCategory.CODING, responder.classify("<code"));
    }

    @Test
    void emptyAndNullFallBackToGeneral() {
        assertEquals(ResponseCategory.GENERAL, responder.classify(""));
        assertEquals(ResponseCategory.GENERAL, responder.classify(null));
        assertNotNull(responder.respond(null));
    }

    @Test
    void fallbackEchoesTheQuery() {
        final String text = responder.respond("tell me a joke");
        assertTrue(text.contains("'tell me a joke'"), text);
    }

    @Test
    void categoriesProduceDistinctAnswers() {
        assertNotEquals(responder.respond("weather"), responder.respond("status"));
        assertEquals(responder.respond("weather today"), responder.respond("sunny?"));
    }
}
