package work.lcod.ftml.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import work.lcod.ftml.api.LogLevel;
import work.lcod.ftml.shared.Diagnostics;
import work.lcod.ftml.support.FtmlTestSupport;

class IdCounterTest {
    @Test
    void countsPerPrefix() {
        var ids = new IdCounter();
        assertEquals("term", ids.newId("term"));
        assertEquals("term_1", ids.newId("term"));
        assertEquals("notation", ids.newId("notation"));
        assertEquals("term_2", ids.newId("term"));
        assertEquals("notation_1", ids.newId("notation"));
    }

    @Test
    void extensionPrefixIsReserved() {
        var ids = new IdCounter();
        assertEquals("EXTSTRUCT_1", ids.newId(IdCounter.EXTENSION_PREFIX));
        assertEquals("EXTSTRUCT_2", ids.newId(IdCounter.EXTENSION_PREFIX));
    }

    @Test
    void forcedIdIsUsedOnce() {
        var ids = new IdCounter();
        ids.forceNext("chosen");
        assertEquals("chosen", ids.newId("section"));
        assertEquals("section", ids.newId("section"));
    }

    @Test
    void stateOverridesTheNextId() {
        var state = new ExtractorState(FtmlTestSupport.DOCUMENT, Diagnostics.silent(LogLevel.WARN));
        state.setNextId("given");
        assertEquals("given", state.newId("term"));
        assertEquals("term", state.newId("term"));
        assertEquals("term_1", state.newId("term"));
    }
}
