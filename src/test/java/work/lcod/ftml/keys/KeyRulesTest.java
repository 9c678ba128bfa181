package work.lcod.ftml.keys;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.lcod.ftml.api.LogLevel;
import work.lcod.ftml.shared.Diagnostics;
import work.lcod.ftml.support.FtmlTestSupport;

class KeyRulesTest {
    @Test
    void everyKeyHasAHandler() {
        var rules = KeyRules.defaults();
        assertEquals(FtmlKey.NUM_KEYS, rules.handlers().size());
        for (FtmlKey key : FtmlKey.values()) {
            assertNotNull(rules.handler(key), key.keyName());
        }
    }

    @Test
    void builderRejectsDuplicatesAndGaps() {
        var builder = KeyRules.builder().on(FtmlKey.TERM, KeyRules.NO_OP);
        assertThrows(IllegalStateException.class, () -> builder.on(FtmlKey.TERM, KeyRules.NO_OP));
        var ex = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(ex.getMessage().contains("module"));
    }

    @Test
    void unsupportedKeysOnlyWarn() {
        assertTrue(KeyRules.notYetSupported().contains(FtmlKey.PROOF_STEP));
        var diagnostics = Diagnostics.silent(LogLevel.WARN);
        var result = FtmlTestSupport.extract("<div data-ftml-spfstep=\"\">step</div>", diagnostics);

        assertTrue(result.document().elements().isEmpty());
        assertTrue(diagnostics.emitted().contains("[warn] Not yet implemented: spfstep"));
    }

    @Test
    void auxiliaryKeysWithoutMainKeyWarn() {
        var diagnostics = Diagnostics.silent(LogLevel.WARN);
        FtmlTestSupport.extract("<span data-ftml-precedence=\"3\">x</span>", diagnostics);
        assertTrue(diagnostics.emitted().contains("[warn] auxiliary key precedence missing its main attribute"));
    }

    @Test
    void unknownAttributesWarn() {
        var diagnostics = Diagnostics.silent(LogLevel.WARN);
        FtmlTestSupport.extract("<span data-ftml-bogus=\"1\">x</span>", diagnostics);
        assertTrue(diagnostics.emitted().contains("[warn] unknown ftml attribute data-ftml-bogus on <span>"));
    }
}
