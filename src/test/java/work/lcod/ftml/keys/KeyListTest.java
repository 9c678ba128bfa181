package work.lcod.ftml.keys;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class KeyListTest {
    @Test
    void popsInDeclarationOrder() {
        var keys = new KeyList(Set.of(FtmlKey.ID, FtmlKey.HEAD, FtmlKey.TERM, FtmlKey.MODULE));
        assertEquals(Optional.of(FtmlKey.MODULE), keys.pop());
        assertEquals(Optional.of(FtmlKey.TERM), keys.pop());
        assertEquals(Optional.of(FtmlKey.HEAD), keys.pop());
        assertEquals(Optional.of(FtmlKey.ID), keys.pop());
        assertEquals(Optional.empty(), keys.pop());
    }

    @Test
    void removedKeysAreSkipped() {
        var keys = new KeyList();
        keys.add(FtmlKey.NOTATION);
        keys.add(FtmlKey.PRECEDENCE);
        keys.add(FtmlKey.ARGPRECS);

        assertEquals(Optional.of(FtmlKey.NOTATION), keys.pop());
        keys.remove(FtmlKey.PRECEDENCE, FtmlKey.ARGPRECS);
        assertTrue(keys.isEmpty());
        assertFalse(keys.contains(FtmlKey.PRECEDENCE));
    }

    @Test
    void attributeNamesMapBackToKeys() {
        assertEquals(FtmlKey.NUM_KEYS, FtmlKey.values().length);
        for (FtmlKey key : FtmlKey.values()) {
            assertTrue(key.attributeName().startsWith(FtmlKey.PREFIX));
            assertEquals(Optional.of(key), FtmlKey.fromAttribute(key.attributeName()));
        }
        assertEquals(Optional.empty(), FtmlKey.fromAttribute("data-ftml-nonsense"));
        assertTrue(FtmlKey.isFtmlAttribute("data-ftml-nonsense"));
        assertFalse(FtmlKey.isFtmlAttribute("class"));
    }
}
