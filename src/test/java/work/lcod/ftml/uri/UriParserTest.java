package work.lcod.ftml.uri;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class UriParserTest {
    @Test
    void parsesEachKind() throws Exception {
        assertInstanceOf(PathUri.class, UriParser.parse("https://mathhub.info?a=smglom/sets&p=mod"));
        var doc = assertInstanceOf(DocumentUri.class, UriParser.parse("https://mathhub.info?a=smglom/sets&d=sets&l=en"));
        assertEquals("sets", doc.name());
        assertEquals("en", doc.language());

        var element = assertInstanceOf(DocumentElementUri.class,
            UriParser.parse("https://mathhub.info?a=smglom/sets&d=sets&l=en&e=section/term"));
        assertEquals("term", element.lastName());
        assertEquals(doc, element.document());

        var symbol = assertInstanceOf(SymbolUri.class, UriParser.parse("https://mathhub.info?a=smglom/sets&m=set&s=union"));
        assertEquals("set", symbol.module().name());
    }

    @Test
    void printsWhatItParses() throws Exception {
        for (String uri : new String[] {
            "https://mathhub.info?a=smglom/sets",
            "https://mathhub.info?a=smglom/sets&p=mod&m=set/inner",
            "https://mathhub.info?a=smglom/sets&d=sets&l=en&e=problem/solution",
            "https://mathhub.info?a=smglom/sets&m=set&s=union"
        }) {
            assertEquals(uri, UriParser.parse(uri).toString());
        }
    }

    @Test
    void rejectsMalformedUris() {
        assertThrows(UriParseException.class, () -> UriParser.parse("no-query"));
        assertThrows(UriParseException.class, () -> UriParser.parse("https://x?m=set"));
        assertThrows(UriParseException.class, () -> UriParser.parse("https://x?a=arch&s=union"));
        assertThrows(UriParseException.class, () -> UriParser.parse("https://x?a=arch&d=doc"));
        assertThrows(UriParseException.class, () -> UriParser.parse("https://x?a=arch&m=set&a=other"));
        assertThrows(UriParseException.class, () -> UriParser.parse("https://x?a=arch&d=doc&l=en&m=set"));
        assertThrows(UriParseException.class, () -> SymbolUri.parse("https://x?a=arch&m=set"));
    }

    @Test
    void composesNestedNames() throws Exception {
        var doc = DocumentUri.parse("https://mathhub.info?a=smglom/sets&d=sets&l=en");
        var module = doc.module("set");
        assertTrue(module.isTop());

        var inner = module.child("inner");
        assertEquals("set/inner", inner.name());
        assertEquals(Optional.of(module.symbol("inner")), inner.asSymbol());
        assertEquals(inner, module.symbol("inner").asModule());
        assertEquals(Optional.empty(), module.asSymbol());

        assertEquals(doc + "&e=a/b", doc.element("a").element("b").toString());
        assertThrows(UriParseException.class, () -> module.child("bad&name"));
    }

    @Test
    void ordersByPrintedForm() throws Exception {
        var a = SymbolUri.parse("https://x?a=arch&m=m&s=a");
        var b = SymbolUri.parse("https://x?a=arch&m=m&s=b");
        assertTrue(a.compareTo(b) < 0);
        assertEquals(0, a.compareTo(SymbolUri.parse("https://x?a=arch&m=m&s=a")));
    }
}
