package work.lcod.ftml.support;

import work.lcod.ftml.api.LogLevel;
import work.lcod.ftml.extraction.ExtractionResult;
import work.lcod.ftml.extraction.HtmlExtractor;
import work.lcod.ftml.shared.Diagnostics;
import work.lcod.ftml.uri.DocumentUri;
import work.lcod.ftml.uri.ModuleUri;
import work.lcod.ftml.uri.PathUri;
import work.lcod.ftml.uri.SymbolUri;

public final class FtmlTestSupport {
    public static final PathUri ARCHIVE = PathUri.of("https://mathhub.info", "test/arith");
    public static final DocumentUri DOCUMENT = new DocumentUri(ARCHIVE, "numbers", "en");
    public static final ModuleUri ARITH = new ModuleUri(ARCHIVE, "arith");

    private FtmlTestSupport() {}

    public static SymbolUri symbol(String name) {
        return new SymbolUri(ARITH, name);
    }

    /** The symbol's uri as it is written into an attribute value. */
    public static String attr(SymbolUri uri) {
        return uri.toString().replace("&", "&amp;");
    }

    public static ExtractionResult extract(String bodyHtml) {
        return extract(bodyHtml, Diagnostics.silent(LogLevel.DEBUG));
    }

    public static ExtractionResult extract(String bodyHtml, Diagnostics diagnostics) {
        return new HtmlExtractor().extract("<html><body>" + bodyHtml + "</body></html>", DOCUMENT, diagnostics);
    }
}
