package work.lcod.ftml.node;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;

/**
 * Parses HTML with source positions tracked, so that node ranges are real offsets.
 */
public final class HtmlSource {
    private HtmlSource() {}

    public static Document parse(String html) {
        Parser parser = Parser.htmlParser().setTrackPosition(true);
        Document document = Jsoup.parse(html, "", parser);
        document.outputSettings().prettyPrint(false);
        return document;
    }

    public static Document read(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public static JsoupNode root(Document document) {
        return new JsoupNode(document);
    }
}
