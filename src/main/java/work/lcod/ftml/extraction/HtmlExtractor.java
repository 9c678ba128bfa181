package work.lcod.ftml.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jsoup.nodes.Document;
import work.lcod.ftml.keys.Attributes;
import work.lcod.ftml.keys.FtmlKey;
import work.lcod.ftml.keys.KeyList;
import work.lcod.ftml.keys.KeyResult;
import work.lcod.ftml.keys.KeyRules;
import work.lcod.ftml.node.FtmlNode;
import work.lcod.ftml.node.HtmlSource;
import work.lcod.ftml.node.NodeChild;
import work.lcod.ftml.shared.Diagnostics;
import work.lcod.ftml.uri.DocumentUri;

/**
 * Walks an HTML tree depth-first. On entering a node its FTML keys are handled lowest ordinal
 * first, each open directive applied as soon as its handler returns; after the children the
 * scheduled closes run in reverse order.
 *
 * <p>The tree is modified in place: solution content, notation markup and other extracted parts
 * are removed and consumed attributes are stripped.
 */
public final class HtmlExtractor {
    private final KeyRules rules;

    public HtmlExtractor() {
        this(KeyRules.defaults());
    }

    public HtmlExtractor(KeyRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public ExtractionResult extract(String html, DocumentUri uri, Diagnostics diagnostics) {
        return extract(HtmlSource.parse(html), uri, diagnostics);
    }

    public ExtractionResult extract(Document html, DocumentUri uri, Diagnostics diagnostics) {
        return extract(HtmlSource.root(html), uri, diagnostics);
    }

    /**
     * @throws FtmlExtractionException on the first malformed node; the tree stays partially processed
     */
    public ExtractionResult extract(FtmlNode root, DocumentUri uri, Diagnostics diagnostics) {
        ExtractorState state = new ExtractorState(uri, diagnostics);
        walk(state, root);
        return state.finish();
    }

    private void walk(ExtractorState state, FtmlNode node) {
        state.currentSourceRange(node.range());
        KeyList keys = keysOf(state, node);
        List<CloseFtmlElement> closes = new ArrayList<>();
        if (!keys.isEmpty()) {
            Attributes attrs = new Attributes(node, state);
            for (Optional<FtmlKey> next = keys.pop(); next.isPresent(); next = keys.pop()) {
                KeyResult result = rules.handler(next.get()).handle(state, attrs, keys, node);
                state.add(result.open(), node);
                if (result.close() != null) {
                    closes.add(result.close());
                }
            }
        }
        for (NodeChild child : node.children()) {
            if (child instanceof NodeChild.Element e) {
                walk(state, e.node());
            }
        }
        for (int i = closes.size() - 1; i >= 0; i--) {
            state.close(closes.get(i), node);
        }
    }

    private static KeyList keysOf(ExtractorState state, FtmlNode node) {
        KeyList keys = new KeyList();
        for (String name : node.attributes().keySet()) {
            if (!FtmlKey.isFtmlAttribute(name)) {
                continue;
            }
            Optional<FtmlKey> key = FtmlKey.fromAttribute(name);
            if (key.isPresent()) {
                keys.add(key.get());
            } else {
                state.diagnostics().warn("unknown ftml attribute %s on <%s>", name, node.tagName());
            }
        }
        return keys;
    }
}
