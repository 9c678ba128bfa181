package work.lcod.ftml.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.Range;
import org.jsoup.nodes.TextNode;

/**
 * {@link FtmlNode} backed by a live jsoup element.
 */
public final class JsoupNode implements FtmlNode {
    private final Element element;

    public JsoupNode(Element element) {
        this.element = Objects.requireNonNull(element, "element");
    }

    public Element element() {
        return element;
    }

    @Override
    public String tagName() {
        return element.tagName();
    }

    @Override
    public List<NodeChild> children() {
        List<NodeChild> children = new ArrayList<>(element.childNodeSize());
        for (Node child : element.childNodes()) {
            if (child instanceof Element e) {
                children.add(new NodeChild.Element(new JsoupNode(e)));
            } else if (child instanceof TextNode t) {
                children.add(new NodeChild.Text(t.getWholeText()));
            } else {
                children.add(new NodeChild.Other(child.outerHtml()));
            }
        }
        return children;
    }

    @Override
    public Map<String, String> attributes() {
        Map<String, String> attrs = new LinkedHashMap<>();
        for (Attribute attr : element.attributes()) {
            attrs.put(attr.getKey(), attr.getValue());
        }
        return Collections.unmodifiableMap(attrs);
    }

    @Override
    public Optional<String> attribute(String name) {
        return element.hasAttr(name) ? Optional.of(element.attr(name)) : Optional.empty();
    }

    @Override
    public void setAttribute(String name, String value) {
        element.attr(name, value);
    }

    @Override
    public Optional<String> removeAttribute(String name) {
        if (!element.hasAttr(name)) {
            return Optional.empty();
        }
        String value = element.attr(name);
        element.removeAttr(name);
        return Optional.of(value);
    }

    @Override
    public String string() {
        return element.outerHtml();
    }

    @Override
    public String innerString() {
        return element.html();
    }

    @Override
    public SourceRange range() {
        Range start = element.sourceRange();
        if (!start.isTracked()) {
            return SourceRange.EMPTY;
        }
        Range end = element.endSourceRange();
        int to = end.isTracked() ? end.endPos() : start.endPos();
        return new SourceRange(start.startPos(), Math.max(to, start.startPos()));
    }

    @Override
    public SourceRange innerRange() {
        Range start = element.sourceRange();
        Range end = element.endSourceRange();
        if (!start.isTracked() || !end.isTracked()) {
            return SourceRange.EMPTY;
        }
        return new SourceRange(start.endPos(), Math.max(end.startPos(), start.endPos()));
    }

    @Override
    public List<Integer> pathFrom(FtmlNode ancestor) {
        if (!(ancestor instanceof JsoupNode other)) {
            throw new IllegalArgumentException("not a jsoup node: " + ancestor);
        }
        List<Integer> path = new ArrayList<>();
        Node current = element;
        while (current != other.element) {
            Node parent = current.parentNode();
            if (parent == null) {
                throw new IllegalArgumentException("<" + tagName() + "> is not inside <" + other.tagName() + ">");
            }
            path.add(current.siblingIndex());
            current = parent;
        }
        Collections.reverse(path);
        return path;
    }

    @Override
    public void delete() {
        if (element.parent() != null) {
            element.remove();
        }
    }

    @Override
    public boolean sameNode(FtmlNode other) {
        return other instanceof JsoupNode n && n.element == element;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof JsoupNode n && n.element == element;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(element);
    }

    @Override
    public String toString() {
        return "<" + element.tagName() + ">";
    }
}
