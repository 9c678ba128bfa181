package work.lcod.ftml.extraction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.ftml.keys.FtmlKey;
import work.lcod.ftml.model.notation.NotationComponent;
import work.lcod.ftml.model.term.OpaqueNode;
import work.lcod.ftml.model.term.Term;
import work.lcod.ftml.node.FtmlNode;
import work.lcod.ftml.node.NodeChild;

/**
 * Rebuilds terms and notation templates from a node and the pieces recorded below it.
 */
public final class NodeConversions {
    private NodeConversions() {}

    /**
     * A single candidate at the node itself is returned as is; otherwise the node becomes an opaque
     * term whose recorded sub-trees are replaced by references to the candidate terms.
     */
    public static Term asTerm(FtmlNode node, List<PathedTerm> candidates) {
        for (PathedTerm candidate : candidates) {
            if (candidate.path().isEmpty()) {
                return candidate.term();
            }
        }
        List<Term> terms = new ArrayList<>(candidates.size());
        for (PathedTerm candidate : candidates) {
            terms.add(candidate.term());
        }
        List<Integer> all = new ArrayList<>(candidates.size());
        for (int c = 0; c < candidates.size(); c++) {
            all.add(c);
        }
        List<OpaqueNode> children = opaqueChildren(node, candidates, all, 0);
        return new Term.Opaque(node.tagName(), node.attributes(), children, terms);
    }

    /** {@code active} holds the indices of the candidates whose paths pass through {@code node}. */
    private static List<OpaqueNode> opaqueChildren(FtmlNode node, List<PathedTerm> candidates, List<Integer> active, int depth) {
        List<OpaqueNode> result = new ArrayList<>();
        List<NodeChild> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            OpaqueNode replaced = null;
            List<Integer> below = new ArrayList<>();
            for (int c : active) {
                List<Integer> path = candidates.get(c).path();
                if (path.get(depth) != i) {
                    continue;
                }
                if (path.size() == depth + 1) {
                    replaced = new OpaqueNode.TermRef(c);
                } else {
                    below.add(c);
                }
            }
            if (replaced != null) {
                result.add(replaced);
                continue;
            }
            NodeChild child = children.get(i);
            if (child instanceof NodeChild.Element e) {
                FtmlNode n = e.node();
                result.add(new OpaqueNode.Element(n.tagName(), n.attributes(), opaqueChildren(n, candidates, below, depth + 1)));
            } else if (child instanceof NodeChild.Text t) {
                result.add(new OpaqueNode.Text(t.text()));
            }
        }
        return result;
    }

    /** The node as a notation template with the recorded components substituted at their paths. */
    public static NotationComponent asNotation(FtmlNode node, List<PathedComponent> components) {
        for (PathedComponent component : components) {
            if (component.path().isEmpty()) {
                return component.component();
            }
        }
        return notationNode(node, components, 0);
    }

    private static NotationComponent.Node notationNode(FtmlNode node, List<PathedComponent> components, int depth) {
        List<NotationComponent> result = new ArrayList<>();
        List<NodeChild> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            NotationComponent recorded = componentAt(components, depth, i);
            if (recorded != null) {
                result.add(recorded);
                continue;
            }
            NodeChild child = children.get(i);
            if (child instanceof NodeChild.Element e) {
                List<PathedComponent> below = new ArrayList<>();
                for (PathedComponent component : components) {
                    List<Integer> path = component.path();
                    if (path.size() > depth + 1 && path.get(depth) == i) {
                        below.add(component);
                    }
                }
                result.add(notationNode(e.node(), below, depth + 1));
            } else if (child instanceof NodeChild.Text t) {
                result.add(new NotationComponent.Text(t.text()));
            }
        }
        return new NotationComponent.Node(node.tagName(), plainAttributes(node), result);
    }

    private static NotationComponent componentAt(List<PathedComponent> components, int depth, int i) {
        for (PathedComponent component : components) {
            List<Integer> path = component.path();
            if (path.size() == depth + 1 && path.get(depth) == i) {
                return component.component();
            }
        }
        return null;
    }

    /** A plain snapshot of the node, without ftml attributes. */
    public static NotationComponent.Node asComponent(FtmlNode node) {
        return notationNode(node, List.of(), 0);
    }

    private static Map<String, String> plainAttributes(FtmlNode node) {
        Map<String, String> attributes = new LinkedHashMap<>();
        node.attributes().forEach((name, value) -> {
            if (!FtmlKey.isFtmlAttribute(name)) {
                attributes.put(name, value);
            }
        });
        return attributes;
    }
}
