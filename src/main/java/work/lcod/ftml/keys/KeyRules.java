package work.lcod.ftml.keys;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The handler table: one {@link KeyHandler} per FTML key.
 *
 * <p>Keys that only qualify another key ({@code data-ftml-head} on a term, {@code data-ftml-precedence}
 * on a notation, ...) are consumed by that key's handler and are no-ops on their own. Keys without an
 * extraction model yet log a warning and are otherwise ignored.
 */
public final class KeyRules {
    /** Handler for keys that carry no meaning of their own. */
    public static final KeyHandler NO_OP = (state, attrs, keys, node) -> KeyResult.NOTHING;

    private static final Set<FtmlKey> NO_OPS = Collections.unmodifiableSet(EnumSet.of(
        FtmlKey.DOC_KIND_DATE, FtmlKey.DOC_KIND_NUM, FtmlKey.DOC_KIND_RETAKE, FtmlKey.DOC_KIND_COURSE,
        FtmlKey.DOC_KIND_TERM, FtmlKey.CAPITALIZE, FtmlKey.INLINE, FtmlKey.FORS, FtmlKey.PROOF_HIDE,
        FtmlKey.PROBLEM_POINTS, FtmlKey.PROBLEM_MINUTES, FtmlKey.AUTOGRADABLE, FtmlKey.PRECONDITION_DIMENSION,
        FtmlKey.OBJECTIVE_DIMENSION, FtmlKey.ANSWER_CLASS_PTS, FtmlKey.PROBLEM_FILLINSOL_WIDTH,
        FtmlKey.PROBLEM_FILLINSOL_CASE_VALUE, FtmlKey.PROBLEM_FILLINSOL_CASE_VERDICT, FtmlKey.STYLES,
        FtmlKey.METATHEORY, FtmlKey.SIGNATURE, FtmlKey.MORPHISM_DOMAIN, FtmlKey.MORPHISM_TOTAL, FtmlKey.RENAME_TO,
        FtmlKey.MACRONAME, FtmlKey.ASSOC_TYPE, FtmlKey.ROLE, FtmlKey.ARGS, FtmlKey.ARGUMENT_REORDERING, FtmlKey.BIND,
        FtmlKey.NOTATION_ID, FtmlKey.HEAD, FtmlKey.ARG_MODE, FtmlKey.NOTATION_FRAGMENT, FtmlKey.PRECEDENCE,
        FtmlKey.ARGPRECS, FtmlKey.LANGUAGE, FtmlKey.ID));

    private static final Set<FtmlKey> NOT_YET_SUPPORTED = Collections.unmodifiableSet(EnumSet.of(
        FtmlKey.PROOF_METHOD, FtmlKey.PROOF_SKETCH, FtmlKey.PROOF_TERM, FtmlKey.PROOF_ASSUMPTION, FtmlKey.PROOF_STEP,
        FtmlKey.PROOF_STEP_NAME, FtmlKey.PROOF_EQ_STEP, FtmlKey.PROOF_PREMISE, FtmlKey.PROOF_CONCLUSION,
        FtmlKey.ASSIGN_MORPHISM_FROM, FtmlKey.ASSIGN_MORPHISM_TO, FtmlKey.CONCLUSION, FtmlKey.ARG_MAP,
        FtmlKey.ARG_MAP_SEP, FtmlKey.RULE, FtmlKey.SREF, FtmlKey.SREF_IN, FtmlKey.SLIDESHOW, FtmlKey.SLIDESHOW_SLIDE));

    private static final KeyRules DEFAULT = createDefault();

    private final Map<FtmlKey, KeyHandler> handlers;

    private KeyRules(Map<FtmlKey, KeyHandler> handlers) {
        this.handlers = handlers;
    }

    public static KeyRules defaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public KeyHandler handler(FtmlKey key) {
        return handlers.get(key);
    }

    public Map<FtmlKey, KeyHandler> handlers() {
        return Collections.unmodifiableMap(handlers);
    }

    /** Keys that are recognised but not extracted yet. */
    public static Set<FtmlKey> notYetSupported() {
        return NOT_YET_SUPPORTED;
    }

    private static KeyRules createDefault() {
        Builder builder = builder();
        DocumentRules.register(builder);
        ParagraphRules.register(builder);
        ProblemRules.register(builder);
        DomainRules.register(builder);
        TermRules.register(builder);
        NotationRules.register(builder);
        for (FtmlKey key : NO_OPS) {
            builder.on(key, auxiliary(key));
        }
        for (FtmlKey key : NOT_YET_SUPPORTED) {
            builder.on(key, todo(key));
        }
        return builder.build();
    }

    /** Auxiliary keys are consumed by their main key; seeing one here means the main key is absent. */
    static KeyHandler auxiliary(FtmlKey key) {
        return (state, attrs, keys, node) -> {
            state.diagnostics().warn("auxiliary key %s missing its main attribute", key);
            return KeyResult.NOTHING;
        };
    }

    static KeyHandler todo(FtmlKey key) {
        return (state, attrs, keys, node) -> {
            state.diagnostics().warn("Not yet implemented: %s", key);
            return KeyResult.NOTHING;
        };
    }

    // ---- value parsers shared by the rule sets

    static Optional<Integer> parseInt(String value) {
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    static Optional<Long> parseLong(String value) {
        try {
            return Optional.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    static Optional<Float> parseFloat(String value) {
        try {
            float f = Float.parseFloat(value.trim());
            return Float.isFinite(f) ? Optional.of(f) : Optional.empty();
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    public static final class Builder {
        private final EnumMap<FtmlKey, KeyHandler> handlers = new EnumMap<>(FtmlKey.class);

        private Builder() {}

        /**
         * @throws IllegalStateException if {@code key} already has a handler
         */
        public Builder on(FtmlKey key, KeyHandler handler) {
            if (handlers.putIfAbsent(key, handler) != null) {
                throw new IllegalStateException("duplicate handler for " + key);
            }
            return this;
        }

        /**
         * @throws IllegalStateException if a key is left without a handler
         */
        public KeyRules build() {
            EnumSet<FtmlKey> missing = EnumSet.allOf(FtmlKey.class);
            missing.removeAll(handlers.keySet());
            if (!missing.isEmpty()) {
                throw new IllegalStateException("keys without handler: " + missing);
            }
            return new KeyRules(new EnumMap<>(handlers));
        }
    }
}
