package work.lcod.ftml.model.term;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import work.lcod.ftml.uri.DocumentElementUri;

/**
 * A variable, either resolved to its declaration or left as a free name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, property = "kind")
public sealed interface Variable {
    String name();

    record Name(String name) implements Variable {}

    record Ref(DocumentElementUri declaration, Boolean isSequence) implements Variable {
        @Override
        public String name() {
            return declaration.lastName();
        }
    }
}
