package work.lcod.ftml.model.narrative;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DocumentCounter(String name, SectionLevel parent) {}
