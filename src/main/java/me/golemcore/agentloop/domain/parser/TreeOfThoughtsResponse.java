package me.golemcore.agentloop.domain.parser;

import lombok.Builder;
import lombok.Value;
import me.golemcore.agentloop.domain.model.ThoughtType;

import java.util.List;

/**
 * Tree-of-thoughts answer. Depending on the request only some fields are set:
 * a single thought (root), a list of children, an evaluation score, or a
 * conclusion.
 */
@Value
@Builder
public class TreeOfThoughtsResponse {

    String thought;
    ThoughtType thoughtType;
    Double estimatedScore;
    List<TreeOfThoughtsResponse> children;
    Double score;
    String reasoning;
    String conclusion;
}
