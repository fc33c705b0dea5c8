package com.e2eq.cnl.transition;

import java.util.List;

/**
 * Client input for creating or replacing a transition. The id is derived from name and adjective.
 */
public record TransitionDraft(String name,
                              String adjective,
                              Tense tense,
                              List<NodeMorphRef> inputs,
                              List<NodeMorphRef> outputs,
                              String description) {
}
