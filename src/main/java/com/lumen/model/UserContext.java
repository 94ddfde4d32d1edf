package com.lumen.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.List;

/**
 * Learner profile returned by the training backend's progress API.
 * <p>
 * The backend serializes with PascalCase property names; camelCase is accepted too.
 * Missing lists are normalized to empty lists.
 * </p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserContext(@JsonAlias("UserId") long userId,
                          @JsonAlias("UserLevel") String userLevel,
                          @JsonAlias("CompletedTopicIds") List<Long> completedTopicIds,
                          @JsonAlias("StruggleTopics") List<String> struggleTopics) {

    public UserContext {
        if (completedTopicIds == null) {
            completedTopicIds = Collections.emptyList();
        }
        if (struggleTopics == null) {
            struggleTopics = Collections.emptyList();
        }
    }
}
