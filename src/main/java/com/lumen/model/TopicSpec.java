package com.lumen.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Training topic definition returned by the training backend.
 *
 * @param promptTemplate Optional authored template; blank means the built-in tutor template is used.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TopicSpec(@JsonAlias("Id") long id,
                        @JsonAlias("Title") String title,
                        @JsonAlias("Description") String description,
                        @JsonAlias("PromptTemplate") String promptTemplate,
                        @JsonAlias("CourseId") long courseId,
                        @JsonAlias("CourseTitle") String courseTitle,
                        @JsonAlias("LearningObjectives") String learningObjectives) {
}
