package me.golemcore.coursemate.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.coursemate.domain.model.CourseCatalog;
import me.golemcore.coursemate.domain.model.CourseOutline;
import me.golemcore.coursemate.domain.model.SearchResults;

import java.util.Optional;

/**
 * Port for the course retrieval service. Only tools talk to it; the query
 * engine itself never retrieves.
 */
public interface CourseSearchPort {

    /**
     * Semantic search over course content.
     *
     * @param query
     *            what to search for
     * @param courseName
     *            optional course filter, partial names allowed
     * @param lessonNumber
     *            optional lesson filter
     * @return results; failures are reported through {@link SearchResults#error()}
     */
    SearchResults search(String query, String courseName, Integer lessonNumber);

    /**
     * Resolves a (possibly partial) course title and returns its outline.
     *
     * @throws me.golemcore.coursemate.domain.exception.RetrievalException
     *             when the retrieval service fails
     */
    Optional<CourseOutline> getCourseOutline(String courseTitle);

    /**
     * Link of a lesson, when the retrieval service knows one.
     */
    Optional<String> getLessonLink(String courseTitle, int lessonNumber);

    /**
     * Titles of all indexed courses.
     *
     * @throws me.golemcore.coursemate.domain.exception.RetrievalException
     *             when the retrieval service fails
     */
    CourseCatalog getCatalog();
}
