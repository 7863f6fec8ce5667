package me.golemcore.coursemate.domain.model;

import java.util.List;

/**
 * Catalog summary: number of known courses and their titles.
 */
public record CourseCatalog(int totalCourses, List<String> courseTitles) {

    public CourseCatalog {
        courseTitles = courseTitles != null ? List.copyOf(courseTitles) : List.of();
    }
}
