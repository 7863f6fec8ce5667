package me.golemcore.coursemate.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CourseStatsResponse {
    @JsonProperty("total_courses")
    private int totalCourses;
    @JsonProperty("course_titles")
    private List<String> courseTitles;
}
