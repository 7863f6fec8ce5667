package me.golemcore.coursemate.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional body of {@code POST /api/new-session}: the session the client is
 * leaving, whose history is dropped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NewSessionRequest {
    @JsonProperty("previous_session_id")
    private String previousSessionId;
}
