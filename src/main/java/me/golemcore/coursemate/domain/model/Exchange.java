package me.golemcore.coursemate.domain.model;

/**
 * One completed question/answer pair stored in a conversation session.
 */
public record Exchange(String question, String answer) {
}
