package com.purchasingpower.recall.reflection;

/**
 * Published when a conversation session ends.
 *
 * @param sessionId the session that ended
 */
public record SessionEndedEvent(String sessionId) {
}
