package org.rescuenet.routing.vrp;

/**
 * Task left unserved with the reason.
 */
public record UnservedTask(String taskId, UnservedReason reason) {
}
