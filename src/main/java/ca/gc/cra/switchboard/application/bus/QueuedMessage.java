package ca.gc.cra.switchboard.application.bus;

import ca.gc.cra.switchboard.domain.node.Message;

/**
 * Message held in a locked instance's inbox, with the handler a group wire asked for (or {@code null}).
 */
record QueuedMessage(Message message, String handlerOverride) {}
