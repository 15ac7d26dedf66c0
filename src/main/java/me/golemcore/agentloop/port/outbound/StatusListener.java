package me.golemcore.agentloop.port.outbound;

import me.golemcore.agentloop.domain.model.StatusUpdate;

/**
 * Receiver of public progress updates (UI, chat channel, log sink).
 */
@FunctionalInterface
public interface StatusListener {

    void onStatusUpdate(StatusUpdate update);
}
