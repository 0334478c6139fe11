package com.demo.groupchat.infrastructure;

import com.demo.groupchat.domain.PushNotification;
import com.demo.groupchat.domain.PushResult;

import java.util.concurrent.CompletableFuture;

/**
 * One fan-out's handle on the push provider.
 */
public interface PushSession extends AutoCloseable {

    /**
     * Send to one device. Provider failures complete normally with a failed {@link PushResult};
     * the future completes exceptionally only when the session itself is unusable.
     *
     * @param dryRun validate with the provider without delivering
     */
    CompletableFuture<PushResult> send(String deviceToken, PushNotification notification, boolean dryRun);

    @Override
    void close();
}
