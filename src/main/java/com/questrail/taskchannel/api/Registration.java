package com.questrail.taskchannel.api;

/**
 * Handle returned for a listener registration.
 */
public interface Registration
{
    /**
     * Remove the registration.
     *
     * @return {@code true} if this call removed it; {@code false} if it was already gone
     */
    boolean cancel();
}
