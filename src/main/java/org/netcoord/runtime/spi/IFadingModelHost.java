package org.netcoord.runtime.spi;

/**
 * Implemented by simulators that accept per-channel fading model overrides.
 */
public interface IFadingModelHost {

    /**
     * Installs the fading model for a channel, replacing any model already attached to it.
     *
     * @param channelId The channel to attach to.
     * @param model The model to use.
     */
    void registerFadingModel(String channelId, IFadingModel model);
}
