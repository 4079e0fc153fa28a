package org.netcoord.runtime.model;

/**
 * Input to a fading model: the link being sampled and its large-scale state.
 *
 * @param channelId Channel the model is attached to.
 * @param timeIndex Simulator step counter.
 * @param baseSnrDb SNR before small-scale fading, in dB.
 * @param distance Link distance in metres.
 */
public record LinkState(String channelId, long timeIndex, double baseSnrDb, double distance) {
}
