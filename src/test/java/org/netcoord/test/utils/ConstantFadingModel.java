package org.netcoord.test.utils;

import org.netcoord.runtime.model.LinkState;
import org.netcoord.runtime.spi.IFadingModel;

import com.typesafe.config.Config;

/**
 * Fading model returning a fixed gain ({@code gain} option, default 0).
 */
public class ConstantFadingModel implements IFadingModel {

    private final double gain;

    public ConstantFadingModel(Config options) {
        this.gain = options.hasPath("gain") ? options.getDouble("gain") : 0.0;
    }

    @Override
    public double sample(LinkState link) {
        return gain;
    }
}
