/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.state;

/**
 * Implementation of {@link StateInt} with trail strategy.
 * The previous value is pushed on the trail at most once per level.
 */
public class TrailInt implements StateInt {

    private final Trailer trail;
    private int v;
    private long lastMagic;

    protected TrailInt(Trailer trail, int initial) {
        this.trail = trail;
        this.v = initial;
        this.lastMagic = trail.getMagic() - 1;
    }

    private void trail() {
        long trailMagic = trail.getMagic();
        if (lastMagic != trailMagic) {
            lastMagic = trailMagic;
            final int savedValue = v;
            trail.pushState(() -> {
                v = savedValue;
                lastMagic = -1;
            });
        }
    }

    @Override
    public int setValue(int v) {
        if (v != this.v) {
            trail();
            this.v = v;
        }
        return this.v;
    }

    @Override
    public int value() {
        return this.v;
    }

    @Override
    public String toString() {
        return String.valueOf(v);
    }
}
