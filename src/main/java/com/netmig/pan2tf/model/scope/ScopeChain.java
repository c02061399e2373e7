package com.netmig.pan2tf.model.scope;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Precedence-ordered list of scope frames, most local first, shared last.
 */
public final class ScopeChain {

    private final List<ScopeFrame> frames;

    public ScopeChain(List<ScopeFrame> frames) {
        if (frames == null || frames.isEmpty()) {
            throw new IllegalArgumentException("A scope chain needs at least one frame");
        }
        this.frames = List.copyOf(frames);
    }

    public static ScopeChain of(ScopeFrame... frames) {
        return new ScopeChain(List.of(frames));
    }

    public List<ScopeFrame> getFrames() {
        return frames;
    }

    /**
     * The frame whose declarations consume this chain.
     */
    public ScopeFrame getOwner() {
        return frames.get(0);
    }

    public int size() {
        return frames.size();
    }

    @Override
    public String toString() {
        return frames.stream().map(ScopeFrame::toString).collect(Collectors.joining(" -> "));
    }
}
