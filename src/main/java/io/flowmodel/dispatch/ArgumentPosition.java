package io.flowmodel.dispatch;

import io.flowmodel.ast.Call;

import java.util.Objects;

/**
 * A position of a call that a value enters through: 0..k-1 for the explicit arguments,
 * {@link #INSTANCE} for the receiver.
 */
public record ArgumentPosition(Call call, int position) {

    public static final int INSTANCE = -1;

    public ArgumentPosition {
        Objects.requireNonNull(call, "call");
        if (position < INSTANCE || position >= call.argumentCount()) {
            throw new IllegalArgumentException("Position " + position + " out of range for " + call);
        }
    }

    public static ArgumentPosition instance(Call call) {
        return new ArgumentPosition(call, INSTANCE);
    }

    public boolean isInstance() {
        return position == INSTANCE;
    }
}
